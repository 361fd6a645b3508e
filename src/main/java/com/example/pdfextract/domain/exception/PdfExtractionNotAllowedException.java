package com.example.pdfextract.domain.exception;

/**
 * Raised when the document's access permissions forbid content extraction and the run enforces them.
 */
public class PdfExtractionNotAllowedException extends DomainException {

    public PdfExtractionNotAllowedException() {
        super("The PDF does not permit text extraction.");
    }
}
