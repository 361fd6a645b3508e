package com.example.pdfextract.domain.exception;

/**
 * Raised when an upload-based extraction is attempted without any PDF content.
 */
public class PdfFileRequiredException extends DomainException {

    public PdfFileRequiredException() {
        super("A PDF file is required for extraction.");
    }
}
