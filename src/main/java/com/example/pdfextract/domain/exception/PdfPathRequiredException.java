package com.example.pdfextract.domain.exception;

/**
 * Raised when text extraction is requested for a {@code null} path.
 */
public class PdfPathRequiredException extends DomainException {

    public PdfPathRequiredException() {
        super("PDF path is required.");
    }
}
