package com.example.pdfextract.infrastructure.exception;

/**
 * Wraps an {@link java.io.IOException} raised while parsing, interpreting or serializing a PDF
 * on the paths that report failures unchecked.
 */
public class PdfProcessingException extends InfrastructureException {

	/**
	 * @param message description shared with the caller
	 * @param cause   low-level PDFBox or I/O exception
	 */
    public PdfProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
