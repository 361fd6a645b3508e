package com.example.pdfextract.domain.exception;

/**
 * Raised when the PDF path handed to the text extraction shortcut does not exist.
 */
public class PdfNotFoundException extends DomainException {

	/**
	 * @param path path that could not be resolved
	 */
    public PdfNotFoundException(String path) {
        super("PDF not found: " + path);
    }
}
