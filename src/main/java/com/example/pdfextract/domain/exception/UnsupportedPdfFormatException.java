package com.example.pdfextract.domain.exception;

/**
 * Raised when an uploaded file is neither declared nor named as a PDF.
 */
public class UnsupportedPdfFormatException extends DomainException {

	/**
	 * @param fileName original file name supplied by the client, may be {@code null}
	 */
    public UnsupportedPdfFormatException(String fileName) {
        super("Only PDF documents can be extracted" + (fileName != null ? ": " + fileName : "."));
    }
}
