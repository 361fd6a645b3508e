package com.example.pdfextract.domain.exception;

/**
 * Raised when an encrypted PDF cannot be opened with the supplied password.
 */
public class PdfDecryptionException extends DomainException {

	/**
	 * @param cause password failure reported by PDFBox
	 */
    public PdfDecryptionException(Throwable cause) {
        super("The PDF is encrypted and the supplied password is incorrect.", cause);
    }
}
