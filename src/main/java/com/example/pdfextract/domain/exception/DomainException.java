package com.example.pdfextract.domain.exception;

/**
 * Base type for failures that describe a problem with the caller's input or the document itself,
 * as opposed to a fault in the machinery that reads it.
 */
public abstract class DomainException extends RuntimeException {

	/**
	 * Creates a domain exception with a message that can be shown to the caller as-is.
	 *
	 * @param message explanation of which rule was violated
	 */
    protected DomainException(String message) {
        super(message);
    }

	/**
	 * Creates a domain exception that keeps the lower-level failure as its cause.
	 *
	 * @param message explanation of which rule was violated
	 * @param cause   exception raised by the PDF library
	 */
    protected DomainException(String message, Throwable cause) {
        super(message, cause);
    }
}
