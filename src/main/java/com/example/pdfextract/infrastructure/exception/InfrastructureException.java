package com.example.pdfextract.infrastructure.exception;

/**
 * Base unchecked exception for failures of the machinery around a document: unreadable bytes,
 * broken content streams, unwritable sinks.
 */
public abstract class InfrastructureException extends RuntimeException {

	/**
	 * @param message context about the failure
	 * @param cause   exception raised by PDFBox or the I/O layer
	 */
    protected InfrastructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
