package com.example.pdfextract.application.exception;

/**
 * Base unchecked exception for failures raised by the application services themselves,
 * independent of the document being processed and of the transport that called them.
 */
public abstract class ApplicationException extends RuntimeException {

	/**
	 * @param message error description suitable for surfacing to the caller
	 */
    protected ApplicationException(String message) {
        super(message);
    }
}
