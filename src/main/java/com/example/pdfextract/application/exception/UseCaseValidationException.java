package com.example.pdfextract.application.exception;

/**
 * Signals that a request is well-formed but asks for something this deployment does not offer,
 * such as image export without a configured image root.
 */
public class UseCaseValidationException extends ApplicationException {

	/**
	 * @param message specific validation failure
	 */
    public UseCaseValidationException(String message) {
        super(message);
    }
}
