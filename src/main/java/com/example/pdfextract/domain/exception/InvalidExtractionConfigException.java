package com.example.pdfextract.domain.exception;

/**
 * Raised while building an {@link com.example.pdfextract.domain.model.ExtractionConfig} from values that
 * cannot describe a valid extraction run, such as an unknown output type or a negative page cap.
 * Nothing is opened or written when this is thrown.
 */
public class InvalidExtractionConfigException extends DomainException {

	/**
	 * @param message which setting was rejected and why
	 */
    public InvalidExtractionConfigException(String message) {
        super(message);
    }
}
