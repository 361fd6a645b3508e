package com.example.pdfextract.domain.model;

import com.example.pdfextract.domain.exception.InvalidExtractionConfigException;

import java.util.Locale;

/**
 * Closed set of serializations an extraction run can produce.
 */
public enum OutputType {
    TEXT("text", "text/plain"),
    XML("xml", "application/xml"),
    HTML("html", "text/html"),
    TAG("tag", "text/plain");

    private final String value;
    private final String mediaType;

    OutputType(String value, String mediaType) {
        this.value = value;
        this.mediaType = mediaType;
    }

    public String getValue() {
        return value;
    }

    /**
     * @return media type (without charset) of the produced document
     */
    public String getMediaType() {
        return mediaType;
    }

	/**
	 * Parses the wire name of an output type.
	 *
	 * @param rawValue name such as {@code text} or {@code XML}
	 * @return the matching output type
	 * @throws InvalidExtractionConfigException when the name matches none of the supported types
	 */
    public static OutputType fromString(String rawValue) {
        if (rawValue == null || rawValue.isBlank()) {
            throw new InvalidExtractionConfigException("Output type is required.");
        }
        String normalized = rawValue.trim().toLowerCase(Locale.ROOT);
        for (OutputType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        throw new InvalidExtractionConfigException("Unknown output type: " + rawValue
                + " (expected one of text, xml, html, tag)");
    }
}
