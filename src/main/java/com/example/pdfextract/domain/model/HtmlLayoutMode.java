package com.example.pdfextract.domain.model;

import com.example.pdfextract.domain.exception.InvalidExtractionConfigException;

import java.util.Locale;

/**
 * Granularity at which HTML output positions its content.
 */
public enum HtmlLayoutMode {
    /** One positioned block per text line. */
    NORMAL,
    /** One positioned span per glyph. */
    EXACT,
    /** One positioned block per paragraph, lines broken with {@code <br>}. */
    LOOSE;

	/**
	 * @param rawValue case-insensitive mode name
	 * @return parsed mode
	 * @throws InvalidExtractionConfigException for unknown names
	 */
    public static HtmlLayoutMode fromString(String rawValue) {
        if (rawValue == null || rawValue.isBlank()) {
            return NORMAL;
        }
        try {
            return HtmlLayoutMode.valueOf(rawValue.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new InvalidExtractionConfigException("Unknown HTML layout mode: " + rawValue);
        }
    }
}
