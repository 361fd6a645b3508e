package com.example.pdfextract.domain.model;

import com.example.pdfextract.domain.exception.InvalidExtractionConfigException;

/**
 * Settings for grouping glyphs into words, lines and paragraphs.
 * Supplying an instance (even {@link #defaults()}) switches on position-based layout analysis;
 * omitting it keeps glyphs in content-stream order.
 *
 * @param sortByPosition                   order text by its position on the page rather than by drawing order
 * @param spacingTolerance                 gap, relative to a space width, that separates two words
 * @param averageCharTolerance             gap, relative to the average glyph width, that separates two words
 * @param dropThreshold                    line-height multiple of vertical gap that starts a new paragraph
 * @param indentThreshold                  glyph-width multiple of indentation that starts a new paragraph
 * @param separateByBeads                  honour article threads when the document declares them
 * @param suppressDuplicateOverlappingText drop glyphs drawn twice at the same spot (fake bold)
 */
public record LayoutParams(
        boolean sortByPosition,
        float spacingTolerance,
        float averageCharTolerance,
        float dropThreshold,
        float indentThreshold,
        boolean separateByBeads,
        boolean suppressDuplicateOverlappingText
) {

    public LayoutParams {
        requireNonNegative("spacingTolerance", spacingTolerance);
        requireNonNegative("averageCharTolerance", averageCharTolerance);
        requireNonNegative("dropThreshold", dropThreshold);
        requireNonNegative("indentThreshold", indentThreshold);
    }

	/**
	 * @return position-sorted layout using PDFBox's stock tolerances
	 */
    public static LayoutParams defaults() {
        return new LayoutParams(true, 0.5f, 0.3f, 2.5f, 2.0f, true, true);
    }

    public LayoutParams withSortByPosition(boolean value) {
        return new LayoutParams(value, spacingTolerance, averageCharTolerance, dropThreshold,
                indentThreshold, separateByBeads, suppressDuplicateOverlappingText);
    }

    public LayoutParams withSpacingTolerance(float value) {
        return new LayoutParams(sortByPosition, value, averageCharTolerance, dropThreshold,
                indentThreshold, separateByBeads, suppressDuplicateOverlappingText);
    }

    public LayoutParams withDropThreshold(float value) {
        return new LayoutParams(sortByPosition, spacingTolerance, averageCharTolerance, value,
                indentThreshold, separateByBeads, suppressDuplicateOverlappingText);
    }

    private static void requireNonNegative(String name, float value) {
        if (!Float.isFinite(value) || value < 0f) {
            throw new InvalidExtractionConfigException(name + " must be a finite, non-negative number: " + value);
        }
    }
}
