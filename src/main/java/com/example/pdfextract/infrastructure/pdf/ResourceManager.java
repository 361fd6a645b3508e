package com.example.pdfextract.infrastructure.pdf;

import org.apache.pdfbox.cos.COSDictionary;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDFontDescriptor;

import java.util.IdentityHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Holds the resource caching policy of a single extraction run.
 * The same flag decides whether the document gets a PDFBox resource cache and whether
 * font descriptions resolved here are remembered across pages. Never shared between runs.
 */
public class ResourceManager {

    private static final int BOLD_WEIGHT = 700;

    private final boolean caching;
    private final Map<COSDictionary, FontDescriptor> fonts = new IdentityHashMap<>();
    private int resolvedFonts;

    public ResourceManager(boolean caching) {
        this.caching = caching;
    }

    public boolean isCaching() {
        return caching;
    }

	/**
	 * Resolves the display name and style of a font, reusing an earlier answer when caching is on.
	 *
	 * @param font font reported with a glyph, may be {@code null}
	 * @return descriptor, {@link FontDescriptor#UNKNOWN} when no font is available
	 */
    public FontDescriptor describeFont(PDFont font) {
        if (font == null) {
            return FontDescriptor.UNKNOWN;
        }
        if (!caching) {
            return resolve(font);
        }
        return fonts.computeIfAbsent(font.getCOSObject(), key -> resolve(font));
    }

	/**
	 * @return number of times a font description was actually computed during this run
	 */
    public int resolvedFontCount() {
        return resolvedFonts;
    }

    private FontDescriptor resolve(PDFont font) {
        resolvedFonts++;
        String name = stripSubsetPrefix(font.getName());
        PDFontDescriptor descriptor = font.getFontDescriptor();
        boolean bold = false;
        boolean italic = false;
        if (descriptor != null) {
            bold = descriptor.isForceBold() || descriptor.getFontWeight() >= BOLD_WEIGHT;
            italic = descriptor.isItalic();
        }
        if (name != null) {
            String lower = name.toLowerCase(Locale.ROOT);
            bold = bold || lower.contains("bold");
            italic = italic || lower.contains("italic") || lower.contains("oblique");
        }
        return new FontDescriptor(name != null ? name : FontDescriptor.UNKNOWN.name(), bold, italic);
    }

    // subset fonts are named like ABCDEF+Helvetica
    private static String stripSubsetPrefix(String name) {
        if (name != null && name.length() > 7 && name.charAt(6) == '+') {
            return name.substring(7);
        }
        return name;
    }

    /**
     * Font facts the output devices print next to glyphs.
     *
     * @param name   base font name without subset prefix
     * @param bold   heavy weight or forced bold
     * @param italic italic or oblique style
     */
    public record FontDescriptor(String name, boolean bold, boolean italic) {

        public static final FontDescriptor UNKNOWN = new FontDescriptor("unknown", false, false);
    }
}
