package com.example.pdfextract.infrastructure.pdf.device;

import org.springframework.web.util.HtmlUtils;

import java.util.regex.Pattern;

/**
 * Escaping shared by the markup devices.
 */
final class Markup {

    // C0 controls other than tab, line feed and carriage return are not allowed in XML 1.0
    private static final Pattern XML_ILLEGAL_CONTROLS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F]");

    private Markup() {
    }

	/**
	 * Escapes the five markup specials; everything else is left to the output charset.
	 *
	 * @param text         raw text
	 * @param stripControl remove XML-illegal control characters first
	 * @return text safe to place in element content or a quoted attribute
	 */
    static String escape(String text, boolean stripControl) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String cleaned = stripControl ? XML_ILLEGAL_CONTROLS.matcher(text).replaceAll("") : text;
        return HtmlUtils.htmlEscape(cleaned, "UTF-8");
    }

    static String escape(String text) {
        return escape(text, false);
    }
}
