package com.example.pdfextract.infrastructure.pdf.device;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MarkupTest {

    @Test
    void escape_replacesMarkupSpecials() {
        assertThat(Markup.escape("a<b & \"c\"")).isEqualTo("a&lt;b &amp; &quot;c&quot;");
        assertThat(Markup.escape(null)).isEmpty();
    }

    /**
     * Control characters survive unless stripping is requested; tab and newline always survive.
     */
    @Test
    void escape_stripsXmlIllegalControlsOnRequest() {
        String raw = "A\u0001B\tC\nD\u001F";

        assertThat(Markup.escape(raw, false)).isEqualTo(raw);
        assertThat(Markup.escape(raw, true)).isEqualTo("AB\tC\nD");
    }

    /**
     * Non-ASCII text is left for the output charset to encode.
     */
    @Test
    void escape_keepsNonAsciiText() {
        assertThat(Markup.escape("Grüße 東京")).isEqualTo("Grüße 東京");
    }
}
