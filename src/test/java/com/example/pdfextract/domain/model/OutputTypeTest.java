package com.example.pdfextract.domain.model;

import com.example.pdfextract.domain.exception.InvalidExtractionConfigException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class OutputTypeTest {

    @Test
    void fromString_trimsAndIgnoresCase() {
        assertThat(OutputType.fromString(" Html ")).isEqualTo(OutputType.HTML);
        assertThat(OutputType.HTML.getMediaType()).isEqualTo("text/html");
    }

    /**
     * Tag output has no declaration and one root per page, so it is served as plain text.
     */
    @Test
    void tagOutputIsServedAsPlainText() {
        assertThat(OutputType.TAG.getMediaType()).isEqualTo("text/plain");
        assertThat(OutputType.XML.getMediaType()).isEqualTo("application/xml");
    }

    @Test
    void fromString_rejectsBlank() {
        assertThrows(InvalidExtractionConfigException.class, () -> OutputType.fromString(""));
        assertThrows(InvalidExtractionConfigException.class, () -> OutputType.fromString(null));
    }

    /**
     * A blank layout mode falls back to NORMAL, an unknown one fails.
     */
    @Test
    void htmlLayoutMode_fromString() {
        assertThat(HtmlLayoutMode.fromString(null)).isEqualTo(HtmlLayoutMode.NORMAL);
        assertThat(HtmlLayoutMode.fromString("exact")).isEqualTo(HtmlLayoutMode.EXACT);
        assertThrows(InvalidExtractionConfigException.class, () -> HtmlLayoutMode.fromString("wide"));
    }
}
