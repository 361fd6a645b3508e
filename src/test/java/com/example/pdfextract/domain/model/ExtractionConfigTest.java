package com.example.pdfextract.domain.model;

import com.example.pdfextract.domain.exception.InvalidExtractionConfigException;
import org.junit.jupiter.api.Test;
import org.slf4j.event.Level;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ExtractionConfigTest {

    /**
     * The builder defaults describe a plain text run over every page.
     */
    @Test
    void builder_appliesDefaults() {
        ExtractionConfig config = ExtractionConfig.builder().build();

        assertThat(config.outputType()).isEqualTo(OutputType.TEXT);
        assertThat(config.codec()).isEqualTo(StandardCharsets.UTF_8);
        assertThat(config.layoutParams()).isNull();
        assertThat(config.pageNumbers()).isNull();
        assertThat(config.maxPages()).isZero();
        assertThat(config.password()).isEmpty();
        assertThat(config.scale()).isEqualTo(1.0d);
        assertThat(config.layoutMode()).isEqualTo(HtmlLayoutMode.NORMAL);
        assertThat(config.extractImages()).isFalse();
        assertThat(config.diagnosticsLevel()).isEqualTo(Level.DEBUG);
    }

    /**
     * Output type names are matched case-insensitively.
     */
    @Test
    void builder_acceptsOutputTypeNames() {
        assertThat(ExtractionConfig.builder().outputType("XML").build().outputType()).isEqualTo(OutputType.XML);
        assertThat(ExtractionConfig.builder().outputType("tag").build().outputType()).isEqualTo(OutputType.TAG);
    }

    /**
     * An unknown output type is a configuration error.
     */
    @Test
    void builder_rejectsUnknownOutputType() {
        InvalidExtractionConfigException ex = assertThrows(InvalidExtractionConfigException.class,
                () -> ExtractionConfig.builder().outputType("pdf"));

        assertThat(ex.getMessage()).contains("pdf");
    }

    /**
     * An unknown codec name is a configuration error.
     */
    @Test
    void builder_rejectsUnknownCodec() {
        assertThrows(InvalidExtractionConfigException.class,
                () -> ExtractionConfig.builder().codec("no-such-charset"));
        assertThrows(InvalidExtractionConfigException.class,
                () -> ExtractionConfig.builder().codec(" "));
    }

    /**
     * A negative page cap is rejected.
     */
    @Test
    void build_rejectsNegativeMaxPages() {
        assertThrows(InvalidExtractionConfigException.class,
                () -> ExtractionConfig.builder().maxPages(-1).build());
    }

    /**
     * Any rotation delta is accepted; it is applied additively per page.
     */
    @Test
    void build_acceptsAnyRotationDelta() {
        assertThat(ExtractionConfig.builder().rotation(-270).build().rotation()).isEqualTo(-270);
        assertThat(ExtractionConfig.builder().rotation(45).build().rotation()).isEqualTo(45);
        assertThat(ExtractionConfig.builder().rotation(Integer.MAX_VALUE).build().rotation())
                .isEqualTo(Integer.MAX_VALUE);
    }

    /**
     * Scale must be a finite positive number.
     */
    @Test
    void build_rejectsInvalidScale() {
        assertThrows(InvalidExtractionConfigException.class, () -> ExtractionConfig.builder().scale(0).build());
        assertThrows(InvalidExtractionConfigException.class,
                () -> ExtractionConfig.builder().scale(Double.NaN).build());
    }

    /**
     * Negative or missing page ordinals are rejected.
     */
    @Test
    void build_rejectsNegativePageNumbers() {
        assertThrows(InvalidExtractionConfigException.class,
                () -> ExtractionConfig.builder().pageNumbers(List.of(0, -1)).build());
        assertThrows(InvalidExtractionConfigException.class,
                () -> ExtractionConfig.builder().pageNumbers(Arrays.asList(1, null)).build());
    }

    /**
     * The page filter is copied, sorted and read-only.
     */
    @Test
    void build_copiesPageNumbers() {
        ExtractionConfig config = ExtractionConfig.builder().pageNumbers(List.of(4, 1, 1, 2)).build();

        assertThat(config.pageNumbers()).containsExactly(1, 2, 4);
        assertThrows(UnsupportedOperationException.class, () -> config.pageNumbers().add(7));
    }

    /**
     * The debug flag raises progress logging to INFO.
     */
    @Test
    void builder_debugRaisesDiagnosticsLevel() {
        assertThat(ExtractionConfig.builder().debug(true).build().diagnosticsLevel()).isEqualTo(Level.INFO);
        assertThat(ExtractionConfig.builder().debug(false).build().diagnosticsLevel()).isEqualTo(Level.DEBUG);
    }

    /**
     * A missing output type cannot reach a run.
     */
    @Test
    void build_requiresOutputType() {
        assertThrows(InvalidExtractionConfigException.class,
                () -> ExtractionConfig.builder().outputType((OutputType) null).build());
    }
}
