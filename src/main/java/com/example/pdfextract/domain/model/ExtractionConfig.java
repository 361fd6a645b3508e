package com.example.pdfextract.domain.model;

import com.example.pdfextract.domain.exception.InvalidExtractionConfigException;
import org.slf4j.event.Level;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable description of one extraction run.
 * Every value is validated when the record is built, so a run never starts from an inconsistent configuration.
 *
 * @param outputType       serialization produced by the run
 * @param codec            charset used to encode the output
 * @param layoutParams     layout analysis settings, {@code null} to keep content-stream order
 * @param pageNumbers      zero-based page ordinals to extract, {@code null} for every page
 * @param maxPages         maximum number of pages to extract after filtering, {@code 0} for no cap
 * @param password         password for encrypted documents, empty when none
 * @param rotation         degrees added to every page's own rotation; quarter turns also turn the page geometry
 * @param scale            HTML only: coordinate scale factor
 * @param layoutMode       HTML only: positioning granularity
 * @param stripControl     XML only: drop control characters that XML 1.0 cannot carry
 * @param outputDir        directory receiving extracted images, {@code null} to skip image export
 * @param disableCaching   re-resolve fonts and other shared resources on every page
 * @param diagnosticsLevel level at which the run logs its progress
 */
public record ExtractionConfig(
        OutputType outputType,
        Charset codec,
        LayoutParams layoutParams,
        Set<Integer> pageNumbers,
        int maxPages,
        String password,
        int rotation,
        double scale,
        HtmlLayoutMode layoutMode,
        boolean stripControl,
        Path outputDir,
        boolean disableCaching,
        Level diagnosticsLevel
) {

    public ExtractionConfig {
        if (outputType == null) {
            throw new InvalidExtractionConfigException("Output type is required.");
        }
        if (codec == null) {
            throw new InvalidExtractionConfigException("Codec is required.");
        }
        if (maxPages < 0) {
            throw new InvalidExtractionConfigException("maxPages must be zero or positive: " + maxPages);
        }
        if (!Double.isFinite(scale) || scale <= 0d) {
            throw new InvalidExtractionConfigException("scale must be a positive number: " + scale);
        }
        if (pageNumbers != null) {
            for (Integer pageNumber : pageNumbers) {
                if (pageNumber == null || pageNumber < 0) {
                    throw new InvalidExtractionConfigException("Page numbers are zero-based and must not be negative: " + pageNumber);
                }
            }
            pageNumbers = Collections.unmodifiableSet(new TreeSet<>(pageNumbers));
        }
        password = password != null ? password : "";
        layoutMode = layoutMode != null ? layoutMode : HtmlLayoutMode.NORMAL;
        diagnosticsLevel = diagnosticsLevel != null ? diagnosticsLevel : Level.DEBUG;
    }

    /**
     * @return builder seeded with the defaults: text output, UTF-8, no layout, every page
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return {@code true} when images should be exported next to the serialized output
     */
    public boolean extractImages() {
        return outputDir != null;
    }

    /**
     * Fluent builder for {@link ExtractionConfig}; {@link #build()} performs the validation.
     */
    public static final class Builder {

        private OutputType outputType = OutputType.TEXT;
        private Charset codec = StandardCharsets.UTF_8;
        private LayoutParams layoutParams;
        private Set<Integer> pageNumbers;
        private int maxPages;
        private String password = "";
        private int rotation;
        private double scale = 1.0d;
        private HtmlLayoutMode layoutMode = HtmlLayoutMode.NORMAL;
        private boolean stripControl;
        private Path outputDir;
        private boolean disableCaching;
        private Level diagnosticsLevel = Level.DEBUG;

        private Builder() {
        }

        public Builder outputType(OutputType outputType) {
            this.outputType = outputType;
            return this;
        }

        public Builder outputType(String outputType) {
            this.outputType = OutputType.fromString(outputType);
            return this;
        }

        public Builder codec(Charset codec) {
            this.codec = codec;
            return this;
        }

		/**
		 * @param codecName charset name such as {@code utf-8}
		 * @throws InvalidExtractionConfigException when the JVM does not know the charset
		 */
        public Builder codec(String codecName) {
            if (codecName == null || codecName.isBlank()) {
                throw new InvalidExtractionConfigException("Codec is required.");
            }
            try {
                this.codec = Charset.forName(codecName.trim());
            } catch (IllegalCharsetNameException | UnsupportedCharsetException ex) {
                throw new InvalidExtractionConfigException("Unsupported codec: " + codecName);
            }
            return this;
        }

        public Builder layoutParams(LayoutParams layoutParams) {
            this.layoutParams = layoutParams;
            return this;
        }

        public Builder pageNumbers(Collection<Integer> pageNumbers) {
            this.pageNumbers = pageNumbers != null ? new HashSet<>(pageNumbers) : null;
            return this;
        }

        public Builder maxPages(int maxPages) {
            this.maxPages = maxPages;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder rotation(int rotation) {
            this.rotation = rotation;
            return this;
        }

        public Builder scale(double scale) {
            this.scale = scale;
            return this;
        }

        public Builder layoutMode(HtmlLayoutMode layoutMode) {
            this.layoutMode = layoutMode;
            return this;
        }

        public Builder stripControl(boolean stripControl) {
            this.stripControl = stripControl;
            return this;
        }

        public Builder outputDir(Path outputDir) {
            this.outputDir = outputDir;
            return this;
        }

        public Builder disableCaching(boolean disableCaching) {
            this.disableCaching = disableCaching;
            return this;
        }

        public Builder diagnosticsLevel(Level diagnosticsLevel) {
            this.diagnosticsLevel = diagnosticsLevel;
            return this;
        }

		/**
		 * Raises the run's progress logging to {@code INFO} so it shows up under the default logging setup.
		 * Logger levels themselves are left untouched.
		 *
		 * @param debug {@code true} for verbose progress output
		 */
        public Builder debug(boolean debug) {
            this.diagnosticsLevel = debug ? Level.INFO : Level.DEBUG;
            return this;
        }

        public ExtractionConfig build() {
            return new ExtractionConfig(outputType, codec, layoutParams, pageNumbers, maxPages, password,
                    rotation, scale, layoutMode, stripControl, outputDir, disableCaching, diagnosticsLevel);
        }
    }
}
