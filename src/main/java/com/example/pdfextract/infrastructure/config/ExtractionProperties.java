package com.example.pdfextract.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Server-side defaults for the HTTP extraction endpoints, bound from {@code pdfextract.*}.
 */
@Component
@ConfigurationProperties(prefix = "pdfextract")
public class ExtractionProperties {

    /** Codec applied when a request does not name one. */
    private String defaultCodec = "UTF-8";

    /** Root directory for images exported on request; image export is refused while unset. */
    private String imageOutputRoot;

    public String getDefaultCodec() {
        return defaultCodec;
    }

    public void setDefaultCodec(String defaultCodec) {
        this.defaultCodec = defaultCodec;
    }

    public String getImageOutputRoot() {
        return imageOutputRoot;
    }

    public void setImageOutputRoot(String imageOutputRoot) {
        this.imageOutputRoot = imageOutputRoot;
    }
}
