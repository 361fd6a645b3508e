package com.example.pdfextract.infrastructure.pdf.device;

import com.example.pdfextract.domain.model.ExtractionConfig;
import com.example.pdfextract.domain.model.OutputType;
import com.example.pdfextract.infrastructure.pdf.ImageExportWriter;
import com.example.pdfextract.infrastructure.pdf.ResourceManager;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Builds the output device matching a run's configured output type.
 */
@Component
public class OutputDeviceFactory {

	/**
	 * Creates a fresh, open device. Only the settings that apply to the chosen type are passed on:
	 * control stripping to XML, scale and layout mode to HTML, and nothing but the codec to TAG.
	 *
	 * @param resourceManager resource policy of the run
	 * @param sink            caller-owned output stream
	 * @param config          validated run configuration
	 * @return device ready for page events
	 * @throws IOException when the image directory cannot be created or the header cannot be written
	 */
    public OutputDevice create(ResourceManager resourceManager, OutputStream sink, ExtractionConfig config)
            throws IOException {
        ImageExportWriter imageWriter = config.extractImages() && config.outputType() != OutputType.TAG
                ? new ImageExportWriter(config.outputDir())
                : null;
        return switch (config.outputType()) {
            case TEXT -> new TextOutputDevice(resourceManager, sink, config.codec(), config.layoutParams(), imageWriter);
            case XML -> new XmlOutputDevice(resourceManager, sink, config.codec(), config.layoutParams(), imageWriter,
                    config.stripControl());
            case HTML -> new HtmlOutputDevice(resourceManager, sink, config.codec(), config.layoutParams(), imageWriter,
                    config.scale(), config.layoutMode());
            case TAG -> new TagOutputDevice(resourceManager, sink, config.codec());
        };
    }
}
