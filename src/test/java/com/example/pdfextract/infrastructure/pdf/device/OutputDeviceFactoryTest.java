package com.example.pdfextract.infrastructure.pdf.device;

import com.example.pdfextract.domain.model.ExtractionConfig;
import com.example.pdfextract.domain.model.LayoutParams;
import com.example.pdfextract.domain.model.OutputType;
import com.example.pdfextract.infrastructure.pdf.ResourceManager;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class OutputDeviceFactoryTest {

    private final OutputDeviceFactory factory = new OutputDeviceFactory();

    private OutputDevice create(ExtractionConfig config) throws IOException {
        return factory.create(new ResourceManager(true), new ByteArrayOutputStream(), config);
    }

    @Test
    void create_picksDevicePerOutputType() throws IOException {
        assertThat(create(ExtractionConfig.builder().outputType(OutputType.TEXT).build()))
                .isInstanceOf(TextOutputDevice.class);
        assertThat(create(ExtractionConfig.builder().outputType(OutputType.XML).build()))
                .isInstanceOf(XmlOutputDevice.class);
        assertThat(create(ExtractionConfig.builder().outputType(OutputType.HTML).build()))
                .isInstanceOf(HtmlOutputDevice.class);
        assertThat(create(ExtractionConfig.builder().outputType(OutputType.TAG).build()))
                .isInstanceOf(TagOutputDevice.class);
    }

    /**
     * Layout settings reach every device except the tag device.
     */
    @Test
    void create_passesLayoutParamsExceptForTags() throws IOException {
        ExtractionConfig.Builder builder = ExtractionConfig.builder().layoutParams(LayoutParams.defaults());

        assertThat(create(builder.outputType(OutputType.XML).build()).layoutParams()).contains(LayoutParams.defaults());
        assertThat(create(builder.outputType(OutputType.TAG).build()).layoutParams()).isEmpty();
    }

    /**
     * The image directory is created up front for devices that export images.
     */
    @Test
    void create_preparesImageDirectory(@TempDir Path tempDir) throws IOException {
        Path htmlImages = tempDir.resolve("html");
        Path tagImages = tempDir.resolve("tag");

        create(ExtractionConfig.builder().outputType(OutputType.HTML).outputDir(htmlImages).build());
        create(ExtractionConfig.builder().outputType(OutputType.TAG).outputDir(tagImages).build());

        assertThat(Files.isDirectory(htmlImages)).isTrue();
        assertThat(Files.exists(tagImages)).isFalse();
    }
}
