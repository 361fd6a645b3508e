package com.example.pdfextract.infrastructure.pdf.device;

import com.example.pdfextract.infrastructure.pdf.ResourceManager;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TextOutputDeviceTest {

    private final ByteArrayOutputStream sink = new ByteArrayOutputStream();
    private final TextOutputDevice device =
            new TextOutputDevice(new ResourceManager(true), sink, StandardCharsets.UTF_8, null, null);

    /**
     * Words, lines and paragraphs map to spaces, newlines and blank lines.
     */
    @Test
    void writesTextStructure() throws IOException {
        device.beginParagraph();
        device.renderText("Hello", List.of());
        device.wordSeparator();
        device.renderText("World", List.of());
        device.lineSeparator();
        device.renderText("Again", List.of());
        device.endParagraph();
        device.close();

        assertThat(sink.toString(StandardCharsets.UTF_8)).isEqualTo("Hello World\nAgain\n\n");
    }

    /**
     * Output is buffered until the device is closed.
     */
    @Test
    void close_flushesBufferedOutput() throws IOException {
        device.renderText("Buffered", List.of());
        assertThat(sink.size()).isZero();

        device.close();

        assertThat(sink.toString(StandardCharsets.UTF_8)).isEqualTo("Buffered");
    }

    /**
     * Closing twice is harmless; events after close are refused.
     */
    @Test
    void close_isIdempotentAndFinal() throws IOException {
        device.close();
        device.close();

        assertThat(device.isOpen()).isFalse();
        IllegalStateException ex = assertThrows(IllegalStateException.class, device::wordSeparator);
        assertThat(ex.getMessage()).isEqualTo("TextOutputDevice is closed");
    }

    /**
     * The codec decides the bytes written to the sink.
     */
    @Test
    void encodesWithConfiguredCodec() throws IOException {
        ByteArrayOutputStream latin1Sink = new ByteArrayOutputStream();
        TextOutputDevice latin1 = new TextOutputDevice(new ResourceManager(true), latin1Sink,
                StandardCharsets.ISO_8859_1, null, null);

        latin1.renderText("é", List.of());
        latin1.close();

        assertThat(latin1Sink.toByteArray()).containsExactly((byte) 0xE9);
    }
}
