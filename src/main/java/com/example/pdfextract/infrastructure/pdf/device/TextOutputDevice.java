package com.example.pdfextract.infrastructure.pdf.device;

import com.example.pdfextract.domain.model.LayoutParams;
import com.example.pdfextract.infrastructure.pdf.ExtractedPage;
import com.example.pdfextract.infrastructure.pdf.ImageExportWriter;
import com.example.pdfextract.infrastructure.pdf.ResourceManager;
import org.apache.pdfbox.text.TextPosition;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.Charset;
import java.util.List;

/**
 * Plain text output: words separated by a space, one line per text line, a blank line after each
 * paragraph and a form feed after each page.
 */
public class TextOutputDevice extends AbstractOutputDevice {

    private static final String LINE_END = "\n";
    private static final String PAGE_END = "\f";

    private boolean atLineStart = true;

    public TextOutputDevice(ResourceManager resourceManager,
                            OutputStream sink,
                            Charset codec,
                            LayoutParams layoutParams,
                            ImageExportWriter imageWriter) {
        super(resourceManager, sink, codec, layoutParams, imageWriter);
    }

    @Override
    protected void onRenderText(String text, List<TextPosition> positions) throws IOException {
        if (!text.isEmpty()) {
            write(text);
            atLineStart = false;
        }
    }

    @Override
    protected void onWordSeparator() throws IOException {
        write(" ");
        atLineStart = false;
    }

    @Override
    protected void onLineSeparator() throws IOException {
        write(LINE_END);
        atLineStart = true;
    }

    @Override
    protected void onEndParagraph() throws IOException {
        if (!atLineStart) {
            write(LINE_END);
        }
        write(LINE_END);
        atLineStart = true;
    }

    @Override
    protected void onEndPage(ExtractedPage page) throws IOException {
        write(PAGE_END);
        atLineStart = true;
    }
}
