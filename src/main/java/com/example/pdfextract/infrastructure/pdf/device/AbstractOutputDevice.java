package com.example.pdfextract.infrastructure.pdf.device;

import com.example.pdfextract.domain.model.LayoutParams;
import com.example.pdfextract.infrastructure.pdf.ExtractedPage;
import com.example.pdfextract.infrastructure.pdf.ImageExportWriter;
import com.example.pdfextract.infrastructure.pdf.ResourceManager;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.apache.pdfbox.text.TextPosition;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.Charset;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Base for the concrete devices: owns the encoding writer and the open/closed state.
 * Public events check the state and delegate to {@code on*} hooks, which do nothing unless overridden.
 * Closing flushes the writer but leaves the caller's output stream open.
 */
public abstract class AbstractOutputDevice implements OutputDevice {

    protected final ResourceManager resourceManager;
    protected final Charset codec;
    private final Writer writer;
    private final LayoutParams layoutParams;
    private final ImageExportWriter imageWriter;
    private ExtractedPage currentPage;
    private boolean open = true;

    protected AbstractOutputDevice(ResourceManager resourceManager,
                                   OutputStream sink,
                                   Charset codec,
                                   LayoutParams layoutParams,
                                   ImageExportWriter imageWriter) {
        this.resourceManager = resourceManager;
        this.codec = codec;
        this.writer = new BufferedWriter(new OutputStreamWriter(sink, codec));
        this.layoutParams = layoutParams;
        this.imageWriter = imageWriter;
    }

    @Override
    public Optional<LayoutParams> layoutParams() {
        return Optional.ofNullable(layoutParams);
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public final void beginPage(ExtractedPage page) throws IOException {
        ensureOpen();
        currentPage = page;
        onBeginPage(page);
    }

    @Override
    public final void endPage(ExtractedPage page) throws IOException {
        ensureOpen();
        onEndPage(page);
        currentPage = null;
    }

    @Override
    public final void beginMarkedContent(String tag, Map<String, String> properties) throws IOException {
        ensureOpen();
        onBeginMarkedContent(tag, properties);
    }

    @Override
    public final void endMarkedContent() throws IOException {
        ensureOpen();
        onEndMarkedContent();
    }

    @Override
    public final void renderCharacter(TextPosition position) throws IOException {
        ensureOpen();
        onRenderCharacter(position);
    }

    @Override
    public final void beginParagraph() throws IOException {
        ensureOpen();
        onBeginParagraph();
    }

    @Override
    public final void endParagraph() throws IOException {
        ensureOpen();
        onEndParagraph();
    }

    @Override
    public final void renderText(String text, List<TextPosition> positions) throws IOException {
        ensureOpen();
        onRenderText(text, positions);
    }

    @Override
    public final void wordSeparator() throws IOException {
        ensureOpen();
        onWordSeparator();
    }

    @Override
    public final void lineSeparator() throws IOException {
        ensureOpen();
        onLineSeparator();
    }

    @Override
    public final void renderImage(String name, PDImageXObject image) throws IOException {
        ensureOpen();
        String fileName = null;
        if (imageWriter != null && currentPage != null) {
            fileName = imageWriter.export(name, currentPage.index(), image);
        }
        onRenderImage(name, image, fileName);
    }

    @Override
    public final void close() throws IOException {
        if (!open) {
            return;
        }
        open = false;
        writeFooter();
        writer.flush();
    }

    protected void onBeginPage(ExtractedPage page) throws IOException {
    }

    protected void onEndPage(ExtractedPage page) throws IOException {
    }

    protected void onBeginMarkedContent(String tag, Map<String, String> properties) throws IOException {
    }

    protected void onEndMarkedContent() throws IOException {
    }

    protected void onRenderCharacter(TextPosition position) throws IOException {
    }

    protected void onBeginParagraph() throws IOException {
    }

    protected void onEndParagraph() throws IOException {
    }

    protected void onRenderText(String text, List<TextPosition> positions) throws IOException {
    }

    protected void onWordSeparator() throws IOException {
    }

    protected void onLineSeparator() throws IOException {
    }

	/**
	 * @param name     resource name of the image
	 * @param image    decoded image object
	 * @param fileName exported file name, {@code null} when image export is off
	 */
    protected void onRenderImage(String name, PDImageXObject image, String fileName) throws IOException {
    }

    protected void writeFooter() throws IOException {
    }

    protected final void write(String text) throws IOException {
        writer.write(text);
    }

    protected static String formatBox(PDRectangle box) {
        return formatNumber(box.getLowerLeftX()) + "," + formatNumber(box.getLowerLeftY()) + ","
                + formatNumber(box.getUpperRightX()) + "," + formatNumber(box.getUpperRightY());
    }

	/**
	 * Glyph box with a top-left origin in display orientation: {@code x0,y0,x1,y1}.
	 */
    protected static String formatGlyphBox(TextPosition position) {
        float x0 = position.getX();
        float y1 = position.getY();
        float y0 = y1 - position.getHeight();
        return formatNumber(x0) + "," + formatNumber(y0) + ","
                + formatNumber(x0 + position.getWidth()) + "," + formatNumber(y1);
    }

    protected static String formatNumber(double value) {
        return String.format(Locale.ROOT, "%.3f", value);
    }

    private void ensureOpen() {
        if (!open) {
            throw new IllegalStateException(getClass().getSimpleName() + " is closed");
        }
    }
}
