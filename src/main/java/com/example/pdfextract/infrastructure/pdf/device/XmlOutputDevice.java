package com.example.pdfextract.infrastructure.pdf.device;

import com.example.pdfextract.domain.model.LayoutParams;
import com.example.pdfextract.infrastructure.pdf.ExtractedPage;
import com.example.pdfextract.infrastructure.pdf.ImageExportWriter;
import com.example.pdfextract.infrastructure.pdf.ResourceManager;
import com.example.pdfextract.infrastructure.pdf.ResourceManager.FontDescriptor;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.apache.pdfbox.text.TextPosition;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.Charset;
import java.util.List;

/**
 * XML rendering of the page layout:
 * {@code <pages>/<page>/<textbox>/<textline>/<text>}, one {@code <text>} element per glyph carrying its
 * font, box and size, plus an {@code <image>} element for every image drawn.
 */
public class XmlOutputDevice extends AbstractOutputDevice {

    private final boolean stripControl;
    private int textboxId;
    private boolean inTextbox;
    private boolean inTextline;

    public XmlOutputDevice(ResourceManager resourceManager,
                           OutputStream sink,
                           Charset codec,
                           LayoutParams layoutParams,
                           ImageExportWriter imageWriter,
                           boolean stripControl) throws IOException {
        super(resourceManager, sink, codec, layoutParams, imageWriter);
        this.stripControl = stripControl;
        write("<?xml version=\"1.0\" encoding=\"" + codec.name() + "\" ?>\n");
        write("<pages>\n");
    }

    @Override
    protected void onBeginPage(ExtractedPage page) throws IOException {
        textboxId = 0;
        write("<page id=\"" + page.pageNumber() + "\" bbox=\"" + formatBox(page.displayBox())
                + "\" rotate=\"" + page.effectiveRotation() + "\">\n");
    }

    @Override
    protected void onEndPage(ExtractedPage page) throws IOException {
        closeTextbox();
        write("</page>\n");
    }

    @Override
    protected void onBeginParagraph() throws IOException {
        closeTextbox();
        write("<textbox id=\"" + textboxId++ + "\">\n");
        inTextbox = true;
    }

    @Override
    protected void onEndParagraph() throws IOException {
        closeTextbox();
    }

    @Override
    protected void onRenderText(String text, List<TextPosition> positions) throws IOException {
        openTextline();
        for (TextPosition position : positions) {
            String unicode = escape(position.getUnicode());
            if (unicode.isEmpty()) {
                continue;
            }
            FontDescriptor font = resourceManager.describeFont(position.getFont());
            write("<text font=\"" + escape(font.name()) + "\" bbox=\"" + formatGlyphBox(position)
                    + "\" size=\"" + formatNumber(position.getFontSizeInPt()) + "\">" + unicode + "</text>\n");
        }
    }

    @Override
    protected void onWordSeparator() throws IOException {
        openTextline();
        write("<text> </text>\n");
    }

    @Override
    protected void onLineSeparator() throws IOException {
        closeTextline();
    }

    @Override
    protected void onRenderImage(String name, PDImageXObject image, String fileName) throws IOException {
        StringBuilder element = new StringBuilder("<image name=\"").append(escape(name)).append('"');
        if (fileName != null) {
            element.append(" src=\"").append(escape(fileName)).append('"');
        }
        element.append(" width=\"").append(image.getWidth())
                .append("\" height=\"").append(image.getHeight()).append("\" />\n");
        write(element.toString());
    }

    @Override
    protected void writeFooter() throws IOException {
        write("</pages>\n");
    }

    private void openTextline() throws IOException {
        if (!inTextbox) {
            write("<textbox id=\"" + textboxId++ + "\">\n");
            inTextbox = true;
        }
        if (!inTextline) {
            write("<textline>\n");
            inTextline = true;
        }
    }

    private void closeTextline() throws IOException {
        if (inTextline) {
            write("</textline>\n");
            inTextline = false;
        }
    }

    private void closeTextbox() throws IOException {
        closeTextline();
        if (inTextbox) {
            write("</textbox>\n");
            inTextbox = false;
        }
    }

    private String escape(String text) {
        return Markup.escape(text, stripControl);
    }
}
