package com.example.pdfextract.infrastructure.pdf.device;

import com.example.pdfextract.domain.model.HtmlLayoutMode;
import com.example.pdfextract.domain.model.LayoutParams;
import com.example.pdfextract.infrastructure.pdf.ExtractedPage;
import com.example.pdfextract.infrastructure.pdf.ImageExportWriter;
import com.example.pdfextract.infrastructure.pdf.ResourceManager;
import com.example.pdfextract.infrastructure.pdf.ResourceManager.FontDescriptor;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.apache.pdfbox.text.TextPosition;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * Visual HTML reconstruction. Pages are stacked top to bottom with a margin between them and every
 * piece of text is absolutely positioned; all coordinates are multiplied by the configured scale.
 */
public class HtmlOutputDevice extends AbstractOutputDevice {

    private static final int PAGE_MARGIN = 50;

    private final double scale;
    private final HtmlLayoutMode layoutMode;
    private double pageTop = PAGE_MARGIN;
    private double pageHeight;
    private final List<Integer> pageNumbers = new ArrayList<>();

    // text block under construction: a line in NORMAL mode, a paragraph in LOOSE mode
    private final StringBuilder block = new StringBuilder();
    private TextPosition blockAnchor;

    public HtmlOutputDevice(ResourceManager resourceManager,
                            OutputStream sink,
                            Charset codec,
                            LayoutParams layoutParams,
                            ImageExportWriter imageWriter,
                            double scale,
                            HtmlLayoutMode layoutMode) throws IOException {
        super(resourceManager, sink, codec, layoutParams, imageWriter);
        this.scale = scale;
        this.layoutMode = layoutMode;
        write("<html><head>\n");
        write("<meta http-equiv=\"Content-Type\" content=\"text/html; charset=" + codec.name() + "\">\n");
        write("</head><body>\n");
    }

    @Override
    protected void onBeginPage(ExtractedPage page) throws IOException {
        PDRectangle box = page.displayBox();
        pageHeight = box.getHeight();
        pageNumbers.add(page.pageNumber());
        write("<div style=\"position:absolute; top:" + px(pageTop - PAGE_MARGIN / 2.0) + ";\">"
                + "<a name=\"" + page.pageNumber() + "\">Page " + page.pageNumber() + "</a></div>\n");
        write("<span style=\"position:absolute; border: gray 1px solid; left:0px; top:" + px(pageTop)
                + "; width:" + px(box.getWidth() * scale) + "; height:" + px(box.getHeight() * scale) + ";\"></span>\n");
    }

    @Override
    protected void onEndPage(ExtractedPage page) throws IOException {
        flushBlock();
        pageTop += pageHeight * scale + PAGE_MARGIN;
    }

    @Override
    protected void onRenderText(String text, List<TextPosition> positions) throws IOException {
        if (positions.isEmpty()) {
            return;
        }
        if (layoutMode == HtmlLayoutMode.EXACT) {
            for (TextPosition position : positions) {
                writeGlyph(position);
            }
            return;
        }
        if (blockAnchor == null) {
            blockAnchor = positions.get(0);
        }
        FontDescriptor font = resourceManager.describeFont(positions.get(0).getFont());
        block.append("<span style=\"font-family: ").append(Markup.escape(font.name()))
                .append("; font-size:").append(px(positions.get(0).getFontSizeInPt() * scale))
                .append(font.bold() ? "; font-weight:bold" : "")
                .append(font.italic() ? "; font-style:italic" : "")
                .append("\">").append(Markup.escape(text)).append("</span>");
    }

    @Override
    protected void onWordSeparator() {
        if (layoutMode != HtmlLayoutMode.EXACT && blockAnchor != null) {
            block.append(' ');
        }
    }

    @Override
    protected void onLineSeparator() throws IOException {
        if (layoutMode == HtmlLayoutMode.NORMAL) {
            flushBlock();
        } else if (layoutMode == HtmlLayoutMode.LOOSE && blockAnchor != null) {
            block.append("<br>");
        }
    }

    @Override
    protected void onEndParagraph() throws IOException {
        flushBlock();
    }

    @Override
    protected void onRenderImage(String name, PDImageXObject image, String fileName) throws IOException {
        if (fileName == null) {
            return;
        }
        write("<img src=\"" + Markup.escape(fileName) + "\" alt=\"" + Markup.escape(name)
                + "\" style=\"position:absolute; left:0px; top:" + px(pageTop)
                + "; width:" + px(image.getWidth() * scale) + "; height:" + px(image.getHeight() * scale) + ";\">\n");
    }

    @Override
    protected void writeFooter() throws IOException {
        StringJoiner links = new StringJoiner(", ");
        for (Integer pageNumber : pageNumbers) {
            links.add("<a href=\"#" + pageNumber + "\">" + pageNumber + "</a>");
        }
        write("<div style=\"position:absolute; top:0px;\">Page: " + links + "</div>\n");
        write("</body></html>\n");
    }

    private void writeGlyph(TextPosition position) throws IOException {
        String unicode = Markup.escape(position.getUnicode());
        if (unicode.isEmpty()) {
            return;
        }
        FontDescriptor font = resourceManager.describeFont(position.getFont());
        write("<span style=\"position:absolute; left:" + px(position.getX() * scale)
                + "; top:" + px(top(position)) + "; font-family: " + Markup.escape(font.name())
                + "; font-size:" + px(position.getFontSizeInPt() * scale) + ";\">" + unicode + "</span>\n");
    }

    private void flushBlock() throws IOException {
        if (blockAnchor == null) {
            block.setLength(0);
            return;
        }
        write("<div style=\"position:absolute; left:" + px(blockAnchor.getX() * scale)
                + "; top:" + px(top(blockAnchor)) + ";\">" + block + "</div>\n");
        block.setLength(0);
        blockAnchor = null;
    }

    private double top(TextPosition position) {
        return pageTop + (position.getY() - position.getHeight()) * scale;
    }

    private static String px(double value) {
        return Math.round(value) + "px";
    }
}
