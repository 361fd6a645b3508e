package com.example.pdfextract.infrastructure.pdf.device;

import com.example.pdfextract.infrastructure.pdf.ExtractedPage;
import com.example.pdfextract.infrastructure.pdf.ResourceManager;
import org.apache.pdfbox.text.TextPosition;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.Charset;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;

/**
 * Raw content-stream dump: glyph text in drawing order wrapped in the document's marked-content tags.
 * Layout analysis never influences this output, so the device takes no layout settings.
 */
public class TagOutputDevice extends AbstractOutputDevice {

    private final Deque<String> openTags = new ArrayDeque<>();

    public TagOutputDevice(ResourceManager resourceManager, OutputStream sink, Charset codec) {
        super(resourceManager, sink, codec, null, null);
    }

    @Override
    protected void onBeginPage(ExtractedPage page) throws IOException {
        openTags.clear();
        write("<page id=\"" + page.pageNumber() + "\" bbox=\"" + formatBox(page.displayBox())
                + "\" rotate=\"" + page.effectiveRotation() + "\">");
    }

    @Override
    protected void onEndPage(ExtractedPage page) throws IOException {
        // unbalanced BMC/EMC pairs must not leak into the next page
        while (!openTags.isEmpty()) {
            write("</" + openTags.pop() + ">");
        }
        write("</page>\n");
    }

    @Override
    protected void onBeginMarkedContent(String tag, Map<String, String> properties) throws IOException {
        String name = Markup.escape(tag);
        StringBuilder element = new StringBuilder("<").append(name);
        for (Map.Entry<String, String> property : properties.entrySet()) {
            element.append(' ').append(Markup.escape(property.getKey()))
                    .append("=\"").append(Markup.escape(property.getValue())).append('"');
        }
        write(element.append('>').toString());
        openTags.push(name);
    }

    @Override
    protected void onEndMarkedContent() throws IOException {
        if (!openTags.isEmpty()) {
            write("</" + openTags.pop() + ">");
        }
    }

    @Override
    protected void onRenderCharacter(TextPosition position) throws IOException {
        write(Markup.escape(position.getUnicode()));
    }
}
