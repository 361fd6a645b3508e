package com.example.pdfextract.support;

import com.example.pdfextract.domain.model.LayoutParams;
import com.example.pdfextract.infrastructure.pdf.ExtractedPage;
import com.example.pdfextract.infrastructure.pdf.ResourceManager;
import com.example.pdfextract.infrastructure.pdf.device.AbstractOutputDevice;
import org.apache.pdfbox.text.TextPosition;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Device that records the events it receives instead of serializing them.
 */
public class RecordingOutputDevice extends AbstractOutputDevice {

    private final List<String> events = new ArrayList<>();
    private final List<Integer> pageIndexes = new ArrayList<>();
    private final List<Integer> effectiveRotations = new ArrayList<>();
    private final List<Integer> documentRotationsSeen = new ArrayList<>();
    private int closeCount;

    public RecordingOutputDevice(ResourceManager resourceManager, LayoutParams layoutParams) {
        super(resourceManager, new ByteArrayOutputStream(), StandardCharsets.UTF_8, layoutParams, null);
    }

    @Override
    protected void onBeginPage(ExtractedPage page) {
        events.add("begin:" + page.index());
        pageIndexes.add(page.index());
        effectiveRotations.add(page.effectiveRotation());
    }

    @Override
    protected void onEndPage(ExtractedPage page) {
        documentRotationsSeen.add(page.page().getRotation());
        events.add("end:" + page.index());
    }

    @Override
    protected void onRenderText(String text, List<TextPosition> positions) {
        events.add("text:" + text);
    }

    @Override
    protected void writeFooter() {
        closeCount++;
        events.add("close");
    }

    public ResourceManager resourceManager() {
        return resourceManager;
    }

    public List<String> events() {
        return events;
    }

    public List<Integer> pageIndexes() {
        return pageIndexes;
    }

    public List<Integer> effectiveRotations() {
        return effectiveRotations;
    }

	/**
	 * @return {@code /Rotate} of each page as seen while it was being interpreted
	 */
    public List<Integer> documentRotationsSeen() {
        return documentRotationsSeen;
    }

    public int closeCount() {
        return closeCount;
    }
}
