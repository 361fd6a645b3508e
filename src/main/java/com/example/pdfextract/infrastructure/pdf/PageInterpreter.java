package com.example.pdfextract.infrastructure.pdf;

import com.example.pdfextract.domain.model.LayoutParams;
import com.example.pdfextract.infrastructure.pdf.device.OutputDevice;
import org.apache.pdfbox.contentstream.operator.Operator;
import org.apache.pdfbox.contentstream.operator.markedcontent.BeginMarkedContentSequence;
import org.apache.pdfbox.contentstream.operator.markedcontent.BeginMarkedContentSequenceWithProperties;
import org.apache.pdfbox.contentstream.operator.markedcontent.EndMarkedContentSequence;
import org.apache.pdfbox.cos.COSBase;
import org.apache.pdfbox.cos.COSDictionary;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.cos.COSNumber;
import org.apache.pdfbox.cos.COSString;
import org.apache.pdfbox.pdmodel.PDResources;
import org.apache.pdfbox.pdmodel.graphics.PDXObject;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Executes the content stream of one page at a time and reports what it finds to an {@link OutputDevice}.
 * Glyph grouping is delegated to PDFBox's {@link PDFTextStripper}, configured from the device's layout settings.
 */
public class PageInterpreter {

    private static final Logger log = LoggerFactory.getLogger(PageInterpreter.class);
    private static final String DRAW_OBJECT = "Do";

    private final ResourceManager resourceManager;
    private final OutputDevice device;
    private final DeviceTextStripper stripper;

    public PageInterpreter(ResourceManager resourceManager, OutputDevice device) throws IOException {
        this.resourceManager = resourceManager;
        this.device = device;
        this.stripper = new DeviceTextStripper();
        configure(stripper, device.layoutParams().orElse(null));
    }

	/**
	 * Interprets a page under its effective rotation. The page's own {@code /Rotate} entry is restored
	 * afterwards, so the document is left as it was found.
	 *
	 * @param page page to interpret
	 * @throws IOException when the content stream cannot be processed or the device cannot write
	 */
    public void processPage(ExtractedPage page) throws IOException {
        COSDictionary pageDictionary = page.page().getCOSObject();
        COSBase declaredRotation = pageDictionary.getItem(COSName.ROTATE);
        page.page().setRotation(page.effectiveRotation());
        try {
            device.beginPage(page);
            stripper.setStartPage(page.pageNumber());
            stripper.setEndPage(page.pageNumber());
            stripper.writeText(page.document(), Writer.nullWriter());
            device.endPage(page);
        } catch (UncheckedIOException ex) {
            throw ex.getCause();
        } finally {
            if (declaredRotation == null) {
                pageDictionary.removeItem(COSName.ROTATE);
            } else {
                pageDictionary.setItem(COSName.ROTATE, declaredRotation);
            }
        }
        log.trace("Interpreted page {} (caching: {})", page.pageNumber(), resourceManager.isCaching());
    }

    private static void configure(PDFTextStripper stripper, LayoutParams layoutParams) {
        if (layoutParams == null) {
            stripper.setSortByPosition(false);
            return;
        }
        stripper.setSortByPosition(layoutParams.sortByPosition());
        stripper.setSpacingTolerance(layoutParams.spacingTolerance());
        stripper.setAverageCharTolerance(layoutParams.averageCharTolerance());
        stripper.setDropThreshold(layoutParams.dropThreshold());
        stripper.setIndentThreshold(layoutParams.indentThreshold());
        stripper.setShouldSeparateByBeads(layoutParams.separateByBeads());
        stripper.setSuppressDuplicateOverlappingText(layoutParams.suppressDuplicateOverlappingText());
    }

    private static Map<String, String> describe(COSDictionary properties) {
        Map<String, String> values = new LinkedHashMap<>();
        if (properties == null) {
            return values;
        }
        for (COSName key : properties.keySet()) {
            COSBase value = properties.getDictionaryObject(key);
            if (value instanceof COSString string) {
                values.put(key.getName(), string.getString());
            } else if (value instanceof COSName name) {
                values.put(key.getName(), name.getName());
            } else if (value instanceof COSNumber number) {
                values.put(key.getName(), number.toString());
            }
        }
        return values;
    }

    /**
     * Text stripper whose output callbacks go to the device instead of a writer.
     * Callbacks that PDFBox declares without {@link IOException} tunnel device failures
     * through {@link UncheckedIOException}; {@link #processPage(ExtractedPage)} unwraps them.
     */
    private final class DeviceTextStripper extends PDFTextStripper {

        private DeviceTextStripper() throws IOException {
            addOperator(new BeginMarkedContentSequence(this));
            addOperator(new BeginMarkedContentSequenceWithProperties(this));
            addOperator(new EndMarkedContentSequence(this));
        }

        @Override
        protected void processOperator(Operator operator, List<COSBase> operands) throws IOException {
            if (DRAW_OBJECT.equals(operator.getName()) && !operands.isEmpty()
                    && operands.get(0) instanceof COSName name) {
                PDResources resources = getResources();
                if (resources != null && resources.isImageXObject(name)) {
                    PDXObject xObject = resources.getXObject(name);
                    if (xObject instanceof PDImageXObject image) {
                        device.renderImage(name.getName(), image);
                    }
                }
            }
            super.processOperator(operator, operands);
        }

        @Override
        protected void processTextPosition(TextPosition text) {
            try {
                device.renderCharacter(text);
            } catch (IOException ex) {
                throw new UncheckedIOException(ex);
            }
            super.processTextPosition(text);
        }

        @Override
        public void beginMarkedContentSequence(COSName tag, COSDictionary properties) {
            try {
                device.beginMarkedContent(tag != null ? tag.getName() : "", describe(properties));
            } catch (IOException ex) {
                throw new UncheckedIOException(ex);
            }
            super.beginMarkedContentSequence(tag, properties);
        }

        @Override
        public void endMarkedContentSequence() {
            try {
                device.endMarkedContent();
            } catch (IOException ex) {
                throw new UncheckedIOException(ex);
            }
            super.endMarkedContentSequence();
        }

        @Override
        protected void writeString(String text, List<TextPosition> textPositions) throws IOException {
            device.renderText(text, textPositions);
        }

        @Override
        protected void writeWordSeparator() throws IOException {
            device.wordSeparator();
        }

        @Override
        protected void writeLineSeparator() throws IOException {
            device.lineSeparator();
        }

        @Override
        protected void writeParagraphStart() throws IOException {
            super.writeParagraphStart();
            device.beginParagraph();
        }

        @Override
        protected void writeParagraphEnd() throws IOException {
            super.writeParagraphEnd();
            device.endParagraph();
        }
    }
}
