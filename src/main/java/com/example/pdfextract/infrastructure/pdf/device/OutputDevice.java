package com.example.pdfextract.infrastructure.pdf.device;

import com.example.pdfextract.domain.model.LayoutParams;
import com.example.pdfextract.infrastructure.pdf.ExtractedPage;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.apache.pdfbox.text.TextPosition;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Sink that serializes interpreted page content.
 * A device starts open, accepts page events in order and becomes closed for good on {@link #close()};
 * any event after that fails with {@link IllegalStateException}.
 * <p>
 * Events arrive in two flavours: stream-order events ({@link #renderCharacter}, marked content) as the
 * content stream is executed, then layout-order events (paragraphs, lines, words) once the page has been
 * grouped. Each device listens to the flavour it needs.
 */
public interface OutputDevice extends Closeable {

	/**
	 * @return layout settings the interpreter should apply, empty to keep content-stream order
	 */
    Optional<LayoutParams> layoutParams();

    boolean isOpen();

    void beginPage(ExtractedPage page) throws IOException;

    void endPage(ExtractedPage page) throws IOException;

    void beginMarkedContent(String tag, Map<String, String> properties) throws IOException;

    void endMarkedContent() throws IOException;

    void renderCharacter(TextPosition position) throws IOException;

    void beginParagraph() throws IOException;

    void endParagraph() throws IOException;

	/**
	 * @param text      text of a run of glyphs, already normalized
	 * @param positions glyphs making up the run
	 */
    void renderText(String text, List<TextPosition> positions) throws IOException;

    void wordSeparator() throws IOException;

    void lineSeparator() throws IOException;

	/**
	 * @param name  resource name of the image XObject
	 * @param image image drawn on the current page
	 */
    void renderImage(String name, PDImageXObject image) throws IOException;
}
