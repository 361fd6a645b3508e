package com.example.pdfextract.infrastructure.pdf;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;

/**
 * One page handed out by {@link PdfPageSequence}.
 *
 * @param index             zero-based ordinal within the document
 * @param document          document that owns the page
 * @param page              PDFBox page object
 * @param intrinsicRotation rotation declared by the document, in [0, 360)
 * @param effectiveRotation rotation the interpreter applies for this run, in [0, 360)
 */
public record ExtractedPage(
        int index,
        PDDocument document,
        PDPage page,
        int intrinsicRotation,
        int effectiveRotation
) {

    static ExtractedPage of(int index, PDDocument document, PDPage page) {
        int rotation = Math.floorMod(page.getRotation(), 360);
        return new ExtractedPage(index, document, page, rotation, rotation);
    }

	/**
	 * Derives the rotation seen by the interpreter without touching the document.
	 *
	 * @param delta degrees to add to the intrinsic rotation
	 * @return copy whose effective rotation is {@code (intrinsic + delta) mod 360}
	 */
    public ExtractedPage withRotationDelta(int delta) {
        return new ExtractedPage(index, document, page, intrinsicRotation,
                Math.floorMod(intrinsicRotation + Math.floorMod(delta, 360), 360));
    }

	/**
	 * Rotations that are not quarter turns leave the box upright, as PDFBox ignores them for geometry.
	 *
	 * @return page box in display orientation, width and height swapped for quarter turns
	 */
    public PDRectangle displayBox() {
        PDRectangle box = page.getCropBox();
        if (effectiveRotation == 90 || effectiveRotation == 270) {
            return new PDRectangle(box.getLowerLeftX(), box.getLowerLeftY(), box.getHeight(), box.getWidth());
        }
        return box;
    }

	/**
	 * @return one-based page number as printed in serialized output
	 */
    public int pageNumber() {
        return index + 1;
    }
}
