package com.example.pdfextract.infrastructure.pdf;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ExtractedPageTest {

    /**
     * Effective rotation is the intrinsic one plus the delta, normalized into [0, 360).
     */
    @Test
    void withRotationDelta_wrapsAround() throws Exception {
        try (PDDocument document = new PDDocument()) {
            PDPage page = new PDPage(PDRectangle.LETTER);
            page.setRotation(270);
            ExtractedPage extracted = ExtractedPage.of(0, document, page);

            assertThat(extracted.withRotationDelta(180).effectiveRotation()).isEqualTo(90);
            assertThat(extracted.withRotationDelta(-630).effectiveRotation()).isEqualTo(0);
            assertThat(extracted.withRotationDelta(0).effectiveRotation()).isEqualTo(270);
            assertThat(extracted.withRotationDelta(180).intrinsicRotation()).isEqualTo(270);
            assertThat(page.getRotation()).isEqualTo(270);
        }
    }

    /**
     * Deltas near the int range are reduced before they are added.
     */
    @Test
    void withRotationDelta_handlesExtremeDeltas() throws Exception {
        try (PDDocument document = new PDDocument()) {
            PDPage page = new PDPage(PDRectangle.LETTER);
            page.setRotation(270);
            ExtractedPage turned = ExtractedPage.of(0, document, page);
            page.setRotation(90);
            ExtractedPage quarter = ExtractedPage.of(1, document, page);

            assertThat(turned.withRotationDelta(2147483610).effectiveRotation()).isEqualTo(0);
            assertThat(turned.withRotationDelta(Integer.MAX_VALUE).effectiveRotation()).isEqualTo(37);
            assertThat(quarter.withRotationDelta(Integer.MIN_VALUE).effectiveRotation()).isEqualTo(322);
        }
    }

    /**
     * A delta that is not a quarter turn is kept as is and leaves the page box upright.
     */
    @Test
    void withRotationDelta_keepsNonQuarterTurns() throws Exception {
        try (PDDocument document = new PDDocument()) {
            PDPage page = new PDPage(PDRectangle.LETTER);
            page.setRotation(90);
            ExtractedPage tilted = ExtractedPage.of(0, document, page).withRotationDelta(-45);

            assertThat(tilted.effectiveRotation()).isEqualTo(45);
            assertThat(tilted.displayBox().getWidth()).isEqualTo(PDRectangle.LETTER.getWidth());
        }
    }

    /**
     * Negative declared rotations are normalized as well.
     */
    @Test
    void of_normalizesDeclaredRotation() throws Exception {
        try (PDDocument document = new PDDocument()) {
            PDPage page = new PDPage(PDRectangle.LETTER);
            page.setRotation(-90);

            assertThat(ExtractedPage.of(3, document, page).intrinsicRotation()).isEqualTo(270);
            assertThat(ExtractedPage.of(3, document, page).pageNumber()).isEqualTo(4);
        }
    }

    /**
     * Quarter turns swap the display box dimensions.
     */
    @Test
    void displayBox_swapsDimensionsForQuarterTurns() throws Exception {
        try (PDDocument document = new PDDocument()) {
            PDPage page = new PDPage(PDRectangle.LETTER);
            ExtractedPage upright = ExtractedPage.of(0, document, page);
            PDRectangle turned = upright.withRotationDelta(90).displayBox();

            assertThat(upright.displayBox().getWidth()).isEqualTo(PDRectangle.LETTER.getWidth());
            assertThat(turned.getWidth()).isEqualTo(PDRectangle.LETTER.getHeight());
            assertThat(turned.getHeight()).isEqualTo(PDRectangle.LETTER.getWidth());
        }
    }
}
