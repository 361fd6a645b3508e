package com.example.pdfextract.infrastructure.pdf;

import com.example.pdfextract.infrastructure.pdf.ResourceManager.FontDescriptor;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ResourceManagerTest {

    /**
     * With caching on a font is described once per run.
     */
    @Test
    void describeFont_reusesDescriptionWhenCaching() {
        ResourceManager resourceManager = new ResourceManager(true);
        PDType1Font font = new PDType1Font(Standard14Fonts.FontName.HELVETICA_BOLD);

        FontDescriptor first = resourceManager.describeFont(font);
        FontDescriptor second = resourceManager.describeFont(font);

        assertThat(second).isSameAs(first);
        assertThat(resourceManager.resolvedFontCount()).isEqualTo(1);
    }

    /**
     * With caching off every lookup resolves again, with the same answer.
     */
    @Test
    void describeFont_resolvesEveryTimeWithoutCaching() {
        ResourceManager resourceManager = new ResourceManager(false);
        PDType1Font font = new PDType1Font(Standard14Fonts.FontName.HELVETICA_BOLD);

        FontDescriptor first = resourceManager.describeFont(font);
        FontDescriptor second = resourceManager.describeFont(font);

        assertThat(second).isEqualTo(first);
        assertThat(resourceManager.resolvedFontCount()).isEqualTo(2);
    }

    @Test
    void describeFont_detectsStyleFromName() {
        ResourceManager resourceManager = new ResourceManager(true);

        FontDescriptor bold = resourceManager.describeFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA_BOLD));
        FontDescriptor oblique = resourceManager.describeFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA_OBLIQUE));
        FontDescriptor regular = resourceManager.describeFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA));

        assertThat(bold.name()).isEqualTo("Helvetica-Bold");
        assertThat(bold.bold()).isTrue();
        assertThat(oblique.italic()).isTrue();
        assertThat(regular.bold()).isFalse();
        assertThat(regular.italic()).isFalse();
    }

    @Test
    void describeFont_handlesMissingFont() {
        assertThat(new ResourceManager(true).describeFont(null)).isEqualTo(FontDescriptor.UNKNOWN);
    }
}
