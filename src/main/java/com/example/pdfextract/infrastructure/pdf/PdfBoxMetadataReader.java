package com.example.pdfextract.infrastructure.pdf;

import com.example.pdfextract.domain.model.PdfDocumentSummary;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentCatalog;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDMetadata;
import org.apache.xmpbox.XMPMetadata;
import org.apache.xmpbox.schema.DublinCoreSchema;
import org.apache.xmpbox.schema.XMPBasicSchema;
import org.apache.xmpbox.type.BadFieldValueException;
import org.apache.xmpbox.xml.DomXmpParser;
import org.apache.xmpbox.xml.XmpParsingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds a {@link PdfDocumentSummary} from an opened document.
 * Descriptive fields come from the info dictionary first and from the XMP packet when the dictionary is silent.
 */
@Component
public class PdfBoxMetadataReader {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxMetadataReader.class);

	/**
	 * @param document opened, already decrypted document
	 * @param fileName display name reported back to the caller
	 * @return summary of structure, permissions and descriptive metadata
	 */
    public PdfDocumentSummary summarize(PDDocument document, String fileName) {
        List<Integer> rotations = new ArrayList<>(document.getNumberOfPages());
        for (PDPage page : document.getPages()) {
            rotations.add(Math.floorMod(page.getRotation(), 360));
        }

        PDDocumentInformation info = document.getDocumentInformation();
        XmpFields xmp = readXmp(document.getDocumentCatalog());

        return new PdfDocumentSummary(
                fileName,
                document.getNumberOfPages(),
                String.valueOf(document.getVersion()),
                document.isEncrypted(),
                document.getCurrentAccessPermission().canExtractContent(),
                List.copyOf(rotations),
                firstNonBlank(info != null ? info.getTitle() : null, xmp.title()),
                firstNonBlank(info != null ? info.getAuthor() : null, xmp.creators()),
                firstNonBlank(info != null ? info.getProducer() : null, xmp.creatorTool())
        );
    }

	/**
	 * Parses the XMP packet leniently; a broken packet only costs the fallback values.
	 *
	 * @param catalog document catalog
	 * @return XMP values, all {@code null} when absent or unreadable
	 */
    private XmpFields readXmp(PDDocumentCatalog catalog) {
        PDMetadata pdMetadata = catalog != null ? catalog.getMetadata() : null;
        if (pdMetadata == null) {
            return XmpFields.EMPTY;
        }
        try (InputStream metadataStream = pdMetadata.exportXMPMetadata()) {
            if (metadataStream == null) {
                return XmpFields.EMPTY;
            }
            DomXmpParser parser = new DomXmpParser();
            parser.setStrictParsing(false);
            XMPMetadata xmp = parser.parse(metadataStream);
            DublinCoreSchema dc = xmp.getDublinCoreSchema();
            XMPBasicSchema basic = xmp.getXMPBasicSchema();

            String title = dc != null ? dc.getTitle() : null;
            List<String> creators = dc != null && dc.getCreators() != null ? dc.getCreators() : List.of();
            return new XmpFields(
                    title,
                    creators.isEmpty() ? null : String.join(", ", creators),
                    basic != null ? basic.getCreatorTool() : null
            );
        } catch (IOException | XmpParsingException | BadFieldValueException ex) {
            log.warn("Failed to parse XMP metadata", ex);
            return XmpFields.EMPTY;
        }
    }

    private static String firstNonBlank(String primary, String fallback) {
        if (primary != null && !primary.isBlank()) {
            return primary;
        }
        return fallback;
    }

    private record XmpFields(String title, String creators, String creatorTool) {

        private static final XmpFields EMPTY = new XmpFields(null, null, null);
    }
}
