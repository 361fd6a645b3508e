package com.example.pdfextract.domain.model;

import java.util.List;

/**
 * Facts about a document that help a caller choose page filters and rotation deltas before extracting.
 *
 * @param fileName      display name of the inspected document
 * @param pageCount     total number of pages
 * @param pdfVersion    header version, e.g. {@code 1.7}
 * @param encrypted     whether the document carries an encryption dictionary
 * @param extractable   whether the access permissions allow content extraction
 * @param pageRotations intrinsic rotation of every page, indexed by zero-based ordinal
 * @param title         title from the info dictionary, falling back to XMP Dublin Core
 * @param author        author from the info dictionary, falling back to XMP Dublin Core creators
 * @param producer      producing application, falling back to the XMP creator tool
 */
public record PdfDocumentSummary(
        String fileName,
        int pageCount,
        String pdfVersion,
        boolean encrypted,
        boolean extractable,
        List<Integer> pageRotations,
        String title,
        String author,
        String producer
) {
}
