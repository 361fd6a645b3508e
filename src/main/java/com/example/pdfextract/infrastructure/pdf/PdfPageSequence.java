package com.example.pdfextract.infrastructure.pdf;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;

import java.io.Closeable;
import java.io.IOException;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * Lazy, filtered view over the pages of an opened document.
 * Pages come out in document order; a page number filter keeps only the listed ordinals and
 * the page cap stops enumeration after that many pages have passed the filter.
 * Closing the sequence closes the document.
 */
public class PdfPageSequence implements Iterable<ExtractedPage>, Closeable {

    private final PDDocument document;
    private final Set<Integer> pageNumbers;
    private final int maxPages;

    PdfPageSequence(PDDocument document, Set<Integer> pageNumbers, int maxPages) {
        this.document = document;
        this.pageNumbers = pageNumbers;
        this.maxPages = maxPages;
    }

    public int documentPageCount() {
        return document.getNumberOfPages();
    }

    @Override
    public Iterator<ExtractedPage> iterator() {
        return new FilteringIterator(document.getPages().iterator());
    }

    @Override
    public void close() throws IOException {
        document.close();
    }

    private boolean selected(int index) {
        return pageNumbers == null || pageNumbers.contains(index);
    }

    private final class FilteringIterator implements Iterator<ExtractedPage> {

        private final Iterator<PDPage> pages;
        private int index = -1;
        private int yielded;
        private ExtractedPage next;

        private FilteringIterator(Iterator<PDPage> pages) {
            this.pages = pages;
        }

        @Override
        public boolean hasNext() {
            if (next != null) {
                return true;
            }
            if (maxPages > 0 && yielded >= maxPages) {
                return false;
            }
            while (pages.hasNext()) {
                PDPage page = pages.next();
                index++;
                if (selected(index)) {
                    next = ExtractedPage.of(index, document, page);
                    return true;
                }
            }
            return false;
        }

        @Override
        public ExtractedPage next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            ExtractedPage page = next;
            next = null;
            yielded++;
            return page;
        }
    }
}
