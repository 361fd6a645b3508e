package com.example.pdfextract.infrastructure.pdf;

import com.example.pdfextract.domain.exception.PdfDecryptionException;
import com.example.pdfextract.domain.exception.PdfExtractionNotAllowedException;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.DefaultResourceCache;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.Set;

/**
 * Opens PDF byte streams with PDFBox and hands out their pages.
 * Decryption and the extraction permission are checked before the first page is produced.
 * The caller keeps ownership of the input stream; it is read fully but never closed here.
 */
@Component
public class PdfDocumentSource {

    private static final Logger log = LoggerFactory.getLogger(PdfDocumentSource.class);

	/**
	 * Opens the document and returns its pages under the given selection policy.
	 *
	 * @param input            PDF bytes
	 * @param pageNumbers      zero-based ordinals to keep, {@code null} for all
	 * @param maxPages         cap on produced pages, {@code 0} for none
	 * @param password         password for encrypted documents
	 * @param caching          keep decoded fonts, colour spaces and XObjects across pages
	 * @param checkExtractable reject documents whose permissions forbid extraction
	 * @return page sequence owning the opened document
	 * @throws PdfDecryptionException           when the password does not open the document
	 * @throws PdfExtractionNotAllowedException when extraction is forbidden and checked
	 * @throws IOException                      when the bytes cannot be parsed
	 */
    public PdfPageSequence getPages(InputStream input,
                                    Set<Integer> pageNumbers,
                                    int maxPages,
                                    String password,
                                    boolean caching,
                                    boolean checkExtractable) throws IOException {
        PDDocument document = open(input, password);
        try {
            if (checkExtractable && !document.getCurrentAccessPermission().canExtractContent()) {
                throw new PdfExtractionNotAllowedException();
            }
            document.setResourceCache(caching ? new DefaultResourceCache() : null);
        } catch (RuntimeException ex) {
            document.close();
            throw ex;
        }
        log.debug("Opened PDF with {} page(s), encrypted: {}, caching: {}",
                document.getNumberOfPages(), document.isEncrypted(), caching);
        return new PdfPageSequence(document, pageNumbers, maxPages);
    }

	/**
	 * Loads and decrypts a document without any permission check.
	 *
	 * @param input    PDF bytes
	 * @param password password for encrypted documents, {@code null} treated as empty
	 * @return opened document, to be closed by the caller
	 * @throws PdfDecryptionException when the password does not open the document
	 * @throws IOException            when the bytes cannot be parsed
	 */
    public PDDocument open(InputStream input, String password) throws IOException {
        byte[] bytes = input.readAllBytes();
        try {
            return Loader.loadPDF(bytes, password != null ? password : "");
        } catch (InvalidPasswordException ex) {
            throw new PdfDecryptionException(ex);
        }
    }
}
