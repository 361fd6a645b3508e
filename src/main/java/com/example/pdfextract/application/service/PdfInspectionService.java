package com.example.pdfextract.application.service;

import com.example.pdfextract.domain.model.PdfDocumentSummary;
import com.example.pdfextract.infrastructure.exception.PdfProcessingException;
import com.example.pdfextract.infrastructure.pdf.PdfBoxMetadataReader;
import com.example.pdfextract.infrastructure.pdf.PdfDocumentSource;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;

/**
 * Application-layer service that reports what a document contains before anything is extracted.
 * Opening goes through the same decryption path as extraction, but the extraction permission is only
 * reported, not enforced.
 */
@Service
public class PdfInspectionService {

    private final PdfDocumentSource documentSource;
    private final PdfBoxMetadataReader metadataReader;

    public PdfInspectionService(PdfDocumentSource documentSource, PdfBoxMetadataReader metadataReader) {
        this.documentSource = documentSource;
        this.metadataReader = metadataReader;
    }

	/**
	 * @param file     uploaded PDF
	 * @param password password for encrypted documents
	 * @return page structure, permissions and descriptive metadata
	 * @throws com.example.pdfextract.domain.exception.PdfDecryptionException when the password is wrong
	 * @throws PdfProcessingException when the document cannot be parsed
	 */
    public PdfDocumentSummary inspect(MultipartFile file, String password) {
        PdfExtractionService.requirePdfUpload(file);
        String fileName = file.getOriginalFilename() != null && !file.getOriginalFilename().isBlank()
                ? file.getOriginalFilename()
                : "uploaded.pdf";
        try (InputStream input = file.getInputStream();
             PDDocument document = documentSource.open(input, password)) {
            return metadataReader.summarize(document, fileName);
        } catch (IOException e) {
            throw new PdfProcessingException("Unable to inspect the uploaded PDF file.", e);
        }
    }
}
