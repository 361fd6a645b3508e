package com.example.pdfextract.application.service;

import com.example.pdfextract.domain.exception.PdfDecryptionException;
import com.example.pdfextract.domain.exception.PdfExtractionNotAllowedException;
import com.example.pdfextract.domain.exception.PdfFileRequiredException;
import com.example.pdfextract.domain.exception.PdfNotFoundException;
import com.example.pdfextract.domain.exception.PdfPathRequiredException;
import com.example.pdfextract.domain.exception.UnsupportedPdfFormatException;
import com.example.pdfextract.domain.model.ExtractionConfig;
import com.example.pdfextract.domain.model.LayoutParams;
import com.example.pdfextract.domain.model.OutputType;
import com.example.pdfextract.infrastructure.exception.PdfProcessingException;
import com.example.pdfextract.infrastructure.pdf.ExtractedPage;
import com.example.pdfextract.infrastructure.pdf.PageInterpreter;
import com.example.pdfextract.infrastructure.pdf.PdfDocumentSource;
import com.example.pdfextract.infrastructure.pdf.PdfPageSequence;
import com.example.pdfextract.infrastructure.pdf.ResourceManager;
import com.example.pdfextract.infrastructure.pdf.device.OutputDevice;
import com.example.pdfextract.infrastructure.pdf.device.OutputDeviceFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Application-layer service that runs PDF extractions.
 * One run opens the document once, interprets every selected page once in document order and routes
 * the result through a single output device, which is closed on every exit path.
 */
@Service
public class PdfExtractionService {

    private static final Logger log = LoggerFactory.getLogger(PdfExtractionService.class);

    private final PdfDocumentSource documentSource;
    private final OutputDeviceFactory deviceFactory;

    /**
     * @param documentSource opens documents and applies the page selection policy
     * @param deviceFactory  builds the output device for a run's output type
     */
    public PdfExtractionService(PdfDocumentSource documentSource, OutputDeviceFactory deviceFactory) {
        this.documentSource = documentSource;
        this.deviceFactory = deviceFactory;
    }

    /**
     * Extracts a document from a stream into a sink.
     * Both streams stay open; the sink holds the complete output only when the method returns normally.
     *
     * @param input  PDF bytes, owned by the caller
     * @param sink   destination of the serialized output, owned by the caller
     * @param config validated run configuration
     * @throws PdfDecryptionException           when the password does not open the document; no page is interpreted
     * @throws PdfExtractionNotAllowedException when the document forbids extraction; no page is interpreted
     * @throws IOException                      when parsing, interpretation or writing fails
     */
    public void extractToStream(InputStream input, OutputStream sink, ExtractionConfig config) throws IOException {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(sink, "sink");
        Objects.requireNonNull(config, "config");
        Level level = config.diagnosticsLevel();

        ResourceManager resourceManager = new ResourceManager(!config.disableCaching());
        try (OutputDevice device = deviceFactory.create(resourceManager, sink, config)) {
            PageInterpreter interpreter = new PageInterpreter(resourceManager, device);
            log.atLevel(level).log("Starting {} extraction (pages: {}, maxPages: {}, rotation: {}, caching: {})",
                    config.outputType().getValue(),
                    config.pageNumbers() != null ? config.pageNumbers() : "all",
                    config.maxPages(), config.rotation(), resourceManager.isCaching());

            try (PdfPageSequence pages = documentSource.getPages(input, config.pageNumbers(), config.maxPages(),
                    config.password(), resourceManager.isCaching(), true)) {
                int interpreted = 0;
                for (ExtractedPage page : pages) {
                    ExtractedPage rotated = page.withRotationDelta(config.rotation());
                    log.atLevel(level).log("Interpreting page {} of {} (rotation {} -> {})",
                            rotated.pageNumber(), pages.documentPageCount(),
                            rotated.intrinsicRotation(), rotated.effectiveRotation());
                    interpreter.processPage(rotated);
                    interpreted++;
                }
                log.atLevel(level).log("Finished {} extraction of {} page(s)", config.outputType().getValue(), interpreted);
            }
        }
    }

    /**
     * Extracts the plain text of a PDF on disk with every default applied.
     *
     * @param pdfPath path to the document
     * @return extracted text
     */
    public String extractText(Path pdfPath) {
        return extractText(pdfPath, "", null, 0, true, StandardCharsets.UTF_8, null);
    }

    /**
     * Extracts the plain text of a PDF on disk.
     * Layout analysis always runs: without explicit settings {@link LayoutParams#defaults()} is used.
     *
     * @param pdfPath      path to the document
     * @param password     password for encrypted documents
     * @param pageNumbers  zero-based ordinals to extract, {@code null} for all
     * @param maxPages     cap on extracted pages, {@code 0} for none
     * @param caching      reuse decoded resources across pages
     * @param codec        charset used for the intermediate encoding
     * @param layoutParams layout settings, {@code null} for the defaults
     * @return extracted text
     * @throws PdfPathRequiredException when {@code pdfPath} is null
     * @throws PdfNotFoundException     when the path does not exist
     * @throws PdfProcessingException   when the file cannot be read or parsed
     */
    public String extractText(Path pdfPath,
                              String password,
                              Set<Integer> pageNumbers,
                              int maxPages,
                              boolean caching,
                              Charset codec,
                              LayoutParams layoutParams) {
        if (pdfPath == null) {
            throw new PdfPathRequiredException();
        }
        if (!Files.exists(pdfPath)) {
            throw new PdfNotFoundException(pdfPath.toAbsolutePath().toString());
        }
        ExtractionConfig config = ExtractionConfig.builder()
                .outputType(OutputType.TEXT)
                .codec(codec)
                .layoutParams(layoutParams != null ? layoutParams : LayoutParams.defaults())
                .pageNumbers(pageNumbers)
                .maxPages(maxPages)
                .password(password)
                .disableCaching(!caching)
                .build();

        byte[] encoded;
        try (InputStream input = Files.newInputStream(pdfPath);
             ByteArrayOutputStream output = new ByteArrayOutputStream()) {
            extractToStream(input, output, config);
            encoded = output.toByteArray();
        } catch (IOException e) {
            throw new PdfProcessingException("Unable to extract text from " + pdfPath, e);
        }
        return new String(encoded, config.codec());
    }

    /**
     * Extracts an uploaded document into memory.
     *
     * @param file   uploaded PDF
     * @param config validated run configuration
     * @return serialized output encoded with the configured codec
     * @throws PdfFileRequiredException      when the upload is missing or empty
     * @throws UnsupportedPdfFormatException when the upload is not declared or named as a PDF
     * @throws PdfProcessingException        when the document cannot be read or parsed
     */
    public byte[] extract(MultipartFile file, ExtractionConfig config) {
        requirePdfUpload(file);
        try (InputStream input = file.getInputStream();
             ByteArrayOutputStream output = new ByteArrayOutputStream()) {
            extractToStream(input, output, config);
            return output.toByteArray();
        } catch (IOException e) {
            throw new PdfProcessingException("Unable to process the uploaded PDF file.", e);
        }
    }

    static void requirePdfUpload(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new PdfFileRequiredException();
        }
        if (!looksLikePdf(file)) {
            throw new UnsupportedPdfFormatException(file.getOriginalFilename());
        }
    }

    /**
     * Accepts uploads declared as {@code application/pdf} or named {@code *.pdf}.
     */
    private static boolean looksLikePdf(MultipartFile file) {
        String contentType = file.getContentType();
        if (contentType != null && contentType.equalsIgnoreCase("application/pdf")) {
            return true;
        }
        String fileName = file.getOriginalFilename();
        return fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(".pdf");
    }
}
