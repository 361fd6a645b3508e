package com.example.pdfextract.interfaces.api;

import com.example.pdfextract.application.exception.UseCaseValidationException;
import com.example.pdfextract.application.service.PdfExtractionService;
import com.example.pdfextract.application.service.PdfInspectionService;
import com.example.pdfextract.domain.model.ExtractionConfig;
import com.example.pdfextract.domain.model.HtmlLayoutMode;
import com.example.pdfextract.domain.model.LayoutParams;
import com.example.pdfextract.domain.model.PdfDocumentSummary;
import com.example.pdfextract.infrastructure.config.ExtractionProperties;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseBody;
import org.springframework.web.multipart.MultipartFile;

import java.nio.file.Path;
import java.util.List;
import java.util.UUID;

/**
 * Interfaces-layer controller exposing extraction and inspection of uploaded PDFs.
 */
@Controller
public class PdfExtractionController {

    static final String IMAGE_DIRECTORY_HEADER = "X-Image-Directory";

    private final PdfExtractionService extractionService;
    private final PdfInspectionService inspectionService;
    private final ExtractionProperties properties;

    public PdfExtractionController(PdfExtractionService extractionService,
                                   PdfInspectionService inspectionService,
                                   ExtractionProperties properties) {
        this.extractionService = extractionService;
        this.inspectionService = inspectionService;
        this.properties = properties;
    }

    /**
     * Extracts the uploaded PDF and returns the serialized result with a matching content type.
     *
     * @param file           uploaded PDF
     * @param outputType     {@code text}, {@code xml}, {@code html} or {@code tag}
     * @param codec          output charset, the configured default when absent
     * @param pages          zero-based page ordinals to extract, all pages when absent
     * @param maxPages       cap on extracted pages, {@code 0} for none
     * @param password       password for encrypted documents
     * @param rotation       degrees added to every page's rotation
     * @param scale          HTML coordinate scale
     * @param layoutMode     HTML layout mode: {@code normal}, {@code exact} or {@code loose}
     * @param stripControl   remove XML-illegal control characters from XML output
     * @param layout         run layout analysis with default settings
     * @param disableCaching re-resolve shared resources on every page
     * @param debug          log run progress at INFO
     * @param extractImages  export images into a fresh directory under the configured image root
     * @return serialized output
     */
    @PostMapping("/api/extract")
    @ResponseBody
    public ResponseEntity<byte[]> extract(@RequestParam("file") MultipartFile file,
                                          @RequestParam(value = "outputType", defaultValue = "text") String outputType,
                                          @RequestParam(value = "codec", required = false) String codec,
                                          @RequestParam(value = "pages", required = false) List<Integer> pages,
                                          @RequestParam(value = "maxPages", defaultValue = "0") int maxPages,
                                          @RequestParam(value = "password", defaultValue = "") String password,
                                          @RequestParam(value = "rotation", defaultValue = "0") int rotation,
                                          @RequestParam(value = "scale", defaultValue = "1.0") double scale,
                                          @RequestParam(value = "layoutMode", defaultValue = "normal") String layoutMode,
                                          @RequestParam(value = "stripControl", defaultValue = "false") boolean stripControl,
                                          @RequestParam(value = "layout", defaultValue = "true") boolean layout,
                                          @RequestParam(value = "disableCaching", defaultValue = "false") boolean disableCaching,
                                          @RequestParam(value = "debug", defaultValue = "false") boolean debug,
                                          @RequestParam(value = "extractImages", defaultValue = "false") boolean extractImages) {
        String imageDirectory = extractImages ? UUID.randomUUID().toString() : null;
        ExtractionConfig config = ExtractionConfig.builder()
                .outputType(outputType)
                .codec(codec != null && !codec.isBlank() ? codec : properties.getDefaultCodec())
                .pageNumbers(pages)
                .maxPages(maxPages)
                .password(password)
                .rotation(rotation)
                .scale(scale)
                .layoutMode(HtmlLayoutMode.fromString(layoutMode))
                .stripControl(stripControl)
                .layoutParams(layout ? LayoutParams.defaults() : null)
                .disableCaching(disableCaching)
                .debug(debug)
                .outputDir(imageDirectory != null ? resolveImageDirectory(imageDirectory) : null)
                .build();

        byte[] body = extractionService.extract(file, config);

        ResponseEntity.BodyBuilder response = ResponseEntity.ok()
                .contentType(new MediaType(MediaType.parseMediaType(config.outputType().getMediaType()), config.codec()));
        if (imageDirectory != null) {
            response.header(IMAGE_DIRECTORY_HEADER, imageDirectory);
        }
        return response.body(body);
    }

    /**
     * Reports page count, rotations, permissions and descriptive metadata of the uploaded PDF.
     *
     * @param file     uploaded PDF
     * @param password password for encrypted documents
     * @return document summary as JSON
     */
    @PostMapping(value = "/api/inspect", produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public ResponseEntity<PdfDocumentSummary> inspect(@RequestParam("file") MultipartFile file,
                                                      @RequestParam(value = "password", defaultValue = "") String password) {
        return ResponseEntity.ok(inspectionService.inspect(file, password));
    }

    private Path resolveImageDirectory(String directoryName) {
        String root = properties.getImageOutputRoot();
        if (root == null || root.isBlank()) {
            throw new UseCaseValidationException("Image extraction is not enabled on this server.");
        }
        return Path.of(root).resolve(directoryName);
    }
}
