package com.example.pdfextract.infrastructure.pdf;

import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Writes images met during interpretation into a directory as PNG files.
 * File names are derived from the page number and the XObject name and are unique within one writer.
 */
public class ImageExportWriter {

    private static final Logger log = LoggerFactory.getLogger(ImageExportWriter.class);
    private static final Pattern UNSAFE_CHARS = Pattern.compile("[^A-Za-z0-9._-]");
    private static final String FORMAT = "png";

    private final Path outputDir;
    private final Set<String> usedNames = new HashSet<>();

	/**
	 * @param outputDir target directory, created when missing
	 * @throws IOException when the directory cannot be created
	 */
    public ImageExportWriter(Path outputDir) throws IOException {
        this.outputDir = Files.createDirectories(outputDir);
    }

	/**
	 * Decodes the image and stores it.
	 *
	 * @param name      resource name of the image XObject
	 * @param pageIndex zero-based page the image was drawn on
	 * @param image     image to export
	 * @return file name of the written image, relative to the output directory
	 * @throws IOException when decoding or writing fails
	 */
    public String export(String name, int pageIndex, PDImageXObject image) throws IOException {
        String fileName = uniqueName("page" + (pageIndex + 1) + "-" + UNSAFE_CHARS.matcher(name).replaceAll("_"));
        BufferedImage decoded = image.getImage();
        Path target = outputDir.resolve(fileName);
        try (OutputStream out = Files.newOutputStream(target)) {
            if (!ImageIO.write(decoded, FORMAT, out)) {
                throw new IOException("No ImageIO writer available for " + FORMAT);
            }
        }
        log.debug("Exported image {} ({}x{}) to {}", name, image.getWidth(), image.getHeight(), target);
        return fileName;
    }

    private String uniqueName(String base) {
        String candidate = base + "." + FORMAT;
        int counter = 1;
        while (!usedNames.add(candidate)) {
            candidate = base + "." + counter++ + "." + FORMAT;
        }
        return candidate;
    }
}
