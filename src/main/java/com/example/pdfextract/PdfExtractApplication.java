package com.example.pdfextract;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Boots the extraction service and exposes the HTTP endpoints under the interfaces layer.
 */
@SpringBootApplication
public class PdfExtractApplication {

	public static void main(String[] args) {
		SpringApplication.run(PdfExtractApplication.class, args);
	}

}
