package com.example.pdfextract.interfaces.api.error;

import java.time.Instant;

/**
 * JSON envelope returned for failed extraction and inspection requests.
 *
 * @param timestamp moment the error was produced
 * @param status    HTTP status code
 * @param error     stable error code, e.g. {@code PDF_PASSWORD_INVALID}
 * @param message   human readable explanation
 * @param path      request path that failed
 */
public record ErrorResponse(
        Instant timestamp,
        int status,
        String error,
        String message,
        String path
) {
    public static ErrorResponse of(int status, String error, String message, String path) {
        return new ErrorResponse(Instant.now(), status, error, message, path);
    }
}
