package com.example.pdfextract.interfaces.api.error;

import com.example.pdfextract.application.exception.ApplicationException;
import com.example.pdfextract.application.exception.UseCaseValidationException;
import com.example.pdfextract.domain.exception.DomainException;
import com.example.pdfextract.domain.exception.InvalidExtractionConfigException;
import com.example.pdfextract.domain.exception.PdfDecryptionException;
import com.example.pdfextract.domain.exception.PdfExtractionNotAllowedException;
import com.example.pdfextract.domain.exception.PdfNotFoundException;
import com.example.pdfextract.infrastructure.exception.InfrastructureException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps domain, application and infrastructure failures to HTTP responses with an {@link ErrorResponse} body.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(PdfNotFoundException.class)
    public ResponseEntity<ErrorResponse> handlePdfNotFound(PdfNotFoundException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.NOT_FOUND, "PDF_NOT_FOUND");
    }

    /**
     * Wrong password for an encrypted document.
     */
    @ExceptionHandler(PdfDecryptionException.class)
    public ResponseEntity<ErrorResponse> handleDecryption(PdfDecryptionException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.UNAUTHORIZED, "PDF_PASSWORD_INVALID");
    }

    /**
     * Document permissions forbid extraction.
     */
    @ExceptionHandler(PdfExtractionNotAllowedException.class)
    public ResponseEntity<ErrorResponse> handleExtractionNotAllowed(PdfExtractionNotAllowedException ex,
                                                                    HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.FORBIDDEN, "PDF_EXTRACTION_FORBIDDEN");
    }

    @ExceptionHandler(InvalidExtractionConfigException.class)
    public ResponseEntity<ErrorResponse> handleInvalidConfig(InvalidExtractionConfigException ex,
                                                             HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.BAD_REQUEST, "INVALID_EXTRACTION_CONFIG");
    }

    @ExceptionHandler(DomainException.class)
    public ResponseEntity<ErrorResponse> handleDomain(DomainException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.BAD_REQUEST, "DOMAIN_ERROR");
    }

    @ExceptionHandler(UseCaseValidationException.class)
    public ResponseEntity<ErrorResponse> handleUseCaseValidation(UseCaseValidationException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.BAD_REQUEST, "USE_CASE_VALIDATION_ERROR");
    }

    @ExceptionHandler(ApplicationException.class)
    public ResponseEntity<ErrorResponse> handleApplication(ApplicationException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.UNPROCESSABLE_ENTITY, "APPLICATION_ERROR");
    }

    @ExceptionHandler(InfrastructureException.class)
    public ResponseEntity<ErrorResponse> handleInfrastructure(InfrastructureException ex, HttpServletRequest request) {
        log.error("Extraction failed for {}", request.getRequestURI(), ex);
        return buildResponse(ex, request, HttpStatus.INTERNAL_SERVER_ERROR, "INFRASTRUCTURE_ERROR");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex, HttpServletRequest request) {
        log.error("Unexpected failure for {}", request.getRequestURI(), ex);
        return buildResponse(ex, request, HttpStatus.INTERNAL_SERVER_ERROR, "UNEXPECTED_ERROR");
    }

    // the content type is forced because extraction endpoints negotiate text, XML or HTML on success
    private ResponseEntity<ErrorResponse> buildResponse(Throwable error,
                                                        HttpServletRequest request,
                                                        HttpStatus status,
                                                        String errorCode) {
        ErrorResponse response = ErrorResponse.of(status.value(), errorCode, error.getMessage(), request.getRequestURI());
        return ResponseEntity.status(status).contentType(MediaType.APPLICATION_JSON).body(response);
    }
}
