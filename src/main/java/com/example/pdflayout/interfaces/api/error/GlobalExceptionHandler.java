package com.example.pdflayout.interfaces.api.error;

import com.example.pdflayout.application.exception.ApplicationException;
import com.example.pdflayout.application.exception.LayoutValidationException;
import com.example.pdflayout.application.exception.UseCaseValidationException;
import com.example.pdflayout.domain.exception.DomainException;
import com.example.pdflayout.domain.exception.PdfNotFoundException;
import com.example.pdflayout.infrastructure.exception.InfrastructureException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps domain, application and infrastructure failures to structured error responses.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Maps {@link PdfNotFoundException} to a 404 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(PdfNotFoundException.class)
    public ResponseEntity<ErrorResponse> handlePdfNotFound(PdfNotFoundException ex, HttpServletRequest request) {
        return buildResponse(ex.getMessage(), request, HttpStatus.NOT_FOUND, "PDF_NOT_FOUND");
    }

    /**
     * Maps missing or unusable input detected by the domain layer to a 400 response.
     *
     * @param ex      thrown domain exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(DomainException.class)
    public ResponseEntity<ErrorResponse> handleDomain(DomainException ex, HttpServletRequest request) {
        return buildResponse(ex.getMessage(), request, HttpStatus.BAD_REQUEST, "DOMAIN_ERROR");
    }

    /**
     * Strict text validation rejects the layout as unprocessable rather than malformed. The offending
     * page and element are reported in {@code details}.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return 422 response
     */
    @ExceptionHandler(LayoutValidationException.class)
    public ResponseEntity<ErrorResponse> handleLayoutValidation(LayoutValidationException ex, HttpServletRequest request) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("pageIndex", ex.getPageIndex());
        details.put("elementIndex", ex.getElementIndex());
        details.put("reason", ex.getReason());
        return buildResponse(ex.getMessage(), request, HttpStatus.UNPROCESSABLE_ENTITY, "LAYOUT_VALIDATION_ERROR",
                details);
    }

    /**
     * Maps generic use-case validation exceptions to a 400 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(UseCaseValidationException.class)
    public ResponseEntity<ErrorResponse> handleUseCaseValidation(UseCaseValidationException ex, HttpServletRequest request) {
        return buildResponse(ex.getMessage(), request, HttpStatus.BAD_REQUEST, "USE_CASE_VALIDATION_ERROR");
    }

    /**
     * Maps remaining application-layer failures to a 422 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(ApplicationException.class)
    public ResponseEntity<ErrorResponse> handleApplication(ApplicationException ex, HttpServletRequest request) {
        return buildResponse(ex.getMessage(), request, HttpStatus.UNPROCESSABLE_ENTITY, "APPLICATION_ERROR");
    }

    /**
     * Body that could not be bound to the layout schema, e.g. {@code pages} that is not an array or an
     * element with an unknown {@code type}.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return 400 response
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex, HttpServletRequest request) {
        return buildResponse("Request body does not match the page layout schema.", request,
                HttpStatus.BAD_REQUEST, "MALFORMED_REQUEST");
    }

    /**
     * Maps an upload request without its {@code file} part to a 400 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(MissingServletRequestPartException.class)
    public ResponseEntity<ErrorResponse> handleMissingPart(MissingServletRequestPartException ex, HttpServletRequest request) {
        return buildResponse("Please choose a PDF file to convert.", request, HttpStatus.BAD_REQUEST, "DOMAIN_ERROR");
    }

    /**
     * Maps uploads above the configured multipart limits to a 413 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleUploadTooLarge(MaxUploadSizeExceededException ex, HttpServletRequest request) {
        return buildResponse("The uploaded PDF is too large.", request, HttpStatus.PAYLOAD_TOO_LARGE, "UPLOAD_TOO_LARGE");
    }

    /**
     * Maps document-level PDF engine and IO failures to a 500 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(InfrastructureException.class)
    public ResponseEntity<ErrorResponse> handleInfrastructure(InfrastructureException ex, HttpServletRequest request) {
        log.warn("Document-level failure on {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return buildResponse(ex.getMessage(), request, HttpStatus.INTERNAL_SERVER_ERROR, "INFRASTRUCTURE_ERROR");
    }

    /**
     * Catch-all that hides the stack trace behind a generic 500 payload.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex, HttpServletRequest request) {
        log.error("Unexpected failure on {}", request.getRequestURI(), ex);
        return buildResponse("Unexpected error while converting the document.", request,
                HttpStatus.INTERNAL_SERVER_ERROR, "UNEXPECTED_ERROR");
    }

    private ResponseEntity<ErrorResponse> buildResponse(String message,
                                                       HttpServletRequest request,
                                                       HttpStatus status,
                                                       String errorCode) {
        return buildResponse(message, request, status, errorCode, null);
    }

    private ResponseEntity<ErrorResponse> buildResponse(String message,
                                                       HttpServletRequest request,
                                                       HttpStatus status,
                                                       String errorCode,
                                                       Map<String, Object> details) {
        ErrorResponse response = ErrorResponse.of(status.value(), errorCode, message, request.getRequestURI(), details);
        return ResponseEntity.status(status).body(response);
    }
}
