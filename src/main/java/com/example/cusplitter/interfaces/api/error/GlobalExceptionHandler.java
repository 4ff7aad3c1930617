package com.example.cusplitter.interfaces.api.error;

import com.example.cusplitter.application.exception.ApplicationException;
import com.example.cusplitter.application.exception.DispatchInProgressException;
import com.example.cusplitter.application.exception.ReportExportValidationException;
import com.example.cusplitter.application.exception.UseCaseValidationException;
import com.example.cusplitter.application.exception.WorkspaceStateException;
import com.example.cusplitter.domain.exception.DomainException;
import com.example.cusplitter.domain.exception.DuplicateFiscalCodeException;
import com.example.cusplitter.infrastructure.exception.InfrastructureException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import java.util.List;
import java.util.Map;

/**
 * Maps domain, application and infrastructure failures to HTTP responses.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Maps a roster with repeated fiscal codes to a 422 response listing the codes.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(DuplicateFiscalCodeException.class)
    public ResponseEntity<ErrorResponse> handleDuplicateFiscalCode(DuplicateFiscalCodeException ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.UNPROCESSABLE_ENTITY;
        Map<String, Object> details = Map.of("fiscalCodes", List.copyOf(ex.getFiscalCodes()));
        ErrorResponse response = ErrorResponse.of(status.value(), "DUPLICATE_FISCAL_CODE", ex.getMessage(),
                request.getRequestURI(), details);
        return ResponseEntity.status(status).body(response);
    }

    /**
     * Maps generic domain validation exceptions to a 400 response.
     */
    @ExceptionHandler(DomainException.class)
    public ResponseEntity<ErrorResponse> handleDomain(DomainException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.BAD_REQUEST, "DOMAIN_ERROR");
    }

    @ExceptionHandler(WorkspaceStateException.class)
    public ResponseEntity<ErrorResponse> handleWorkspaceState(WorkspaceStateException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.CONFLICT, "WORKSPACE_STATE_ERROR");
    }

    @ExceptionHandler(DispatchInProgressException.class)
    public ResponseEntity<ErrorResponse> handleDispatchInProgress(DispatchInProgressException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.CONFLICT, "DISPATCH_IN_PROGRESS");
    }

    /**
     * Maps report export validation exceptions to a 422 response.
     */
    @ExceptionHandler(ReportExportValidationException.class)
    public ResponseEntity<ErrorResponse> handleReportExportValidation(ReportExportValidationException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.UNPROCESSABLE_ENTITY, "REPORT_EXPORT_VALIDATION_ERROR");
    }

    /**
     * Maps generic use-case validation exceptions to a 400 response.
     */
    @ExceptionHandler(UseCaseValidationException.class)
    public ResponseEntity<ErrorResponse> handleUseCaseValidation(UseCaseValidationException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.BAD_REQUEST, "USE_CASE_VALIDATION_ERROR");
    }

    /**
     * Maps other application-layer exceptions to a 422 response.
     */
    @ExceptionHandler(ApplicationException.class)
    public ResponseEntity<ErrorResponse> handleApplication(ApplicationException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.UNPROCESSABLE_ENTITY, "APPLICATION_ERROR");
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleUploadTooLarge(MaxUploadSizeExceededException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.PAYLOAD_TOO_LARGE, "UPLOAD_TOO_LARGE");
    }

    /**
     * Maps infrastructure exceptions to a 500 response.
     */
    @ExceptionHandler(InfrastructureException.class)
    public ResponseEntity<ErrorResponse> handleInfrastructure(InfrastructureException ex, HttpServletRequest request) {
        log.error("Infrastructure failure on {}", request.getRequestURI(), ex);
        return buildResponse(ex, request, HttpStatus.INTERNAL_SERVER_ERROR, "INFRASTRUCTURE_ERROR");
    }

    /**
     * Fallback for unexpected exceptions.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex, HttpServletRequest request) {
        log.error("Unexpected failure on {}", request.getRequestURI(), ex);
        return buildResponse(ex, request, HttpStatus.INTERNAL_SERVER_ERROR, "UNEXPECTED_ERROR");
    }

    /**
     * Central helper that creates a consistent {@link ErrorResponse} envelope.
     *
     * @param error     exception that triggered the handler
     * @param request   incoming HTTP request
     * @param status    HTTP status code to return
     * @param errorCode application-specific error code
     * @return response entity containing the serialized error
     */
    private ResponseEntity<ErrorResponse> buildResponse(Throwable error,
                                                       HttpServletRequest request,
                                                       HttpStatus status,
                                                       String errorCode) {
        ErrorResponse response = ErrorResponse.of(status.value(), errorCode, error.getMessage(), request.getRequestURI());
        return ResponseEntity.status(status).body(response);
    }
}
