package com.phillippitts.ttsbatch.presentation.exception;

import com.phillippitts.ttsbatch.exception.InvalidRequestException;
import com.phillippitts.ttsbatch.exception.ModelUnavailableException;
import com.phillippitts.ttsbatch.exception.SynthesisException;
import com.phillippitts.ttsbatch.presentation.dto.ApiError;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with a {@code {"detail": ...}} body.
 * Logs errors for monitoring while keeping engine internals out of client responses.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - invalid input (HTTP 400).
     */
    @ExceptionHandler(InvalidRequestException.class)
    ResponseEntity<ApiError> handleInvalidRequest(InvalidRequestException ex) {
        LOG.warn("Invalid request: field={}, reason={}", ex.getField(), ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    /**
     * Malformed or missing JSON body (HTTP 400).
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex) {
        LOG.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return error(HttpStatus.BAD_REQUEST, "Request body must be JSON with a \"text\" field");
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    ResponseEntity<ApiError> handleMediaType(HttpMediaTypeNotSupportedException ex) {
        return error(HttpStatus.UNSUPPORTED_MEDIA_TYPE, "Content-Type must be application/json");
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    ResponseEntity<ApiError> handleMethod(HttpRequestMethodNotSupportedException ex) {
        return error(HttpStatus.METHOD_NOT_ALLOWED, ex.getMessage());
    }

    @ExceptionHandler(NoResourceFoundException.class)
    ResponseEntity<ApiError> handleNoResource(NoResourceFoundException ex) {
        return error(HttpStatus.NOT_FOUND, "Not found: /" + ex.getResourcePath());
    }

    /**
     * Unknown model (HTTP 404), or model temporarily unavailable (HTTP 503).
     */
    @ExceptionHandler(ModelUnavailableException.class)
    ResponseEntity<ApiError> handleModelUnavailable(ModelUnavailableException ex) {
        if (ex.isUnknownModel()) {
            LOG.warn("Unknown model requested: {} ({})", ex.getModelId(), ex.getReason());
            return error(HttpStatus.NOT_FOUND, "Model '" + ex.getModelId() + "' not found");
        }
        LOG.error("Model unavailable: model={}, reason={}", ex.getModelId(), ex.getReason(), ex);
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage());
    }

    /**
     * Engine failure (HTTP 500).
     */
    @ExceptionHandler(SynthesisException.class)
    ResponseEntity<ApiError> handleSynthesisFailure(SynthesisException ex) {
        LOG.error("Synthesis failed: engine={}", ex.getEngineName(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Speech synthesis failed (engine: " + ex.getEngineName() + ")");
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred");
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, String detail) {
        return ResponseEntity.status(status).body(new ApiError(detail));
    }
}
