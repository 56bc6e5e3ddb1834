package com.analyticssync.api;

import com.analyticssync.api.dto.ApiError;
import com.analyticssync.infrastructure.upstream.UpstreamFetchException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps exceptions to {@link ApiError} bodies.
 *
 * Upstream failures become 502, except authentication (401) and permission (403) failures,
 * which the caller can fix by re-authenticating.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(MissingCredentialsException.class)
    public ResponseEntity<ApiError> handleMissingCredentials(MissingCredentialsException ex) {
        return respond(HttpStatus.UNAUTHORIZED, "Unauthorized", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(ApiExceptionHandler::describe)
                .orElse("Validation failed");
        return respond(HttpStatus.BAD_REQUEST, "Bad Request", message);
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class})
    public ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        return respond(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage());
    }

    @ExceptionHandler(NoPropertiesFoundException.class)
    public ResponseEntity<ApiError> handleNoProperties(NoPropertiesFoundException ex) {
        return respond(HttpStatus.NOT_FOUND, "No Properties Found", ex.getMessage());
    }

    @ExceptionHandler(UpstreamFetchException.class)
    public ResponseEntity<ApiError> handleUpstream(UpstreamFetchException ex) {
        log.warn("Upstream failure ({}): {}", ex.getCategory(), ex.getMessage());
        return switch (ex.getCategory()) {
            case AUTHENTICATION -> respond(HttpStatus.UNAUTHORIZED, "Authentication Failed", ex.getMessage());
            case PERMISSION -> respond(HttpStatus.FORBIDDEN, "Permission Denied", ex.getMessage());
            default -> respond(HttpStatus.BAD_GATEWAY, "Upstream Failure", ex.getMessage());
        };
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        log.error("Unhandled error: {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Error", ex.getMessage());
    }

    private static ResponseEntity<ApiError> respond(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(ApiError.of(error, message, status.value()));
    }

    private static String describe(FieldError error) {
        return error.getField() + ": " + error.getDefaultMessage();
    }
}
