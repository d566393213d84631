package ch.so.arp.docqa.exception;

import java.time.Instant;
import java.util.UUID;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Translates the application exceptions into {@link ApiError} responses so that
 * REST callers always receive a renderable body.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(UnsupportedFormatException.class)
    public ResponseEntity<ApiError> handleUnsupportedFormat(UnsupportedFormatException ex,
            HttpServletRequest request) {
        return respond(HttpStatus.UNSUPPORTED_MEDIA_TYPE, ApiError.UNSUPPORTED_FORMAT, ex.getMessage(), request);
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ApiError> handleValidation(ValidationException ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, ApiError.VALIDATION_ERROR, ex.getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleInvalidArgument(MethodArgumentNotValidException ex,
            HttpServletRequest request) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return respond(HttpStatus.BAD_REQUEST, ApiError.VALIDATION_ERROR, message, request);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ApiError> handleUploadTooLarge(MaxUploadSizeExceededException ex,
            HttpServletRequest request) {
        return respond(HttpStatus.PAYLOAD_TOO_LARGE, ApiError.VALIDATION_ERROR, "File too large", request);
    }

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<ApiError> handleSessionNotFound(SessionNotFoundException ex, HttpServletRequest request) {
        return respond(HttpStatus.NOT_FOUND, ApiError.SESSION_NOT_FOUND, "Session not found", request);
    }

    @ExceptionHandler(ProviderException.class)
    public ResponseEntity<ApiError> handleProvider(ProviderException ex, HttpServletRequest request) {
        return fail(HttpStatus.BAD_GATEWAY, ApiError.PROVIDER_UNAVAILABLE, ex.getUserMessage(), ex, request);
    }

    @ExceptionHandler(StoreException.class)
    public ResponseEntity<ApiError> handleStore(StoreException ex, HttpServletRequest request) {
        return fail(HttpStatus.SERVICE_UNAVAILABLE, ApiError.STORE_UNAVAILABLE, ex.getUserMessage(), ex, request);
    }

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<ApiError> handleConfiguration(ConfigurationException ex, HttpServletRequest request) {
        return fail(HttpStatus.INTERNAL_SERVER_ERROR, ApiError.CONFIGURATION_ERROR,
                "The service is not configured correctly.", ex, request);
    }

    private ResponseEntity<ApiError> respond(HttpStatus status, String code, String message,
            HttpServletRequest request) {
        String errorId = generateErrorId();
        LOGGER.warn("Request rejected [{}] {}: {}", errorId, code, message);
        return ResponseEntity.status(status)
                .body(new ApiError(errorId, code, message, request.getRequestURI(), Instant.now()));
    }

    private ResponseEntity<ApiError> fail(HttpStatus status, String code, String message, Exception ex,
            HttpServletRequest request) {
        String errorId = generateErrorId();
        LOGGER.error("Request failed [{}] {}: {}", errorId, code, ex.getMessage(), ex);
        return ResponseEntity.status(status)
                .body(new ApiError(errorId, code, message, request.getRequestURI(), Instant.now()));
    }

    private String generateErrorId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
