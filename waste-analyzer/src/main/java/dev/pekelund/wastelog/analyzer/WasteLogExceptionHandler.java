package dev.pekelund.wastelog.analyzer;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.pekelund.wastelog.storage.WasteEntryNotFoundException;
import dev.pekelund.wastelog.storage.WasteStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.server.ResponseStatusException;

/**
 * Translates failures from ingestion and the store into JSON error responses.
 */
@RestControllerAdvice
public class WasteLogExceptionHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(WasteLogExceptionHandler.class);

    @ExceptionHandler(VisionAnalysisException.class)
    public ResponseEntity<ErrorResponse> handleVisionFailure(VisionAnalysisException exception) {
        VisionFailure failure = exception.getFailure();
        HttpStatus status = statusFor(failure);
        if (status.is5xxServerError()) {
            LOGGER.error("Waste photo analysis failed: {} - {}", failure, exception.getMessage(), exception);
        } else {
            LOGGER.warn("Waste photo analysis rejected: {} - {}", failure, exception.getMessage());
        }
        return ResponseEntity.status(status).body(new ErrorResponse("Failed to analyze waste", exception.getMessage(),
            failure.name(), failure.remediation().name(), failure.retryable()));
    }

    @ExceptionHandler(InvalidWasteImageException.class)
    public ResponseEntity<ErrorResponse> handleInvalidImage(InvalidWasteImageException exception) {
        LOGGER.warn("Rejected upload: {}", exception.getMessage());
        return ResponseEntity.badRequest().body(ErrorResponse.of(exception.getMessage(), exception.getMessage()));
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleUploadTooLarge(MaxUploadSizeExceededException exception) {
        LOGGER.warn("Rejected oversized upload: {}", exception.getMessage());
        return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
            .body(ErrorResponse.of("Image too large", "Images must be 10 MB or smaller"));
    }

    @ExceptionHandler(WasteEntryNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(WasteEntryNotFoundException exception) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(ErrorResponse.of(exception.getMessage(), exception.getMessage()));
    }

    @ExceptionHandler(WasteStoreException.class)
    public ResponseEntity<ErrorResponse> handleStoreFailure(WasteStoreException exception) {
        LOGGER.error("Waste store operation failed", exception);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(ErrorResponse.of("Failed to save waste data", exception.getMessage()));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleResponseStatus(ResponseStatusException exception) {
        String reason = exception.getReason() != null ? exception.getReason() : exception.getMessage();
        return ResponseEntity.status(exception.getStatusCode()).body(ErrorResponse.of(reason, reason));
    }

    static HttpStatus statusFor(VisionFailure failure) {
        return switch (failure) {
            case MISSING_CREDENTIAL -> HttpStatus.UNAUTHORIZED;
            case ACCESS_DENIED -> HttpStatus.FORBIDDEN;
            case QUOTA_EXCEEDED, RATE_LIMITED -> HttpStatus.TOO_MANY_REQUESTS;
            case INVALID_INPUT -> HttpStatus.BAD_REQUEST;
            case UPSTREAM_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            case MALFORMED_RESPONSE -> HttpStatus.BAD_GATEWAY;
        };
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ErrorResponse(String error, String message, String failure, String remediation, Boolean retryable) {

        static ErrorResponse of(String error, String message) {
            return new ErrorResponse(error, message, null, null, null);
        }
    }
}
