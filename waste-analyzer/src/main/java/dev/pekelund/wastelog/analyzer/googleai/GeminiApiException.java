package dev.pekelund.wastelog.analyzer.googleai;

/**
 * Raised by {@link GeminiClient} implementations. Carries enough of the HTTP exchange for callers
 * to classify the failure.
 */
public class GeminiApiException extends RuntimeException {

    public enum Kind {
        MISSING_API_KEY,
        HTTP_ERROR,
        TRANSPORT_ERROR,
        INVALID_RESPONSE
    }

    private final Kind kind;
    private final int statusCode;
    private final String responseBody;

    public GeminiApiException(Kind kind, String message) {
        this(kind, 0, null, message, null);
    }

    public GeminiApiException(Kind kind, String message, Throwable cause) {
        this(kind, 0, null, message, cause);
    }

    public GeminiApiException(Kind kind, int statusCode, String responseBody, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
        this.responseBody = responseBody != null ? responseBody : "";
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return the HTTP status returned by Gemini, or {@code 0} when no response was received
     */
    public int getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }
}
