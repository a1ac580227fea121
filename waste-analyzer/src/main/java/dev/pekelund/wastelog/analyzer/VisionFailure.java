package dev.pekelund.wastelog.analyzer;

/**
 * Reasons an image analysis can fail, each with what the caller should do about it.
 */
public enum VisionFailure {

    MISSING_CREDENTIAL(Remediation.RECONFIGURE, false,
        "Gemini API key is missing or invalid. Set GEMINI_API_KEY to a key from https://aistudio.google.com/app/apikey"),
    QUOTA_EXCEEDED(Remediation.RECONFIGURE, false,
        "Gemini API quota exceeded. Check your Google Cloud billing and quota at https://console.cloud.google.com/"),
    RATE_LIMITED(Remediation.WAIT, true,
        "Gemini API rate limit reached. Wait a moment and try again."),
    ACCESS_DENIED(Remediation.RECONFIGURE, false,
        "Gemini API access forbidden. Check the API key permissions and that the Generative Language API is enabled."),
    INVALID_INPUT(Remediation.FIX_INPUT, false,
        "Gemini rejected the request. Check the image format and try again."),
    UPSTREAM_UNAVAILABLE(Remediation.RETRY_LATER, true,
        "Gemini is currently unavailable. Try again later."),
    MALFORMED_RESPONSE(Remediation.RETRY_LATER, true,
        "Failed to parse AI response. The AI did not return valid JSON.");

    public enum Remediation {
        RECONFIGURE,
        WAIT,
        RETRY_LATER,
        FIX_INPUT
    }

    private final Remediation remediation;
    private final boolean retryable;
    private final String defaultMessage;

    VisionFailure(Remediation remediation, boolean retryable, String defaultMessage) {
        this.remediation = remediation;
        this.retryable = retryable;
        this.defaultMessage = defaultMessage;
    }

    public Remediation remediation() {
        return remediation;
    }

    public boolean retryable() {
        return retryable;
    }

    public String defaultMessage() {
        return defaultMessage;
    }
}
