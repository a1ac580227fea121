package dev.pekelund.wastelog.analyzer.googleai;

import java.util.Base64;
import java.util.Objects;

/**
 * Image bytes sent inline with a Gemini prompt.
 */
public record InlineImage(byte[] data, String mimeType) {

    public InlineImage {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(mimeType, "mimeType");
    }

    String base64Data() {
        return Base64.getEncoder().encodeToString(data);
    }
}
