package dev.pekelund.wastelog.analyzer;

/**
 * Signals that an uploaded file cannot be analyzed as a waste photo.
 */
public class InvalidWasteImageException extends RuntimeException {

    public InvalidWasteImageException(String message) {
        super(message);
    }
}
