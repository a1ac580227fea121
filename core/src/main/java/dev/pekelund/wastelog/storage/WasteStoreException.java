package dev.pekelund.wastelog.storage;

/**
 * Signals that the durable waste store could not be read or written.
 */
public class WasteStoreException extends RuntimeException {

    public WasteStoreException(String message) {
        super(message);
    }

    public WasteStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
