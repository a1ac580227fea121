package dev.pekelund.wastelog.storage;

/**
 * Thrown when an operation targets an entry id that does not exist.
 */
public class WasteEntryNotFoundException extends RuntimeException {

    public WasteEntryNotFoundException(long entryId) {
        super("Entry #%d not found".formatted(entryId));
    }
}
