package dev.pekelund.wastelog.storage;

/**
 * Outcome of a destructive store operation.
 */
public record StoreOperationResult(boolean success, String message) {

    static StoreOperationResult ok(String message) {
        return new StoreOperationResult(true, message);
    }
}
