package dev.pekelund.wastelog.waste;

import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * Entry fields supplied by the caller when appending to the store. Identifiers and the creation
 * timestamp are assigned by the store.
 *
 * @param totalEstimatedValue reconciled total to persist; {@code null} makes the store sum the items
 */
public record NewWasteEntry(
    String imagePath,
    OffsetDateTime timestamp,
    String estimatedWeight,
    String notes,
    String imageHash,
    Long duplicateOfEntryId,
    String consistencyNote,
    Double totalEstimatedValue
) {

    public NewWasteEntry {
        Objects.requireNonNull(timestamp, "timestamp");
    }
}
