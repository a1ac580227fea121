package dev.pekelund.wastelog.waste;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.List;
import org.springframework.util.StringUtils;

/**
 * One logged waste event: a photographed plate or bin and the items identified in it.
 *
 * @param id                  store-assigned identifier, never reused
 * @param imagePath           reference to the uploaded image
 * @param timestamp           when the waste was logged, in the caller's offset
 * @param totalEstimatedValue monetary value of the whole entry
 * @param estimatedWeight     free-text weight summary
 * @param notes               observations from the analysis, possibly with a consistency note appended
 * @param imageHash           SHA-256 of the uploaded image bytes
 * @param duplicateOfEntryId  earlier entry this one was reconciled against, or {@code null}
 * @param consistencyNote     explanation of any value alignment, empty when none happened
 * @param createdAt           when the store created the entry
 * @param items               the entry's line items
 */
public record WasteEntry(
    long id,
    String imagePath,
    OffsetDateTime timestamp,
    double totalEstimatedValue,
    String estimatedWeight,
    String notes,
    String imageHash,
    Long duplicateOfEntryId,
    String consistencyNote,
    Instant createdAt,
    List<WasteItem> items
) {

    public WasteEntry {
        estimatedWeight = estimatedWeight != null ? estimatedWeight : "";
        notes = notes != null ? notes : "";
        imageHash = imageHash != null ? imageHash : "";
        consistencyNote = consistencyNote != null ? consistencyNote : "";
        items = items != null ? List.copyOf(items) : List.of();
    }

    public boolean hasImageHash() {
        return StringUtils.hasText(imageHash);
    }
}
