package dev.pekelund.wastelog.storage;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * On-disk layout of the waste store. Field names match the {@code waste.json} files written by
 * earlier versions of the service so existing data keeps loading.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record WasteDataDocument(
    List<StoredEntry> entries,
    List<StoredItem> items,
    Long nextEntryId,
    Long nextItemId
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    record StoredEntry(
        long id,
        @JsonProperty("image_path") String imagePath,
        String timestamp,
        @JsonProperty("total_estimated_value") Double totalEstimatedValue,
        @JsonProperty("estimated_weight") String estimatedWeight,
        String notes,
        @JsonProperty("image_hash") String imageHash,
        @JsonProperty("duplicate_of_entry_id") Long duplicateOfEntryId,
        @JsonProperty("consistency_note") String consistencyNote,
        @JsonProperty("created_at") String createdAt
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record StoredItem(
        long id,
        @JsonProperty("waste_entry_id") long wasteEntryId,
        String name,
        String category,
        @JsonProperty("estimated_amount") String estimatedAmount,
        String condition,
        @JsonProperty("estimated_value") Double estimatedValue
    ) {
    }
}
