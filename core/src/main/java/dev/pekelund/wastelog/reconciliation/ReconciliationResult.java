package dev.pekelund.wastelog.reconciliation;

import dev.pekelund.wastelog.waste.FoodItemEstimate;
import java.util.List;
import org.springframework.util.StringUtils;

/**
 * Items and total after aligning a fresh analysis with an earlier entry of the same image.
 *
 * @param items              fresh items, with values taken from the prior entry where names match
 * @param totalEstimatedValue resolved total
 * @param duplicateOfEntryId prior entry the analysis was reconciled against, or {@code null}
 * @param consistencyNote    explanation of a preserved total, empty when none
 */
public record ReconciliationResult(
    List<FoodItemEstimate> items,
    double totalEstimatedValue,
    Long duplicateOfEntryId,
    String consistencyNote
) {

    public ReconciliationResult {
        items = items != null ? List.copyOf(items) : List.of();
        consistencyNote = consistencyNote != null ? consistencyNote : "";
    }

    public boolean hasConsistencyNote() {
        return StringUtils.hasText(consistencyNote);
    }

    public boolean isDuplicate() {
        return duplicateOfEntryId != null;
    }
}
