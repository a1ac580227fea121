package dev.pekelund.wastelog.waste;

/**
 * Persisted line item of a {@link WasteEntry}.
 */
public record WasteItem(
    long id,
    long wasteEntryId,
    String name,
    String category,
    String estimatedAmount,
    String condition,
    double estimatedValue
) {

    public static WasteItem from(long id, long wasteEntryId, FoodItemEstimate estimate) {
        return new WasteItem(id, wasteEntryId, estimate.name(), estimate.category(), estimate.estimatedAmount(),
            estimate.condition(), estimate.estimatedValue());
    }
}
