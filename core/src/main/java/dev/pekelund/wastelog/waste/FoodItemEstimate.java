package dev.pekelund.wastelog.waste;

import org.springframework.util.StringUtils;

/**
 * A single food item identified in a waste photo, before it is persisted.
 *
 * @param name            item name as reported by the analysis
 * @param category        menu category, {@code "unknown"} when absent
 * @param estimatedAmount free-text portion description
 * @param condition       observed condition, {@code "unknown"} when absent
 * @param estimatedValue  non-negative monetary value
 */
public record FoodItemEstimate(
    String name,
    String category,
    String estimatedAmount,
    String condition,
    double estimatedValue
) {

    public FoodItemEstimate {
        name = StringUtils.hasText(name) ? name.trim() : WasteItemDefaults.UNKNOWN_ITEM_NAME;
        category = StringUtils.hasText(category) ? category.trim() : WasteItemDefaults.UNKNOWN;
        estimatedAmount = estimatedAmount != null ? estimatedAmount : "";
        condition = StringUtils.hasText(condition) ? condition.trim() : WasteItemDefaults.UNKNOWN;
        estimatedValue = Double.isFinite(estimatedValue) && estimatedValue > 0 ? estimatedValue : 0.0;
    }

    public FoodItemEstimate withEstimatedValue(double value) {
        return new FoodItemEstimate(name, category, estimatedAmount, condition, value);
    }
}
