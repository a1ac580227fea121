package dev.pekelund.wastelog.suggestions;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Objects;

/**
 * A prioritized recommendation for reducing waste.
 *
 * @param estimatedSavings human-readable savings text, {@code null} when there is nothing to quote
 * @param savingsAmount    numeric savings behind {@code estimatedSavings}, when it is a money amount
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WasteSuggestion(
    SuggestionType type,
    SuggestionPriority priority,
    String title,
    String description,
    String estimatedSavings,
    Double savingsAmount
) {

    public WasteSuggestion {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(priority, "priority");
    }
}
