package dev.pekelund.wastelog.suggestions;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum SuggestionType {
    PORTION_ADJUSTMENT,
    MENU_CHANGE,
    TREND_ALERT,
    BEST_PRACTICE;

    @JsonValue
    public String jsonValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
