package dev.pekelund.wastelog.suggestions;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum SuggestionPriority {
    HIGH(3),
    MEDIUM(2),
    LOW(1);

    private final int rank;

    SuggestionPriority(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    @JsonValue
    public String jsonValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
