package dev.pekelund.wastelog.suggestions;

import java.util.Locale;

final class SuggestionFormat {

    private SuggestionFormat() {
    }

    static String money(double amount) {
        return String.format(Locale.US, "%.2f", amount);
    }

    static String wholePercent(double ratio) {
        return String.format(Locale.US, "%.0f", ratio * 100);
    }
}
