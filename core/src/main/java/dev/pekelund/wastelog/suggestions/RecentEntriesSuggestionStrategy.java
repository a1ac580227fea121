package dev.pekelund.wastelog.suggestions;

import dev.pekelund.wastelog.waste.WasteEntry;
import dev.pekelund.wastelog.waste.WasteItem;
import dev.pekelund.wastelog.waste.WasteItemDefaults;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.springframework.util.StringUtils;

/**
 * Rules over the few most recent entries, meant for quick feedback right after logging waste.
 * Suggestions are returned in the order the rules emit them.
 */
public class RecentEntriesSuggestionStrategy {

    public static final int REQUIRED_ENTRIES = 3;

    static final Set<String> SPOILAGE_CONDITIONS = Set.of("spoiled", "expired", "stale");

    private static final int MAX_REPEATED_ITEMS = 3;
    private static final int MAX_SPOILED_ITEMS = 2;
    private static final double HIGH_PRIORITY_VALUE = 10.0;
    private static final double NUDGE_THRESHOLD = 5.0;

    /**
     * @param recentEntries entries newest first; fewer than {@value #REQUIRED_ENTRIES} yields no suggestions
     */
    public List<WasteSuggestion> suggest(List<WasteEntry> recentEntries) {
        if (recentEntries == null || recentEntries.size() < REQUIRED_ENTRIES) {
            return List.of();
        }
        List<WasteEntry> entries = recentEntries.subList(0, REQUIRED_ENTRIES);

        Map<String, ItemTally> tallies = new LinkedHashMap<>();
        double recentTotal = 0.0;
        for (WasteEntry entry : entries) {
            recentTotal += entry.totalEstimatedValue();
            for (WasteItem item : entry.items()) {
                String displayName = StringUtils.hasText(item.name()) ? item.name() : WasteItemDefaults.UNKNOWN_ITEM_NAME;
                tallies.computeIfAbsent(displayName.toLowerCase(Locale.ROOT), key -> new ItemTally(key, displayName))
                    .add(item);
            }
        }

        List<WasteSuggestion> suggestions = new ArrayList<>();

        tallies.values().stream()
            .filter(tally -> tally.count >= 2)
            .sorted(Comparator.comparingDouble(ItemTally::totalValue).reversed())
            .limit(MAX_REPEATED_ITEMS)
            .forEach(tally -> suggestions.add(repeatedItem(tally)));

        tallies.values().stream()
            .filter(ItemTally::showsSpoilage)
            .limit(MAX_SPOILED_ITEMS)
            .forEach(tally -> suggestions.add(storageAndRotation(tally)));

        if (suggestions.isEmpty()) {
            tallies.values().stream()
                .max(Comparator.comparingDouble(ItemTally::totalValue))
                .ifPresent(top -> suggestions.add(focusItem(top)));
        }

        if (recentTotal >= NUDGE_THRESHOLD) {
            double target = recentTotal * 0.2;
            suggestions.add(new WasteSuggestion(
                SuggestionType.BEST_PRACTICE,
                SuggestionPriority.LOW,
                "Quick wins to reduce immediate waste",
                "1) Offer smaller default portions with add-on sides, 2) Pre-portion popular sides to reduce "
                    + "over-scooping, 3) Label prep times to tighten hold limits.",
                "Target $" + SuggestionFormat.money(target) + " reduction next 3 entries",
                target));
        }

        return List.copyOf(suggestions);
    }

    private static WasteSuggestion repeatedItem(ItemTally tally) {
        SuggestionPriority priority = tally.count >= REQUIRED_ENTRIES || tally.totalValue >= HIGH_PRIORITY_VALUE
            ? SuggestionPriority.HIGH
            : SuggestionPriority.MEDIUM;
        Double savings = tally.totalValue > 0 ? tally.totalValue * 0.3 : null;
        return new WasteSuggestion(
            SuggestionType.PORTION_ADJUSTMENT,
            priority,
            "Reduce portions or adjust prep for " + tally.displayName,
            ("%s appeared in %d of your last 3 entries (≈ $%s wasted). Consider smaller default portions, "
                + "offering half sizes, or preparing fewer batches.")
                .formatted(tally.displayName, tally.count, SuggestionFormat.money(tally.totalValue)),
            savings != null ? "Up to $" + SuggestionFormat.money(savings) + " per week" : null,
            savings);
    }

    private static WasteSuggestion storageAndRotation(ItemTally tally) {
        return new WasteSuggestion(
            SuggestionType.BEST_PRACTICE,
            SuggestionPriority.MEDIUM,
            "Improve storage and rotation for " + tally.key,
            ("Recent entries show spoilage or staleness for %s. Tighten FIFO rotation, cool-down procedures, "
                + "and sealed storage to extend shelf life and prevent discard.").formatted(tally.key),
            null,
            null);
    }

    private static WasteSuggestion focusItem(ItemTally top) {
        Double savings = top.totalValue > 0 ? top.totalValue * 0.25 : null;
        return new WasteSuggestion(
            SuggestionType.TREND_ALERT,
            SuggestionPriority.LOW,
            "Focus on " + top.displayName + " waste first",
            ("%s contributed the most value to waste across your last 3 entries (≈ $%s). "
                + "Review portioning, prep timing, and menu fit.")
                .formatted(top.displayName, SuggestionFormat.money(top.totalValue)),
            savings != null ? "Save $" + SuggestionFormat.money(savings) + " by small adjustments" : null,
            savings);
    }

    private static final class ItemTally {

        private final String key;
        private final String displayName;
        private final Set<String> conditions = new LinkedHashSet<>();
        private int count;
        private double totalValue;

        private ItemTally(String key, String displayName) {
            this.key = key;
            this.displayName = displayName;
        }

        void add(WasteItem item) {
            count++;
            totalValue += item.estimatedValue();
            if (StringUtils.hasText(item.condition())) {
                conditions.add(item.condition().toLowerCase(Locale.ROOT));
            }
        }

        double totalValue() {
            return totalValue;
        }

        boolean showsSpoilage() {
            return conditions.stream().anyMatch(SPOILAGE_CONDITIONS::contains);
        }
    }
}
