package dev.pekelund.wastelog.suggestions;

import dev.pekelund.wastelog.statistics.WasteStatistics;
import dev.pekelund.wastelog.statistics.WasteStatistics.CategoryStat;
import dev.pekelund.wastelog.statistics.WasteStatistics.DailyStat;
import dev.pekelund.wastelog.statistics.WasteStatistics.TopItem;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Threshold rules over the aggregated statistics. The result is ordered by priority, high first,
 * keeping rule order within a priority.
 */
public class AggregateSuggestionStrategy {

    static final int FREQUENT_ITEM_THRESHOLD = 5;
    static final int CATEGORY_FREQUENCY_THRESHOLD = 10;
    static final double CATEGORY_VALUE_THRESHOLD = 50.0;
    static final double CATEGORY_SAVINGS_RATE = 0.3;
    static final double TREND_FACTOR = 1.2;
    static final int RECENT_DAYS = 3;

    public List<WasteSuggestion> suggest(WasteStatistics statistics) {
        List<WasteSuggestion> suggestions = new ArrayList<>();

        portionAdjustment(statistics.topItems(), suggestions);
        menuReviews(statistics.categoryStats(), suggestions);
        trendAlert(statistics.dailyStats(), suggestions);

        suggestions.add(new WasteSuggestion(
            SuggestionType.BEST_PRACTICE,
            SuggestionPriority.LOW,
            "Prevent food waste best practices",
            "Consider: 1) Pre-ordering systems to reduce over-preparation, 2) Flexible portion sizes, "
                + "3) Daily specials for items nearing expiration, 4) Staff training on portion control, "
                + "5) Regular inventory rotation",
            "Long-term improvement",
            null));

        return suggestions.stream()
            .sorted(Comparator.comparingInt((WasteSuggestion suggestion) -> suggestion.priority().rank()).reversed())
            .toList();
    }

    private void portionAdjustment(List<TopItem> topItems, List<WasteSuggestion> suggestions) {
        if (topItems.isEmpty()) {
            return;
        }
        TopItem topItem = topItems.get(0);
        if (topItem.frequency() < FREQUENT_ITEM_THRESHOLD) {
            return;
        }
        suggestions.add(new WasteSuggestion(
            SuggestionType.PORTION_ADJUSTMENT,
            SuggestionPriority.HIGH,
            "Consider reducing portions for " + topItem.name(),
            "%s is being wasted frequently (%d times). Consider reducing portion sizes or offering half-portion options."
                .formatted(topItem.name(), topItem.frequency()),
            "$" + SuggestionFormat.money(topItem.totalValue()) + " per period",
            topItem.totalValue()));
    }

    private void menuReviews(List<CategoryStat> categoryStats, List<WasteSuggestion> suggestions) {
        for (CategoryStat category : categoryStats) {
            if (category.frequency() < CATEGORY_FREQUENCY_THRESHOLD
                || category.totalValue() <= CATEGORY_VALUE_THRESHOLD) {
                continue;
            }
            double savings = category.totalValue() * CATEGORY_SAVINGS_RATE;
            suggestions.add(new WasteSuggestion(
                SuggestionType.MENU_CHANGE,
                SuggestionPriority.MEDIUM,
                "Review menu items in " + category.category() + " category",
                "%s items account for $%s in waste. Consider menu rotation or recipe adjustments."
                    .formatted(category.category(), SuggestionFormat.money(category.totalValue())),
                "Up to $" + SuggestionFormat.money(savings) + " per period",
                savings));
        }
    }

    private void trendAlert(List<DailyStat> dailyStats, List<WasteSuggestion> suggestions) {
        if (dailyStats.isEmpty()) {
            return;
        }
        double avgDaily = average(dailyStats);
        double recentAvg = average(dailyStats.subList(0, Math.min(RECENT_DAYS, dailyStats.size())));
        if (avgDaily <= 0 || recentAvg <= avgDaily * TREND_FACTOR) {
            return;
        }
        suggestions.add(new WasteSuggestion(
            SuggestionType.TREND_ALERT,
            SuggestionPriority.HIGH,
            "Recent increase in food waste detected",
            "Waste has increased %s%% in recent days. Review recent menu changes or preparation methods."
                .formatted(SuggestionFormat.wholePercent(recentAvg / avgDaily - 1)),
            "Monitor and adjust",
            null));
    }

    private static double average(List<DailyStat> days) {
        return days.stream().mapToDouble(DailyStat::totalValue).average().orElse(0.0);
    }
}
