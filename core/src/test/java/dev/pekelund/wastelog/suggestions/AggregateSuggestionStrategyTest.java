package dev.pekelund.wastelog.suggestions;

import static org.assertj.core.api.Assertions.assertThat;

import dev.pekelund.wastelog.statistics.WasteStatistics;
import dev.pekelund.wastelog.statistics.WasteStatistics.CategoryStat;
import dev.pekelund.wastelog.statistics.WasteStatistics.DailyStat;
import dev.pekelund.wastelog.statistics.WasteStatistics.Overall;
import dev.pekelund.wastelog.statistics.WasteStatistics.TopItem;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class AggregateSuggestionStrategyTest {

    private final AggregateSuggestionStrategy strategy = new AggregateSuggestionStrategy();

    @Test
    void alwaysRecommendsBestPractices() {
        List<WasteSuggestion> suggestions = strategy.suggest(statistics(List.of(), List.of(), List.of()));

        assertThat(suggestions).singleElement().satisfies(suggestion -> {
            assertThat(suggestion.type()).isEqualTo(SuggestionType.BEST_PRACTICE);
            assertThat(suggestion.priority()).isEqualTo(SuggestionPriority.LOW);
            assertThat(suggestion.estimatedSavings()).isEqualTo("Long-term improvement");
        });
    }

    @Test
    void flagsTrendWhenRecentDaysRiseThirtyPercentAboveAverage() {
        List<WasteSuggestion> suggestions = strategy.suggest(statistics(List.of(), List.of(), days(13, 13, 13, 1)));

        assertThat(suggestions).first().satisfies(suggestion -> {
            assertThat(suggestion.type()).isEqualTo(SuggestionType.TREND_ALERT);
            assertThat(suggestion.priority()).isEqualTo(SuggestionPriority.HIGH);
            assertThat(suggestion.description()).startsWith("Waste has increased 30% in recent days.");
        });
    }

    @Test
    void ignoresTrendBelowTwentyPercentThreshold() {
        List<WasteSuggestion> suggestions = strategy.suggest(statistics(List.of(), List.of(), days(11, 11, 11, 7)));

        assertThat(suggestions).extracting(WasteSuggestion::type).doesNotContain(SuggestionType.TREND_ALERT);
    }

    @Test
    void ignoresTrendWhenThereIsNoWaste() {
        List<WasteSuggestion> suggestions = strategy.suggest(statistics(List.of(), List.of(), days(0, 0)));

        assertThat(suggestions).extracting(WasteSuggestion::type).containsExactly(SuggestionType.BEST_PRACTICE);
    }

    @Test
    void suggestsPortionAdjustmentForFrequentlyWastedTopItem() {
        TopItem pasta = new TopItem("Pasta", "main dish", 5, 25.5, 5.1);

        List<WasteSuggestion> suggestions = strategy.suggest(statistics(List.of(pasta), List.of(), List.of()));

        assertThat(suggestions).first().satisfies(suggestion -> {
            assertThat(suggestion.type()).isEqualTo(SuggestionType.PORTION_ADJUSTMENT);
            assertThat(suggestion.title()).isEqualTo("Consider reducing portions for Pasta");
            assertThat(suggestion.description()).contains("(5 times)");
            assertThat(suggestion.estimatedSavings()).isEqualTo("$25.50 per period");
            assertThat(suggestion.savingsAmount()).isEqualTo(25.5);
        });
    }

    @Test
    void skipsPortionAdjustmentBelowFiveOccurrences() {
        TopItem pasta = new TopItem("Pasta", "main dish", 4, 25.5, 6.375);

        List<WasteSuggestion> suggestions = strategy.suggest(statistics(List.of(pasta), List.of(), List.of()));

        assertThat(suggestions).extracting(WasteSuggestion::type).containsExactly(SuggestionType.BEST_PRACTICE);
    }

    @Test
    void suggestsMenuReviewOnlyForFrequentAndCostlyCategories() {
        List<CategoryStat> categories = List.of(
            new CategoryStat("main dish", 9, 100.0),
            new CategoryStat("side", 10, 60.0),
            new CategoryStat("dessert", 12, 50.0));

        List<WasteSuggestion> suggestions = strategy.suggest(statistics(List.of(), categories, List.of()));

        assertThat(suggestions).extracting(WasteSuggestion::type)
            .containsExactly(SuggestionType.MENU_CHANGE, SuggestionType.BEST_PRACTICE);
        WasteSuggestion review = suggestions.get(0);
        assertThat(review.priority()).isEqualTo(SuggestionPriority.MEDIUM);
        assertThat(review.title()).isEqualTo("Review menu items in side category");
        assertThat(review.description()).startsWith("side items account for $60.00 in waste.");
        assertThat(review.estimatedSavings()).isEqualTo("Up to $18.00 per period");
    }

    @Test
    void ordersSuggestionsByPriorityKeepingRuleOrderWithinPriority() {
        TopItem pasta = new TopItem("Pasta", "main dish", 6, 30.0, 5.0);
        List<CategoryStat> categories = List.of(new CategoryStat("main dish", 10, 75.0));

        List<WasteSuggestion> suggestions = strategy.suggest(statistics(List.of(pasta), categories,
            days(13, 13, 13, 1)));

        assertThat(suggestions).extracting(WasteSuggestion::type).containsExactly(
            SuggestionType.PORTION_ADJUSTMENT,
            SuggestionType.TREND_ALERT,
            SuggestionType.MENU_CHANGE,
            SuggestionType.BEST_PRACTICE);
    }

    private static WasteStatistics statistics(List<TopItem> topItems, List<CategoryStat> categories,
        List<DailyStat> days) {
        return new WasteStatistics(new Overall(0, 0.0, 0.0), topItems, days, categories);
    }

    private static List<DailyStat> days(double... totals) {
        List<DailyStat> days = new ArrayList<>();
        LocalDate date = LocalDate.parse("2025-10-19");
        for (double total : totals) {
            days.add(new DailyStat(date, 1, total));
            date = date.minusDays(1);
        }
        return days;
    }
}
