package dev.pekelund.wastelog.statistics;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.LocalDate;
import java.util.List;

/**
 * Aggregated view of the waste history.
 */
public record WasteStatistics(
    Overall overall,
    List<TopItem> topItems,
    List<DailyStat> dailyStats,
    List<CategoryStat> categoryStats
) {

    public WasteStatistics {
        topItems = topItems != null ? List.copyOf(topItems) : List.of();
        dailyStats = dailyStats != null ? List.copyOf(dailyStats) : List.of();
        categoryStats = categoryStats != null ? List.copyOf(categoryStats) : List.of();
    }

    public record Overall(
        @JsonProperty("total_entries") long totalEntries,
        @JsonProperty("total_value") double totalValue,
        @JsonProperty("avg_value") double avgValue
    ) {
    }

    public record TopItem(
        String name,
        String category,
        long frequency,
        @JsonProperty("total_value") double totalValue,
        @JsonProperty("avg_value") double avgValue
    ) {
    }

    public record DailyStat(
        LocalDate date,
        long entries,
        @JsonProperty("total_value") double totalValue
    ) {
    }

    public record CategoryStat(
        String category,
        long frequency,
        @JsonProperty("total_value") double totalValue
    ) {
    }
}
