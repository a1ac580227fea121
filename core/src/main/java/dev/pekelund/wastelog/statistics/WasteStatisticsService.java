package dev.pekelund.wastelog.statistics;

import dev.pekelund.wastelog.statistics.WasteStatistics.CategoryStat;
import dev.pekelund.wastelog.statistics.WasteStatistics.DailyStat;
import dev.pekelund.wastelog.statistics.WasteStatistics.Overall;
import dev.pekelund.wastelog.statistics.WasteStatistics.TopItem;
import dev.pekelund.wastelog.storage.StoreSnapshot;
import dev.pekelund.wastelog.storage.WasteEntryStore;
import dev.pekelund.wastelog.waste.WasteEntry;
import dev.pekelund.wastelog.waste.WasteItem;
import dev.pekelund.wastelog.waste.WasteItemDefaults;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Derives totals, top items, the recent daily trend and the category breakdown from the store.
 * Nothing is cached; every call reads a fresh snapshot.
 */
public class WasteStatisticsService {

    private static final Logger LOGGER = LoggerFactory.getLogger(WasteStatisticsService.class);

    static final int TOP_ITEM_LIMIT = 10;
    static final Duration DAILY_WINDOW = Duration.ofDays(30);

    private final WasteEntryStore store;
    private final Clock clock;

    public WasteStatisticsService(WasteEntryStore store, Clock clock) {
        this.store = store;
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    public WasteStatistics loadStatistics() {
        StoreSnapshot snapshot = store.snapshot();
        WasteStatistics statistics = compute(snapshot, clock.instant());
        LOGGER.debug("Computed statistics over {} entries and {} items", snapshot.entries().size(),
            snapshot.items().size());
        return statistics;
    }

    public static WasteStatistics compute(StoreSnapshot snapshot, Instant now) {
        return new WasteStatistics(
            overall(snapshot.entries()),
            topItems(snapshot.items()),
            dailyStats(snapshot.entries(), now.minus(DAILY_WINDOW)),
            categoryStats(snapshot.items())
        );
    }

    private static Overall overall(List<WasteEntry> entries) {
        double totalValue = entries.stream().mapToDouble(WasteEntry::totalEstimatedValue).sum();
        double avgValue = entries.isEmpty() ? 0.0 : totalValue / entries.size();
        return new Overall(entries.size(), totalValue, avgValue);
    }

    private static List<TopItem> topItems(List<WasteItem> items) {
        Map<String, ItemAccumulator> byName = new LinkedHashMap<>();
        for (WasteItem item : items) {
            byName.computeIfAbsent(item.name(), name -> new ItemAccumulator(name, item.category()))
                .add(item.estimatedValue());
        }
        return byName.values().stream()
            .map(ItemAccumulator::toTopItem)
            .sorted(Comparator.comparingLong(TopItem::frequency).reversed())
            .limit(TOP_ITEM_LIMIT)
            .toList();
    }

    private static List<DailyStat> dailyStats(List<WasteEntry> entries, Instant cutoff) {
        Map<LocalDate, DailyStat> byDate = new TreeMap<>(Comparator.reverseOrder());
        for (WasteEntry entry : entries) {
            if (entry.timestamp().toInstant().isBefore(cutoff)) {
                continue;
            }
            LocalDate date = entry.timestamp().toLocalDate();
            byDate.merge(date, new DailyStat(date, 1, entry.totalEstimatedValue()),
                (current, added) -> new DailyStat(date, current.entries() + 1,
                    current.totalValue() + added.totalValue()));
        }
        return List.copyOf(byDate.values());
    }

    private static List<CategoryStat> categoryStats(List<WasteItem> items) {
        Map<String, CategoryStat> byCategory = new LinkedHashMap<>();
        for (WasteItem item : items) {
            String category = StringUtils.hasText(item.category()) ? item.category() : WasteItemDefaults.UNKNOWN;
            byCategory.merge(category, new CategoryStat(category, 1, item.estimatedValue()),
                (current, added) -> new CategoryStat(category, current.frequency() + 1,
                    current.totalValue() + added.totalValue()));
        }
        return byCategory.values().stream()
            .sorted(Comparator.comparingDouble(CategoryStat::totalValue).reversed())
            .toList();
    }

    private static final class ItemAccumulator {

        private final String name;
        private final String category;
        private long frequency;
        private double totalValue;

        private ItemAccumulator(String name, String category) {
            this.name = name;
            this.category = category;
        }

        void add(double value) {
            frequency++;
            totalValue += value;
        }

        TopItem toTopItem() {
            return new TopItem(name, category, frequency, totalValue, frequency > 0 ? totalValue / frequency : 0.0);
        }
    }
}
