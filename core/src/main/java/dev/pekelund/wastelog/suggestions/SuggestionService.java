package dev.pekelund.wastelog.suggestions;

import dev.pekelund.wastelog.statistics.WasteStatisticsService;
import dev.pekelund.wastelog.storage.WasteEntryQuery;
import dev.pekelund.wastelog.storage.WasteEntryStore;
import java.util.List;

/**
 * Entry point for the aggregate and recent-entries suggestion rule sets.
 */
public class SuggestionService {

    private final WasteStatisticsService statisticsService;
    private final WasteEntryStore store;
    private final AggregateSuggestionStrategy aggregateStrategy = new AggregateSuggestionStrategy();
    private final RecentEntriesSuggestionStrategy recentEntriesStrategy = new RecentEntriesSuggestionStrategy();

    public SuggestionService(WasteStatisticsService statisticsService, WasteEntryStore store) {
        this.statisticsService = statisticsService;
        this.store = store;
    }

    public List<WasteSuggestion> aggregateSuggestions() {
        return aggregateStrategy.suggest(statisticsService.loadStatistics());
    }

    public List<WasteSuggestion> recentEntrySuggestions() {
        return recentEntriesStrategy.suggest(
            store.list(WasteEntryQuery.latest(RecentEntriesSuggestionStrategy.REQUIRED_ENTRIES)));
    }
}
