package dev.pekelund.wastelog.analyzer;

import dev.pekelund.wastelog.statistics.WasteStatistics;
import dev.pekelund.wastelog.statistics.WasteStatisticsService;
import dev.pekelund.wastelog.storage.StoreOperationResult;
import dev.pekelund.wastelog.storage.WasteEntryNotFoundException;
import dev.pekelund.wastelog.storage.WasteEntryQuery;
import dev.pekelund.wastelog.storage.WasteEntryStore;
import dev.pekelund.wastelog.suggestions.SuggestionService;
import dev.pekelund.wastelog.suggestions.WasteSuggestion;
import dev.pekelund.wastelog.waste.WasteEntry;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

/**
 * JSON API for logging waste photos and reading back history, statistics and suggestions.
 */
@RestController
@RequestMapping(path = "/api", produces = MediaType.APPLICATION_JSON_VALUE)
public class WasteLogController {

    private static final Logger LOGGER = LoggerFactory.getLogger(WasteLogController.class);

    private final WasteIngestionService ingestionService;
    private final WasteEntryStore store;
    private final WasteStatisticsService statisticsService;
    private final SuggestionService suggestionService;
    private final Clock clock;

    public WasteLogController(WasteIngestionService ingestionService, WasteEntryStore store,
        WasteStatisticsService statisticsService, SuggestionService suggestionService, Clock clock) {
        this.ingestionService = ingestionService;
        this.store = store;
        this.statisticsService = statisticsService;
        this.suggestionService = suggestionService;
        this.clock = clock;
    }

    @PostMapping(path = "/analyze-waste", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public AnalyzeWasteResponse analyzeWaste(@RequestPart(name = "image", required = false) MultipartFile image)
        throws IOException {
        if (image == null || image.isEmpty()) {
            throw new InvalidWasteImageException("No image file provided");
        }
        LOGGER.info("Received waste photo '{}' ({} bytes, {})", image.getOriginalFilename(), image.getSize(),
            image.getContentType());
        IngestionResult result = ingestionService.ingest(image.getBytes(), image.getOriginalFilename(),
            image.getContentType());
        return new AnalyzeWasteResponse(true, result.analysis(), result.wasteEntry());
    }

    @GetMapping("/waste-history")
    public List<WasteEntry> wasteHistory(
        @RequestParam(name = "limit", defaultValue = "50") int limit,
        @RequestParam(name = "startDate", required = false) String startDate,
        @RequestParam(name = "endDate", required = false) String endDate) {
        WasteEntryQuery query = new WasteEntryQuery(limit, parseBound(startDate, false), parseBound(endDate, true));
        return store.list(query);
    }

    @GetMapping("/waste-history/{id}")
    public WasteEntry wasteEntry(@PathVariable("id") long id) {
        return store.findById(id).orElseThrow(() -> new WasteEntryNotFoundException(id));
    }

    @GetMapping("/waste-stats")
    public WasteStatistics wasteStats() {
        return statisticsService.loadStatistics();
    }

    @GetMapping("/suggestions")
    public List<WasteSuggestion> suggestions() {
        return suggestionService.aggregateSuggestions();
    }

    @GetMapping("/suggestions/recent")
    public List<WasteSuggestion> recentSuggestions() {
        return suggestionService.recentEntrySuggestions();
    }

    @DeleteMapping("/waste-history/{id}")
    public StoreOperationResult deleteEntry(@PathVariable("id") long id) {
        return store.deleteById(id);
    }

    @DeleteMapping("/waste-history")
    public StoreOperationResult clearHistory() {
        return store.clearAll();
    }

    @GetMapping("/health")
    public HealthResponse health() {
        return new HealthResponse("ok", Instant.now(clock), store.count(), store.loadWarning().orElse(null));
    }

    /**
     * Accepts a full ISO-8601 timestamp with offset or a plain date. A plain date covers the whole
     * day in UTC.
     */
    static Instant parseBound(String value, boolean endOfDay) {
        if (!StringUtils.hasText(value)) {
            return null;
        }
        String trimmed = value.trim();
        try {
            if (trimmed.length() == 10) {
                LocalDate date = LocalDate.parse(trimmed);
                LocalTime time = endOfDay ? LocalTime.MAX : LocalTime.MIN;
                return date.atTime(time).toInstant(ZoneOffset.UTC);
            }
            return OffsetDateTime.parse(trimmed).toInstant();
        } catch (DateTimeParseException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                "Invalid date '%s'; use YYYY-MM-DD or an ISO-8601 timestamp".formatted(trimmed), ex);
        }
    }

    public record AnalyzeWasteResponse(boolean success, WasteAnalysis analysis, WasteEntry wasteEntry) { }

    public record HealthResponse(String status, Instant timestamp, int entries, String storeWarning) { }
}
