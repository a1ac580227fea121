package dev.pekelund.wastelog.analyzer;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dev.pekelund.wastelog.reconciliation.ValueReconciler;
import dev.pekelund.wastelog.statistics.WasteStatisticsService;
import dev.pekelund.wastelog.storage.WasteEntryStore;
import dev.pekelund.wastelog.suggestions.SuggestionService;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the waste store and the services built on it.
 */
@Configuration
@EnableConfigurationProperties(WasteLogProperties.class)
public class WasteAnalyzerConfiguration {

    private static final Logger LOGGER = LoggerFactory.getLogger(WasteAnalyzerConfiguration.class);

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules();
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public WasteEntryStore wasteEntryStore(WasteLogProperties properties, ObjectMapper objectMapper, Clock clock) {
        WasteEntryStore store = new WasteEntryStore(properties.getStore().getDataFile(), objectMapper, clock);
        LOGGER.info("Waste store ready at {} with {} entries", store.getDataFile().toAbsolutePath(), store.count());
        return store;
    }

    @Bean
    public ValueReconciler valueReconciler() {
        return new ValueReconciler();
    }

    @Bean
    public WasteStatisticsService wasteStatisticsService(WasteEntryStore wasteEntryStore, Clock clock) {
        return new WasteStatisticsService(wasteEntryStore, clock);
    }

    @Bean
    public SuggestionService suggestionService(WasteStatisticsService wasteStatisticsService,
        WasteEntryStore wasteEntryStore) {
        return new SuggestionService(wasteStatisticsService, wasteEntryStore);
    }

    @Bean
    public UploadedImageStore uploadedImageStore(WasteLogProperties properties, Clock clock) {
        return new UploadedImageStore(properties.getUploads().getDirectory(), clock);
    }

    @Bean
    public WasteIngestionService wasteIngestionService(WasteImageAnalyzer wasteImageAnalyzer,
        WasteEntryStore wasteEntryStore, ValueReconciler valueReconciler, UploadedImageStore uploadedImageStore,
        Clock clock, WasteLogProperties properties) {
        return new WasteIngestionService(wasteImageAnalyzer, wasteEntryStore, valueReconciler, uploadedImageStore,
            clock, properties.getUploads().getMaxSize());
    }
}
