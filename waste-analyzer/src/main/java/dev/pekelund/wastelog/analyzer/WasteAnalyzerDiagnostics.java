package dev.pekelund.wastelog.analyzer;

import dev.pekelund.wastelog.analyzer.googleai.GeminiClient;
import dev.pekelund.wastelog.storage.WasteEntryStore;
import java.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Emits diagnostic logging when the service boots so the active configuration can be verified.
 */
@Component
public class WasteAnalyzerDiagnostics implements ApplicationRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(WasteAnalyzerDiagnostics.class);

    private final Environment environment;
    private final WasteEntryStore store;
    private final WasteLogProperties properties;
    private final ObjectProvider<GeminiClient> geminiClientProvider;
    private final WasteImageAnalyzer analyzer;

    public WasteAnalyzerDiagnostics(Environment environment, WasteEntryStore store, WasteLogProperties properties,
        ObjectProvider<GeminiClient> geminiClientProvider, WasteImageAnalyzer analyzer) {
        this.environment = environment;
        this.store = store;
        this.properties = properties;
        this.geminiClientProvider = geminiClientProvider;
        this.analyzer = analyzer;
    }

    @Override
    public void run(ApplicationArguments args) {
        LOGGER.info("Food waste analyzer diagnostics starting");
        LOGGER.info("Active Spring profiles: {}", Arrays.toString(environment.getActiveProfiles()));
        LOGGER.info("Waste store {} holds {} entries; uploads go to {} (max {} MB)",
            store.getDataFile().toAbsolutePath(), store.count(),
            properties.getUploads().getDirectory().toAbsolutePath(), properties.getUploads().getMaxSize().toMegabytes());
        store.loadWarning().ifPresent(warning -> LOGGER.warn("Waste store recovered at startup: {}", warning));

        LOGGER.info("Waste image analyzer implementation: {}", analyzer.getClass().getName());
        GeminiClient geminiClient = geminiClientProvider.getIfAvailable();
        if (geminiClient != null) {
            LOGGER.info("Gemini client implementation: {} - default options: {}", geminiClient.getClass().getName(),
                geminiClient.getDefaultOptions());
        } else {
            LOGGER.info("Gemini client bean not available; skipping client diagnostics");
        }
    }
}
