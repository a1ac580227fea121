package dev.pekelund.wastelog.analyzer;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pekelund.wastelog.analyzer.googleai.GeminiClient;
import dev.pekelund.wastelog.analyzer.googleai.GoogleAiGeminiChatOptions;
import dev.pekelund.wastelog.analyzer.googleai.GoogleAiGeminiClient;
import io.micrometer.observation.ObservationRegistry;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.core.env.Environment;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

/**
 * Gemini-backed vision collaborator. Replaced by a stub under the {@code local} profile.
 */
@Configuration
@Profile("!local")
public class GeminiVisionConfiguration {

    private static final Logger LOGGER = LoggerFactory.getLogger(GeminiVisionConfiguration.class);

    static final String DEFAULT_MODEL = "gemini-2.0-flash";
    static final double DEFAULT_TEMPERATURE = 0.4;
    static final List<String> DEFAULT_FALLBACK_MODELS = List.of("gemini-1.5-flash", "gemini-1.5-pro");

    @Bean
    public GoogleAiGeminiChatOptions wasteGeminiChatOptions(Environment environment) {
        String modelName = environment.getProperty("google.ai.gemini.model", DEFAULT_MODEL);
        Double temperature = environment.getProperty("google.ai.gemini.temperature", Double.class,
            DEFAULT_TEMPERATURE);
        Double topP = environment.getProperty("google.ai.gemini.top-p", Double.class);
        Integer topK = environment.getProperty("google.ai.gemini.top-k", Integer.class);
        Integer maxOutputTokens = environment.getProperty("google.ai.gemini.max-output-tokens", Integer.class);
        LOGGER.info("Configured Google AI Gemini settings - model: {}, temperature: {}, topP: {}, topK: {}, maxOutputTokens: {}",
            modelName, temperature, topP, topK, maxOutputTokens);
        return GoogleAiGeminiChatOptions.builder()
            .model(modelName)
            .temperature(temperature)
            .topP(topP)
            .topK(topK)
            .maxOutputTokens(maxOutputTokens)
            .responseMimeType("application/json")
            .build();
    }

    @Bean
    public GoogleAiGeminiClient googleAiGeminiClient(Environment environment,
        GoogleAiGeminiChatOptions wasteGeminiChatOptions, ObjectProvider<ObservationRegistry> observationRegistry) {

        String apiKey = resolveApiKey(environment);
        if (!StringUtils.hasText(apiKey)) {
            LOGGER.warn("No Gemini API key configured (GEMINI_API_KEY); photo analysis will fail until one is set");
        }

        String baseUrl = environment.getProperty("google.ai.gemini.base-url", GoogleAiGeminiClient.DEFAULT_BASE_URL);
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(environment.getProperty("google.ai.gemini.connect-timeout", Duration.class,
            Duration.ofSeconds(10)));
        requestFactory.setReadTimeout(environment.getProperty("google.ai.gemini.read-timeout", Duration.class,
            Duration.ofSeconds(60)));
        RestClient restClient = RestClient.builder()
            .baseUrl(baseUrl)
            .requestFactory(requestFactory)
            .build();

        GoogleAiGeminiClient client = new GoogleAiGeminiClient(restClient, apiKey, wasteGeminiChatOptions,
            observationRegistry.getIfAvailable(() -> ObservationRegistry.NOOP));
        LOGGER.info("Google AI Gemini client default options: {}", client.getDefaultOptions());
        return client;
    }

    @Bean
    public WasteImageAnalyzer wasteImageAnalyzer(GeminiClient geminiClient, ObjectMapper objectMapper,
        GoogleAiGeminiChatOptions wasteGeminiChatOptions, Environment environment) {
        String[] configuredFallbacks = environment.getProperty("google.ai.gemini.fallback-models", String[].class);
        List<String> fallbackModels = configuredFallbacks != null
            ? Arrays.asList(configuredFallbacks)
            : DEFAULT_FALLBACK_MODELS;
        boolean discoverModels = environment.getProperty("google.ai.gemini.discover-models", Boolean.class, true);
        LOGGER.info("Gemini fallback models: {}, model discovery: {}", fallbackModels, discoverModels);
        return new GeminiWasteImageAnalyzer(geminiClient, objectMapper, wasteGeminiChatOptions, fallbackModels,
            discoverModels);
    }

    static String resolveApiKey(Environment environment) {
        String apiKey = environment.getProperty("GEMINI_API_KEY");
        if (StringUtils.hasText(apiKey)) {
            return apiKey.trim();
        }
        String fallback = environment.getProperty("AI_STUDIO_API_KEY");
        return StringUtils.hasText(fallback) ? fallback.trim() : null;
    }
}
