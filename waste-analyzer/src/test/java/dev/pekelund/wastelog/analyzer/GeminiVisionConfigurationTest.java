package dev.pekelund.wastelog.analyzer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pekelund.wastelog.analyzer.googleai.GeminiClient;
import dev.pekelund.wastelog.analyzer.googleai.GoogleAiGeminiChatOptions;
import dev.pekelund.wastelog.analyzer.googleai.GoogleAiGeminiClient;
import io.micrometer.observation.ObservationRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.support.DefaultListableBeanFactory;
import org.springframework.mock.env.MockEnvironment;

class GeminiVisionConfigurationTest {

    private final GeminiVisionConfiguration configuration = new GeminiVisionConfiguration();

    @Test
    void prefersGeminiApiKeyOverStudioFallback() {
        MockEnvironment environment = new MockEnvironment()
            .withProperty("GEMINI_API_KEY", " primary ")
            .withProperty("AI_STUDIO_API_KEY", "fallback");

        assertThat(GeminiVisionConfiguration.resolveApiKey(environment)).isEqualTo("primary");
    }

    @Test
    void fallsBackToStudioApiKey() {
        MockEnvironment environment = new MockEnvironment().withProperty("AI_STUDIO_API_KEY", "fallback");

        assertThat(GeminiVisionConfiguration.resolveApiKey(environment)).isEqualTo("fallback");
        assertThat(GeminiVisionConfiguration.resolveApiKey(new MockEnvironment())).isNull();
    }

    @Test
    void readsModelSettingsFromEnvironment() {
        MockEnvironment environment = new MockEnvironment()
            .withProperty("google.ai.gemini.model", "gemini-1.5-flash")
            .withProperty("google.ai.gemini.top-k", "32");

        GoogleAiGeminiChatOptions options = configuration.wasteGeminiChatOptions(environment);

        assertThat(options.getModel()).isEqualTo("gemini-1.5-flash");
        assertThat(options.getTemperature()).isEqualTo(GeminiVisionConfiguration.DEFAULT_TEMPERATURE);
        assertThat(options.getTopK()).isEqualTo(32);
        assertThat(options.getTopP()).isNull();
        assertThat(options.getResponseMimeType()).isEqualTo("application/json");
    }

    @Test
    void startsWithoutApiKey() {
        MockEnvironment environment = new MockEnvironment();
        GoogleAiGeminiChatOptions options = configuration.wasteGeminiChatOptions(environment);

        GoogleAiGeminiClient client = configuration.googleAiGeminiClient(environment, options,
            new DefaultListableBeanFactory().getBeanProvider(ObservationRegistry.class));

        assertThat(client.hasApiKey()).isFalse();
        assertThat(client.getDefaultOptions().getModel()).isEqualTo(GeminiVisionConfiguration.DEFAULT_MODEL);
    }

    @Test
    void readsFallbackModelsFromEnvironment() {
        MockEnvironment environment = new MockEnvironment()
            .withProperty("google.ai.gemini.fallback-models", "gemini-1.5-pro, gemini-1.5-flash-8b")
            .withProperty("google.ai.gemini.discover-models", "false");
        GoogleAiGeminiChatOptions options = configuration.wasteGeminiChatOptions(environment);

        WasteImageAnalyzer analyzer = configuration.wasteImageAnalyzer(mock(GeminiClient.class), new ObjectMapper(),
            options, environment);

        assertThat(((GeminiWasteImageAnalyzer) analyzer).candidateModels())
            .containsExactly("gemini-2.0-flash", "gemini-1.5-pro", "gemini-1.5-flash-8b");
    }

    @Test
    void defaultsFallbackModels() {
        MockEnvironment environment = new MockEnvironment().withProperty("google.ai.gemini.discover-models", "false");
        GoogleAiGeminiChatOptions options = configuration.wasteGeminiChatOptions(environment);

        WasteImageAnalyzer analyzer = configuration.wasteImageAnalyzer(mock(GeminiClient.class), new ObjectMapper(),
            options, environment);

        assertThat(((GeminiWasteImageAnalyzer) analyzer).candidateModels())
            .containsExactly("gemini-2.0-flash", "gemini-1.5-flash", "gemini-1.5-pro");
    }
}
