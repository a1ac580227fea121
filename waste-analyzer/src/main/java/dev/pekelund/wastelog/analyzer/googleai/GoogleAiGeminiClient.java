package dev.pekelund.wastelog.analyzer.googleai;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.micrometer.observation.Observation;
import io.micrometer.observation.ObservationRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Client that invokes Google AI Studio's Gemini API using an API key.
 */
public class GoogleAiGeminiClient implements GeminiClient {

    public static final String DEFAULT_BASE_URL = "https://generativelanguage.googleapis.com/v1beta";

    private static final Logger LOGGER = LoggerFactory.getLogger(GoogleAiGeminiClient.class);
    private static final String MODEL_NAME_PREFIX = "models/";

    private final RestClient restClient;
    private final String apiKey;
    private final GoogleAiGeminiChatOptions defaultOptions;
    private final ObservationRegistry observationRegistry;

    public GoogleAiGeminiClient(RestClient restClient, String apiKey, GoogleAiGeminiChatOptions defaultOptions,
        ObservationRegistry observationRegistry) {
        this.restClient = restClient;
        this.apiKey = apiKey;
        this.defaultOptions = defaultOptions != null ? defaultOptions : GoogleAiGeminiChatOptions.builder().build();
        this.observationRegistry = observationRegistry != null ? observationRegistry : ObservationRegistry.NOOP;
    }

    @Override
    public GoogleAiGeminiChatOptions getDefaultOptions() {
        return defaultOptions;
    }

    public boolean hasApiKey() {
        return StringUtils.hasText(apiKey);
    }

    @Override
    public String generateContent(String prompt, InlineImage image, GoogleAiGeminiChatOptions overrides) {
        if (!StringUtils.hasText(prompt)) {
            throw new IllegalArgumentException("Prompt must not be empty");
        }
        if (!hasApiKey()) {
            throw new GeminiApiException(GeminiApiException.Kind.MISSING_API_KEY,
                "No Gemini API key configured; set GEMINI_API_KEY");
        }
        GoogleAiGeminiChatOptions resolvedOptions = defaultOptions.merge(overrides);
        Observation observation = Observation.start("google.ai.gemini.call", observationRegistry)
            .highCardinalityKeyValue("model", Optional.ofNullable(resolvedOptions.getModel()).orElse("(unset)"));
        try (Observation.Scope scope = observation.openScope()) {
            LOGGER.info("Calling Google AI Gemini model '{}' with prompt length {} and {} image bytes",
                resolvedOptions.getModel(), prompt.length(), image != null ? image.data().length : 0);
            GenerateContentRequest request = buildRequest(prompt, image, resolvedOptions);
            GenerateContentResponse response = executeRequest(resolvedOptions.getModel(), request);
            return extractContent(response);
        } catch (RuntimeException ex) {
            observation.error(ex);
            throw ex;
        } finally {
            observation.stop();
        }
    }

    @Override
    public List<String> listModels() {
        if (!hasApiKey()) {
            throw new GeminiApiException(GeminiApiException.Kind.MISSING_API_KEY,
                "No Gemini API key configured; set GEMINI_API_KEY");
        }
        ListModelsResponse response;
        try {
            response = restClient.get()
                .uri(uriBuilder -> uriBuilder
                    .path("/models")
                    .queryParam("key", apiKey)
                    .build())
                .retrieve()
                .body(ListModelsResponse.class);
        } catch (RestClientResponseException ex) {
            int status = ex.getStatusCode().value();
            throw new GeminiApiException(GeminiApiException.Kind.HTTP_ERROR, status, ex.getResponseBodyAsString(),
                "Listing Google AI Gemini models failed with HTTP " + status, ex);
        } catch (ResourceAccessException ex) {
            throw new GeminiApiException(GeminiApiException.Kind.TRANSPORT_ERROR,
                "Google AI Gemini could not be reached", ex);
        } catch (RestClientException ex) {
            throw new GeminiApiException(GeminiApiException.Kind.INVALID_RESPONSE,
                "Google AI Gemini model listing could not be read", ex);
        }
        if (response == null || CollectionUtils.isEmpty(response.models())) {
            return List.of();
        }
        List<String> models = response.models().stream()
            .filter(model -> model != null && StringUtils.hasText(model.name()))
            .filter(model -> model.supportedGenerationMethods() == null
                || model.supportedGenerationMethods().contains("generateContent"))
            .map(model -> model.name().startsWith(MODEL_NAME_PREFIX)
                ? model.name().substring(MODEL_NAME_PREFIX.length())
                : model.name())
            .toList();
        LOGGER.info("Google AI Gemini lists {} models usable with generateContent", models.size());
        return models;
    }

    private GenerateContentRequest buildRequest(String promptText, InlineImage image,
        GoogleAiGeminiChatOptions options) {
        List<GenerateContentRequest.Part> parts = new ArrayList<>();
        parts.add(new GenerateContentRequest.Part(promptText, null));
        if (image != null) {
            parts.add(new GenerateContentRequest.Part(null,
                new GenerateContentRequest.InlineData(image.mimeType(), image.base64Data())));
        }
        GenerateContentRequest.Content content = new GenerateContentRequest.Content("user", parts);
        GenerateContentRequest.GenerationConfig generationConfig = new GenerateContentRequest.GenerationConfig(
            options.getTemperature(), options.getTopP(), options.getTopK(), options.getMaxOutputTokens(),
            options.getResponseMimeType());
        return new GenerateContentRequest(List.of(content), generationConfig);
    }

    private GenerateContentResponse executeRequest(String model, GenerateContentRequest request) {
        String modelName = StringUtils.hasText(model) ? model : defaultOptions.getModel();
        if (!StringUtils.hasText(modelName)) {
            throw new IllegalStateException("Gemini model name must be configured");
        }
        try {
            return restClient.post()
                .uri(uriBuilder -> uriBuilder
                    .path("/models/{model}:generateContent")
                    .queryParam("key", apiKey)
                    .build(modelName))
                .body(request)
                .retrieve()
                .body(GenerateContentResponse.class);
        } catch (RestClientResponseException ex) {
            int status = ex.getStatusCode().value();
            LOGGER.warn("Google AI Gemini returned HTTP {} for model '{}'", status, modelName);
            throw new GeminiApiException(GeminiApiException.Kind.HTTP_ERROR, status, ex.getResponseBodyAsString(),
                "Google AI Gemini request failed with HTTP " + status, ex);
        } catch (ResourceAccessException ex) {
            throw new GeminiApiException(GeminiApiException.Kind.TRANSPORT_ERROR,
                "Google AI Gemini could not be reached", ex);
        } catch (RestClientException ex) {
            throw new GeminiApiException(GeminiApiException.Kind.INVALID_RESPONSE,
                "Google AI Gemini response could not be read", ex);
        }
    }

    private String extractContent(GenerateContentResponse response) {
        if (response == null || CollectionUtils.isEmpty(response.candidates())) {
            throw new GeminiApiException(GeminiApiException.Kind.INVALID_RESPONSE,
                "Gemini response did not contain any candidates");
        }
        return response.candidates().stream()
            .filter(candidate -> candidate != null && candidate.content() != null)
            .flatMap(candidate -> {
                List<GenerateContentResponse.Part> parts = candidate.content().parts();
                return parts != null ? parts.stream() : List.<GenerateContentResponse.Part>of().stream();
            })
            .map(GenerateContentResponse.Part::text)
            .filter(StringUtils::hasText)
            .findFirst()
            .orElseThrow(() -> new GeminiApiException(GeminiApiException.Kind.INVALID_RESPONSE,
                "Gemini response did not contain any text parts"));
    }

    private record GenerateContentRequest(List<Content> contents, GenerationConfig generationConfig) {

        private record Content(String role, List<Part> parts) {
        }

        @JsonInclude(JsonInclude.Include.NON_NULL)
        private record Part(String text, InlineData inlineData) {
        }

        private record InlineData(String mimeType, String data) {
        }

        @JsonInclude(JsonInclude.Include.NON_NULL)
        private record GenerationConfig(Double temperature, Double topP, Integer topK, Integer maxOutputTokens,
                                        String responseMimeType) {
        }
    }

    private record GenerateContentResponse(List<Candidate> candidates) {

        private record Candidate(Content content) {
        }

        private record Content(List<Part> parts) {
        }

        private record Part(String text) {
        }
    }

    private record ListModelsResponse(List<Model> models) {

        private record Model(String name, List<String> supportedGenerationMethods) {
        }
    }
}
