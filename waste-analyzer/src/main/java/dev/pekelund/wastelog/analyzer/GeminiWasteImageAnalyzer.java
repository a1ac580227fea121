package dev.pekelund.wastelog.analyzer;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pekelund.wastelog.analyzer.WasteAnalysis.EstimatedWaste;
import dev.pekelund.wastelog.analyzer.googleai.GeminiApiException;
import dev.pekelund.wastelog.analyzer.googleai.GeminiClient;
import dev.pekelund.wastelog.analyzer.googleai.GoogleAiGeminiChatOptions;
import dev.pekelund.wastelog.analyzer.googleai.InlineImage;
import dev.pekelund.wastelog.waste.FoodItemEstimate;
import java.io.IOException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Invokes Gemini through the {@link GeminiClient} to identify wasted food items in a photo.
 */
public class GeminiWasteImageAnalyzer implements WasteImageAnalyzer {

    private static final Logger LOGGER = LoggerFactory.getLogger(GeminiWasteImageAnalyzer.class);
    private static final int MAX_UNFILTERED_MODELS = 3;

    static final String PROMPT = """
        You are analyzing a photo for FOOD WASTE logging. Be cautious with claims of spoilage (e.g., mold).
        Rules for uncertainty and lighting:
        - Do NOT infer mold solely from bright spots, glare, reflections, specular highlights, or compression noise, especially through plastic bags or containers.
        - If distinguishing mold vs. glare/reflection is ambiguous, do NOT assert spoilage; instead include a clear disclaimer and optionally ask for a clearer photo.
        - If image quality is poor (blurry, low light, heavy reflections, occlusions), ask for a better-quality picture and reduce confidence.
        - Prefer neutral phrasing like "possible" only when supported by multiple, unambiguous visual cues (texture fuzz, green/blue/white filamentous growth, consistent across non-reflective surfaces).

        Analyze this image of food waste. Identify:
        1. All food items visible (be specific: e.g., "chicken breast", "mashed potatoes", "mixed vegetables")
        2. Estimate the quantity/portion size wasted for each item
        3. Assess the condition of the food (e.g., untouched, partially eaten, spoiled). Only mark "spoiled" if clearly evident beyond lighting artifacts. If unsure, prefer "uncertain" and include disclaimer.
        4. Provide insights on why this waste might have occurred
        5. Provide a confidence score in [0,1]. If low (<0.6), include an uncertainty disclaimer and optionally request a better photo.
        6. Ensure estimate CONSISTENCY:
           - Use conservative, typical unit pricing (round each item to nearest $0.10) unless strong evidence suggests otherwise.
           - Use weight ranges when uncertain; avoid large spread unless necessary.
           - If items look identical (e.g., cookies), apply consistent per-item values across the set.

        Respond in JSON format with this structure:
        {
          "items": [
            {
              "name": "item name",
              "category": "main dish/side/appetizer/dessert",
              "estimatedAmount": "description of amount",
              "condition": "untouched/partially eaten/spoiled/expired/uncertain",
              "estimatedValue": estimated value in USD
            }
          ],
          "totalEstimatedValue": total estimated value,
          "estimatedWaste": {
            "weight": "estimated weight in pounds/grams",
            "percentage": "estimated percentage of original portion"
          },
          "confidence": number between 0 and 1,
          "uncertaintyDisclaimer": "short disclaimer if visual cues could be due to lighting/reflection/poor quality; empty string otherwise",
          "needsBetterPhoto": true or false,
          "reasonsUncertain": ["short reasons if uncertain"],
          "notes": "observations and potential reasons for waste"
        }

        IMPORTANT: Respond ONLY with valid JSON, no additional text before or after.
        """;

    private final GeminiClient geminiClient;
    private final ObjectMapper objectMapper;
    private final GoogleAiGeminiChatOptions chatOptions;
    private final List<String> fallbackModels;
    private final boolean discoverModels;
    private volatile List<String> discoveredModels;

    /**
     * @param fallbackModels models tried in order when the configured model is unknown or rejects the request
     * @param discoverModels whether to ask Gemini which models the key can use before trying any
     */
    public GeminiWasteImageAnalyzer(GeminiClient geminiClient, ObjectMapper objectMapper,
        GoogleAiGeminiChatOptions chatOptions, List<String> fallbackModels, boolean discoverModels) {
        this.geminiClient = geminiClient;
        this.objectMapper = objectMapper;
        this.chatOptions = chatOptions != null ? chatOptions : GoogleAiGeminiChatOptions.builder().build();
        this.fallbackModels = fallbackModels != null ? List.copyOf(fallbackModels) : List.of();
        this.discoverModels = discoverModels;
    }

    @Override
    public WasteAnalysis analyze(byte[] imageBytes, String fileName, String mimeType) {
        if (imageBytes == null || imageBytes.length == 0) {
            throw new InvalidWasteImageException("Cannot analyze an empty image");
        }
        String resolvedMimeType = StringUtils.hasText(mimeType) ? mimeType : "image/jpeg";
        List<String> models = candidateModels();
        LOGGER.info("Analyzing waste photo '{}' ({} bytes, {}) with models {}", fileName, imageBytes.length,
            resolvedMimeType, models);

        String response = generateWithFallback(new InlineImage(imageBytes, resolvedMimeType), models);
        if (!StringUtils.hasText(response)) {
            throw new VisionAnalysisException(VisionFailure.MALFORMED_RESPONSE, "Gemini returned an empty response",
                null);
        }

        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Gemini raw response: {}", response);
        }
        return toAnalysis(parseStructuredResponse(sanitiseResponse(response)));
    }

    private String generateWithFallback(InlineImage image, List<String> models) {
        if (models.isEmpty()) {
            try {
                return geminiClient.generateContent(PROMPT, image, chatOptions);
            } catch (GeminiApiException ex) {
                throw failed(ex);
            }
        }
        GeminiApiException lastError = null;
        for (String model : models) {
            GoogleAiGeminiChatOptions options = chatOptions.merge(GoogleAiGeminiChatOptions.builder().model(model).build());
            try {
                String response = geminiClient.generateContent(PROMPT, image, options);
                LOGGER.info("Gemini model '{}' answered", options.getModel());
                return response;
            } catch (GeminiApiException ex) {
                lastError = ex;
                VisionFailure failure = classify(ex);
                if (!triesNextModel(ex, failure)) {
                    throw failed(ex);
                }
                LOGGER.warn("Gemini model '{}' unusable ({}, HTTP {}); trying next model", options.getModel(),
                    failure, ex.getStatusCode());
            }
        }
        VisionFailure failure = classify(lastError);
        LOGGER.warn("All Gemini models failed; last error ({}, HTTP {}): {}", failure, lastError.getStatusCode(),
            lastError.getMessage());
        throw new VisionAnalysisException(failure,
            "All model attempts failed. Tried models: %s. %s".formatted(String.join(", ", models),
                failure.defaultMessage()),
            lastError);
    }

    private static VisionAnalysisException failed(GeminiApiException ex) {
        VisionFailure failure = classify(ex);
        LOGGER.warn("Gemini call failed ({}, HTTP {}): {}", failure, ex.getStatusCode(), ex.getMessage());
        return new VisionAnalysisException(failure, ex);
    }

    private static boolean triesNextModel(GeminiApiException ex, VisionFailure failure) {
        return ex.getKind() == GeminiApiException.Kind.HTTP_ERROR
            && (ex.getStatusCode() == 404 || failure == VisionFailure.INVALID_INPUT);
    }

    /**
     * Configured model first, then the fallbacks. When discovery succeeded, models the key cannot
     * use are dropped and the remaining listed vision models are appended.
     */
    List<String> candidateModels() {
        Set<String> configured = new LinkedHashSet<>();
        if (StringUtils.hasText(chatOptions.getModel())) {
            configured.add(chatOptions.getModel());
        }
        fallbackModels.stream().filter(StringUtils::hasText).map(String::trim).forEach(configured::add);

        List<String> available = availableModels();
        if (available.isEmpty()) {
            return List.copyOf(configured);
        }
        List<String> visionModels = available.stream()
            .filter(name -> (name.contains("pro") || name.contains("flash")) && !name.contains("embedding"))
            .toList();
        Set<String> candidates = new LinkedHashSet<>();
        configured.stream().filter(available::contains).forEach(candidates::add);
        candidates.addAll(visionModels.isEmpty()
            ? available.subList(0, Math.min(MAX_UNFILTERED_MODELS, available.size()))
            : visionModels);
        return List.copyOf(candidates);
    }

    private List<String> availableModels() {
        if (!discoverModels) {
            return List.of();
        }
        List<String> cached = discoveredModels;
        if (cached != null) {
            return cached;
        }
        try {
            List<String> listed = geminiClient.listModels();
            if (listed == null || listed.isEmpty()) {
                return List.of();
            }
            discoveredModels = List.copyOf(listed);
            return discoveredModels;
        } catch (GeminiApiException ex) {
            LOGGER.info("Could not list Gemini models ({}); using configured model names", ex.getMessage());
            return List.of();
        }
    }

    static VisionFailure classify(GeminiApiException ex) {
        return switch (ex.getKind()) {
            case MISSING_API_KEY -> VisionFailure.MISSING_CREDENTIAL;
            case TRANSPORT_ERROR -> VisionFailure.UPSTREAM_UNAVAILABLE;
            case INVALID_RESPONSE -> VisionFailure.MALFORMED_RESPONSE;
            case HTTP_ERROR -> classifyHttpError(ex.getStatusCode(), ex.getResponseBody());
        };
    }

    private static VisionFailure classifyHttpError(int status, String body) {
        String lowerBody = body != null ? body.toLowerCase(Locale.ROOT) : "";
        if (status == 401 || lowerBody.contains("api_key_invalid") || lowerBody.contains("api key not valid")) {
            return VisionFailure.MISSING_CREDENTIAL;
        }
        if (status == 403 || status == 404) {
            return VisionFailure.ACCESS_DENIED;
        }
        if (status == 429) {
            return lowerBody.contains("quota") ? VisionFailure.QUOTA_EXCEEDED : VisionFailure.RATE_LIMITED;
        }
        if (status >= 400 && status < 500) {
            return VisionFailure.INVALID_INPUT;
        }
        return VisionFailure.UPSTREAM_UNAVAILABLE;
    }

    private String sanitiseResponse(String response) {
        String trimmed = response.trim();
        if (trimmed.startsWith("```") && trimmed.endsWith("```") && trimmed.length() >= 6) {
            int firstBreak = trimmed.indexOf('\n');
            trimmed = firstBreak > 0
                ? trimmed.substring(firstBreak + 1, trimmed.length() - 3).trim()
                : trimmed.substring(3, trimmed.length() - 3).trim();
        }
        int start = trimmed.indexOf('{');
        int end = trimmed.lastIndexOf('}');
        if (start >= 0 && end > start) {
            trimmed = trimmed.substring(start, end + 1);
        }
        if (!trimmed.equals(response)) {
            LOGGER.debug("Response trimmed from {} to {} characters during sanitisation", response.length(),
                trimmed.length());
        }
        return trimmed;
    }

    private RawWasteAnalysis parseStructuredResponse(String response) {
        try {
            RawWasteAnalysis parsed = objectMapper.readValue(response, RawWasteAnalysis.class);
            if (parsed == null) {
                throw new VisionAnalysisException(VisionFailure.MALFORMED_RESPONSE, "Gemini returned a null document",
                    null);
            }
            return parsed;
        } catch (IOException ex) {
            LOGGER.error("Failed to parse Gemini response. Payload begins with: {}", preview(response));
            throw new VisionAnalysisException(VisionFailure.MALFORMED_RESPONSE, ex);
        }
    }

    private WasteAnalysis toAnalysis(RawWasteAnalysis raw) {
        List<FoodItemEstimate> items = raw.items() == null ? List.of() : raw.items().stream()
            .filter(Objects::nonNull)
            .map(item -> new FoodItemEstimate(item.name(), item.category(), item.estimatedAmount(), item.condition(),
                item.estimatedValue() != null ? item.estimatedValue() : 0.0))
            .toList();
        double total = raw.totalEstimatedValue() != null
            ? raw.totalEstimatedValue()
            : items.stream().mapToDouble(FoodItemEstimate::estimatedValue).sum();
        EstimatedWaste estimatedWaste = raw.estimatedWaste() != null
            ? new EstimatedWaste(raw.estimatedWaste().weight(), raw.estimatedWaste().percentage())
            : EstimatedWaste.unknown();

        WasteAnalysis analysis = new WasteAnalysis(items, total, estimatedWaste, raw.confidence(),
            raw.uncertaintyDisclaimer(), Boolean.TRUE.equals(raw.needsBetterPhoto()), raw.reasonsUncertain(),
            raw.notes());
        LOGGER.info("Gemini identified {} items (total {}, confidence {}, needs better photo: {})",
            analysis.items().size(), analysis.totalEstimatedValue(), analysis.confidence(),
            analysis.needsBetterPhoto());
        return analysis;
    }

    private String preview(String response) {
        if (response == null) {
            return "<null>";
        }
        int max = Math.min(response.length(), 256);
        return response.substring(0, max);
    }
}

@JsonIgnoreProperties(ignoreUnknown = true)
record RawWasteAnalysis(
    List<RawWasteItem> items,
    Double totalEstimatedValue,
    RawEstimatedWaste estimatedWaste,
    Double confidence,
    String uncertaintyDisclaimer,
    Boolean needsBetterPhoto,
    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY) List<String> reasonsUncertain,
    String notes
) { }

@JsonIgnoreProperties(ignoreUnknown = true)
record RawWasteItem(
    String name,
    String category,
    String estimatedAmount,
    String condition,
    Double estimatedValue
) { }

@JsonIgnoreProperties(ignoreUnknown = true)
record RawEstimatedWaste(String weight, String percentage) { }
