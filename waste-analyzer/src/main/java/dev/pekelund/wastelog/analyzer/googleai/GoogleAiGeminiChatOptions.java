package dev.pekelund.wastelog.analyzer.googleai;

import java.util.Objects;
import org.springframework.util.StringUtils;

/**
 * Generation options used by the Google AI Studio Gemini client.
 */
public class GoogleAiGeminiChatOptions {

    private final String model;
    private final Double temperature;
    private final Integer topK;
    private final Double topP;
    private final Integer maxOutputTokens;
    private final String responseMimeType;

    private GoogleAiGeminiChatOptions(Builder builder) {
        this.model = builder.model;
        this.temperature = builder.temperature;
        this.topK = builder.topK;
        this.topP = builder.topP;
        this.maxOutputTokens = builder.maxOutputTokens;
        this.responseMimeType = builder.responseMimeType;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return builder()
            .model(this.model)
            .temperature(this.temperature)
            .topK(this.topK)
            .topP(this.topP)
            .maxOutputTokens(this.maxOutputTokens)
            .responseMimeType(this.responseMimeType);
    }

    public GoogleAiGeminiChatOptions merge(GoogleAiGeminiChatOptions overrides) {
        if (overrides == null) {
            return this;
        }
        Builder builder = this.toBuilder();
        if (StringUtils.hasText(overrides.getModel())) {
            builder.model(overrides.getModel());
        }
        if (overrides.getTemperature() != null) {
            builder.temperature(overrides.getTemperature());
        }
        if (overrides.getTopK() != null) {
            builder.topK(overrides.getTopK());
        }
        if (overrides.getTopP() != null) {
            builder.topP(overrides.getTopP());
        }
        if (overrides.getMaxOutputTokens() != null) {
            builder.maxOutputTokens(overrides.getMaxOutputTokens());
        }
        if (StringUtils.hasText(overrides.getResponseMimeType())) {
            builder.responseMimeType(overrides.getResponseMimeType());
        }
        return builder.build();
    }

    public String getModel() {
        return model;
    }

    public Double getTemperature() {
        return temperature;
    }

    public Integer getTopK() {
        return topK;
    }

    public Double getTopP() {
        return topP;
    }

    public Integer getMaxOutputTokens() {
        return maxOutputTokens;
    }

    public String getResponseMimeType() {
        return responseMimeType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GoogleAiGeminiChatOptions that)) {
            return false;
        }
        return Objects.equals(model, that.model)
            && Objects.equals(temperature, that.temperature)
            && Objects.equals(topK, that.topK)
            && Objects.equals(topP, that.topP)
            && Objects.equals(maxOutputTokens, that.maxOutputTokens)
            && Objects.equals(responseMimeType, that.responseMimeType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(model, temperature, topK, topP, maxOutputTokens, responseMimeType);
    }

    @Override
    public String toString() {
        return "GoogleAiGeminiChatOptions{"
            + "model='" + model + '\''
            + ", temperature=" + temperature
            + ", topP=" + topP
            + ", topK=" + topK
            + ", maxOutputTokens=" + maxOutputTokens
            + ", responseMimeType='" + responseMimeType + '\''
            + '}';
    }

    /**
     * Builder for {@link GoogleAiGeminiChatOptions}.
     */
    public static class Builder {

        private String model;
        private Double temperature;
        private Integer topK;
        private Double topP;
        private Integer maxOutputTokens;
        private String responseMimeType;

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder temperature(Double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder topK(Integer topK) {
            this.topK = topK;
            return this;
        }

        public Builder topP(Double topP) {
            this.topP = topP;
            return this;
        }

        public Builder maxOutputTokens(Integer maxOutputTokens) {
            this.maxOutputTokens = maxOutputTokens;
            return this;
        }

        public Builder responseMimeType(String responseMimeType) {
            this.responseMimeType = responseMimeType;
            return this;
        }

        public GoogleAiGeminiChatOptions build() {
            return new GoogleAiGeminiChatOptions(this);
        }
    }
}
