package dev.pekelund.wastelog.analyzer.googleai;

import java.util.List;

/**
 * Minimal client interface for invoking Google AI Studio's Gemini API with an image.
 */
public interface GeminiClient {

    /**
     * @return the default chat options configured for the client.
     */
    GoogleAiGeminiChatOptions getDefaultOptions();

    /**
     * Generates text using Gemini for the provided prompt and inline image.
     *
     * @param prompt the instructions to send to the model
     * @param image the image the prompt refers to; may be {@code null} for text-only prompts
     * @param overrides optional overrides for the default chat options; may be {@code null}
     * @return the generated text response from Gemini
     * @throws GeminiApiException when the call cannot be made or Gemini rejects it
     */
    String generateContent(String prompt, InlineImage image, GoogleAiGeminiChatOptions overrides);

    /**
     * Lists the models the configured key can call, without the {@code models/} prefix.
     *
     * @throws GeminiApiException when the listing cannot be retrieved
     */
    List<String> listModels();
}
