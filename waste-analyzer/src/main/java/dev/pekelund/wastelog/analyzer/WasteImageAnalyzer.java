package dev.pekelund.wastelog.analyzer;

/**
 * Turns a photo of food waste into a structured analysis.
 */
public interface WasteImageAnalyzer {

    /**
     * @param imageBytes raw image content, never empty
     * @param fileName original file name, may be {@code null}
     * @param mimeType image MIME type such as {@code image/jpeg}
     * @throws VisionAnalysisException when no analysis could be produced
     */
    WasteAnalysis analyze(byte[] imageBytes, String fileName, String mimeType);
}
