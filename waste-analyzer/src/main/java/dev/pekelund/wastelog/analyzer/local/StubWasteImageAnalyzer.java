package dev.pekelund.wastelog.analyzer.local;

import dev.pekelund.wastelog.analyzer.WasteAnalysis;
import dev.pekelund.wastelog.analyzer.WasteAnalysis.EstimatedWaste;
import dev.pekelund.wastelog.analyzer.WasteImageAnalyzer;
import dev.pekelund.wastelog.waste.FoodItemEstimate;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deterministic {@link WasteImageAnalyzer} used for the {@code local} profile so the service runs
 * without a Gemini API key. Every photo yields the same plate.
 */
class StubWasteImageAnalyzer implements WasteImageAnalyzer {

    private static final Logger LOGGER = LoggerFactory.getLogger(StubWasteImageAnalyzer.class);

    static final List<FoodItemEstimate> ITEMS = List.of(
        new FoodItemEstimate("Chicken breast", "main dish", "about half a breast", "partially eaten", 3.48),
        new FoodItemEstimate("Mixed vegetables", "side", "one cup", "untouched", 2.35),
        new FoodItemEstimate("White rice", "side", "half a cup", "partially eaten", 1.20)
    );

    @Override
    public WasteAnalysis analyze(byte[] imageBytes, String fileName, String mimeType) {
        LOGGER.info("Returning stub analysis for '{}' ({} bytes)", fileName, imageBytes != null ? imageBytes.length : 0);
        double total = ITEMS.stream().mapToDouble(FoodItemEstimate::estimatedValue).sum();
        return new WasteAnalysis(ITEMS, total, new EstimatedWaste("250 g", "40%"), 0.9, "", false, List.of(),
            "Stub analysis for local development.");
    }
}
