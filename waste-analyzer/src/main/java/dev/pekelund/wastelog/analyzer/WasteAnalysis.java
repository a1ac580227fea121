package dev.pekelund.wastelog.analyzer;

import dev.pekelund.wastelog.waste.FoodItemEstimate;
import dev.pekelund.wastelog.waste.WasteItemDefaults;
import java.util.List;
import java.util.Objects;
import org.springframework.util.StringUtils;

/**
 * Validated result of analyzing a waste photo.
 *
 * @param confidence model confidence in [0, 1], or {@code null} when the model did not report one
 */
public record WasteAnalysis(
    List<FoodItemEstimate> items,
    double totalEstimatedValue,
    EstimatedWaste estimatedWaste,
    Double confidence,
    String uncertaintyDisclaimer,
    boolean needsBetterPhoto,
    List<String> reasonsUncertain,
    String notes
) {

    public WasteAnalysis {
        items = items != null ? items.stream().filter(Objects::nonNull).toList() : List.of();
        estimatedWaste = estimatedWaste != null ? estimatedWaste : EstimatedWaste.unknown();
        confidence = confidence != null && !confidence.isNaN() ? Math.max(0.0, Math.min(1.0, confidence)) : null;
        uncertaintyDisclaimer = uncertaintyDisclaimer != null ? uncertaintyDisclaimer : "";
        reasonsUncertain = reasonsUncertain != null
            ? reasonsUncertain.stream().filter(StringUtils::hasText).toList()
            : List.of();
        notes = notes != null ? notes : "";
    }

    /**
     * @return a copy carrying reconciled item values and total
     */
    public WasteAnalysis withReconciledValues(List<FoodItemEstimate> reconciledItems, double reconciledTotal) {
        return new WasteAnalysis(reconciledItems, reconciledTotal, estimatedWaste, confidence, uncertaintyDisclaimer,
            needsBetterPhoto, reasonsUncertain, notes);
    }

    public record EstimatedWaste(String weight, String percentage) {

        public EstimatedWaste {
            weight = StringUtils.hasText(weight) ? weight : WasteItemDefaults.UNKNOWN;
            percentage = StringUtils.hasText(percentage) ? percentage : WasteItemDefaults.UNKNOWN;
        }

        public static EstimatedWaste unknown() {
            return new EstimatedWaste(null, null);
        }
    }
}
