package dev.pekelund.wastelog.reconciliation;

import dev.pekelund.wastelog.waste.FoodItemEstimate;
import dev.pekelund.wastelog.waste.WasteEntry;
import dev.pekelund.wastelog.waste.WasteItem;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Aligns the values of a fresh analysis with the most recent earlier entry for the same image so
 * repeated photos of the same waste produce the same figures.
 */
public class ValueReconciler {

    private static final Logger LOGGER = LoggerFactory.getLogger(ValueReconciler.class);

    static final String CONSISTENCY_NOTE_TEMPLATE = "Values aligned with duplicate of entry #%d for consistency.";

    public ReconciliationResult reconcile(List<FoodItemEstimate> freshItems, WasteEntry prior) {
        List<FoodItemEstimate> items = freshItems != null
            ? freshItems.stream().filter(Objects::nonNull).toList()
            : List.of();

        if (prior == null) {
            return new ReconciliationResult(items, roundToDime(sum(items)), null, "");
        }

        Map<String, WasteItem> priorByName = new HashMap<>();
        for (WasteItem priorItem : prior.items()) {
            priorByName.put(normalise(priorItem.name()), priorItem);
        }

        List<FoodItemEstimate> aligned = new ArrayList<>(items.size());
        int matched = 0;
        for (FoodItemEstimate item : items) {
            WasteItem priorItem = priorByName.get(normalise(item.name()));
            if (priorItem != null) {
                aligned.add(item.withEstimatedValue(priorItem.estimatedValue()));
                matched++;
            } else {
                aligned.add(item);
            }
        }

        LOGGER.info("Reconciling analysis against entry #{} ({} of {} items matched by name)",
            prior.id(), matched, items.size());

        if (prior.totalEstimatedValue() > 0) {
            return new ReconciliationResult(aligned, prior.totalEstimatedValue(), prior.id(),
                CONSISTENCY_NOTE_TEMPLATE.formatted(prior.id()));
        }
        return new ReconciliationResult(aligned, roundToDime(sum(aligned)), prior.id(), "");
    }

    /**
     * Rounds to one decimal place, half up for positive amounts.
     */
    public static double roundToDime(double value) {
        return Math.round(value * 10) / 10.0;
    }

    private static double sum(List<FoodItemEstimate> items) {
        return items.stream().mapToDouble(FoodItemEstimate::estimatedValue).sum();
    }

    private static String normalise(String name) {
        return name == null ? "" : name.toLowerCase(Locale.ROOT);
    }
}
