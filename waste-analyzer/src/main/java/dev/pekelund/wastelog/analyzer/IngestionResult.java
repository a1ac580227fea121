package dev.pekelund.wastelog.analyzer;

import dev.pekelund.wastelog.waste.WasteEntry;

/**
 * Reconciled analysis of an uploaded photo together with the entry it was logged as.
 */
public record IngestionResult(WasteAnalysis analysis, WasteEntry wasteEntry) {
}
