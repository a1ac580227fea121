package dev.pekelund.wastelog.storage;

import dev.pekelund.wastelog.waste.WasteEntry;
import dev.pekelund.wastelog.waste.WasteItem;
import java.util.List;

/**
 * Consistent read of the whole store. Entries (with their items joined) and items are both in
 * ascending id order, which is also insertion order.
 */
public record StoreSnapshot(List<WasteEntry> entries, List<WasteItem> items) {

    public StoreSnapshot {
        entries = entries != null ? List.copyOf(entries) : List.of();
        items = items != null ? List.copyOf(items) : List.of();
    }
}
