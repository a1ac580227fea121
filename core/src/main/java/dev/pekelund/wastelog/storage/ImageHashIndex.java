package dev.pekelund.wastelog.storage;

import dev.pekelund.wastelog.waste.WasteEntry;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.springframework.util.StringUtils;

/**
 * Secondary index from image content hash to the most recent entry carrying that hash.
 * Not thread-safe; the owning store copies it before every mutation.
 */
final class ImageHashIndex {

    static final Comparator<WasteEntry> RECENCY = Comparator
        .comparing((WasteEntry entry) -> entry.timestamp().toInstant())
        .thenComparingLong(WasteEntry::id);

    private final Map<String, WasteEntry> mostRecentByHash = new HashMap<>();

    void add(WasteEntry entry) {
        if (!entry.hasImageHash()) {
            return;
        }
        mostRecentByHash.merge(entry.imageHash(), entry,
            (current, candidate) -> RECENCY.compare(candidate, current) > 0 ? candidate : current);
    }

    void remove(WasteEntry entry, Collection<WasteEntry> remaining) {
        if (!entry.hasImageHash()) {
            return;
        }
        WasteEntry indexed = mostRecentByHash.get(entry.imageHash());
        if (indexed == null || indexed.id() != entry.id()) {
            return;
        }
        mostRecentByHash.remove(entry.imageHash());
        remaining.stream()
            .filter(candidate -> candidate.id() != entry.id())
            .filter(candidate -> entry.imageHash().equals(candidate.imageHash()))
            .max(RECENCY)
            .ifPresent(this::add);
    }

    Optional<Long> find(String imageHash) {
        if (!StringUtils.hasText(imageHash)) {
            return Optional.empty();
        }
        return Optional.ofNullable(mostRecentByHash.get(imageHash)).map(WasteEntry::id);
    }

    ImageHashIndex copy() {
        ImageHashIndex copy = new ImageHashIndex();
        copy.mostRecentByHash.putAll(mostRecentByHash);
        return copy;
    }

    int size() {
        return mostRecentByHash.size();
    }
}
