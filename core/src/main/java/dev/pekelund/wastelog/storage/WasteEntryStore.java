package dev.pekelund.wastelog.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pekelund.wastelog.storage.WasteDataDocument.StoredEntry;
import dev.pekelund.wastelog.storage.WasteDataDocument.StoredItem;
import dev.pekelund.wastelog.waste.FoodItemEstimate;
import dev.pekelund.wastelog.waste.NewWasteEntry;
import dev.pekelund.wastelog.waste.WasteEntry;
import dev.pekelund.wastelog.waste.WasteItem;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * File-backed store of waste entries and their items.
 *
 * <p>The canonical state is held in memory. Every mutation builds the complete post-mutation
 * state, writes it to a temporary file that is atomically moved over the data file, and only
 * then publishes the new state. A failed write therefore leaves both the file and the in-memory
 * state (including the id counters) untouched. Mutations are serialized through the write lock;
 * readers share the read lock and always see a fully published state.</p>
 */
public class WasteEntryStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(WasteEntryStore.class);

    private static final Comparator<WasteEntry> NEWEST_FIRST = ImageHashIndex.RECENCY.reversed();

    private final Path dataFile;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private StoreState state = StoreState.empty();
    private volatile String loadWarning;

    public WasteEntryStore(Path dataFile, ObjectMapper objectMapper, Clock clock) {
        this.dataFile = Objects.requireNonNull(dataFile, "dataFile");
        this.objectMapper = objectMapper != null ? objectMapper : new ObjectMapper();
        this.clock = clock != null ? clock : Clock.systemUTC();
        load();
    }

    public WasteEntry append(NewWasteEntry newEntry, List<FoodItemEstimate> estimates) {
        Objects.requireNonNull(newEntry, "newEntry");
        List<FoodItemEstimate> safeEstimates = estimates != null ? estimates : List.of();

        lock.writeLock().lock();
        try {
            StoreState current = state;
            long entryId = current.nextEntryId;
            long itemId = current.nextItemId;

            List<WasteItem> entryItems = new ArrayList<>(safeEstimates.size());
            for (FoodItemEstimate estimate : safeEstimates) {
                if (estimate != null) {
                    entryItems.add(WasteItem.from(itemId++, entryId, estimate));
                }
            }

            double total = newEntry.totalEstimatedValue() != null
                ? newEntry.totalEstimatedValue()
                : entryItems.stream().mapToDouble(WasteItem::estimatedValue).sum();

            WasteEntry entry = new WasteEntry(
                entryId,
                newEntry.imagePath(),
                newEntry.timestamp(),
                Double.isFinite(total) && total > 0 ? total : 0.0,
                newEntry.estimatedWeight(),
                newEntry.notes(),
                newEntry.imageHash(),
                newEntry.duplicateOfEntryId(),
                newEntry.consistencyNote(),
                Instant.now(clock),
                entryItems
            );

            commit(current.withAppended(entry, entryId + 1, itemId));
            LOGGER.info("Stored waste entry #{} with {} items (total {})", entry.id(), entryItems.size(),
                entry.totalEstimatedValue());
            return entry;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<WasteEntry> list(WasteEntryQuery query) {
        WasteEntryQuery resolved = query != null ? query : WasteEntryQuery.latest(WasteEntryQuery.DEFAULT_LIMIT);
        lock.readLock().lock();
        try {
            return state.entries.values().stream()
                .filter(entry -> resolved.matches(entry.timestamp().toInstant()))
                .sorted(NEWEST_FIRST)
                .limit(resolved.limit())
                .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<WasteEntry> findById(long id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(state.entries.get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns the entry with the given image hash and the latest timestamp; on equal timestamps the
     * entry with the highest id wins.
     */
    public Optional<WasteEntry> findMostRecentByHash(String imageHash) {
        lock.readLock().lock();
        try {
            return state.hashIndex.find(imageHash).map(state.entries::get);
        } finally {
            lock.readLock().unlock();
        }
    }

    public StoreOperationResult deleteById(long id) {
        lock.writeLock().lock();
        try {
            StoreState current = state;
            WasteEntry existing = current.entries.get(id);
            if (existing == null) {
                throw new WasteEntryNotFoundException(id);
            }
            commit(current.withRemoved(existing));
            LOGGER.info("Deleted waste entry #{} and its {} items", id, existing.items().size());
            return StoreOperationResult.ok("Entry #%d deleted".formatted(id));
        } finally {
            lock.writeLock().unlock();
        }
    }

    public StoreOperationResult clearAll() {
        lock.writeLock().lock();
        try {
            int removed = state.entries.size();
            commit(StoreState.empty());
            LOGGER.info("Cleared waste store ({} entries removed)", removed);
            return StoreOperationResult.ok("All waste data cleared");
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int count() {
        lock.readLock().lock();
        try {
            return state.entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public StoreSnapshot snapshot() {
        lock.readLock().lock();
        try {
            List<WasteEntry> entries = List.copyOf(state.entries.values());
            return new StoreSnapshot(entries, allItems(entries));
        } finally {
            lock.readLock().unlock();
        }
    }

    public Path getDataFile() {
        return dataFile;
    }

    /**
     * @return a description of the problem when the data file could not be loaded at startup and
     *     the store fell back to an empty state
     */
    public Optional<String> loadWarning() {
        return Optional.ofNullable(loadWarning);
    }

    private void commit(StoreState next) {
        writeDocument(toDocument(next));
        state = next;
    }

    private void load() {
        lock.writeLock().lock();
        try {
            if (!Files.exists(dataFile)) {
                LOGGER.info("No waste store found at {}; starting empty", dataFile);
                initialiseEmpty();
                return;
            }
            try {
                WasteDataDocument document = objectMapper.readValue(dataFile.toFile(), WasteDataDocument.class);
                if (document == null) {
                    throw new WasteStoreException("Waste store " + dataFile + " contains no document");
                }
                state = fromDocument(document);
                LOGGER.info("Loaded {} waste entries from {} (next entry id {}, next item id {})",
                    state.entries.size(), dataFile, state.nextEntryId, state.nextItemId);
            } catch (IOException | WasteStoreException ex) {
                LOGGER.warn("Waste store {} is unreadable; continuing with an empty store", dataFile, ex);
                Path quarantined = quarantineCorruptFile();
                loadWarning = quarantined != null
                    ? "Waste store was unreadable and has been moved to %s".formatted(quarantined)
                    : "Waste store %s was unreadable; starting empty".formatted(dataFile);
                initialiseEmpty();
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void initialiseEmpty() {
        state = StoreState.empty();
        try {
            writeDocument(toDocument(state));
        } catch (WasteStoreException ex) {
            LOGGER.warn("Unable to write initial waste store to {}", dataFile, ex);
            if (loadWarning == null) {
                loadWarning = "Waste store %s could not be written: %s".formatted(dataFile, ex.getMessage());
            }
        }
    }

    private Path quarantineCorruptFile() {
        Path target = dataFile.resolveSibling(dataFile.getFileName() + ".corrupt-" + clock.millis());
        try {
            return Files.move(dataFile, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException ex) {
            LOGGER.warn("Unable to move unreadable waste store {} aside", dataFile, ex);
            return null;
        }
    }

    private void writeDocument(WasteDataDocument document) {
        Path absolute = dataFile.toAbsolutePath();
        try {
            Path directory = absolute.getParent();
            Files.createDirectories(directory);
            Path temp = Files.createTempFile(directory, absolute.getFileName().toString(), ".tmp");
            try {
                Files.write(temp, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(document));
                moveIntoPlace(temp, absolute);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException ex) {
            throw new WasteStoreException("Failed to write waste store " + dataFile, ex);
        }
    }

    private void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException ex) {
            LOGGER.debug("Atomic move not supported for {}; falling back to a plain replace", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static List<WasteItem> allItems(List<WasteEntry> entries) {
        return entries.stream()
            .flatMap(entry -> entry.items().stream())
            .sorted(Comparator.comparingLong(WasteItem::id))
            .toList();
    }

    private static WasteDataDocument toDocument(StoreState state) {
        List<WasteEntry> entries = List.copyOf(state.entries.values());
        List<StoredEntry> storedEntries = entries.stream()
            .map(entry -> new StoredEntry(
                entry.id(),
                entry.imagePath(),
                DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(entry.timestamp()),
                entry.totalEstimatedValue(),
                entry.estimatedWeight(),
                entry.notes(),
                entry.imageHash(),
                entry.duplicateOfEntryId(),
                entry.consistencyNote(),
                entry.createdAt() != null ? entry.createdAt().toString() : null))
            .toList();
        List<StoredItem> storedItems = allItems(entries).stream()
            .map(item -> new StoredItem(item.id(), item.wasteEntryId(), item.name(), item.category(),
                item.estimatedAmount(), item.condition(), item.estimatedValue()))
            .toList();
        return new WasteDataDocument(storedEntries, storedItems, state.nextEntryId, state.nextItemId);
    }

    private StoreState fromDocument(WasteDataDocument document) {
        List<StoredEntry> storedEntries = document.entries() != null ? document.entries() : List.of();
        List<StoredItem> storedItems = document.items() != null ? document.items() : List.of();

        Map<Long, List<WasteItem>> itemsByEntry = new HashMap<>();
        long maxItemId = 0;
        for (StoredItem stored : storedItems) {
            if (stored == null) {
                continue;
            }
            FoodItemEstimate estimate = new FoodItemEstimate(stored.name(), stored.category(),
                stored.estimatedAmount(), stored.condition(),
                stored.estimatedValue() != null ? stored.estimatedValue() : 0.0);
            itemsByEntry.computeIfAbsent(stored.wasteEntryId(), key -> new ArrayList<>())
                .add(WasteItem.from(stored.id(), stored.wasteEntryId(), estimate));
            maxItemId = Math.max(maxItemId, stored.id());
        }

        NavigableMap<Long, WasteEntry> entries = new TreeMap<>();
        ImageHashIndex hashIndex = new ImageHashIndex();
        long maxEntryId = 0;
        int skipped = 0;
        for (StoredEntry stored : storedEntries) {
            if (stored == null) {
                continue;
            }
            // skipped ids still advance the counter so they are never handed out again
            maxEntryId = Math.max(maxEntryId, stored.id());
            List<WasteItem> entryItems = itemsByEntry.getOrDefault(stored.id(), List.of()).stream()
                .sorted(Comparator.comparingLong(WasteItem::id))
                .toList();
            Instant createdAt;
            OffsetDateTime timestamp;
            try {
                createdAt = parseInstant(stored.createdAt());
                timestamp = parseTimestamp(stored.timestamp(), createdAt);
            } catch (DateTimeParseException ex) {
                LOGGER.warn("Skipping waste entry #{} in {}: unreadable timestamp '{}'", stored.id(), dataFile,
                    ex.getParsedString());
                skipped++;
                continue;
            }
            WasteEntry entry = new WasteEntry(
                stored.id(),
                stored.imagePath(),
                timestamp,
                stored.totalEstimatedValue() != null ? stored.totalEstimatedValue() : 0.0,
                stored.estimatedWeight(),
                stored.notes(),
                stored.imageHash(),
                stored.duplicateOfEntryId(),
                stored.consistencyNote(),
                createdAt,
                entryItems
            );
            entries.put(entry.id(), entry);
            hashIndex.add(entry);
        }
        if (skipped > 0) {
            loadWarning = "Skipped %d waste entries with unreadable timestamps in %s".formatted(skipped, dataFile);
        }

        long orphans = itemsByEntry.keySet().stream().filter(entryId -> !entries.containsKey(entryId)).count();
        if (orphans > 0) {
            LOGGER.warn("Ignoring items that reference {} missing entries in {}", orphans, dataFile);
        }

        return new StoreState(entries, hashIndex,
            resolveCounter(document.nextEntryId(), maxEntryId),
            resolveCounter(document.nextItemId(), maxItemId));
    }

    private static long resolveCounter(Long stored, long maxExistingId) {
        long minimum = maxExistingId + 1;
        if (stored == null || stored < minimum) {
            return minimum;
        }
        return stored;
    }

    private static OffsetDateTime parseTimestamp(String value, Instant fallback) {
        if (StringUtils.hasText(value)) {
            return OffsetDateTime.parse(value.trim());
        }
        Instant instant = fallback != null ? fallback : Instant.EPOCH;
        return instant.atOffset(ZoneOffset.UTC);
    }

    private static Instant parseInstant(String value) {
        if (!StringUtils.hasText(value)) {
            return null;
        }
        return OffsetDateTime.parse(value.trim()).toInstant();
    }

    private static final class StoreState {

        private final NavigableMap<Long, WasteEntry> entries;
        private final ImageHashIndex hashIndex;
        private final long nextEntryId;
        private final long nextItemId;

        private StoreState(NavigableMap<Long, WasteEntry> entries, ImageHashIndex hashIndex, long nextEntryId,
            long nextItemId) {
            this.entries = entries;
            this.hashIndex = hashIndex;
            this.nextEntryId = nextEntryId;
            this.nextItemId = nextItemId;
        }

        static StoreState empty() {
            return new StoreState(new TreeMap<>(), new ImageHashIndex(), 1L, 1L);
        }

        StoreState withAppended(WasteEntry entry, long newNextEntryId, long newNextItemId) {
            NavigableMap<Long, WasteEntry> copy = new TreeMap<>(entries);
            copy.put(entry.id(), entry);
            ImageHashIndex index = hashIndex.copy();
            index.add(entry);
            return new StoreState(copy, index, newNextEntryId, newNextItemId);
        }

        StoreState withRemoved(WasteEntry entry) {
            NavigableMap<Long, WasteEntry> copy = new TreeMap<>(entries);
            copy.remove(entry.id());
            ImageHashIndex index = hashIndex.copy();
            index.remove(entry, copy.values());
            return new StoreState(copy, index, nextEntryId, nextItemId);
        }
    }
}
