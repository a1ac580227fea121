package dev.pekelund.wastelog.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pekelund.wastelog.waste.FoodItemEstimate;
import dev.pekelund.wastelog.waste.NewWasteEntry;
import dev.pekelund.wastelog.waste.WasteEntry;
import dev.pekelund.wastelog.waste.WasteItem;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class WasteEntryStoreTest {

    private static final Instant NOW = Instant.parse("2025-10-19T12:00:00Z");

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    @Test
    void appendAssignsIncreasingIdsAndSumsItemValues() {
        WasteEntryStore store = newStore(tempDir.resolve("waste.json"));

        WasteEntry first = store.append(entryAt("2025-10-19T08:00:00Z", "hash-a"),
            List.of(item("Rice", 1.5), item("Beans", 2.0)));
        WasteEntry second = store.append(entryAt("2025-10-19T09:00:00Z", "hash-b"), List.of(item("Bread", 0.8)));

        assertThat(first.id()).isEqualTo(1L);
        assertThat(first.totalEstimatedValue()).isEqualTo(3.5);
        assertThat(first.createdAt()).isEqualTo(NOW);
        assertThat(first.items()).extracting(WasteItem::id).containsExactly(1L, 2L);
        assertThat(first.items()).extracting(WasteItem::wasteEntryId).containsOnly(1L);
        assertThat(second.id()).isEqualTo(2L);
        assertThat(second.items()).extracting(WasteItem::id).containsExactly(3L);
    }

    @Test
    void suppliedTotalTakesPrecedenceOverItemSum() {
        WasteEntryStore store = newStore(tempDir.resolve("waste.json"));
        NewWasteEntry newEntry = new NewWasteEntry("/uploads/a.jpg", OffsetDateTime.parse("2025-10-19T08:00:00Z"),
            "", "", "hash", 4L, "aligned", 12.40);

        WasteEntry entry = store.append(newEntry, List.of(item("Soup", 3.0)));

        assertThat(entry.totalEstimatedValue()).isEqualTo(12.40);
        assertThat(entry.duplicateOfEntryId()).isEqualTo(4L);
        assertThat(entry.consistencyNote()).isEqualTo("aligned");
    }

    @Test
    void idsAreNeverReusedAfterDeletion() {
        WasteEntryStore store = newStore(tempDir.resolve("waste.json"));
        store.append(entryAt("2025-10-19T08:00:00Z", "a"), List.of(item("Rice", 1.0)));
        WasteEntry second = store.append(entryAt("2025-10-19T09:00:00Z", "b"), List.of(item("Rice", 1.0)));

        store.deleteById(second.id());
        WasteEntry third = store.append(entryAt("2025-10-19T10:00:00Z", "c"), List.of(item("Rice", 1.0)));

        assertThat(third.id()).isEqualTo(3L);
        assertThat(third.items()).extracting(WasteItem::id).containsExactly(3L);
    }

    @Test
    void concurrentAppendsAssignUniqueIdsAndPersistEveryEntry() throws Exception {
        Path dataFile = tempDir.resolve("waste.json");
        WasteEntryStore store = newStore(dataFile);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        List<Future<WasteEntry>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < 200; i++) {
                String hash = "hash-" + i;
                futures.add(executor.submit(() -> store.append(entryAt("2025-10-19T08:00:00Z", hash),
                    List.of(item("Rice", 1.0)))));
            }
            Set<Long> entryIds = new HashSet<>();
            Set<Long> itemIds = new HashSet<>();
            for (Future<WasteEntry> future : futures) {
                WasteEntry entry = future.get(30, TimeUnit.SECONDS);
                entryIds.add(entry.id());
                entry.items().forEach(stored -> itemIds.add(stored.id()));
            }
            assertThat(entryIds).hasSize(200);
            assertThat(itemIds).hasSize(200);
        } finally {
            executor.shutdownNow();
        }

        StoreSnapshot reloaded = newStore(dataFile).snapshot();
        assertThat(reloaded.entries()).hasSize(200);
        assertThat(reloaded.items()).hasSize(200);
        assertThat(reloaded.entries()).extracting(WasteEntry::id).doesNotHaveDuplicates();
    }

    @Test
    void deleteRemovesEntryTogetherWithItsItems() {
        WasteEntryStore store = newStore(tempDir.resolve("waste.json"));
        WasteEntry kept = store.append(entryAt("2025-10-19T08:00:00Z", "a"), List.of(item("Rice", 1.0)));
        WasteEntry removed = store.append(entryAt("2025-10-19T09:00:00Z", "b"),
            List.of(item("Soup", 2.0), item("Bread", 0.5)));

        StoreOperationResult result = store.deleteById(removed.id());

        assertThat(result.success()).isTrue();
        assertThat(result.message()).isEqualTo("Entry #2 deleted");
        StoreSnapshot snapshot = store.snapshot();
        assertThat(snapshot.entries()).extracting(WasteEntry::id).containsExactly(kept.id());
        assertThat(snapshot.items()).extracting(WasteItem::wasteEntryId).containsOnly(kept.id());
        assertThat(store.findById(removed.id())).isEmpty();
    }

    @Test
    void deletingUnknownEntryThrowsNotFound() {
        WasteEntryStore store = newStore(tempDir.resolve("waste.json"));

        assertThatThrownBy(() -> store.deleteById(99L))
            .isInstanceOf(WasteEntryNotFoundException.class)
            .hasMessage("Entry #99 not found");
    }

    @Test
    void clearAllRemovesEverythingAndRestartsIds() {
        WasteEntryStore store = newStore(tempDir.resolve("waste.json"));
        store.append(entryAt("2025-10-19T08:00:00Z", "a"), List.of(item("Rice", 1.0), item("Soup", 2.0)));
        store.append(entryAt("2025-10-19T09:00:00Z", "b"), List.of(item("Bread", 1.0)));

        StoreOperationResult result = store.clearAll();
        WasteEntry next = store.append(entryAt("2025-10-19T10:00:00Z", "c"), List.of(item("Pasta", 1.0)));

        assertThat(result.message()).isEqualTo("All waste data cleared");
        assertThat(next.id()).isEqualTo(1L);
        assertThat(next.items()).extracting(WasteItem::id).containsExactly(1L);
        assertThat(store.count()).isEqualTo(1);
    }

    @Test
    void reloadsPersistedStateAndContinuesIdSequences() throws Exception {
        Path dataFile = tempDir.resolve("waste.json");
        WasteEntryStore store = newStore(dataFile);
        store.append(entryAt("2025-10-19T08:00:00+02:00", "a"), List.of(item("Rice", 1.25)));
        WasteEntry second = store.append(entryAt("2025-10-19T09:00:00Z", "b"), List.of(item("Soup", 2.0)));
        store.deleteById(second.id());

        WasteEntryStore reloaded = newStore(dataFile);
        WasteEntry next = reloaded.append(entryAt("2025-10-19T10:00:00Z", "c"), List.of(item("Bread", 1.0)));

        assertThat(reloaded.loadWarning()).isEmpty();
        WasteEntry restored = reloaded.findById(1L).orElseThrow();
        assertThat(restored.timestamp()).isEqualTo(OffsetDateTime.parse("2025-10-19T08:00:00+02:00"));
        assertThat(restored.items()).singleElement().satisfies(item -> {
            assertThat(item.name()).isEqualTo("Rice");
            assertThat(item.estimatedValue()).isEqualTo(1.25);
        });
        assertThat(next.id()).isEqualTo(3L);
        assertThat(next.items()).extracting(WasteItem::id).containsExactly(3L);

        JsonNode document = objectMapper.readTree(dataFile.toFile());
        assertThat(document.get("nextEntryId").asLong()).isEqualTo(4L);
        assertThat(document.get("entries").get(0).get("image_hash").asText()).isEqualTo("a");
        assertThat(document.get("items").get(0).get("waste_entry_id").asLong()).isEqualTo(1L);
    }

    @Test
    void recomputesMissingCountersFromExistingIds() throws Exception {
        Path dataFile = tempDir.resolve("waste.json");
        Files.writeString(dataFile, """
            {
              "entries": [
                {"id": 4, "image_path": "/uploads/old.jpg", "timestamp": "2025-10-18T09:30:00.000Z",
                 "total_estimated_value": 5.5, "estimated_weight": "300g", "notes": "old",
                 "image_hash": "abc", "duplicate_of_entry_id": null, "consistency_note": "",
                 "created_at": "2025-10-18T09:30:01.000Z"}
              ],
              "items": [
                {"id": 7, "waste_entry_id": 4, "name": "Lasagna", "category": "main dish",
                 "estimated_amount": "half", "condition": "partially eaten", "estimated_value": 5.5}
              ]
            }
            """, StandardCharsets.UTF_8);

        WasteEntryStore store = newStore(dataFile);
        WasteEntry next = store.append(entryAt("2025-10-19T10:00:00Z", "def"), List.of(item("Salad", 1.0)));

        assertThat(store.findMostRecentByHash("abc")).map(WasteEntry::id).contains(4L);
        assertThat(next.id()).isEqualTo(5L);
        assertThat(next.items()).extracting(WasteItem::id).containsExactly(8L);
    }

    @Test
    void movesCorruptFileAsideAndStartsEmpty() throws Exception {
        Path dataFile = tempDir.resolve("waste.json");
        Files.writeString(dataFile, "{not valid json", StandardCharsets.UTF_8);

        WasteEntryStore store = newStore(dataFile);

        assertThat(store.count()).isZero();
        assertThat(store.loadWarning()).hasValueSatisfying(warning -> assertThat(warning).contains("corrupt"));
        Path quarantined = tempDir.resolve("waste.json.corrupt-" + NOW.toEpochMilli());
        assertThat(quarantined).hasContent("{not valid json");
        assertThat(objectMapper.readTree(dataFile.toFile()).get("entries").size()).isZero();
    }

    @Test
    void skipsEntryWithUnreadableTimestampAndKeepsTheRest() throws Exception {
        Path dataFile = tempDir.resolve("waste.json");
        Files.writeString(dataFile, """
            {
              "entries": [
                {"id": 1, "image_path": "/uploads/a.jpg", "timestamp": "yesterday evening",
                 "total_estimated_value": 2.0, "image_hash": "a"},
                {"id": 2, "image_path": "/uploads/b.jpg", "timestamp": "2025-10-18T09:30:00.000Z",
                 "total_estimated_value": 3.5, "image_hash": "b"}
              ],
              "items": [
                {"id": 1, "waste_entry_id": 1, "name": "Soup", "estimated_value": 2.0},
                {"id": 2, "waste_entry_id": 2, "name": "Pasta", "estimated_value": 3.5}
              ],
              "nextEntryId": 3,
              "nextItemId": 3
            }
            """, StandardCharsets.UTF_8);

        WasteEntryStore store = newStore(dataFile);

        assertThat(store.snapshot().entries()).extracting(WasteEntry::id).containsExactly(2L);
        assertThat(store.snapshot().items()).extracting(WasteItem::name).containsExactly("Pasta");
        assertThat(store.findMostRecentByHash("a")).isEmpty();
        assertThat(store.loadWarning()).hasValueSatisfying(warning -> assertThat(warning).contains("Skipped 1"));
        assertThat(tempDir.resolve("waste.json.corrupt-" + NOW.toEpochMilli())).doesNotExist();
        assertThat(store.append(entryAt("2025-10-19T08:00:00Z", "c"), List.of(item("Rice", 1.0))).id())
            .isEqualTo(3L);
    }

    @Test
    void skippedEntryIdsAreNotReusedWhenCountersAreMissing() throws Exception {
        Path dataFile = tempDir.resolve("waste.json");
        Files.writeString(dataFile, """
            {"entries": [{"id": 5, "timestamp": "not a date"}], "items": []}
            """, StandardCharsets.UTF_8);

        WasteEntryStore store = newStore(dataFile);

        assertThat(store.count()).isZero();
        assertThat(store.append(entryAt("2025-10-19T08:00:00Z", "c"), List.of()).id()).isEqualTo(6L);
    }

    @Test
    void failedWriteLeavesStateAndIdsUntouched() throws Exception {
        Path dataDir = tempDir.resolve("data");
        Path dataFile = dataDir.resolve("waste.json");
        WasteEntryStore store = newStore(dataFile);

        Files.delete(dataFile);
        Files.delete(dataDir);
        Files.writeString(dataDir, "blocking the store directory", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> store.append(entryAt("2025-10-19T08:00:00Z", "a"), List.of(item("Rice", 1.0))))
            .isInstanceOf(WasteStoreException.class);
        assertThat(store.count()).isZero();
        assertThat(store.findMostRecentByHash("a")).isEmpty();

        Files.delete(dataDir);
        WasteEntry entry = store.append(entryAt("2025-10-19T08:00:00Z", "a"), List.of(item("Rice", 1.0)));

        assertThat(entry.id()).isEqualTo(1L);
        assertThat(entry.items()).extracting(WasteItem::id).containsExactly(1L);
    }

    @Test
    void hashLookupPrefersLatestTimestampThenHighestId() {
        WasteEntryStore store = newStore(tempDir.resolve("waste.json"));
        store.append(entryAt("2025-10-19T10:00:00Z", "same"), List.of());
        WasteEntry latest = store.append(entryAt("2025-10-19T12:00:00Z", "same"), List.of());
        store.append(entryAt("2025-10-19T11:00:00Z", "same"), List.of());

        assertThat(store.findMostRecentByHash("same")).map(WasteEntry::id).contains(latest.id());

        WasteEntry tie = store.append(entryAt("2025-10-19T14:00:00+02:00", "same"), List.of());
        assertThat(store.findMostRecentByHash("same")).map(WasteEntry::id).contains(tie.id());

        store.deleteById(tie.id());
        assertThat(store.findMostRecentByHash("same")).map(WasteEntry::id).contains(latest.id());
        assertThat(store.findMostRecentByHash("")).isEmpty();
        assertThat(store.findMostRecentByHash("other")).isEmpty();
    }

    @Test
    void listReturnsNewestFirstWithinBoundsAndLimit() {
        WasteEntryStore store = newStore(tempDir.resolve("waste.json"));
        store.append(entryAt("2025-10-17T08:00:00Z", "a"), List.of(item("Rice", 1.0)));
        store.append(entryAt("2025-10-18T08:00:00Z", "b"), List.of());
        store.append(entryAt("2025-10-19T08:00:00Z", "c"), List.of(item("Soup", 2.0)));
        store.append(entryAt("2025-10-19T08:00:00Z", "d"), List.of());

        assertThat(store.list(WasteEntryQuery.latest(10))).extracting(WasteEntry::id).containsExactly(4L, 3L, 2L, 1L);
        assertThat(store.list(WasteEntryQuery.latest(2))).extracting(WasteEntry::id).containsExactly(4L, 3L);

        WasteEntryQuery bounded = new WasteEntryQuery(0, Instant.parse("2025-10-18T08:00:00Z"),
            Instant.parse("2025-10-19T07:59:59Z"));
        List<WasteEntry> window = store.list(bounded);
        assertThat(window).extracting(WasteEntry::id).containsExactly(2L);
        assertThat(window.get(0).items()).isEmpty();
    }

    @Test
    void missingFileIsCreatedOnStartup() {
        Path dataFile = tempDir.resolve("nested").resolve("waste.json");

        WasteEntryStore store = newStore(dataFile);

        assertThat(dataFile).exists();
        assertThat(store.count()).isZero();
        assertThat(store.loadWarning()).isEmpty();
    }

    private WasteEntryStore newStore(Path dataFile) {
        return new WasteEntryStore(dataFile, objectMapper, clock);
    }

    private static NewWasteEntry entryAt(String timestamp, String imageHash) {
        return new NewWasteEntry("/uploads/photo.jpg", OffsetDateTime.parse(timestamp), "200 g", "", imageHash, null,
            "", null);
    }

    private static FoodItemEstimate item(String name, double value) {
        return new FoodItemEstimate(name, "side", "one portion", "untouched", value);
    }
}
