package dev.pekelund.wastelog.storage;

import java.time.Instant;

/**
 * Filter for listing waste history. Both time bounds are inclusive and optional.
 *
 * @param limit     maximum number of entries, {@link #DEFAULT_LIMIT} when not positive
 * @param startTime earliest timestamp to include, or {@code null}
 * @param endTime   latest timestamp to include, or {@code null}
 */
public record WasteEntryQuery(int limit, Instant startTime, Instant endTime) {

    public static final int DEFAULT_LIMIT = 50;

    public WasteEntryQuery {
        if (limit <= 0) {
            limit = DEFAULT_LIMIT;
        }
    }

    public static WasteEntryQuery latest(int limit) {
        return new WasteEntryQuery(limit, null, null);
    }

    boolean matches(Instant timestamp) {
        if (startTime != null && timestamp.isBefore(startTime)) {
            return false;
        }
        return endTime == null || !timestamp.isAfter(endTime);
    }
}
