package com.sqlrecorder.store;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

/**
 * Process-local {@link TraceStore} backed by concurrent maps.
 *
 * Suitable when every worker shares one JVM; values honour their TTL lazily on read.
 */
public class InMemoryTraceStore implements TraceStore {

    private final ConcurrentHashMap<String, Entry> values = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, LinkedList<String>> lists = new ConcurrentHashMap<>();
    private final LongSupplier clock;

    /** Stored value with its expiry in epoch millis; {@code 0} never expires. */
    record Entry(String value, long expiresAt) {
        boolean isExpired(long now) {
            return expiresAt > 0 && now >= expiresAt;
        }
    }

    public InMemoryTraceStore() {
        this(System::currentTimeMillis);
    }

    /** @param clock source of the current time in epoch millis, used for TTL checks */
    public InMemoryTraceStore(LongSupplier clock) {
        this.clock = clock;
    }

    @Override
    public void set(String key, String value) {
        values.put(key, new Entry(value, 0L));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            set(key, value);
            return;
        }
        values.put(key, new Entry(value, clock.getAsLong() + ttl.toMillis()));
    }

    @Override
    public String get(String key) {
        Entry entry = values.get(key);
        if (entry == null) return null;
        if (entry.isExpired(clock.getAsLong())) {
            values.remove(key, entry);
            return null;
        }
        return entry.value();
    }

    @Override
    public void delete(String key) {
        values.remove(key);
        lists.remove(key);
    }

    // List operations run inside the map's per-key compute, so a push can never land on a list
    // that a concurrent delete has already unlinked.

    @Override
    public void push(String key, String value) {
        lists.compute(key, (k, list) -> {
            LinkedList<String> target = list == null ? new LinkedList<>() : list;
            target.addFirst(value);
            return target;
        });
    }

    @Override
    public List<String> range(String key, int start, int end) {
        List<String> result = new ArrayList<>();
        lists.computeIfPresent(key, (k, list) -> {
            int[] bounds = resolve(list.size(), start, end);
            if (bounds != null) result.addAll(list.subList(bounds[0], bounds[1] + 1));
            return list;
        });
        return result;
    }

    @Override
    public void trim(String key, int start, int end) {
        lists.computeIfPresent(key, (k, list) -> {
            int[] bounds = resolve(list.size(), start, end);
            if (bounds == null) return null;
            return new LinkedList<>(list.subList(bounds[0], bounds[1] + 1));
        });
    }

    /** Resolves inclusive, possibly negative bounds against {@code size}; null when the range is empty. */
    static int[] resolve(int size, int start, int end) {
        int from = start < 0 ? size + start : start;
        int to = end < 0 ? size + end : end;
        from = Math.max(from, 0);
        to = Math.min(to, size - 1);
        if (size == 0 || from > to) return null;
        return new int[]{ from, to };
    }
}
