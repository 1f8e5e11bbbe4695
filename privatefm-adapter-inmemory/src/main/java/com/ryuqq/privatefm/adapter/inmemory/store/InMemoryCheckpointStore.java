package com.ryuqq.privatefm.adapter.inmemory.store;

import com.ryuqq.privatefm.core.spi.CheckpointStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link CheckpointStore} SPI with key expiry.
 *
 * <p>Expired keys are invisible to {@link #get(String)} and {@link #listKeys(String)} as soon
 * as their deadline passes; {@link #evictExpired()} reclaims them. Values are copied on the way
 * in and out, so callers cannot mutate stored bytes.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * CheckpointStore store = new InMemoryCheckpointStore(Clock.systemUTC());
 * store.put("checkpoint:abc", bytes, Duration.ofDays(30));
 * store.listKeys("checkpoint:");   // ["checkpoint:abc"]
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryCheckpointStore implements CheckpointStore {

    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryCheckpointStore() {
        this(Clock.systemUTC());
    }

    public InMemoryCheckpointStore(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    @Override
    public void put(String key, byte[] value) {
        requireKey(key);
        entries.put(key, new Entry(copy(value), null));
    }

    @Override
    public void put(String key, byte[] value, Duration ttl) {
        requireKey(key);
        requirePositive(ttl);
        entries.put(key, new Entry(copy(value), clock.instant().plus(ttl)));
    }

    @Override
    public Optional<byte[]> get(String key) {
        Entry entry = live(key);
        return entry == null ? Optional.empty() : Optional.of(copy(entry.value));
    }

    @Override
    public boolean delete(String key) {
        Entry removed = entries.remove(key);
        return removed != null && !removed.isExpired(clock.instant());
    }

    @Override
    public List<String> listKeys(String prefix) {
        Instant now = clock.instant();
        return entries.entrySet().stream()
            .filter(e -> e.getKey().startsWith(prefix) && !e.getValue().isExpired(now))
            .map(Map.Entry::getKey)
            .sorted()
            .collect(Collectors.toList());
    }

    @Override
    public Optional<Instant> expiresAt(String key) {
        Entry entry = live(key);
        return entry == null ? Optional.empty() : Optional.ofNullable(entry.expiresAt);
    }

    @Override
    public boolean expire(String key, Duration ttl) {
        requirePositive(ttl);
        Instant now = clock.instant();
        Entry updated = entries.computeIfPresent(key, (k, current) ->
            current.isExpired(now) ? current : new Entry(current.value, now.plus(ttl)));
        return updated != null && !updated.isExpired(now);
    }

    @Override
    public int evictExpired() {
        Instant now = clock.instant();
        int evicted = 0;
        Iterator<Map.Entry<String, Entry>> it = entries.entrySet().iterator();
        while (it.hasNext()) {
            if (it.next().getValue().isExpired(now)) {
                it.remove();
                evicted++;
            }
        }
        return evicted;
    }

    /**
     * Number of stored keys, including expired keys not yet evicted.
     */
    public int size() {
        return entries.size();
    }

    private Entry live(String key) {
        Entry entry = entries.get(key);
        if (entry == null || entry.isExpired(clock.instant())) {
            return null;
        }
        return entry;
    }

    private static void requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
    }

    private static void requirePositive(Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive (current: " + ttl + ")");
        }
    }

    private static byte[] copy(byte[] value) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        return Arrays.copyOf(value, value.length);
    }

    private static final class Entry {
        private final byte[] value;
        private final Instant expiresAt;

        private Entry(byte[] value, Instant expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }

        private boolean isExpired(Instant now) {
            return expiresAt != null && !now.isBefore(expiresAt);
        }
    }
}
