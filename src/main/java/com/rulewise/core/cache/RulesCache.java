package com.rulewise.core.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * In-memory store of fetched rule documents keyed by rule path.
 * <p>
 * Entries live for a fixed TTL measured against the injected {@link Clock}. The
 * live index holds at most {@code capacity} entries and evicts the least recently
 * used one when full. Entries leaving the live index through expiry or eviction
 * move to a stale area of the same capacity, which is only consulted through
 * {@link #getStale(String)} when a refetch fails.
 * <p>
 * Thread-safe. Both indexes sit behind a single lock; loads started through
 * {@link #getOrFill} run outside it, at most one per key.
 */
public class RulesCache {

    private static final Logger log = LoggerFactory.getLogger(RulesCache.class);

    public static final Duration DEFAULT_TTL = Duration.ofHours(1);
    public static final int DEFAULT_CAPACITY = 256;

    private final Duration ttl;
    private final int capacity;
    private final Clock clock;

    private final Object lock = new Object();
    private final LinkedHashMap<String, CacheEntry> live;
    private final LinkedHashMap<String, CacheEntry> stale;
    private final Map<String, CompletableFuture<CacheEntry>> inFlight = new ConcurrentHashMap<>();

    private long hits;
    private long misses;

    public RulesCache() {
        this(DEFAULT_TTL, DEFAULT_CAPACITY, Clock.systemUTC());
    }

    public RulesCache(Duration ttl, int capacity, Clock clock) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive: " + ttl);
        }
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.ttl = ttl;
        this.capacity = capacity;
        this.clock = clock;
        this.stale = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, CacheEntry> eldest) {
                return size() > RulesCache.this.capacity;
            }
        };
        this.live = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, CacheEntry> eldest) {
                if (size() > RulesCache.this.capacity) {
                    log.debug("Evicting least recently used entry {}", eldest.getKey());
                    stale.put(eldest.getKey(), eldest.getValue());
                    return true;
                }
                return false;
            }
        };
    }

    /**
     * Returns the live entry for {@code key}, counting a hit or a miss. An expired
     * entry is moved to the stale area; a corrupt one is dropped.
     */
    public Optional<CacheEntry> get(String key) {
        synchronized (lock) {
            CacheEntry entry = live.get(key);
            if (entry == null) {
                misses++;
                return Optional.empty();
            }
            if (isExpired(entry)) {
                live.remove(key);
                stale.put(key, entry);
                misses++;
                log.debug("Cache entry {} expired", key);
                return Optional.empty();
            }
            if (!entry.isValidUtf8()) {
                live.remove(key);
                misses++;
                log.warn("Discarding corrupt cache entry {} ({} bytes are not valid UTF-8)", key, entry.size());
                return Optional.empty();
            }
            hits++;
            return Optional.of(entry);
        }
    }

    public CacheEntry set(String key, byte[] content) {
        var entry = new CacheEntry(content, clock.instant());
        synchronized (lock) {
            live.put(key, entry);
            stale.remove(key);
        }
        return entry;
    }

    /** True if a non-expired entry exists. Does not count as a hit or miss. */
    public boolean has(String key) {
        synchronized (lock) {
            CacheEntry entry = peek(key);
            return entry != null && !isExpired(entry);
        }
    }

    public boolean delete(String key) {
        synchronized (lock) {
            stale.remove(key);
            return live.remove(key) != null;
        }
    }

    /** Drops every entry, stale ones included, and resets the counters. */
    public void clear() {
        synchronized (lock) {
            live.clear();
            stale.clear();
            hits = 0;
            misses = 0;
        }
    }

    /** Keys of non-expired live entries, least recently used first. */
    public List<String> keys() {
        synchronized (lock) {
            var keys = new ArrayList<String>(live.size());
            for (var e : live.entrySet()) {
                if (!isExpired(e.getValue())) {
                    keys.add(e.getKey());
                }
            }
            return keys;
        }
    }

    public CacheStats getStats() {
        synchronized (lock) {
            int size = 0;
            for (CacheEntry entry : live.values()) {
                if (!isExpired(entry)) {
                    size++;
                }
            }
            return CacheStats.of(hits, misses, size);
        }
    }

    /**
     * Last known content for {@code key} regardless of age, for use when a refetch
     * failed. Corrupt content is never returned.
     */
    public Optional<CacheEntry> getStale(String key) {
        synchronized (lock) {
            CacheEntry entry = peek(key);
            if (entry == null) {
                entry = stale.get(key);
            }
            if (entry == null || !entry.isValidUtf8()) {
                return Optional.empty();
            }
            return Optional.of(entry);
        }
    }

    /**
     * Returns the cached entry, or starts {@code loader} to fill it.
     *
     * @see #fill(String, Function)
     */
    public CompletableFuture<CacheEntry> getOrFill(String key, Function<String, CompletableFuture<byte[]>> loader) {
        Optional<CacheEntry> cached = get(key);
        if (cached.isPresent()) {
            return CompletableFuture.completedFuture(cached.get());
        }
        return fill(key, loader);
    }

    /**
     * Loads {@code key} through {@code loader} unless a load for it is already running,
     * in which case the caller joins that load. The loaded value is stored before the
     * returned future completes, so a caller never observes a completed fill that is
     * missing from the cache. Failed loads store nothing.
     *
     * @param loader starts the load for a key; must not block
     */
    public CompletableFuture<CacheEntry> fill(String key, Function<String, CompletableFuture<byte[]>> loader) {
        var fill = new CompletableFuture<CacheEntry>();
        CompletableFuture<CacheEntry> existing = inFlight.putIfAbsent(key, fill);
        if (existing != null) {
            log.debug("Joining in-flight load for {}", key);
            return existing;
        }

        // a fill may have finished between the miss and claiming the slot
        CacheEntry raced;
        synchronized (lock) {
            raced = peek(key);
            if (raced != null && isExpired(raced)) {
                raced = null;
            }
        }
        if (raced != null) {
            inFlight.remove(key, fill);
            fill.complete(raced);
            return fill;
        }

        CompletableFuture<byte[]> load;
        try {
            load = loader.apply(key);
        } catch (RuntimeException e) {
            inFlight.remove(key, fill);
            fill.completeExceptionally(e);
            return fill;
        }

        load.whenComplete((bytes, error) -> {
            if (error != null) {
                inFlight.remove(key, fill);
                fill.completeExceptionally(unwrap(error));
                return;
            }
            if (bytes == null) {
                inFlight.remove(key, fill);
                fill.completeExceptionally(new IllegalStateException("Loader returned no content for " + key));
                return;
            }
            CacheEntry entry = set(key, bytes);
            inFlight.remove(key, fill);
            fill.complete(entry);
        });
        return fill;
    }

    /** Number of loads currently running. */
    public int inFlightCount() {
        return inFlight.size();
    }

    public Duration ttl() {
        return ttl;
    }

    public int capacity() {
        return capacity;
    }

    // caller holds lock
    private CacheEntry peek(String key) {
        return live.get(key);
    }

    private boolean isExpired(CacheEntry entry) {
        Instant expiresAt = entry.fetchedAt().plus(ttl);
        return !clock.instant().isBefore(expiresAt);
    }

    static boolean isValidUtf8(byte[] bytes) {
        try {
            StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes));
            return true;
        } catch (CharacterCodingException e) {
            return false;
        }
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }
}
