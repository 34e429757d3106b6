package com.decisions.scraper.cache;

import com.decisions.scraper.model.SearchResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link SearchResultCache} with a fixed TTL and capacity.
 * <p>
 * Reads are lock-free. Writes are serialised so the capacity check and the
 * insert happen atomically. There is no LRU: once full, only keys already
 * present can be rewritten until entries expire and are removed, either when
 * read or by {@link #evictExpired()}.
 * </p>
 */
@Slf4j
public class InMemorySearchResultCache implements SearchResultCache {

    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();

    private final Clock clock;

    private final Duration ttl;

    private final int capacity;

    public InMemorySearchResultCache(final Clock clock, final Duration ttl, final int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.clock = clock;
        this.ttl = ttl;
        this.capacity = capacity;
    }

    @Override
    public Optional<CacheEntry> get(final String key) {
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpiredAt(clock.instant())) {
            entries.remove(key, entry);
            log.debug("Cache entry {} expired", key);
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    @Override
    public synchronized CachePutOutcome put(final String key, final SearchResult result) {
        if (!entries.containsKey(key) && entries.size() >= capacity) {
            log.warn("Result cache full ({} entries), not storing {}", capacity, key);
            return CachePutOutcome.REJECTED_CAPACITY;
        }
        entries.put(key, new CacheEntry(key, result, clock.instant(), ttl));
        return CachePutOutcome.ACCEPTED;
    }

    @Override
    public int evictExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.values().removeIf(entry -> entry.isExpiredAt(now));
        return before - entries.size();
    }

    @Override
    public int size() {
        return entries.size();
    }
}
