package com.decisions.scraper.cache;

import com.decisions.scraper.model.SearchResult;

import java.time.Duration;
import java.time.Instant;

/**
 * A stored aggregate, immutable once written.
 *
 * @param key       canonical keyword-set key
 * @param result    the full, untruncated aggregate
 * @param createdAt write time
 * @param ttl       lifetime
 */
public record CacheEntry(String key, SearchResult result, Instant createdAt, Duration ttl) {

    /**
     * @param now the current instant
     * @return {@code true} once {@code now - createdAt > ttl}
     */
    public boolean isExpiredAt(final Instant now) {
        return Duration.between(createdAt, now).compareTo(ttl) > 0;
    }
}
