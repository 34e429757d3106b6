package com.decisions.scraper.cache;

import com.decisions.scraper.model.SearchResult;

import java.util.Optional;

/**
 * Store of previously computed aggregates, addressed by
 * {@link CacheKeys#canonicalKey canonical keyword-set keys}.
 */
public interface SearchResultCache {

    /**
     * @param key canonical key
     * @return the live entry, or empty when absent or expired
     */
    Optional<CacheEntry> get(String key);

    /**
     * Stores {@code result} under {@code key}. Writes of a new key into a
     * full cache are rejected; existing entries are never displaced.
     *
     * @param key    canonical key
     * @param result aggregate to store
     * @return whether the write was accepted
     */
    CachePutOutcome put(String key, SearchResult result);

    /**
     * Drops every expired entry.
     *
     * @return number of entries removed
     */
    int evictExpired();

    /**
     * @return entries currently held, expired ones included
     */
    int size();
}
