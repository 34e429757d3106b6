package com.decisions.scraper.cache;

/**
 * Result of a cache write.
 */
public enum CachePutOutcome {

    ACCEPTED,

    /** The cache was full and the key was new; nothing was stored. */
    REJECTED_CAPACITY
}
