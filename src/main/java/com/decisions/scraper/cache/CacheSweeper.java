package com.decisions.scraper.cache;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically drops expired result-cache entries so they stop counting
 * against the cache capacity.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CacheSweeper {

    private final SearchResultCache cache;

    @Scheduled(fixedDelayString = "${scraper.cache.sweep-interval:PT10M}",
            initialDelayString = "${scraper.cache.sweep-interval:PT10M}")
    public void sweep() {
        int removed = cache.evictExpired();
        if (removed > 0) {
            log.info("Result cache sweep removed {} expired entries, {} remain", removed, cache.size());
        }
    }
}
