package com.decisions.scraper.service;

import com.decisions.scraper.cache.CacheEntry;
import com.decisions.scraper.cache.CacheKeys;
import com.decisions.scraper.cache.CachePutOutcome;
import com.decisions.scraper.cache.SearchResultCache;
import com.decisions.scraper.config.ScraperProperties;
import com.decisions.scraper.dispatch.DispatchReport;
import com.decisions.scraper.dispatch.KeywordDispatcher;
import com.decisions.scraper.dispatch.ResultAggregator;
import com.decisions.scraper.model.SearchRequest;
import com.decisions.scraper.model.SearchResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Entry point of the scraping core: answers one {@code Search(keywords, max_results)} call.
 * <p>
 * Flow: normalise the request, look the keyword set up in the
 * {@link SearchResultCache}, otherwise dispatch one session per keyword,
 * aggregate, and store the aggregate when every keyword succeeded.
 * Concurrent calls for the same keyword set share a single dispatch.
 * </p>
 * <p>
 * The cache holds the full aggregate; {@code max_results} is applied to each
 * response, so callers asking for different limits share one entry.
 * </p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DecisionSearchService {

    private final ScraperProperties props;

    private final SearchResultCache cache;

    private final KeywordDispatcher dispatcher;

    private final ResultAggregator aggregator;

    /**
     * Dispatches currently running, keyed by canonical keyword-set key.
     */
    private final Map<String, CompletableFuture<SearchResult>> inFlight = new ConcurrentHashMap<>();

    /**
     * Runs a search.
     *
     * @param request keywords and result limit
     * @return the aggregate, truncated to the effective {@code max_results}
     * @throws IllegalArgumentException when no usable keyword remains after normalisation
     */
    public SearchResult search(final SearchRequest request) {
        List<String> keywords = normalizeKeywords(request.keywords());
        if (keywords.isEmpty()) {
            throw new IllegalArgumentException("At least one non-blank keyword is required");
        }
        int maxResults = effectiveMaxResults(request.maxResults());
        String key = CacheKeys.canonicalKey(keywords);

        Optional<CacheEntry> hit = cache.get(key);
        if (hit.isPresent()) {
            log.info("Serving {} keywords from cache", keywords.size());
            return hit.get().result().fromCache().limitedTo(maxResults);
        }

        CompletableFuture<SearchResult> mine = new CompletableFuture<>();
        CompletableFuture<SearchResult> running = inFlight.putIfAbsent(key, mine);
        if (running != null) {
            log.info("Joining an identical search already in progress for {}", keywords);
            return await(running).limitedTo(maxResults);
        }

        try {
            // an identical search may have finished between the lookup and claiming the slot
            SearchResult full = cache.get(key)
                    .map(entry -> entry.result().fromCache())
                    .orElseGet(() -> scrape(keywords, key));
            mine.complete(full);
            return full.limitedTo(maxResults);
        } catch (RuntimeException ex) {
            mine.completeExceptionally(ex);
            throw ex;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    private SearchResult scrape(final List<String> keywords, final String key) {
        log.info("Searching portal for {} keywords: {}", keywords.size(), keywords);
        DispatchReport report = dispatcher.dispatch(keywords);
        SearchResult full = aggregator.aggregate(keywords, report);

        if (full.allKeywordsSucceeded()) {
            if (cache.put(key, full) == CachePutOutcome.REJECTED_CAPACITY) {
                log.debug("Aggregate for {} not cached, cache full", keywords);
            }
        } else {
            log.info("Not caching aggregate for {}: some keyword sessions failed", keywords);
        }
        return full;
    }

    /**
     * Trims, drops blanks, removes duplicates keeping first occurrence, and
     * caps the count at {@code scraper.max-keywords}.
     *
     * @param raw keywords as received
     * @return normalised keywords in request order
     */
    List<String> normalizeKeywords(final List<String> raw) {
        if (raw == null) {
            return List.of();
        }
        Set<String> unique = new LinkedHashSet<>();
        for (String keyword : raw) {
            String cleaned = StringUtils.normalizeSpace(keyword);
            if (StringUtils.isNotBlank(cleaned)) {
                unique.add(cleaned);
            }
        }
        List<String> keywords = new ArrayList<>(unique);
        if (keywords.size() > props.getMaxKeywords()) {
            log.info("Dropping {} keywords beyond the cap of {}",
                    keywords.size() - props.getMaxKeywords(), props.getMaxKeywords());
            keywords = keywords.subList(0, props.getMaxKeywords());
        }
        return List.copyOf(keywords);
    }

    int effectiveMaxResults(final Integer requested) {
        if (requested == null || requested < 1) {
            return props.getDefaultMaxResults();
        }
        return Math.min(requested, props.getMaxResultsCap());
    }

    private static SearchResult await(final CompletableFuture<SearchResult> running) {
        try {
            return running.join();
        } catch (CompletionException ex) {
            if (ex.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw ex;
        }
    }
}
