package com.decisions.scraper.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Aggregate answer to one search call.
 *
 * @param results        de-duplicated decisions, first-seen order
 * @param success        {@code false} only when every keyword session failed
 * @param message        run summary
 * @param searchDetails  outcome per keyword, in keyword order
 * @param processingTime wall-clock seconds spent on the call
 * @param totalKeywords  number of keywords searched after normalisation
 * @param uniqueResults  size of {@code results}
 * @param cached         whether the answer was served from the result cache
 */
public record SearchResult(
        List<ResultItem> results,
        boolean success,
        String message,
        @JsonProperty("search_details") Map<String, SearchOutcome> searchDetails,
        @JsonProperty("processing_time") double processingTime,
        @JsonProperty("total_keywords") int totalKeywords,
        @JsonProperty("unique_results") int uniqueResults,
        boolean cached
) {

    /**
     * @return {@code true} when every keyword outcome reports success
     */
    public boolean allKeywordsSucceeded() {
        return searchDetails.values().stream().allMatch(SearchOutcome::success);
    }

    /**
     * Copy re-stamped for a cache hit: zero processing time, {@code cached=true}.
     *
     * @return the cached view of this result
     */
    public SearchResult fromCache() {
        return new SearchResult(results, success, message, searchDetails,
                0.0d, totalKeywords, uniqueResults, true);
    }

    /**
     * Truncates {@link #results} to at most {@code maxResults} entries and
     * adjusts {@link #uniqueResults} accordingly.
     *
     * @param maxResults the bound, at least 1
     * @return this instance when already within the bound, otherwise a copy
     */
    public SearchResult limitedTo(final int maxResults) {
        if (results.size() <= maxResults) {
            return this;
        }
        List<ResultItem> head = List.copyOf(results.subList(0, maxResults));
        return new SearchResult(head, success, message, searchDetails,
                processingTime, totalKeywords, head.size(), cached);
    }
}
