package com.decisions.scraper.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Inbound search payload.
 * <p>
 * Keywords are normalised by the service (trimmed, blanks dropped, duplicates
 * removed, capped); {@code maxResults} falls back to the configured default
 * when absent or non-positive and is clamped to the configured cap.
 * </p>
 *
 * @param keywords   free-text keywords, one portal search each
 * @param maxResults upper bound on the number of decisions returned
 */
public record SearchRequest(
        @NotEmpty @Size(max = 50) List<String> keywords,
        @JsonProperty("max_results") Integer maxResults
) {
}
