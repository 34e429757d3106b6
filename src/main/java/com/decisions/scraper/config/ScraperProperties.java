package com.decisions.scraper.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Binds the scraping configuration from <code>application.yml</code> under
 * the <code>scraper</code> prefix.
 * <p>
 * Example YAML:
 * <pre>{@code
 * scraper:
 *   portal-url: https://karararama.yargitay.gov.tr
 *   target-results-per-keyword: 3
 *   max-pages-to-search: 5
 *   locators:
 *     result-rows: "#detayAramaSonuclar tbody tr"
 *   cache:
 *     ttl: 1h
 *     capacity: 100
 * }</pre>
 */
@Component
@Validated
@ConfigurationProperties(prefix = "scraper")
@Getter
@Setter
public class ScraperProperties {

    /**
     * Search page loaded at the start of every keyword session.
     */
    @NotBlank
    private String portalUrl = "https://karararama.yargitay.gov.tr";

    /**
     * A keyword session stops once it has collected this many decisions.
     */
    @Min(1)
    private int targetResultsPerKeyword = 3;

    /**
     * Hard pagination ceiling per keyword session.
     */
    @Min(1)
    private int maxPagesToSearch = 5;

    /**
     * Upper bound of keyword sessions running in parallel for one search.
     */
    @Min(1)
    private int maxConcurrency = 10;

    /**
     * Keywords beyond this count are dropped after normalisation.
     */
    @Min(1)
    private int maxKeywords = 10;

    /**
     * {@code max_results} larger than this is clamped.
     */
    @Min(1)
    private int maxResultsCap = 20;

    /**
     * Used when a request carries no usable {@code max_results}.
     */
    @Min(1)
    private int defaultMaxResults = 5;

    /**
     * Attempts for the initial portal load, first call included.
     */
    @Min(1)
    private int pageLoadAttempts = 3;

    /**
     * Fixed delay between initial-load attempts.
     */
    @NotNull
    private Duration pageLoadDelay = Duration.ofSeconds(2);

    /**
     * Bound of every element, document-ready and detail-pane wait.
     */
    @NotNull
    private Duration waitTimeout = Duration.ofSeconds(20);

    /**
     * Deadline of a single keyword session.
     */
    @NotNull
    private Duration sessionTimeout = Duration.ofMinutes(3);

    /**
     * Deadline of a whole dispatch; sessions still running after it are cancelled.
     */
    @NotNull
    private Duration dispatchTimeout = Duration.ofMinutes(5);

    @Valid
    private Locators locators = new Locators();

    @Valid
    private CacheSettings cache = new CacheSettings();

    /**
     * CSS selectors of the portal's search UI.
     */
    @Data
    public static class Locators {

        /** Free-text search box. */
        @NotBlank
        private String searchInput = "#aranan";

        /** Button submitting the search form. */
        @NotBlank
        private String submitButton = "#aramaG";

        /** Table holding the result rows; present once a result page rendered. */
        @NotBlank
        private String resultsContainer = "#detayAramaSonuclar";

        /** Individual result rows. */
        @NotBlank
        private String resultRows = "#detayAramaSonuclar tbody tr";

        /** Cells inside one row. */
        @NotBlank
        private String rowCells = "td";

        /** Side pane showing the decision text of the selected row. */
        @NotBlank
        private String detailPane = "#kararAlani";

        /** Pager "next" control. */
        @NotBlank
        private String nextButton = "a.paginate_button.next";

        /** Class the pager puts on the "next" control on the last page. */
        @NotBlank
        private String disabledClass = "disabled";
    }

    /**
     * Result cache bounds.
     */
    @Data
    public static class CacheSettings {

        /** Entries older than this are never served. */
        @NotNull
        private Duration ttl = Duration.ofHours(1);

        /** Writes of new keys are rejected once this many entries are held. */
        @Min(1)
        private int capacity = 100;

        /** Period of the expired-entry sweep. */
        @NotNull
        private Duration sweepInterval = Duration.ofMinutes(10);
    }
}
