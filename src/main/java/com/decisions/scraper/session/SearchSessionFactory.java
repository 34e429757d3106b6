package com.decisions.scraper.session;

import com.decisions.scraper.config.ScraperProperties;
import com.decisions.scraper.driver.PageDriverFactory;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.RequiredArgsConstructor;

import java.time.Clock;
import java.time.Instant;

/**
 * Creates one {@link KeywordSearchSession} per keyword, sharing the configured
 * driver source, retry policy and acquisition breaker.
 */
@RequiredArgsConstructor
public class SearchSessionFactory {

    private final ScraperProperties props;

    private final PageDriverFactory driverFactory;

    private final PageLoadRetryPolicy retryPolicy;

    private final CircuitBreaker driverBreaker;

    private final Clock clock;

    /**
     * @param keyword  the keyword to search
     * @param deadline instant after which the session aborts
     * @return a fresh session, not yet started
     */
    public KeywordSearchSession create(final String keyword, final Instant deadline) {
        return new KeywordSearchSession(keyword, props, driverFactory, retryPolicy, driverBreaker, deadline, clock);
    }
}
