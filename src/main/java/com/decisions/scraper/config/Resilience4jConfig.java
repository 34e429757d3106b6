package com.decisions.scraper.config;

import com.decisions.scraper.session.PageLoadRetryPolicy;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * <h2>Resilience4j Configuration</h2>
 *
 * <p>
 * Exposes the Resilience4j registries and the two policies the keyword
 * sessions rely on: the fixed-delay retry around the initial portal load and
 * the circuit breaker around browser acquisition. Sessions get them injected
 * and never configure resilience themselves.
 * </p>
 */
@Configuration
public class Resilience4jConfig {

    /**
     * Name of the retry guarding the initial portal load.
     */
    public static final String PAGE_LOAD = "portalPageLoad";

    /**
     * Name of the breaker guarding browser acquisition.
     */
    public static final String DRIVER_ACQUISITION = "driverAcquisition";

    /**
     * Failure rate, in percent, at which driver acquisition stops being attempted.
     */
    private static final float ACQUISITION_FAILURE_RATE = 50.0f;

    /**
     * Calls the breaker looks at before judging the failure rate.
     */
    private static final int ACQUISITION_WINDOW = 10;

    /**
     * How long acquisition stays blocked once the breaker opened.
     */
    private static final Duration ACQUISITION_OPEN_WAIT = Duration.ofSeconds(30);

    /**
     * Creates the global {@link RetryRegistry}; its default configuration is
     * the fixed-delay page-load retry bound from {@link ScraperProperties}.
     *
     * @param props scraper settings
     * @return the registry
     */
    @Bean
    public RetryRegistry retryRegistry(final ScraperProperties props) {
        return RetryRegistry.of(PageLoadRetryPolicy.config(
                props.getPageLoadAttempts(), props.getPageLoadDelay()));
    }

    /**
     * Creates the global {@link CircuitBreakerRegistry}.
     *
     * @return a registry whose default configuration suits browser acquisition
     */
    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        return CircuitBreakerRegistry.of(CircuitBreakerConfig.custom()
                .failureRateThreshold(ACQUISITION_FAILURE_RATE)
                .slidingWindowSize(ACQUISITION_WINDOW)
                .minimumNumberOfCalls(ACQUISITION_WINDOW)
                .waitDurationInOpenState(ACQUISITION_OPEN_WAIT)
                .build());
    }

    /**
     * @param registry the global {@link RetryRegistry}
     * @return the {@link Retry} named {@value #PAGE_LOAD}
     */
    @Bean
    public Retry pageLoadRetry(final RetryRegistry registry) {
        return registry.retry(PAGE_LOAD);
    }

    /**
     * @param pageLoadRetry the retry named {@value #PAGE_LOAD}
     * @return the session-facing policy wrapping it
     */
    @Bean
    public PageLoadRetryPolicy pageLoadRetryPolicy(final Retry pageLoadRetry) {
        return new PageLoadRetryPolicy(pageLoadRetry);
    }

    /**
     * When the browser grid keeps refusing sessions this breaker opens, and
     * further keyword sessions fail fast instead of each waiting on the grid.
     *
     * @param registry the global {@link CircuitBreakerRegistry}
     * @return the {@link CircuitBreaker} named {@value #DRIVER_ACQUISITION}
     */
    @Bean
    public CircuitBreaker driverAcquisitionBreaker(final CircuitBreakerRegistry registry) {
        return registry.circuitBreaker(DRIVER_ACQUISITION);
    }
}
