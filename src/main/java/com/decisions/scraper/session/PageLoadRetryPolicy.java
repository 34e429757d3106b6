package com.decisions.scraper.session;

import com.decisions.scraper.driver.DriverException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Bounded, fixed-delay retry around one fallible page interaction.
 * <p>
 * Backed by a Resilience4j {@link Retry}: {@link PageLoadException} and
 * {@link DriverException} trigger another attempt after {@code delay}; once
 * {@code maxAttempts} calls failed the last exception is re-thrown unchanged.
 * Any other exception propagates immediately.
 * </p>
 */
@Slf4j
public class PageLoadRetryPolicy {

    private final Retry retry;

    /**
     * @param retry a Resilience4j retry, typically pulled from the application registry
     */
    public PageLoadRetryPolicy(final Retry retry) {
        this.retry = retry;
        retry.getEventPublisher().onRetry(event ->
                log.warn("Page load attempt {} failed ({}), retrying in {} ms",
                        event.getNumberOfRetryAttempts(),
                        event.getLastThrowable() == null ? "unknown" : event.getLastThrowable().toString(),
                        event.getWaitInterval().toMillis()));
    }

    /**
     * Builds a stand-alone policy.
     *
     * @param name        retry name, shows up in logs and metrics
     * @param maxAttempts attempts including the first call, at least 1
     * @param delay       fixed wait between attempts
     * @return the policy
     */
    public static PageLoadRetryPolicy of(final String name, final int maxAttempts, final Duration delay) {
        return new PageLoadRetryPolicy(Retry.of(name, config(maxAttempts, delay)));
    }

    /**
     * Retry configuration shared by {@link #of} and the Spring registry.
     *
     * @param maxAttempts attempts including the first call
     * @param delay       fixed wait between attempts
     * @return the configuration
     */
    public static RetryConfig config(final int maxAttempts, final Duration delay) {
        return RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .waitDuration(delay)
                .retryExceptions(PageLoadException.class, DriverException.class)
                .build();
    }

    public void run(final Runnable call) {
        retry.executeRunnable(call);
    }
}
