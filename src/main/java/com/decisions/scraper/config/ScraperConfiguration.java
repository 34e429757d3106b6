package com.decisions.scraper.config;

import com.decisions.scraper.cache.InMemorySearchResultCache;
import com.decisions.scraper.cache.SearchResultCache;
import com.decisions.scraper.driver.DriverException;
import com.decisions.scraper.driver.PageDriverFactory;
import com.decisions.scraper.session.PageLoadRetryPolicy;
import com.decisions.scraper.session.SearchSessionFactory;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the scraping core: clock, session factory and result cache.
 * <p>
 * The browser integration is contributed separately as a
 * {@link PageDriverFactory} bean. Without one the application still starts;
 * every keyword session then fails with a "no page driver" outcome.
 * </p>
 */
@Slf4j
@Configuration
public class ScraperConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SearchSessionFactory searchSessionFactory(final ScraperProperties props,
                                                     final ObjectProvider<PageDriverFactory> driverFactories,
                                                     final PageLoadRetryPolicy pageLoadRetryPolicy,
                                                     final CircuitBreaker driverAcquisitionBreaker,
                                                     final Clock clock) {
        PageDriverFactory driverFactory = driverFactories.getIfAvailable(() -> {
            log.warn("No PageDriverFactory bean configured; keyword sessions will fail");
            return () -> {
                throw new DriverException("no page driver configured");
            };
        });
        return new SearchSessionFactory(props, driverFactory, pageLoadRetryPolicy, driverAcquisitionBreaker, clock);
    }

    @Bean
    public SearchResultCache searchResultCache(final ScraperProperties props, final Clock clock) {
        ScraperProperties.CacheSettings cache = props.getCache();
        return new InMemorySearchResultCache(clock, cache.getTtl(), cache.getCapacity());
    }
}
