package com.decisions.scraper.service;

import com.decisions.scraper.cache.InMemorySearchResultCache;
import com.decisions.scraper.cache.SearchResultCache;
import com.decisions.scraper.config.ScraperProperties;
import com.decisions.scraper.dispatch.DispatchReport;
import com.decisions.scraper.dispatch.KeywordDispatcher;
import com.decisions.scraper.dispatch.ResultAggregator;
import com.decisions.scraper.model.ResultItem;
import com.decisions.scraper.model.SearchOutcome;
import com.decisions.scraper.model.SearchRequest;
import com.decisions.scraper.model.SearchResult;
import com.decisions.scraper.session.PageLoadRetryPolicy;
import com.decisions.scraper.session.SearchSessionFactory;
import com.decisions.scraper.session.SessionResult;
import com.decisions.scraper.support.FixtureDriverFactory;
import com.decisions.scraper.support.FixturePortal;
import com.decisions.scraper.support.TestScraperProperties;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

import static com.decisions.scraper.support.FixturePortal.decision;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DecisionSearchServiceTest {

    private final Clock clock = Clock.systemUTC();

    private ScraperProperties props;

    private FixturePortal portal;

    private FixtureDriverFactory drivers;

    private SearchResultCache cache;

    private DecisionSearchService service;

    @BeforeEach
    void setUp() {
        props = TestScraperProperties.create();
        portal = new FixturePortal();
        drivers = new FixtureDriverFactory(portal);
        cache = new InMemorySearchResultCache(clock, Duration.ofHours(1), 100);
        SearchSessionFactory sessions = new SearchSessionFactory(props, drivers,
                PageLoadRetryPolicy.of("service-test", 3, Duration.ofMillis(1)),
                CircuitBreaker.ofDefaults("service-test"), clock);
        service = new DecisionSearchService(props, cache,
                new KeywordDispatcher(props, sessions, clock), new ResultAggregator());
    }

    private static SearchRequest request(final Integer maxResults, final String... keywords) {
        return new SearchRequest(Arrays.asList(keywords), maxResults);
    }

    @Nested
    @DisplayName("searching the portal")
    class Searching {

        @Test
        @DisplayName("two keywords with overlapping decisions")
        void shouldMergeAndLimitResults() {
            portal.keyword("tazminat",
                            List.of(decision("2023/1", "2024/1"), decision("2023/2", "2024/2")),
                            List.of(decision("2023/3", "2024/3"), decision("2023/4", "2024/4")))
                    .keyword("sözleşme",
                            List.of(decision("2023/3", "2024/3"), decision("2023/5", "2024/5"),
                                    decision("2023/6", "2024/6")));

            SearchResult result = service.search(request(4, "tazminat", "sözleşme"));

            assertThat(result.success()).isTrue();
            assertThat(result.cached()).isFalse();
            assertThat(result.totalKeywords()).isEqualTo(2);
            assertThat(result.results()).hasSize(4);
            assertThat(result.uniqueResults()).isEqualTo(4);
            assertThat(result.results()).extracting(ResultItem::caseId).doesNotHaveDuplicates();
            assertThat(result.searchDetails().get("tazminat")).isEqualTo(new SearchOutcome(true, 3, "3 results found"));
            assertThat(result.searchDetails().get("sözleşme")).isEqualTo(new SearchOutcome(true, 3, "3 results found"));
            assertThat(result.message()).startsWith("Processed 2 keywords in ");
            assertThat(result.processingTime()).isPositive();

            SearchResult full = service.search(request(20, "sözleşme", "tazminat"));
            assertThat(full.cached()).isTrue();
            assertThat(full.results()).extracting(ResultItem::caseNumber)
                    .containsExactlyInAnyOrder("2023/1", "2023/2", "2023/3", "2023/5", "2023/6");
        }

        @Test
        @DisplayName("keyword without hits still counts as success")
        void shouldReportEmptyKeyword() {
            SearchResult result = service.search(request(null, "xyzzy"));

            assertThat(result.success()).isTrue();
            assertThat(result.results()).isEmpty();
            assertThat(result.uniqueResults()).isZero();
            assertThat(result.searchDetails().get("xyzzy"))
                    .isEqualTo(new SearchOutcome(true, 0, SessionResult.NO_RESULTS_MESSAGE));
        }

        @Test
        @DisplayName("session lost on page two keeps page one")
        void shouldKeepPartialResultsOfFailedKeyword() {
            props.setTargetResultsPerKeyword(5);
            portal.keyword("icra",
                            List.of(decision("1", "1"), decision("2", "2")),
                            List.of(decision("3", "3")))
                    .failOnPage("icra", 2)
                    .keyword("kira", List.of(decision("4", "4")));

            SearchResult result = service.search(request(20, "icra", "kira"));

            assertThat(result.success()).isTrue();
            assertThat(result.searchDetails().get("icra").success()).isFalse();
            assertThat(result.searchDetails().get("icra").count()).isEqualTo(2);
            assertThat(result.results()).extracting(ResultItem::caseNumber).containsExactlyInAnyOrder("1", "2", "4");
            assertThat(cache.size()).isZero();
        }

        @Test
        void shouldReportFailureWhenEveryKeywordFailed() {
            portal.failNavigations(100);

            SearchResult result = service.search(request(null, "kira"));

            assertThat(result.success()).isFalse();
            assertThat(result.searchDetails().get("kira").success()).isFalse();
        }
    }

    @Nested
    @DisplayName("caching")
    class Caching {

        @Test
        void shouldServeRepeatedSearchFromCache() {
            portal.keyword("kira", List.of(decision("1", "1"), decision("2", "2")));
            SearchResult first = service.search(request(5, "kira", "icra"));
            int opened = drivers.opened();

            SearchResult second = service.search(request(5, "icra", " kira "));

            assertThat(second.cached()).isTrue();
            assertThat(second.processingTime()).isZero();
            assertThat(second.results()).isEqualTo(first.results());
            assertThat(second.searchDetails()).isEqualTo(first.searchDetails());
            assertThat(drivers.opened()).isEqualTo(opened);
        }

        @Test
        void shouldNotServeSplitKeywordSetForKeywordContainingSeparator() {
            service.search(request(null, "a", "b"));

            SearchResult joined = service.search(request(null, "a|b"));

            assertThat(joined.cached()).isFalse();
            assertThat(joined.searchDetails()).containsOnlyKeys("a|b");
        }

        @Test
        void shouldApplyEachCallersLimitToCachedResult() {
            portal.keyword("kira", List.of(decision("1", "1"), decision("2", "2"), decision("3", "3")));
            service.search(request(20, "kira"));

            SearchResult limited = service.search(request(2, "kira"));

            assertThat(limited.cached()).isTrue();
            assertThat(limited.results()).extracting(ResultItem::caseNumber).containsExactly("1", "2");
            assertThat(limited.uniqueResults()).isEqualTo(2);
        }

        @Test
        void shouldSearchAgainWhenPreviousAttemptFailed() {
            portal.keyword("kira", List.of(decision("1", "1"))).failNavigations(3);
            SearchResult failed = service.search(request(null, "kira"));

            SearchResult retried = service.search(request(null, "kira"));

            assertThat(failed.success()).isFalse();
            assertThat(retried.cached()).isFalse();
            assertThat(retried.results()).hasSize(1);
            assertThat(drivers.opened()).isEqualTo(2);
        }

        @Test
        @Timeout(10)
        void shouldShareOneDispatchBetweenConcurrentIdenticalSearches() throws Exception {
            KeywordDispatcher dispatcher = mock(KeywordDispatcher.class);
            CountDownLatch entered = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            ResultItem item = new ResultItem("3. Hukuk Dairesi", "1", "1", "12.03.2024", "text", "kira");
            when(dispatcher.dispatch(anyList())).thenAnswer(invocation -> {
                entered.countDown();
                release.await(5, TimeUnit.SECONDS);
                return new DispatchReport(List.of(SessionResult.done("kira", List.of(item), 1)), Duration.ofMillis(5));
            });
            DecisionSearchService coalescing = new DecisionSearchService(props,
                    new InMemorySearchResultCache(clock, Duration.ofHours(1), 100), dispatcher, new ResultAggregator());

            CompletableFuture<SearchResult> first = CompletableFuture.supplyAsync(
                    () -> coalescing.search(request(null, "kira")));
            assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
            CompletableFuture<SearchResult> second = CompletableFuture.supplyAsync(
                    () -> coalescing.search(request(null, "kira")));
            Thread.sleep(100);
            release.countDown();

            assertThat(first.get(5, TimeUnit.SECONDS).results()).containsExactly(item);
            assertThat(second.get(5, TimeUnit.SECONDS).results()).containsExactly(item);
            verify(dispatcher, times(1)).dispatch(anyList());
        }
    }

    @Nested
    @DisplayName("request normalisation")
    class Normalisation {

        @Test
        void shouldRejectRequestWithoutUsableKeyword() {
            assertThatThrownBy(() -> service.search(request(5, " ", "", "\t")))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("keyword");
            assertThat(drivers.opened()).isZero();
        }

        @Test
        void shouldTrimDropBlanksAndDeduplicate() {
            assertThat(service.normalizeKeywords(Arrays.asList(" kira ", "", null, "icra", "kira", "  ")))
                    .containsExactly("kira", "icra");
        }

        @Test
        void shouldCapKeywordCount() {
            List<String> raw = IntStream.rangeClosed(1, 15).mapToObj(i -> "kw" + i).toList();

            assertThat(service.normalizeKeywords(raw)).hasSize(10).startsWith("kw1").endsWith("kw10");
        }

        @Test
        void shouldDefaultAndClampMaxResults() {
            assertThat(service.effectiveMaxResults(null)).isEqualTo(5);
            assertThat(service.effectiveMaxResults(0)).isEqualTo(5);
            assertThat(service.effectiveMaxResults(7)).isEqualTo(7);
            assertThat(service.effectiveMaxResults(500)).isEqualTo(20);
        }
    }
}
