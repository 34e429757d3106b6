package com.decisions.scraper.dispatch;

import com.decisions.scraper.model.ResultItem;
import com.decisions.scraper.model.SearchOutcome;
import com.decisions.scraper.model.SearchResult;
import com.decisions.scraper.session.SessionResult;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ResultAggregatorTest {

    private final ResultAggregator aggregator = new ResultAggregator();

    private static ResultItem item(final String caseNumber, final String decisionNumber, final String keyword) {
        return new ResultItem("3. Hukuk Dairesi", caseNumber, decisionNumber, "12.03.2024",
                "text " + caseNumber, keyword);
    }

    @Test
    void shouldKeepFirstSeenDecisionAcrossKeywords() {
        DispatchReport report = new DispatchReport(List.of(
                SessionResult.done("kira", List.of(item("1", "1", "kira"), item("2", "2", "kira")), 1),
                SessionResult.done("tazminat", List.of(item("2", "2", "tazminat"), item("3", "3", "tazminat")), 1)),
                Duration.ofMillis(2500));

        SearchResult result = aggregator.aggregate(List.of("tazminat", "kira"), report);

        assertThat(result.results()).extracting(ResultItem::caseId).containsExactly("1-1", "2-2", "3-3");
        assertThat(result.results().get(1).matchedKeyword()).isEqualTo("kira");
        assertThat(result.uniqueResults()).isEqualTo(3);
        assertThat(result.totalKeywords()).isEqualTo(2);
        assertThat(result.searchDetails()).containsOnlyKeys("tazminat", "kira");
        assertThat(result.searchDetails().keySet()).containsExactly("tazminat", "kira");
        assertThat(result.searchDetails().get("tazminat").count()).isEqualTo(2);
        assertThat(result.message()).isEqualTo("Processed 2 keywords in 2.50s");
        assertThat(result.processingTime()).isEqualTo(2.5d);
        assertThat(result.cached()).isFalse();
        assertThat(result.success()).isTrue();
    }

    @Test
    void shouldSucceedWhenAnyKeywordSucceeded() {
        DispatchReport report = new DispatchReport(List.of(
                SessionResult.failed("kira", List.of(), 0, "timeout"),
                SessionResult.noResults("icra")), Duration.ZERO);

        SearchResult result = aggregator.aggregate(List.of("kira", "icra"), report);

        assertThat(result.success()).isTrue();
        assertThat(result.allKeywordsSucceeded()).isFalse();
        assertThat(result.results()).isEmpty();
    }

    @Test
    void shouldFailWhenEveryKeywordFailed() {
        DispatchReport report = new DispatchReport(List.of(
                SessionResult.failed("kira", List.of(item("1", "1", "kira")), 1, "session lost")),
                Duration.ZERO);

        SearchResult result = aggregator.aggregate(List.of("kira"), report);

        assertThat(result.success()).isFalse();
        assertThat(result.results()).hasSize(1);
        assertThat(result.searchDetails().get("kira"))
                .isEqualTo(new SearchOutcome(false, 1, "session lost"));
    }

    @Test
    void shouldReportKeywordMissingFromDispatch() {
        DispatchReport report = new DispatchReport(List.of(SessionResult.noResults("kira")), Duration.ZERO);

        SearchResult result = aggregator.aggregate(List.of("kira", "icra"), report);

        assertThat(result.searchDetails().get("icra").success()).isFalse();
        assertThat(result.searchDetails().get("icra").count()).isZero();
    }
}
