package com.decisions.scraper.dispatch;

import com.decisions.scraper.model.ResultItem;
import com.decisions.scraper.model.SearchOutcome;
import com.decisions.scraper.model.SearchResult;
import com.decisions.scraper.session.SessionResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Folds a {@link DispatchReport} into one {@link SearchResult}.
 * <p>
 * Decisions are de-duplicated by case id, first seen wins. "First" follows
 * the report's completion order, so which keyword a shared decision is
 * attributed to depends on which session finished first. Each keyword's
 * {@code count} still includes decisions dropped here as duplicates.
 * </p>
 */
@Slf4j
@Component
public class ResultAggregator {

    /**
     * @param keywords the dispatched keywords, in request order
     * @param report   the dispatch outcome
     * @return the full, untruncated aggregate
     */
    public SearchResult aggregate(final List<String> keywords, final DispatchReport report) {
        Map<String, ResultItem> unique = new LinkedHashMap<>();
        for (ResultItem item : report.rawResults()) {
            unique.putIfAbsent(item.caseId(), item);
        }

        Map<String, SearchOutcome> byKeyword = new LinkedHashMap<>();
        report.sessions().forEach(s -> byKeyword.put(s.keyword(), s.toOutcome()));

        Map<String, SearchOutcome> details = new LinkedHashMap<>();
        for (String keyword : keywords) {
            details.put(keyword, byKeyword.getOrDefault(keyword,
                    new SearchOutcome(false, 0, "keyword was not searched")));
        }

        boolean anySucceeded = details.values().stream().anyMatch(SearchOutcome::success);
        double seconds = report.elapsed().toNanos() / 1_000_000_000.0d;
        List<ResultItem> results = List.copyOf(unique.values());

        log.info("Aggregated {} raw results into {} unique decisions for {} keywords",
                report.rawResults().size(), results.size(), keywords.size());

        return new SearchResult(
                results,
                anySucceeded,
                String.format(Locale.ROOT, "Processed %d keywords in %.2fs", keywords.size(), seconds),
                Collections.unmodifiableMap(details),
                seconds,
                keywords.size(),
                results.size(),
                false);
    }
}
