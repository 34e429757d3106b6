package com.decisions.scraper.session;

import com.decisions.scraper.model.ResultItem;
import com.decisions.scraper.model.SearchOutcome;

import java.util.List;

/**
 * What a keyword session hands back when it terminates.
 *
 * @param keyword      the searched keyword
 * @param results      decisions collected, in collection order
 * @param status       terminal state
 * @param message      outcome message
 * @param pagesVisited result pages the session processed
 */
public record SessionResult(
        String keyword,
        List<ResultItem> results,
        SessionStatus status,
        String message,
        int pagesVisited
) {

    public static final String NO_RESULTS_MESSAGE = "no results";

    public SessionResult {
        results = List.copyOf(results);
    }

    public static SessionResult done(final String keyword, final List<ResultItem> results, final int pages) {
        return new SessionResult(keyword, results, SessionStatus.DONE,
                results.size() + " results found", pages);
    }

    public static SessionResult noResults(final String keyword) {
        return new SessionResult(keyword, List.of(), SessionStatus.NO_RESULTS, NO_RESULTS_MESSAGE, 0);
    }

    public static SessionResult failed(final String keyword,
                                       final List<ResultItem> partial,
                                       final int pages,
                                       final String error) {
        return new SessionResult(keyword, partial, SessionStatus.FAILED, error, pages);
    }

    public boolean success() {
        return status.isSuccess();
    }

    public SearchOutcome toOutcome() {
        return new SearchOutcome(success(), results.size(), message);
    }
}
