package com.decisions.scraper.dispatch;

import com.decisions.scraper.model.ResultItem;
import com.decisions.scraper.session.SessionResult;

import java.time.Duration;
import java.util.List;

/**
 * Everything one dispatch produced.
 *
 * @param sessions session results in completion order, one per keyword
 * @param elapsed  wall-clock time of the whole dispatch
 */
public record DispatchReport(List<SessionResult> sessions, Duration elapsed) {

    public DispatchReport {
        sessions = List.copyOf(sessions);
    }

    /**
     * @return every collected decision, in completion order, duplicates included
     */
    public List<ResultItem> rawResults() {
        return sessions.stream()
                .flatMap(s -> s.results().stream())
                .toList();
    }
}
