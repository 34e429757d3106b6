package com.decisions.scraper.session;

import com.decisions.scraper.model.ResultItem;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Mutable progress of one keyword session. Confined to the session's worker
 * thread; never shared.
 */
final class SessionState {

    private int pageNumber = 1;

    private final Set<String> processedCaseIds = new HashSet<>();

    private final List<ResultItem> results = new ArrayList<>();

    int pageNumber() {
        return pageNumber;
    }

    void nextPage() {
        pageNumber++;
    }

    int foundCount() {
        return results.size();
    }

    boolean isProcessed(final String caseId) {
        return processedCaseIds.contains(caseId);
    }

    void record(final ResultItem item) {
        processedCaseIds.add(item.caseId());
        results.add(item);
    }

    List<ResultItem> results() {
        return List.copyOf(results);
    }
}
