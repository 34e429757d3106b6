package com.decisions.scraper.controller;

import com.decisions.scraper.model.SearchRequest;
import com.decisions.scraper.model.SearchResult;
import com.decisions.scraper.service.DecisionSearchService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST boundary of the scraping core.
 * <p>
 * Endpoint: <code>POST /api/search</code><br>
 * Consumes: <code>application/json</code><br>
 * Produces: <code>application/json</code>
 * </p>
 *
 * <h3>Example Request</h3>
 * <pre>{@code
 * POST /api/search
 * Content-Type: application/json
 *
 * {
 *   "keywords": ["tazminat", "sözleşme"],
 *   "max_results": 5
 * }
 * }</pre>
 *
 * <h3>Example Response</h3>
 * <pre>{@code
 * {
 *   "results": [
 *     {
 *       "chamber": "3. Hukuk Dairesi",
 *       "case_number": "2023/1234",
 *       "decision_number": "2024/567",
 *       "decision_date": "12.03.2024",
 *       "decision_text": "...",
 *       "matched_keyword": "tazminat"
 *     }
 *   ],
 *   "success": true,
 *   "message": "Processed 2 keywords in 41.07s",
 *   "search_details": {
 *     "tazminat": {"success": true, "count": 3, "message": "3 results found"},
 *     "sözleşme": {"success": true, "count": 0, "message": "no results"}
 *   },
 *   "processing_time": 41.07,
 *   "total_keywords": 2,
 *   "unique_results": 3,
 *   "cached": false
 * }
 * }</pre>
 */
@RestController
@RequestMapping("/api/search")
@RequiredArgsConstructor
public class SearchController {

    private final DecisionSearchService searchService;

    /**
     * @param request keywords and optional result limit
     * @return the aggregate search result
     */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public SearchResult search(@RequestBody @Validated final SearchRequest request) {
        return searchService.search(request);
    }
}
