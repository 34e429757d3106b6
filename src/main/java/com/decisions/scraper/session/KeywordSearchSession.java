package com.decisions.scraper.session;

import com.decisions.scraper.config.ScraperProperties;
import com.decisions.scraper.driver.DriverException;
import com.decisions.scraper.driver.PageDriver;
import com.decisions.scraper.driver.PageDriverFactory;
import com.decisions.scraper.driver.PageElement;
import com.decisions.scraper.model.ResultItem;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * <h2>One keyword's search against the portal</h2>
 *
 * <p>Drives a single {@link PageDriver} through the portal's search flow:</p>
 * <ol>
 *   <li>open a driver (guarded by the acquisition circuit breaker) and load
 *       the portal, retried by the {@link PageLoadRetryPolicy};</li>
 *   <li>type the keyword and submit the search form;</li>
 *   <li>wait for the result rows; none within the wait timeout means
 *       {@link SessionStatus#NO_RESULTS};</li>
 *   <li>for each row of the page: read its columns, skip case ids already
 *       collected, activate the row and read the refreshed detail pane;
 *       a failing row is logged and skipped;</li>
 *   <li>follow the pager until the target count, the page ceiling or the
 *       last page is reached.</li>
 * </ol>
 *
 * <p>Any other failure ends the session as {@link SessionStatus#FAILED} while
 * keeping the decisions collected so far. The driver is closed exactly once
 * on every path. A session instance runs once and is confined to one thread.</p>
 */
@Slf4j
public class KeywordSearchSession {

    /**
     * Centers the row before clicking it; the portal ignores clicks on rows
     * hidden behind its sticky header.
     */
    static final String SCROLL_INTO_VIEW = "arguments[0].scrollIntoView({block: 'center'});";

    /**
     * Clicks through script; the pager control is often overlapped by the table footer.
     */
    static final String SCRIPT_CLICK = "arguments[0].click();";

    private final String keyword;

    private final ScraperProperties props;

    private final PageDriverFactory driverFactory;

    private final PageLoadRetryPolicy retryPolicy;

    private final CircuitBreaker driverBreaker;

    private final Instant deadline;

    private final Clock clock;

    private final SessionState state = new SessionState();

    private int pagesVisited;

    private String tag;

    public KeywordSearchSession(final String keyword,
                                final ScraperProperties props,
                                final PageDriverFactory driverFactory,
                                final PageLoadRetryPolicy retryPolicy,
                                final CircuitBreaker driverBreaker,
                                final Instant deadline,
                                final Clock clock) {
        this.keyword = keyword;
        this.props = props;
        this.driverFactory = driverFactory;
        this.retryPolicy = retryPolicy;
        this.driverBreaker = driverBreaker;
        this.deadline = deadline;
        this.clock = clock;
    }

    /**
     * Runs the session to a terminal state. Never throws.
     *
     * @return the terminal result, carrying partial results on failure
     */
    public SessionResult run() {
        tag = "[" + Thread.currentThread().getName() + "] '" + keyword + "'";
        log.info("{} search started", tag);

        PageDriver driver;
        try {
            driver = driverBreaker.executeSupplier(driverFactory::open);
        } catch (RuntimeException ex) {
            log.error("{} could not acquire a page driver: {}", tag, ex.toString());
            return SessionResult.failed(keyword, List.of(), 0, describe(ex));
        }

        try {
            return drive(driver);
        } catch (RuntimeException ex) {
            log.error("{} session failed after {} results", tag, state.foundCount(), ex);
            return SessionResult.failed(keyword, state.results(), pagesVisited, describe(ex));
        } finally {
            release(driver);
        }
    }

    private SessionResult drive(final PageDriver driver) {
        ScraperProperties.Locators loc = props.getLocators();

        retryPolicy.run(() -> loadPortal(driver));
        checkAborted();

        submitQuery(driver, loc);

        if (driver.waitForElement(loc.getResultRows(), props.getWaitTimeout()).isEmpty()) {
            log.warn("{} no results found", tag);
            return SessionResult.noResults(keyword);
        }
        log.info("{} results loaded", tag);

        int target = props.getTargetResultsPerKeyword();
        while (true) {
            pagesVisited = state.pageNumber();
            log.info("{} processing page {} (found {}/{})", tag, state.pageNumber(), state.foundCount(), target);
            processPage(driver, loc, target);

            if (state.foundCount() >= target) {
                log.info("{} target of {} results reached", tag, target);
                break;
            }
            if (state.pageNumber() >= props.getMaxPagesToSearch()) {
                log.info("{} page ceiling of {} reached", tag, props.getMaxPagesToSearch());
                break;
            }
            checkAborted();
            if (!advancePage(driver, loc)) {
                break;
            }
        }

        log.info("{} search finished with {} results", tag, state.foundCount());
        return SessionResult.done(keyword, state.results(), pagesVisited);
    }

    private void loadPortal(final PageDriver driver) {
        log.info("{} loading {}", tag, props.getPortalUrl());
        driver.navigate(props.getPortalUrl());
        if (!driver.waitForDocumentReady(props.getWaitTimeout())) {
            throw new PageLoadException("portal did not become ready: " + props.getPortalUrl());
        }
    }

    private void submitQuery(final PageDriver driver, final ScraperProperties.Locators loc) {
        PageElement input = driver.waitForElement(loc.getSearchInput(), props.getWaitTimeout())
                .orElseThrow(() -> new PageLoadException("search input not found: " + loc.getSearchInput()));
        driver.replaceText(input, keyword);

        PageElement submit = driver.waitForElement(loc.getSubmitButton(), props.getWaitTimeout())
                .orElseThrow(() -> new PageLoadException("submit button not found: " + loc.getSubmitButton()));
        driver.click(submit);
    }

    /**
     * Rows are listed once per page; the table is not re-queried while rows
     * are being activated.
     */
    private void processPage(final PageDriver driver, final ScraperProperties.Locators loc, final int target) {
        List<PageElement> rows = driver.findAll(loc.getResultRows());
        if (rows.isEmpty()) {
            log.warn("{} page {} has no rows", tag, state.pageNumber());
            return;
        }

        for (int i = 0; i < rows.size() && state.foundCount() < target; i++) {
            checkAborted();
            try {
                processRow(driver, loc, rows.get(i));
            } catch (RuntimeException ex) {
                log.warn("{} row {}/{} on page {} skipped: {}",
                        tag, i + 1, rows.size(), state.pageNumber(), ex.getMessage());
            }
        }
    }

    private void processRow(final PageDriver driver, final ScraperProperties.Locators loc, final PageElement row) {
        RowFields fields = RowFields.from(row, loc.getRowCells());
        String caseId = fields.caseId();
        if (state.isProcessed(caseId)) {
            log.info("{} decision {} already collected, skipping", tag, caseId);
            return;
        }

        driver.executeScript(SCROLL_INTO_VIEW, row);
        String before = currentDetailText(driver, loc);
        driver.activateRow(row);
        String text = driver.readUpdatedDetail(loc.getDetailPane(), before, props.getWaitTimeout());
        if (StringUtils.isBlank(text)) {
            throw new RowExtractionException("empty decision text for " + caseId);
        }

        ResultItem item = fields.toResultItem(text.strip(), keyword);
        state.record(item);
        log.info("{} decision {} collected ({}/{})",
                tag, caseId, state.foundCount(), props.getTargetResultsPerKeyword());
    }

    /**
     * Pane text right before a row is activated. A skipped row's detail may
     * still land after its wait gave up, so the last collected text is not a
     * safe baseline.
     */
    private static String currentDetailText(final PageDriver driver, final ScraperProperties.Locators loc) {
        return driver.findAll(loc.getDetailPane()).stream()
                .findFirst()
                .map(driver::readText)
                .orElse(null);
    }

    /**
     * Moves to the next result page.
     *
     * @return {@code false} when there is no next page
     */
    private boolean advancePage(final PageDriver driver, final ScraperProperties.Locators loc) {
        Optional<PageElement> next;
        try {
            next = driver.findAll(loc.getNextButton()).stream().findFirst();
        } catch (DriverException ex) {
            log.warn("{} pager not readable, stopping: {}", tag, ex.getMessage());
            return false;
        }
        if (next.isEmpty()) {
            log.info("{} no pager, single result page", tag);
            return false;
        }
        String classes = StringUtils.defaultString(next.get().attribute("class"));
        if (StringUtils.containsIgnoreCase(classes, loc.getDisabledClass())) {
            log.info("{} last result page reached", tag);
            return false;
        }

        log.info("{} moving to page {}", tag, state.pageNumber() + 1);
        driver.executeScript(SCRIPT_CLICK, next.get());
        if (!driver.waitForDocumentReady(props.getWaitTimeout())
                || driver.waitForElement(loc.getResultsContainer(), props.getWaitTimeout()).isEmpty()) {
            throw new PageLoadException("result page " + (state.pageNumber() + 1) + " did not load");
        }
        state.nextPage();
        return true;
    }

    private void checkAborted() {
        if (Thread.currentThread().isInterrupted()) {
            throw new SessionAbortedException("session interrupted");
        }
        if (!clock.instant().isBefore(deadline)) {
            throw new SessionAbortedException("session deadline of " + deadline + " exceeded");
        }
    }

    private void release(final PageDriver driver) {
        try {
            driver.close();
            log.info("{} page driver released", tag);
        } catch (RuntimeException ex) {
            log.warn("{} page driver did not close cleanly: {}", tag, ex.toString());
        }
    }

    private static String describe(final Throwable ex) {
        return StringUtils.defaultIfBlank(ex.getMessage(), ex.getClass().getSimpleName());
    }
}
