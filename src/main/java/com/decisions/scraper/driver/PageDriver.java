package com.decisions.scraper.driver;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * <h2>Page automation capability</h2>
 *
 * <p>One browser session against one document. The scraping core only ever
 * consumes this interface; concrete implementations (Selenium grid, CDP,
 * Playwright, test fixtures) are supplied through a {@link PageDriverFactory}.</p>
 *
 * <p>Instances are not thread-safe and are owned by exactly one keyword
 * session for its whole lifetime. {@link #close()} releases the underlying
 * browser and must be safe to call once on every exit path.</p>
 *
 * <p>All selectors are CSS selectors.</p>
 */
public interface PageDriver extends AutoCloseable {

    /**
     * Poll interval used by {@link #waitForDocumentReady(Duration)}.
     */
    Duration READY_POLL_INTERVAL = Duration.ofMillis(200);

    /**
     * Loads {@code url} in the browser.
     *
     * @param url absolute URL
     * @throws DriverException when the browser cannot load the page
     */
    void navigate(String url);

    /**
     * Waits until an element matching {@code cssSelector} is present.
     *
     * @param cssSelector the selector
     * @param timeout     upper bound of the wait
     * @return the first matching element, or empty when the wait timed out
     */
    Optional<PageElement> waitForElement(String cssSelector, Duration timeout);

    /**
     * Finds all elements currently matching {@code cssSelector}, without waiting.
     *
     * @param cssSelector the selector
     * @return matching elements in document order; never {@code null}
     */
    List<PageElement> findAll(String cssSelector);

    /**
     * Clicks an element.
     *
     * @param element a handle obtained from this driver
     */
    void click(PageElement element);

    /**
     * Clears an input element and types {@code text} into it.
     *
     * @param input the input element
     * @param text  the new value
     */
    void replaceText(PageElement input, String text);

    /**
     * Reads the visible text of an element.
     *
     * @param element a handle obtained from this driver
     * @return the trimmed text
     */
    String readText(PageElement element);

    /**
     * Executes JavaScript in the page. Element handles passed in {@code args}
     * are exposed to the script as {@code arguments[i]}.
     *
     * @param script the script body
     * @param args   script arguments
     * @return the script's return value, possibly {@code null}
     */
    Object executeScript(String script, Object... args);

    /**
     * Selects a result row so that the detail pane starts loading that row's
     * decision.
     *
     * @param row a result row element
     */
    void activateRow(PageElement row);

    /**
     * Waits until the detail pane is visible and its content differs from
     * {@code previousText}, then returns the new content. The pane stays in
     * the DOM across row selections, so presence alone does not mean the
     * content belongs to the row that was just activated.
     *
     * @param paneSelector selector of the detail pane
     * @param previousText pane text observed before the activation, or {@code null}
     * @param timeout      upper bound of the wait
     * @return the refreshed pane text
     * @throws DriverException when the content did not change within {@code timeout}
     */
    String readUpdatedDetail(String paneSelector, String previousText, Duration timeout);

    /**
     * Polls {@code document.readyState} until it reports {@code complete}.
     *
     * @param timeout upper bound of the wait
     * @return {@code true} when the document became ready in time
     */
    default boolean waitForDocumentReady(final Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            Object state = executeScript("return document.readyState");
            if ("complete".equals(state)) {
                return true;
            }
            if (System.nanoTime() >= deadline) {
                return false;
            }
            try {
                Thread.sleep(READY_POLL_INTERVAL.toMillis());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new DriverException("Interrupted while waiting for document ready", ex);
            }
        }
    }

    /**
     * Releases the browser session.
     */
    @Override
    void close();
}
