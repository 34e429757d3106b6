package com.decisions.scraper.driver;

import java.util.List;

/**
 * Handle to one element of the document currently loaded in a {@link PageDriver}.
 * Handles may go stale once the driver navigates or the page re-renders.
 */
public interface PageElement {

    /**
     * @return the rendered, trimmed text content of the element
     */
    String text();

    /**
     * @param name attribute name, e.g. {@code class}
     * @return the attribute value, or {@code null} when absent
     */
    String attribute(String name);

    /**
     * Finds descendants matching a CSS selector, in document order.
     *
     * @param cssSelector the selector, relative to this element
     * @return the matching elements; never {@code null}
     */
    List<PageElement> findAll(String cssSelector);
}
