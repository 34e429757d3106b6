package com.decisions.scraper.driver;

/**
 * Source of fresh {@link PageDriver} sessions. Each keyword session opens its
 * own driver and closes it when done.
 */
@FunctionalInterface
public interface PageDriverFactory {

    /**
     * Opens a new browser session.
     *
     * @return a driver owned by the caller
     * @throws DriverException when no browser could be acquired
     */
    PageDriver open();
}
