package com.decisions.scraper.driver;

/**
 * Raised by {@link PageDriver} implementations when a browser interaction
 * fails: lost session, stale element, script error or an exhausted wait that
 * has no "absent" answer.
 */
public class DriverException extends RuntimeException {

    public DriverException(final String message) {
        super(message);
    }

    public DriverException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
