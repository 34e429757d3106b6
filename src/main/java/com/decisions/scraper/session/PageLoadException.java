package com.decisions.scraper.session;

/**
 * A page did not finish loading: navigation failed, the document never became
 * ready, or the element identifying the page never appeared. Retried for the
 * initial portal load, fatal to the session everywhere else.
 */
public class PageLoadException extends RuntimeException {

    public PageLoadException(final String message) {
        super(message);
    }

    public PageLoadException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
