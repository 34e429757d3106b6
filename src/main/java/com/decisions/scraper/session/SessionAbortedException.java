package com.decisions.scraper.session;

/**
 * The session ran past its deadline or its worker thread was interrupted.
 */
public class SessionAbortedException extends RuntimeException {

    public SessionAbortedException(final String message) {
        super(message);
    }
}
