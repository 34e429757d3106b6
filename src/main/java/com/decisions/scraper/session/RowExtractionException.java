package com.decisions.scraper.session;

/**
 * One result row could not be turned into a decision. The session logs it and
 * moves on to the next row.
 */
public class RowExtractionException extends RuntimeException {

    public RowExtractionException(final String message) {
        super(message);
    }
}
