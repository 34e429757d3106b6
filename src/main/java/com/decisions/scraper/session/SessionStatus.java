package com.decisions.scraper.session;

/**
 * Terminal states of a keyword session.
 */
public enum SessionStatus {

    /** Target reached, pages exhausted or pager ended. */
    DONE,

    /** The result list never appeared for the keyword. */
    NO_RESULTS,

    /** A fatal error ended the session; collected decisions are kept. */
    FAILED;

    public boolean isSuccess() {
        return this != FAILED;
    }
}
