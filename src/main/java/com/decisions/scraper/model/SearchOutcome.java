package com.decisions.scraper.model;

/**
 * Per-keyword summary produced once, when the keyword's session terminates.
 *
 * @param success {@code false} only when the session ended on a fatal error
 * @param count   number of decisions the session collected (before global de-duplication)
 * @param message human-readable status
 */
public record SearchOutcome(boolean success, int count, String message) {
}
