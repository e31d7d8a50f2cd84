package com.nestegg.backend.exception;

/**
 * Seeding the equity history failed. Caught by the reconstructor and turned into a
 * fallback curve; never reaches a caller.
 */
public class HistorySeedException extends RuntimeException {
    public HistorySeedException(String message, Throwable cause) {
        super(message, cause);
    }
}
