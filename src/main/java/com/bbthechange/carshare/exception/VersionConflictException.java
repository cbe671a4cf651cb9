package com.bbthechange.carshare.exception;

/**
 * Exception thrown when a compare-and-set update finds that the stored item has been modified
 * since it was read.
 *
 * Services retry on this for field updates that do not depend on ownership. It only reaches
 * callers once the retry budget is exhausted.
 */
public class VersionConflictException extends RuntimeException {

    public VersionConflictException(String message) {
        super(message);
    }

    public VersionConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
