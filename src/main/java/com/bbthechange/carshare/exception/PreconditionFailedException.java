package com.bbthechange.carshare.exception;

import java.util.List;

/**
 * Exception thrown when a car fails the safety check at the end of a rental.
 * Lists every violated flag so the rider can fix all of them at once.
 */
public class PreconditionFailedException extends RuntimeException {

    private final List<String> issues;

    public PreconditionFailedException(String message, List<String> issues) {
        super(message);
        this.issues = List.copyOf(issues);
    }

    public List<String> getIssues() {
        return issues;
    }
}
