package com.acme.dlq.domain;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Diagnostics of a failure: error name (usually the exception class), message and stack trace.
 */
public record FailureDetails(String name, String message, String stack) {

    public FailureDetails {
        if (name == null || name.isBlank()) {
            name = "Error";
        }
        if (message == null) {
            message = name;
        }
    }

    public static FailureDetails of(String name, String message) {
        return new FailureDetails(name, message, null);
    }

    /** Capture name, message and stack trace of an exception. */
    public static FailureDetails from(Throwable error) {
        StringWriter stack = new StringWriter();
        error.printStackTrace(new PrintWriter(stack));
        return new FailureDetails(error.getClass().getSimpleName(), error.getMessage(), stack.toString());
    }
}
