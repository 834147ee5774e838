package com.acme.dlq.domain;

import java.time.Instant;
import java.util.Map;

/**
 * One failed retry attempt, appended to a message's retry history.
 */
public record RetryAttempt(int attempt, Instant timestamp, String error, Map<String, Object> context) {

    public RetryAttempt {
        context = context == null ? Map.of() : Map.copyOf(context);
    }
}
