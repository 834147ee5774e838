package com.acme.dlq.spi;

import java.util.UUID;

/**
 * Outbound notifications raised by the DLQ engine. Implementations fan out to concrete providers
 * (incident trackers, chat, email); the engine knows none of them.
 */
public interface AlertingBridge {

    /**
     * A failed operation was added to the DLQ (normally {@link AlertSeverity#MEDIUM})
     */
    void onEnqueued(UUID organizationId, AlertSummary summary, AlertSeverity severity);

    /**
     * A message failed its last allowed attempt (normally {@link AlertSeverity#HIGH})
     */
    void onTerminalFailure(UUID organizationId, AlertSummary summary, AlertSeverity severity);
}
