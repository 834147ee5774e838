package com.acme.dlq.spi;

import com.acme.dlq.domain.DlqMessage;

/**
 * Performs the real work of a failed operation again. Supplied by the caller per message type.
 */
@FunctionalInterface
public interface DlqProcessor {

    /**
     * Retry the operation described by the message.
     * If this method throws, the attempt counts as failed and consumes retry budget.
     *
     * @param message the message being retried (status PROCESSING)
     * @throws Exception if processing fails
     */
    void process(DlqMessage message) throws Exception;
}
