package com.acme.dlq.domain;

import java.util.Arrays;
import java.util.Locale;

/**
 * Kind of asynchronous operation that failed. The type selects the processor used to retry it and
 * never changes after the message is created.
 */
public enum DlqMessageType {
    CONTENT_GENERATION("content_generation"),
    POLICY_CHECK("policy_check"),
    PUBLISH("publish"),
    METRICS_INGESTION("metrics_ingestion"),
    WEBHOOK_PROCESSING("webhook_processing"),
    ASSET_PROCESSING("asset_processing"),
    EXPERIMENT_PROCESSING("experiment_processing"),
    REPORT_GENERATION("report_generation"),
    NOTIFICATION("notification"),
    AUDIT_LOG("audit_log");

    private final String code;

    DlqMessageType(String code) {
        this.code = code;
    }

    /** Stable code stored in the database and sent to alerting. */
    public String code() {
        return code;
    }

    /**
     * Resolve a type from its code. Accepts the dashed form ({@code content-generation}) too.
     *
     * @throws IllegalArgumentException if the code matches no type
     */
    public static DlqMessageType fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("DLQ message type code must not be null");
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return Arrays.stream(values())
                .filter(t -> t.code.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown DLQ message type: " + code));
    }
}
