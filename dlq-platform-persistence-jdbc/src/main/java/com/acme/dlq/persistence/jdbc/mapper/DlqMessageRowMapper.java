package com.acme.dlq.persistence.jdbc.mapper;

import com.acme.dlq.core.Jsons;
import com.acme.dlq.domain.DlqMessage;
import com.acme.dlq.domain.DlqMessageStatus;
import com.acme.dlq.domain.DlqMessageType;
import com.acme.dlq.domain.RetryAttempt;
import com.fasterxml.jackson.core.type.TypeReference;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Maps between dlq_messages rows and the DlqMessage domain object.
 * JSON columns (message data, error context, retry history, metadata) are stored as text.
 */
public final class DlqMessageRowMapper {

    private static final TypeReference<List<RetryAttempt>> HISTORY_TYPE = new TypeReference<>() {
    };

    private DlqMessageRowMapper() {
    }

    public static DlqMessage map(ResultSet rs) throws SQLException {
        DlqMessage message = new DlqMessage();
        message.setId(rs.getObject("id", UUID.class));
        message.setOrganizationId(rs.getObject("organization_id", UUID.class));
        message.setType(DlqMessageType.fromCode(rs.getString("message_type")));
        message.setStatus(DlqMessageStatus.valueOf(rs.getString("status")));
        message.setOriginalMessage(rs.getString("original_message"));
        message.setMessageData(Jsons.toMap(rs.getString("message_data")));
        message.setErrorMessage(rs.getString("error_message"));
        message.setErrorStack(rs.getString("error_stack"));
        message.setErrorContext(Jsons.toMap(rs.getString("error_context")));
        message.setRetryCount(rs.getInt("retry_count"));
        message.setMaxRetries(rs.getInt("max_retries"));
        message.setNextRetryAt(instant(rs, "next_retry_at"));
        message.setLastRetryAt(instant(rs, "last_retry_at"));
        message.setRetryHistory(historyFromJson(rs.getString("retry_history")));
        message.setSourceQueue(rs.getString("source_queue"));
        message.setSourceSubject(rs.getString("source_subject"));
        message.setMetadata(Jsons.toMap(rs.getString("metadata")));
        message.setExpiresAt(instant(rs, "expires_at"));
        message.setResolvedBy(rs.getString("resolved_by"));
        message.setResolutionNotes(rs.getString("resolution_notes"));
        message.setCreatedAt(instant(rs, "created_at"));
        message.setUpdatedAt(instant(rs, "updated_at"));
        message.setProcessedAt(instant(rs, "processed_at"));
        message.setVersion(rs.getLong("version"));
        return message;
    }

    public static String mapToJson(Map<String, Object> map) {
        return Jsons.fromMap(map);
    }

    public static String historyToJson(List<RetryAttempt> history) {
        return Jsons.toJson(history == null ? List.of() : history);
    }

    static List<RetryAttempt> historyFromJson(String json) {
        if (json == null || json.isBlank()) {
            return new ArrayList<>();
        }
        return new ArrayList<>(Jsons.fromJson(json, HISTORY_TYPE));
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts == null ? null : ts.toInstant();
    }
}
