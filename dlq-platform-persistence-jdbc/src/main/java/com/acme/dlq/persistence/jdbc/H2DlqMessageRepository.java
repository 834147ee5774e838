package com.acme.dlq.persistence.jdbc;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;

import javax.sql.DataSource;

/**
 * H2-specific implementation of DlqMessageRepository. JSON columns are plain CLOBs.
 */
@Singleton
@Requires(property = "db.dialect", value = "H2")
public class H2DlqMessageRepository extends JdbcDlqMessageRepository {

    public H2DlqMessageRepository(DataSource dataSource) {
        super(dataSource);
    }

    @Override
    protected String getInsertSql() {
        return """
                INSERT INTO dlq_messages
                (id, organization_id, message_type, status, original_message, message_data,
                 error_message, error_stack, error_context, retry_count, max_retries,
                 next_retry_at, last_retry_at, retry_history, source_queue, source_subject,
                 metadata, expires_at, resolved_by, resolution_notes, created_at, updated_at,
                 processed_at, version)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;
    }

    @Override
    protected String getUpdateSql() {
        return """
                UPDATE dlq_messages
                SET status = ?, message_data = ?, error_message = ?, error_stack = ?,
                    error_context = ?, retry_count = ?, max_retries = ?, next_retry_at = ?,
                    last_retry_at = ?, retry_history = ?, metadata = ?, expires_at = ?,
                    resolved_by = ?, resolution_notes = ?, updated_at = ?, processed_at = ?,
                    version = ?
                WHERE id = ? AND version = ?
                """;
    }
}
