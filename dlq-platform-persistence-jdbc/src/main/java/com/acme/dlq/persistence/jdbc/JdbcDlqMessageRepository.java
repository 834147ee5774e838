package com.acme.dlq.persistence.jdbc;

import com.acme.dlq.domain.DlqMessage;
import com.acme.dlq.domain.DlqMessageStatus;
import com.acme.dlq.domain.DlqMessageType;
import com.acme.dlq.persistence.jdbc.mapper.DlqMessageRowMapper;
import com.acme.dlq.repository.DlqMessageRepository;
import io.micronaut.transaction.annotation.Transactional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Abstract JDBC implementation of DlqMessageRepository using Template Method pattern.
 * Subclasses override database-specific SQL methods; the query SQL is portable between H2 and
 * PostgreSQL and lives here.
 */
public abstract class JdbcDlqMessageRepository implements DlqMessageRepository {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcDlqMessageRepository.class);

    protected static final String SELECT_COLUMNS = """
            SELECT id, organization_id, message_type, status, original_message, message_data,
                   error_message, error_stack, error_context, retry_count, max_retries,
                   next_retry_at, last_retry_at, retry_history, source_queue, source_subject,
                   metadata, expires_at, resolved_by, resolution_notes, created_at, updated_at,
                   processed_at, version
            FROM dlq_messages
            """;

    protected final DataSource dataSource;

    protected JdbcDlqMessageRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    @Transactional
    public void insert(DlqMessage message) {
        String sql = getInsertSql();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setObject(1, message.getId());
            ps.setObject(2, message.getOrganizationId());
            ps.setString(3, message.getType().code());
            ps.setString(4, message.getStatus().name());
            ps.setString(5, message.getOriginalMessage());
            ps.setString(6, DlqMessageRowMapper.mapToJson(message.getMessageData()));
            ps.setString(7, message.getErrorMessage());
            ps.setString(8, message.getErrorStack());
            ps.setString(9, DlqMessageRowMapper.mapToJson(message.getErrorContext()));
            ps.setInt(10, message.getRetryCount());
            ps.setInt(11, message.getMaxRetries());
            setInstant(ps, 12, message.getNextRetryAt());
            setInstant(ps, 13, message.getLastRetryAt());
            ps.setString(14, DlqMessageRowMapper.historyToJson(message.getRetryHistory()));
            ps.setString(15, message.getSourceQueue());
            ps.setString(16, message.getSourceSubject());
            ps.setString(17, DlqMessageRowMapper.mapToJson(message.getMetadata()));
            setInstant(ps, 18, message.getExpiresAt());
            ps.setString(19, message.getResolvedBy());
            ps.setString(20, message.getResolutionNotes());
            setInstant(ps, 21, message.getCreatedAt());
            setInstant(ps, 22, message.getUpdatedAt());
            setInstant(ps, 23, message.getProcessedAt());
            ps.setLong(24, message.getVersion());

            ps.executeUpdate();
            LOG.debug(
                    "Inserted DLQ message: id={}, type={}, organizationId={}",
                    message.getId(),
                    message.getType().code(),
                    message.getOrganizationId());

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "insert DLQ message", LOG);
        }
    }

    @Override
    @Transactional
    public boolean update(DlqMessage message, long expectedVersion) {
        String sql = getUpdateSql();
        long newVersion = expectedVersion + 1;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, message.getStatus().name());
            ps.setString(2, DlqMessageRowMapper.mapToJson(message.getMessageData()));
            ps.setString(3, message.getErrorMessage());
            ps.setString(4, message.getErrorStack());
            ps.setString(5, DlqMessageRowMapper.mapToJson(message.getErrorContext()));
            ps.setInt(6, message.getRetryCount());
            ps.setInt(7, message.getMaxRetries());
            setInstant(ps, 8, message.getNextRetryAt());
            setInstant(ps, 9, message.getLastRetryAt());
            ps.setString(10, DlqMessageRowMapper.historyToJson(message.getRetryHistory()));
            ps.setString(11, DlqMessageRowMapper.mapToJson(message.getMetadata()));
            setInstant(ps, 12, message.getExpiresAt());
            ps.setString(13, message.getResolvedBy());
            ps.setString(14, message.getResolutionNotes());
            setInstant(ps, 15, message.getUpdatedAt());
            setInstant(ps, 16, message.getProcessedAt());
            ps.setLong(17, newVersion);
            ps.setObject(18, message.getId());
            ps.setLong(19, expectedVersion);

            int updated = ps.executeUpdate();
            if (updated == 0) {
                LOG.debug(
                        "Conditional update missed: id={}, expectedVersion={}",
                        message.getId(),
                        expectedVersion);
                return false;
            }
            message.setVersion(newVersion);
            return true;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "update DLQ message", LOG);
        }
    }

    @Override
    @Transactional
    public boolean deleteById(UUID id) {
        String sql = "DELETE FROM dlq_messages WHERE id = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setObject(1, id);
            return ps.executeUpdate() > 0;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "delete DLQ message", LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<DlqMessage> findById(UUID id) {
        String sql = SELECT_COLUMNS + " WHERE id = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setObject(1, id);

            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(DlqMessageRowMapper.map(rs));
                }
            }
            return Optional.empty();

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find DLQ message by id", LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<DlqMessage> findPending(UUID organizationId, DlqMessageType type, int limit) {
        Filter filter = Filter.status(DlqMessageStatus.PENDING).organization(organizationId).type(type);
        return query(filter, "created_at ASC, id ASC", limit, "find pending DLQ messages");
    }

    @Override
    @Transactional(readOnly = true)
    public List<DlqMessage> findReadyToRetry(Instant now, int limit) {
        Filter filter = Filter.status(DlqMessageStatus.PENDING)
                .and("(next_retry_at IS NULL OR next_retry_at <= ?)", Timestamp.from(now));
        return query(filter, "created_at ASC, id ASC", limit, "find DLQ messages ready to retry");
    }

    @Override
    @Transactional(readOnly = true)
    public List<DlqMessage> findFailed(UUID organizationId, DlqMessageType type, int limit) {
        Filter filter = Filter.status(DlqMessageStatus.FAILED).organization(organizationId).type(type);
        return query(filter, "last_retry_at DESC NULLS LAST, id ASC", limit, "find failed DLQ messages");
    }

    @Override
    @Transactional(readOnly = true)
    public List<DlqMessage> findExpiredCandidates(Instant now, int limit) {
        Filter filter = Filter.status(DlqMessageStatus.PENDING)
                .and("expires_at < ?", Timestamp.from(now));
        return query(filter, "created_at ASC, id ASC", limit, "find expired DLQ message candidates");
    }

    @Override
    @Transactional(readOnly = true)
    public long countAll(UUID organizationId) {
        return count(new Filter().organization(organizationId), "count DLQ messages");
    }

    @Override
    @Transactional(readOnly = true)
    public long countByStatus(DlqMessageStatus status, UUID organizationId) {
        return count(Filter.status(status).organization(organizationId), "count DLQ messages by status");
    }

    @Override
    @Transactional(readOnly = true)
    public Map<DlqMessageType, Long> countByType(UUID organizationId) {
        Filter filter = new Filter().organization(organizationId);
        String sql = "SELECT message_type, COUNT(*) AS cnt FROM dlq_messages"
                + filter.whereClause()
                + " GROUP BY message_type";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            filter.bind(ps);

            Map<DlqMessageType, Long> counts = new EnumMap<>(DlqMessageType.class);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    counts.put(DlqMessageType.fromCode(rs.getString("message_type")), rs.getLong("cnt"));
                }
            }
            return counts;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "count DLQ messages by type", LOG);
        }
    }

    // Template methods for database-specific SQL

    protected abstract String getInsertSql();

    protected abstract String getUpdateSql();

    // Helpers

    private List<DlqMessage> query(Filter filter, String orderBy, int limit, String operation) {
        String sql = SELECT_COLUMNS + filter.whereClause() + " ORDER BY " + orderBy + " LIMIT ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            int next = filter.bind(ps);
            ps.setInt(next, limit);

            List<DlqMessage> results = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    results.add(DlqMessageRowMapper.map(rs));
                }
            }
            return results;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, operation, LOG);
        }
    }

    private long count(Filter filter, String operation) {
        String sql = "SELECT COUNT(*) FROM dlq_messages" + filter.whereClause();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            filter.bind(ps);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, operation, LOG);
        }
    }

    protected static void setInstant(PreparedStatement ps, int index, Instant instant)
            throws SQLException {
        ps.setTimestamp(index, instant == null ? null : Timestamp.from(instant));
    }

    /**
     * Accumulates AND-ed predicates with their positional parameters.
     */
    private static final class Filter {
        private final List<String> predicates = new ArrayList<>();
        private final List<Object> params = new ArrayList<>();

        static Filter status(DlqMessageStatus status) {
            return new Filter().and("status = ?", status.name());
        }

        Filter organization(UUID organizationId) {
            return organizationId == null ? this : and("organization_id = ?", organizationId);
        }

        Filter type(DlqMessageType type) {
            return type == null ? this : and("message_type = ?", type.code());
        }

        Filter and(String predicate, Object param) {
            predicates.add(predicate);
            params.add(param);
            return this;
        }

        String whereClause() {
            return predicates.isEmpty() ? "" : " WHERE " + String.join(" AND ", predicates);
        }

        /** Bind parameters starting at index 1 and return the next free index. */
        int bind(PreparedStatement ps) throws SQLException {
            int index = 1;
            for (Object param : params) {
                ps.setObject(index++, param);
            }
            return index;
        }
    }
}
