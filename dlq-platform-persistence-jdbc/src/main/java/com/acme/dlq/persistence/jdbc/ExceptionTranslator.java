package com.acme.dlq.persistence.jdbc;

import com.acme.dlq.core.PermanentException;
import com.acme.dlq.core.TransientException;
import org.slf4j.Logger;

import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Translates SQLException into the platform's retryable / non-retryable exceptions.
 *
 * <p>Classification looks at the SQL state class first, then at vendor error codes of H2 and
 * PostgreSQL, then at the message text. Anything unrecognised is treated as transient.
 */
public final class ExceptionTranslator {

    // 08 connection exception, 40 transaction rollback, 53 insufficient resources, 57 operator intervention
    private static final List<String> TRANSIENT_STATE_CLASSES = List.of("08", "40", "53", "57");

    // 22 data exception, 23 integrity constraint, 42 syntax/access, 3D catalog, 3F schema
    private static final List<String> PERMANENT_STATE_CLASSES = List.of("22", "23", "42", "3D", "3F");

    // H2: 50200 lock timeout, 90008 invalid value / timeout, 90067 connection broken
    private static final Set<Integer> TRANSIENT_VENDOR_CODES = Set.of(50200, 90008, 90067);

    // H2: 42102 table not found, 42122 column not found, 90007 object closed, 23505 / 23513 constraints
    private static final Set<Integer> PERMANENT_VENDOR_CODES = Set.of(42102, 42122, 90007, 23505, 23513);

    private static final List<String> TRANSIENT_HINTS = List.of(
            "timeout", "timed out", "connection refused", "connection reset", "deadlock",
            "too many connections", "pool exhausted", "could not serialize");

    private static final List<String> PERMANENT_HINTS = List.of(
            "syntax error", "not found", "does not exist", "constraint", "foreign key",
            "type mismatch", "invalid column", "data conversion");

    private ExceptionTranslator() {
    }

    /**
     * Log the failure and return the exception to throw in its place.
     *
     * @param cause     the SQLException raised by the driver
     * @param operation short description of what the repository was doing
     * @param logger    logger of the calling repository
     * @return a {@link TransientException} or {@link PermanentException} wrapping the cause
     */
    public static RuntimeException translateException(SQLException cause, String operation, Logger logger) {
        logger.error("Database operation failed: {} (sqlState={}, errorCode={})",
                operation, cause.getSQLState(), cause.getErrorCode(), cause);

        String detail = String.format("%s: %s", operation, cause.getMessage());
        if (isPermanent(cause)) {
            return new PermanentException("Permanent database error during " + detail, cause);
        }
        if (isTransient(cause)) {
            return new TransientException("Transient database error during " + detail, cause);
        }
        return new TransientException("Database error during " + detail, cause);
    }

    static boolean isTransient(SQLException e) {
        return stateClassIn(e, TRANSIENT_STATE_CLASSES)
                || TRANSIENT_VENDOR_CODES.contains(e.getErrorCode())
                || messageContains(e, TRANSIENT_HINTS);
    }

    static boolean isPermanent(SQLException e) {
        if (stateClassIn(e, TRANSIENT_STATE_CLASSES) || TRANSIENT_VENDOR_CODES.contains(e.getErrorCode())) {
            return false;
        }
        return stateClassIn(e, PERMANENT_STATE_CLASSES)
                || PERMANENT_VENDOR_CODES.contains(e.getErrorCode())
                || (!messageContains(e, TRANSIENT_HINTS) && messageContains(e, PERMANENT_HINTS));
    }

    private static boolean stateClassIn(SQLException e, List<String> classes) {
        String state = e.getSQLState();
        if (state == null || state.length() < 2) {
            return false;
        }
        return classes.contains(state.substring(0, 2).toUpperCase(Locale.ROOT));
    }

    private static boolean messageContains(SQLException e, List<String> hints) {
        String message = e.getMessage();
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        for (String hint : hints) {
            if (lower.contains(hint)) {
                return true;
            }
        }
        return false;
    }
}
