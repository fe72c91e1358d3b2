package com.ivamare.pipeline.exception;

import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;

import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Classifies queue backend failures as transient (back off and poll again) or not.
 *
 * <p>Workers use this only to pick the log level and wording of their backoff
 * messages; either way the message stays leased and is redelivered after its
 * visibility timeout.
 *
 * @see <a href="https://www.postgresql.org/docs/current/errcodes-appendix.html">PostgreSQL Error Codes</a>
 */
public final class DatabaseExceptionClassifier {

    private static final String UNKNOWN = "Unknown";

    private DatabaseExceptionClassifier() {
    }

    /**
     * Exception types treated as transient, most specific first.
     * SQLNonTransientConnectionException is included: a broken connection is
     * recoverable by opening a new one.
     */
    private static final List<Class<? extends Throwable>> TRANSIENT_TYPES = List.of(
        QueueUnavailableException.class,
        CannotGetJdbcConnectionException.class,
        TransientDataAccessException.class,
        RecoverableDataAccessException.class,
        DataAccessResourceFailureException.class,
        SQLTransientException.class,
        SQLRecoverableException.class,
        SQLNonTransientConnectionException.class
    );

    /**
     * Connection (08), resources (53), operator intervention (57) and rollback (40) states.
     */
    private static final Set<String> TRANSIENT_SQL_STATES = Set.of(
        "08000", "08001", "08003", "08004", "08006", "08007", "08P01",
        "53000", "53100", "53200", "53300",
        "57P01", "57P02", "57P03", "57P04",
        "40001", "40P01"
    );

    private static final List<String> TRANSIENT_MESSAGE_PATTERNS = List.of(
        "connection refused",
        "connection reset",
        "connection timed out",
        "read timed out",
        "connection is not available",
        "pool exhausted",
        "connection closed",
        "broken pipe",
        "no route to host",
        "terminating connection",
        "could not connect to server",
        "the database system is starting up",
        "the database system is shutting down"
    );

    /**
     * Determine if the failure is transient.
     *
     * @param ex the exception to classify
     * @return true if polling should simply resume after a backoff
     */
    public static boolean isTransient(Throwable ex) {
        return !UNKNOWN.equals(getTransientReason(ex));
    }

    /**
     * Get the SQL state from an exception or its causes.
     *
     * @param ex the exception to inspect
     * @return the SQL state code, or null if not available
     */
    public static String getSqlState(Throwable ex) {
        for (Throwable t = ex; t != null; t = t.getCause() == t ? null : t.getCause()) {
            if (t instanceof SQLException sqlEx && sqlEx.getSQLState() != null) {
                return sqlEx.getSQLState();
            }
        }
        return null;
    }

    /**
     * Describe why the exception counts as transient, for log lines.
     *
     * @param ex the exception to describe
     * @return short reason, or "Unknown" if the exception is not transient
     */
    public static String getTransientReason(Throwable ex) {
        for (Throwable t = ex; t != null; t = t.getCause() == t ? null : t.getCause()) {
            for (Class<? extends Throwable> type : TRANSIENT_TYPES) {
                if (type.isInstance(t)) {
                    return t.getClass().getSimpleName();
                }
            }
            if (t instanceof SQLException sqlEx
                    && sqlEx.getSQLState() != null
                    && TRANSIENT_SQL_STATES.contains(sqlEx.getSQLState())) {
                return "SQL state " + sqlEx.getSQLState();
            }
            String message = t.getMessage();
            if (message != null) {
                String lower = message.toLowerCase(Locale.ROOT);
                for (String pattern : TRANSIENT_MESSAGE_PATTERNS) {
                    if (lower.contains(pattern)) {
                        return "Message pattern: " + pattern;
                    }
                }
            }
        }
        return UNKNOWN;
    }
}
