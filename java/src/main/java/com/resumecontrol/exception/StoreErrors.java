package com.resumecontrol.exception;

import io.r2dbc.spi.R2dbcException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;

/**
 * Classifies failures reported by the store.
 *
 * Spring translates PostgreSQL errors into {@link DataAccessException}s; a raw
 * {@link R2dbcException} is matched on its SQL state.
 */
public final class StoreErrors {

    private static final String UNIQUE_VIOLATION = "23505";
    private static final String FOREIGN_KEY_VIOLATION = "23503";
    private static final String STRING_DATA_RIGHT_TRUNCATION = "22001";

    private StoreErrors() {
    }

    /**
     * True when the store rejected a write because of a unique constraint.
     */
    public static boolean isUniqueViolation(Throwable error) {
        if (error instanceof DuplicateKeyException) {
            return true;
        }
        return UNIQUE_VIOLATION.equals(sqlState(error));
    }

    /**
     * True when the store rejected a write because of a foreign key.
     */
    public static boolean isReferenceViolation(Throwable error) {
        String state = sqlState(error);
        if (state != null) {
            return FOREIGN_KEY_VIOLATION.equals(state);
        }
        return error instanceof DataIntegrityViolationException && !(error instanceof DuplicateKeyException);
    }

    /**
     * True when a value did not fit its column.
     */
    public static boolean isValueTooLong(Throwable error) {
        return STRING_DATA_RIGHT_TRUNCATION.equals(sqlState(error));
    }

    /**
     * True for any failure raised by the store driver or Spring's data-access layer.
     */
    public static boolean isStoreFailure(Throwable error) {
        return error instanceof DataAccessException || error instanceof R2dbcException;
    }

    private static String sqlState(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof R2dbcException && ((R2dbcException) current).getSqlState() != null) {
                return ((R2dbcException) current).getSqlState();
            }
            current = current.getCause();
        }
        return null;
    }
}
