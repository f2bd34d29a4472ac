package com.resumecontrol.exception;

import io.r2dbc.spi.R2dbcDataIntegrityViolationException;
import io.r2dbc.spi.R2dbcNonTransientResourceException;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for StoreErrors.
 */
class StoreErrorsTest {

    @Test
    void uniqueViolation_FromTranslatedException() {
        assertTrue(StoreErrors.isUniqueViolation(new DuplicateKeyException("duplicate key")));
        assertFalse(StoreErrors.isReferenceViolation(new DuplicateKeyException("duplicate key")));
    }

    @Test
    void uniqueViolation_FromSqlStateInCauseChain() {
        DataIntegrityViolationException wrapped = new DataIntegrityViolationException("insert failed",
                new R2dbcDataIntegrityViolationException("duplicate key value", "23505"));

        assertTrue(StoreErrors.isUniqueViolation(wrapped));
        assertFalse(StoreErrors.isReferenceViolation(wrapped));
    }

    @Test
    void referenceViolation_FromSqlState() {
        R2dbcDataIntegrityViolationException error =
                new R2dbcDataIntegrityViolationException("violates foreign key constraint", "23503");

        assertTrue(StoreErrors.isReferenceViolation(error));
        assertFalse(StoreErrors.isUniqueViolation(error));
    }

    @Test
    void valueTooLong_FromSqlStateInCauseChain() {
        DataIntegrityViolationException wrapped = new DataIntegrityViolationException("insert failed",
                new R2dbcDataIntegrityViolationException("value too long for type character varying(255)", "22001"));

        assertTrue(StoreErrors.isValueTooLong(wrapped));
        assertFalse(StoreErrors.isReferenceViolation(wrapped));
        assertFalse(StoreErrors.isUniqueViolation(wrapped));
        assertFalse(StoreErrors.isValueTooLong(new DuplicateKeyException("duplicate key")));
    }

    @Test
    void storeFailure_CoversDriverAndSpringErrors() {
        assertTrue(StoreErrors.isStoreFailure(new R2dbcNonTransientResourceException("connection closed")));
        assertTrue(StoreErrors.isStoreFailure(new DuplicateKeyException("duplicate key")));
        assertFalse(StoreErrors.isStoreFailure(new ResourceNotFoundException("Company", 1L)));
        assertFalse(StoreErrors.isStoreFailure(new StoreException("Failed to list Company", null)));
    }
}
