package io.github.flameyossnowy.filetx.api.exceptions;

/**
 * Classifies every failure a unit of work or a storage backend can report.
 */
public enum ErrorKind {
    /**
     * The entry is already durable in the backend, so it cannot be staged for creation.
     */
    ALREADY_EXISTS,

    /**
     * The entry does not exist in the backend (and is not pending creation).
     */
    NOT_FOUND,

    /**
     * The backend failed to apply a mutation while committing.
     */
    BACKEND_FAILURE,

    /**
     * A compensating operation failed during rollback. The backend may be inconsistent
     * and the affected entry needs manual repair.
     */
    COMPENSATION_FAILURE,

    /**
     * The unit of work cannot accept the call in its current state (closed, or already committing).
     */
    ILLEGAL_STATE
}
