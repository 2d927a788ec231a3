package io.github.flameyossnowy.filetx.api;

/**
 * Lifecycle of a {@link UnitOfWork}.
 * <pre>
 * EMPTY -> STAGED -> COMMITTING -> EMPTY        (commit succeeded)
 *                               -> ROLLED_BACK  (commit failed, rollback ran)
 * ROLLED_BACK -> STAGED | COMMITTING | EMPTY (clear)
 * any state but COMMITTING -> CLOSED
 * </pre>
 */
public enum UnitOfWorkState {
    EMPTY,
    STAGED,
    COMMITTING,
    ROLLED_BACK,
    CLOSED;

    public boolean acceptsWork() {
        return this != COMMITTING && this != CLOSED;
    }
}
