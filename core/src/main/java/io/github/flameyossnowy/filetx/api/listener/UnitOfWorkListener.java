package io.github.flameyossnowy.filetx.api.listener;

import io.github.flameyossnowy.filetx.api.UnitOfWork;
import io.github.flameyossnowy.filetx.api.report.CompensationReport;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Listener for unit of work lifecycle events.
 * <p>
 * Listeners run on the caller's thread. An exception thrown by a listener is logged and
 * never changes the outcome of the staging call or commit that triggered it.
 */
@SuppressWarnings("unused")
public interface UnitOfWorkListener {
    /**
     * Called after a create was staged.
     * @param unit the unit of work
     * @param name the staged entry
     */
    default void onStageCreate(@NotNull UnitOfWork unit, @NotNull String name) {}

    /**
     * Called after a delete was staged and the entry's content captured for rollback.
     */
    default void onStageDelete(@NotNull UnitOfWork unit, @NotNull String name) {}

    /**
     * Called when a delete cancelled a create staged in the same batch.
     */
    default void onCreateCancelled(@NotNull UnitOfWork unit, @NotNull String name) {}

    /**
     * Called before a commit touches the backend.
     * @param creates the names about to be written, in order
     * @param deletes the names about to be deleted, in order
     */
    default void onPreCommit(@NotNull UnitOfWork unit, @NotNull List<String> creates, @NotNull List<String> deletes) {}

    /**
     * Called after both commit phases succeeded.
     */
    default void onCommitted(@NotNull UnitOfWork unit, @NotNull List<String> created, @NotNull List<String> deleted) {}

    /**
     * Called after a failed commit was rolled back.
     * @param report what failed and what the rollback managed to restore
     */
    default void onRolledBack(@NotNull UnitOfWork unit, @NotNull CompensationReport report) {}
}
