package io.github.flameyossnowy.filetx.api.report;

import io.github.flameyossnowy.filetx.api.CommitPhase;
import io.github.flameyossnowy.filetx.api.exceptions.UnitOfWorkException;
import org.jetbrains.annotations.NotNull;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of a rollback, for operators. Entries listed in {@code unresolved} could not be
 * restored and need manual repair.
 *
 * @param unitId the id of the unit of work
 * @param failedPhase the phase that failed and triggered the rollback
 * @param failedName the entry the failing backend call was made for
 * @param cause message of the triggering failure
 * @param compensated entries restored to their state before the commit attempt
 * @param unresolved entries the rollback could not restore
 * @param failures the compensation failures, one per unresolved entry
 * @param timestamp when the rollback finished
 */
public record CompensationReport(
        @NotNull String unitId,
        @NotNull CommitPhase failedPhase,
        @NotNull String failedName,
        @NotNull String cause,
        @NotNull List<String> compensated,
        @NotNull List<String> unresolved,
        @NotNull List<Failure> failures,
        @NotNull Instant timestamp) {

    public CompensationReport {
        compensated = List.copyOf(compensated);
        unresolved = List.copyOf(unresolved);
        failures = List.copyOf(failures);
    }

    public boolean isClean() {
        return unresolved.isEmpty();
    }

    /**
     * A single compensation failure.
     *
     * @param phase the compensating phase
     * @param name the entry that could not be restored
     * @param message what went wrong
     */
    public record Failure(@NotNull CommitPhase phase, @NotNull String name, @NotNull String message) {
        public static @NotNull Failure of(@NotNull UnitOfWorkException exception) {
            return new Failure(
                    exception.getPhase().orElse(CommitPhase.COMPENSATE_CREATES),
                    exception.getName().orElse(""),
                    String.valueOf(exception.getMessage()));
        }
    }
}
