package io.github.flameyossnowy.filetx.api;

import io.github.flameyossnowy.filetx.api.backend.BackendNames;
import io.github.flameyossnowy.filetx.api.exceptions.ErrorKind;
import io.github.flameyossnowy.filetx.api.exceptions.UnitOfWorkException;
import io.github.flameyossnowy.filetx.api.listener.UnitOfWorkListener;
import io.github.flameyossnowy.filetx.api.report.CompensationReport;
import io.github.flameyossnowy.filetx.api.result.TransactionResult;
import io.github.flameyossnowy.filetx.api.statistics.UnitOfWorkStatistics;
import io.github.flameyossnowy.filetx.api.utils.Logging;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Buffers creates and deletes against a {@link StorageBackend} and applies them together
 * in {@link #commit()}.
 * <p>
 * Staging never mutates the backend. A commit writes every pending create, then deletes
 * every pending delete, both in staging order, and stops at the first failure. A failed
 * commit is rolled back before it returns: creates that reached the backend are deleted
 * again and deletes that reached the backend are re-written with the content captured
 * when they were staged. The caller gets the triggering failure, with any compensation
 * failures attached to it.
 * <p>
 * After a failed commit the instance is {@link UnitOfWorkState#ROLLED_BACK} and keeps its
 * buffers as staged, so the caller may fix the cause and commit again, stage more work,
 * or {@link #clear()} it.
 * <p>
 * Not thread-safe: staging and committing must be serialized by the caller. Nothing
 * isolates two units of work that touch the same names.
 */
public class UnitOfWork implements AutoCloseable {
    private final String id;
    private final StorageBackend backend;
    private final List<UnitOfWorkListener> listeners;
    private final UnitOfWorkStatistics statistics;

    // name -> content to write
    private Map<String, byte[]> pendingCreates = new LinkedHashMap<>();
    // name -> content read at staging time, restored on rollback
    private Map<String, byte[]> pendingDeletes = new LinkedHashMap<>();

    private UnitOfWorkState state = UnitOfWorkState.EMPTY;
    private CompensationReport lastCompensationReport;

    UnitOfWork(@NotNull String id, @NotNull StorageBackend backend, @NotNull List<UnitOfWorkListener> listeners, @NotNull UnitOfWorkStatistics statistics) {
        this.id = id;
        this.backend = backend;
        this.listeners = List.copyOf(listeners);
        this.statistics = statistics;
    }

    public static @NotNull UnitOfWorkBuilder builder(@NotNull StorageBackend backend) {
        return new UnitOfWorkBuilder(backend);
    }

    public static @NotNull UnitOfWork of(@NotNull StorageBackend backend) {
        return new UnitOfWorkBuilder(backend).build();
    }

    /**
     * Stages a create. Fails with {@link ErrorKind#ALREADY_EXISTS} if the entry is already
     * in the backend. Staging the same name twice keeps the latest content.
     *
     * @param name the entry to create
     * @param content the content to write on commit
     * @return the staging result
     */
    public @NotNull TransactionResult<Boolean> stageCreate(@NotNull String name, byte @NotNull [] content) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(content, "content");
        BackendNames.validate(name);
        TransactionResult<Boolean> rejected = rejectIfBusy("stage a create");
        if (rejected != null) return rejected;

        boolean exists;
        try {
            // a pending delete means the entry was durable when it was staged
            exists = pendingDeletes.containsKey(name) || backend.exists(name);
        } catch (RuntimeException e) {
            return stagingFailure(name, e);
        }

        if (exists) {
            Logging.deepInfo("[" + id + "] Rejected create of existing entry " + name);
            return TransactionResult.failure(UnitOfWorkException.alreadyExists(name));
        }

        pendingCreates.put(name, content.clone());
        state = UnitOfWorkState.STAGED;
        Logging.deepInfo("[" + id + "] Staged create " + name + " (" + content.length + " bytes)");
        notifyListeners(listener -> listener.onStageCreate(this, name));
        return TransactionResult.ok();
    }

    /**
     * Stages a delete. A delete of a name that is pending creation cancels that create
     * without touching the backend. Otherwise the current content is captured for rollback,
     * and the call fails with {@link ErrorKind#NOT_FOUND} if there is none.
     *
     * @param name the entry to delete
     * @return the staging result
     */
    public @NotNull TransactionResult<Boolean> stageDelete(@NotNull String name) {
        Objects.requireNonNull(name, "name");
        BackendNames.validate(name);
        TransactionResult<Boolean> rejected = rejectIfBusy("stage a delete");
        if (rejected != null) return rejected;

        if (pendingCreates.remove(name) != null) {
            statistics.recordCancelledCreate();
            state = isEmpty() ? UnitOfWorkState.EMPTY : UnitOfWorkState.STAGED;
            Logging.deepInfo("[" + id + "] Delete of " + name + " cancelled its pending create");
            notifyListeners(listener -> listener.onCreateCancelled(this, name));
            return TransactionResult.ok();
        }

        Optional<byte[]> current;
        try {
            current = backend.tryRead(name);
        } catch (RuntimeException e) {
            return stagingFailure(name, e);
        }

        if (current.isEmpty()) {
            Logging.deepInfo("[" + id + "] Rejected delete of missing entry " + name);
            return TransactionResult.failure(UnitOfWorkException.notFound(name));
        }

        pendingDeletes.put(name, current.get());
        state = UnitOfWorkState.STAGED;
        Logging.deepInfo("[" + id + "] Staged delete " + name);
        notifyListeners(listener -> listener.onStageDelete(this, name));
        return TransactionResult.ok();
    }

    /**
     * Applies everything staged. An empty unit of work commits successfully without
     * touching the backend.
     *
     * @return success with both buffers emptied, or the first failure after the rollback ran
     */
    public @NotNull TransactionResult<Boolean> commit() {
        TransactionResult<Boolean> rejected = rejectIfBusy("commit");
        if (rejected != null) return rejected;

        if (isEmpty()) {
            state = UnitOfWorkState.EMPTY;
            return TransactionResult.ok();
        }

        state = UnitOfWorkState.COMMITTING;
        try {
            return applyStaged();
        } finally {
            if (state == UnitOfWorkState.COMMITTING) {
                // an Error escaped before the rollback ran; applied entries are not compensated
                state = UnitOfWorkState.ROLLED_BACK;
                Logging.error("[" + id + "] Commit aborted, backend may hold part of the batch; buffers kept as staged");
            }
        }
    }

    private TransactionResult<Boolean> applyStaged() {
        long start = System.currentTimeMillis();
        List<String> creates = List.copyOf(pendingCreates.keySet());
        List<String> deletes = List.copyOf(pendingDeletes.keySet());
        Logging.info("[" + id + "] Committing " + creates.size() + " create(s) and " + deletes.size() + " delete(s)");
        notifyListeners(listener -> listener.onPreCommit(this, creates, deletes));

        List<String> written = new ArrayList<>(creates.size());
        List<String> deleted = new ArrayList<>(deletes.size());

        UnitOfWorkException failure = applyCreates(written);
        if (failure == null) {
            failure = applyDeletes(deleted);
        }

        if (failure == null) {
            pendingCreates = new LinkedHashMap<>();
            pendingDeletes = new LinkedHashMap<>();
            state = UnitOfWorkState.EMPTY;
            statistics.recordCommit(written.size(), deleted.size(), System.currentTimeMillis() - start);
            Logging.info("[" + id + "] Committed " + written.size() + " create(s) and " + deleted.size() + " delete(s)");
            notifyListeners(listener -> listener.onCommitted(this, written, deleted));
            return TransactionResult.ok();
        }

        Logging.error("[" + id + "] Commit failed, rolling back: " + failure.getMessage(), failure.getCause());

        // a failed write may still have left the entry behind
        if (failure.getPhase().orElse(null) == CommitPhase.APPLY_CREATES) {
            failure.getName().ifPresent(written::add);
        }

        CompensationReport report = rollback(failure, written, deleted);
        lastCompensationReport = report;
        state = UnitOfWorkState.ROLLED_BACK;
        statistics.recordFailedCommit(report.isClean(), System.currentTimeMillis() - start);
        notifyListeners(listener -> listener.onRolledBack(this, report));
        return TransactionResult.failure(failure);
    }

    private @Nullable UnitOfWorkException applyCreates(List<String> written) {
        for (Map.Entry<String, byte[]> entry : pendingCreates.entrySet()) {
            String name = entry.getKey();
            UnitOfWorkException failure = apply(CommitPhase.APPLY_CREATES, name, () -> backend.write(name, entry.getValue()));
            if (failure != null) return failure;
            written.add(name);
        }
        return null;
    }

    private @Nullable UnitOfWorkException applyDeletes(List<String> deleted) {
        for (String name : pendingDeletes.keySet()) {
            UnitOfWorkException failure = apply(CommitPhase.APPLY_DELETES, name, () -> backend.delete(name));
            if (failure != null) return failure;
            deleted.add(name);
        }
        return null;
    }

    private @Nullable UnitOfWorkException apply(CommitPhase phase, String name, BackendCall call) {
        try {
            TransactionResult<Boolean> result = call.run();
            if (result.isSuccess()) return null;
            return UnitOfWorkException.backendFailure(phase, name, result.getError().orElse(null));
        } catch (RuntimeException e) {
            return UnitOfWorkException.backendFailure(phase, name, e);
        }
    }

    /**
     * Undoes what the failed attempt applied, newest first. Every entry is attempted even
     * when an earlier compensation failed.
     */
    private CompensationReport rollback(UnitOfWorkException failure, List<String> written, List<String> deleted) {
        List<String> compensated = new ArrayList<>();
        List<String> unresolved = new ArrayList<>();
        List<CompensationReport.Failure> failures = new ArrayList<>();

        for (int i = written.size() - 1; i >= 0; i--) {
            String name = written.get(i);
            UnitOfWorkException compensationFailure = compensate(CommitPhase.COMPENSATE_CREATES, name, () ->
                    backend.exists(name) ? backend.delete(name) : TransactionResult.ok());
            record(failure, name, compensationFailure, compensated, unresolved, failures);
        }

        for (int i = deleted.size() - 1; i >= 0; i--) {
            String name = deleted.get(i);
            byte[] original = pendingDeletes.get(name);
            UnitOfWorkException compensationFailure = compensate(CommitPhase.COMPENSATE_DELETES, name, () ->
                    backend.exists(name) ? TransactionResult.ok() : backend.write(name, original));
            record(failure, name, compensationFailure, compensated, unresolved, failures);
        }

        if (unresolved.isEmpty()) {
            Logging.info("[" + id + "] Rollback restored " + compensated.size() + " entr(ies)");
        } else {
            Logging.error("[" + id + "] Rollback left " + unresolved.size() + " entr(ies) unresolved, manual repair needed: " + unresolved);
        }

        return new CompensationReport(
                id,
                failure.getPhase().orElse(CommitPhase.APPLY_CREATES),
                failure.getName().orElse(""),
                String.valueOf(failure.getMessage()),
                compensated,
                unresolved,
                failures,
                Instant.now());
    }

    private @Nullable UnitOfWorkException compensate(CommitPhase phase, String name, BackendCall call) {
        try {
            TransactionResult<Boolean> result = call.run();
            if (result.isSuccess()) return null;
            return UnitOfWorkException.compensationFailure(phase, name, result.getError().orElse(null));
        } catch (RuntimeException e) {
            return UnitOfWorkException.compensationFailure(phase, name, e);
        }
    }

    private void record(UnitOfWorkException failure, String name, @Nullable UnitOfWorkException compensationFailure,
                        List<String> compensated, List<String> unresolved, List<CompensationReport.Failure> failures) {
        if (compensationFailure == null) {
            compensated.add(name);
            Logging.deepInfo("[" + id + "] Compensated " + name);
            return;
        }
        Logging.error("[" + id + "] " + compensationFailure.getMessage(), compensationFailure.getCause());
        failure.addCompensationFailure(compensationFailure);
        unresolved.add(name);
        failures.add(CompensationReport.Failure.of(compensationFailure));
    }

    /**
     * Drops everything staged and returns to {@link UnitOfWorkState#EMPTY}. The backend is
     * not touched.
     */
    public void clear() {
        if (state == UnitOfWorkState.COMMITTING) {
            throw UnitOfWorkException.illegalState("Unit of work " + id + " cannot be cleared while committing");
        }
        if (state == UnitOfWorkState.CLOSED) return;
        pendingCreates = new LinkedHashMap<>();
        pendingDeletes = new LinkedHashMap<>();
        state = UnitOfWorkState.EMPTY;
    }

    /**
     * Drops everything staged without touching the backend. A closed unit of work rejects
     * further staging and commits.
     */
    @Override
    public void close() {
        if (state == UnitOfWorkState.COMMITTING) {
            Logging.warn("[" + id + "] Ignoring close() during commit");
            return;
        }
        if (state == UnitOfWorkState.STAGED || state == UnitOfWorkState.ROLLED_BACK) {
            Logging.info("[" + id + "] Closing with " + pendingCreates.size() + " create(s) and " + pendingDeletes.size() + " delete(s) discarded");
        }
        pendingCreates = Map.of();
        pendingDeletes = Map.of();
        state = UnitOfWorkState.CLOSED;
    }

    private TransactionResult<Boolean> stagingFailure(String name, RuntimeException cause) {
        UnitOfWorkException failure = UnitOfWorkException.stagingFailure(name, cause);
        Logging.error("[" + id + "] " + failure.getMessage(), cause);
        return TransactionResult.failure(failure);
    }

    private @Nullable TransactionResult<Boolean> rejectIfBusy(String action) {
        if (state.acceptsWork()) return null;
        return TransactionResult.failure(UnitOfWorkException.illegalState(
                "Cannot " + action + " in unit of work " + id + " while it is " + state));
    }

    private void notifyListeners(Consumer<UnitOfWorkListener> event) {
        for (UnitOfWorkListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                Logging.error("[" + id + "] Listener " + listener.getClass().getName() + " failed", e);
            }
        }
    }

    public @NotNull String id() {
        return id;
    }

    public @NotNull UnitOfWorkState state() {
        return state;
    }

    public @NotNull StorageBackend backend() {
        return backend;
    }

    public boolean isEmpty() {
        return pendingCreates.isEmpty() && pendingDeletes.isEmpty();
    }

    /**
     * @return the names pending creation, in staging order
     */
    public @NotNull List<String> pendingCreates() {
        return List.copyOf(pendingCreates.keySet());
    }

    /**
     * @return the names pending deletion, in staging order
     */
    public @NotNull List<String> pendingDeletes() {
        return List.copyOf(pendingDeletes.keySet());
    }

    /**
     * @return the report of the most recent rollback, if a commit of this instance ever failed
     */
    public @NotNull Optional<CompensationReport> lastCompensationReport() {
        return Optional.ofNullable(lastCompensationReport);
    }

    public @NotNull UnitOfWorkStatistics statistics() {
        return statistics;
    }

    @Override
    public String toString() {
        return "UnitOfWork{id=" + id + ", state=" + state + ", creates=" + pendingCreates.size() + ", deletes=" + pendingDeletes.size() + "}";
    }

    @FunctionalInterface
    private interface BackendCall {
        TransactionResult<Boolean> run();
    }
}
