package io.github.flameyossnowy.filetx.api.exceptions;

import io.github.flameyossnowy.filetx.api.CommitPhase;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The single exception type of filetx. Every failure carries an {@link ErrorKind},
 * the name of the entry involved and, for commit-time failures, the {@link CommitPhase}
 * that was running.
 * <p>
 * A {@link ErrorKind#BACKEND_FAILURE} raised by a commit keeps every compensation failure
 * that happened during the following rollback, both as suppressed exceptions and through
 * {@link #getCompensationFailures()}.
 */
public class UnitOfWorkException extends RuntimeException {
    private final ErrorKind kind;
    private final String name;
    private final CommitPhase phase;
    private final List<UnitOfWorkException> compensationFailures = new ArrayList<>(0);

    public UnitOfWorkException(@NotNull ErrorKind kind, @Nullable String name, @Nullable CommitPhase phase, @NotNull String message, @Nullable Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.name = name;
        this.phase = phase;
    }

    public UnitOfWorkException(@NotNull ErrorKind kind, @Nullable String name, @NotNull String message) {
        this(kind, name, null, message, null);
    }

    @Contract("_ -> new")
    public static @NotNull UnitOfWorkException alreadyExists(@NotNull String name) {
        return new UnitOfWorkException(ErrorKind.ALREADY_EXISTS, name, "Entry [" + name + "] already exists");
    }

    @Contract("_ -> new")
    public static @NotNull UnitOfWorkException notFound(@NotNull String name) {
        return new UnitOfWorkException(ErrorKind.NOT_FOUND, name, "Entry [" + name + "] does not exist");
    }

    @Contract("_ -> new")
    public static @NotNull UnitOfWorkException illegalState(@NotNull String message) {
        return new UnitOfWorkException(ErrorKind.ILLEGAL_STATE, null, message);
    }

    /**
     * Wraps a failure reported by a backend call made during a commit.
     *
     * @param phase the phase the commit was in
     * @param name the entry the backend call was made for
     * @param cause what the backend reported
     * @return a {@link ErrorKind#BACKEND_FAILURE}
     */
    @Contract("_, _, _ -> new")
    public static @NotNull UnitOfWorkException backendFailure(@NotNull CommitPhase phase, @NotNull String name, @Nullable Throwable cause) {
        return new UnitOfWorkException(ErrorKind.BACKEND_FAILURE, name, phase,
                phase + " failed for entry [" + name + "]" + describe(cause), cause);
    }

    /**
     * Wraps a backend call made while staging that threw instead of answering.
     */
    @Contract("_, _ -> new")
    public static @NotNull UnitOfWorkException stagingFailure(@NotNull String name, @NotNull Throwable cause) {
        return new UnitOfWorkException(ErrorKind.BACKEND_FAILURE, name, null,
                "Could not inspect entry [" + name + "] while staging" + describe(cause), cause);
    }

    /**
     * Wraps a failure of a compensating operation.
     */
    @Contract("_, _, _ -> new")
    public static @NotNull UnitOfWorkException compensationFailure(@NotNull CommitPhase phase, @NotNull String name, @Nullable Throwable cause) {
        return new UnitOfWorkException(ErrorKind.COMPENSATION_FAILURE, name, phase,
                phase + " could not restore entry [" + name + "]" + describe(cause), cause);
    }

    private static String describe(@Nullable Throwable cause) {
        return cause == null || cause.getMessage() == null ? "" : ": " + cause.getMessage();
    }

    public @NotNull ErrorKind getKind() {
        return kind;
    }

    public @NotNull Optional<String> getName() {
        return Optional.ofNullable(name);
    }

    public @NotNull Optional<CommitPhase> getPhase() {
        return Optional.ofNullable(phase);
    }

    /**
     * Walks the cause chain and returns the kind of the innermost {@link UnitOfWorkException},
     * which is the kind a backend originally reported.
     */
    public @NotNull ErrorKind getRootKind() {
        ErrorKind root = kind;
        Throwable current = getCause();
        while (current != null) {
            if (current instanceof UnitOfWorkException unitOfWorkException) {
                root = unitOfWorkException.kind;
            }
            current = current.getCause();
        }
        return root;
    }

    public void addCompensationFailure(@NotNull UnitOfWorkException failure) {
        compensationFailures.add(failure);
        addSuppressed(failure);
    }

    public @NotNull List<UnitOfWorkException> getCompensationFailures() {
        return Collections.unmodifiableList(compensationFailures);
    }

    public boolean hasCompensationFailures() {
        return !compensationFailures.isEmpty();
    }
}
