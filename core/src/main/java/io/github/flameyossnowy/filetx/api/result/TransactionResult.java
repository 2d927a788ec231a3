package io.github.flameyossnowy.filetx.api.result;

import io.github.flameyossnowy.filetx.api.exceptions.ErrorKind;
import io.github.flameyossnowy.filetx.api.exceptions.UnitOfWorkException;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Tagged success/failure result returned by every staging call, every commit and every
 * backend mutation. A failed result always carries a {@link UnitOfWorkException}, whose
 * {@link ErrorKind} tells the caller what went wrong.
 *
 * @param <T> the value carried by a successful result
 */
public final class TransactionResult<T> {
    private static final TransactionResult<Boolean> TRUE = new TransactionResult<>(true, null);

    private final T result;
    private final UnitOfWorkException error;

    private TransactionResult(T result, UnitOfWorkException error) {
        this.result = result;
        this.error = error;
    }

    /**
     * Returns a successful TransactionResult with the given value.
     *
     * @param value the value to be returned by the successful TransactionResult
     * @return a successful TransactionResult
     */
    @Contract(value = "_ -> new", pure = true)
    public static <T> @NotNull TransactionResult<T> success(T value) {
        return new TransactionResult<>(value, null);
    }

    /**
     * The shared successful result used by mutations that have nothing else to report.
     */
    @Contract(pure = true)
    public static @NotNull TransactionResult<Boolean> ok() {
        return TRUE;
    }

    /**
     * Returns a failed TransactionResult with the given error.
     *
     * @param error the error to be returned by the failed TransactionResult
     * @return a failed TransactionResult
     */
    @Contract(value = "_ -> new", pure = true)
    public static <T> @NotNull TransactionResult<T> failure(@NotNull UnitOfWorkException error) {
        return new TransactionResult<>(null, Objects.requireNonNull(error, "error"));
    }

    /**
     * Checks if the transaction resulted in a success.
     * @return true if the transaction was successful, false otherwise
     */
    public boolean isSuccess() {
        return error == null;
    }

    /**
     * Checks if the transaction resulted in an error.
     *
     * @return true if the transaction resulted in an error, false otherwise
     */
    public boolean isError() {
        return error != null;
    }

    /**
     * @return the kind of the error, or empty for a successful result
     */
    public @NotNull Optional<ErrorKind> getErrorKind() {
        return error == null ? Optional.empty() : Optional.of(error.getKind());
    }

    /**
     * Checks whether this result failed with the given kind.
     */
    public boolean isError(@NotNull ErrorKind kind) {
        return error != null && error.getKind() == kind;
    }

    /**
     * Retrieves the result of the transaction if it was successful.
     *
     * @return an Optional containing the result if the transaction was successful,
     *         or an empty Optional if the transaction resulted in an error.
     */
    @Contract(pure = true)
    public @NotNull Optional<T> getResult() {
        return Optional.ofNullable(result);
    }

    /**
     * Retrieves the error of the transaction if it resulted in an error.
     *
     * @return an Optional containing the error if the transaction resulted in an error,
     *         or an empty Optional if the transaction was successful.
     */
    @Contract(pure = true)
    public @NotNull Optional<UnitOfWorkException> getError() {
        return Optional.ofNullable(error);
    }

    /**
     * Runs the given consumer on the result of the transaction if it was successful.
     * Does nothing if the transaction resulted in an error.
     *
     * @param consumer the consumer to be run on the result
     */
    public void ifSuccess(Consumer<T> consumer) {
        if (isSuccess()) consumer.accept(result);
    }

    /**
     * Runs the given consumer on the error of the transaction if it resulted in an error.
     * Does nothing if the transaction was successful.
     *
     * @param consumer the consumer to be run on the error
     */
    public void ifError(Consumer<UnitOfWorkException> consumer) {
        if (isError()) consumer.accept(error);
    }

    /**
     * Applies the given function to the result of the transaction if it was successful,
     * or returns a failed TransactionResult with the same error otherwise.
     */
    public <E> TransactionResult<E> map(Function<T, E> function) {
        if (isSuccess()) return TransactionResult.success(function.apply(result));
        return TransactionResult.failure(error);
    }

    /**
     * Chains another result-producing step onto a successful result. A failed result is
     * passed through unchanged and the function is never called.
     */
    public <E> TransactionResult<E> flatMap(Function<T, TransactionResult<E>> function) {
        if (isSuccess()) return function.apply(result);
        return TransactionResult.failure(error);
    }

    /**
     * If this transaction result is successful, returns the given transaction result.
     * If this transaction result resulted in an error, returns this transaction result.
     */
    public TransactionResult<T> and(TransactionResult<T> other) {
        if (isError()) return this;
        return other;
    }

    /**
     * If this transaction result was successful, returns this transaction result.
     * If this transaction result resulted in an error, returns the given transaction result.
     */
    public TransactionResult<T> or(TransactionResult<T> other) {
        if (isSuccess()) return this;
        return other;
    }

    /**
     * Retrieves the result of the transaction if it was successful, or returns the given
     * value if the transaction resulted in an error.
     */
    public T getOr(T fallback) {
        if (isSuccess()) return this.result;
        return fallback;
    }

    /**
     * Retrieves the result of the transaction if it was successful, or throws the
     * carried {@link UnitOfWorkException}.
     *
     * @return the result of the transaction if successful
     * @throws UnitOfWorkException if the transaction resulted in an error
     */
    public T expect() {
        if (isSuccess()) return result;
        throw error;
    }

    /**
     * Same as {@link #expect()} but wraps the error in a new exception of the same kind
     * with the given message, so the caller's context shows up in the stack trace.
     */
    public T expect(String message) {
        if (isSuccess()) return result;
        throw new UnitOfWorkException(error.getKind(), error.getName().orElse(null), error.getPhase().orElse(null), message, error);
    }

    @Override
    public String toString() {
        return isSuccess() ? "TransactionResult[success=" + result + "]" : "TransactionResult[error=" + error.getKind() + ": " + error.getMessage() + "]";
    }
}
