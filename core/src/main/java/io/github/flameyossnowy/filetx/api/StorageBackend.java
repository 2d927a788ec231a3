package io.github.flameyossnowy.filetx.api;

import io.github.flameyossnowy.filetx.api.exceptions.ErrorKind;
import io.github.flameyossnowy.filetx.api.result.TransactionResult;
import org.jetbrains.annotations.NotNull;

import java.util.Collection;
import java.util.Optional;

/**
 * Durable store addressed by name, holding whole values. A {@link UnitOfWork} builds its
 * commit and rollback protocol on top of these calls and nothing else, so any store that
 * keeps the contracts below works: a directory, a map, a remote object store.
 * <p>
 * Implementations copy content on the way in and out; callers may reuse their arrays.
 * Names that are null, empty, or could escape a namespace are rejected with
 * {@link IllegalArgumentException}.
 */
public interface StorageBackend {
    /**
     * @param name the entry name
     * @return true if the entry is stored; false for absent entries
     */
    boolean exists(@NotNull String name);

    /**
     * Reads an entry.
     *
     * @param name the entry name
     * @return the stored content, or empty if the entry is absent
     */
    @NotNull
    Optional<byte[]> tryRead(@NotNull String name);

    /**
     * Creates or overwrites an entry.
     *
     * @return a successful result, or a failure of kind {@link ErrorKind#BACKEND_FAILURE}
     */
    @NotNull
    TransactionResult<Boolean> write(@NotNull String name, byte @NotNull [] content);

    /**
     * Removes an entry.
     *
     * @return a successful result, a failure of kind {@link ErrorKind#NOT_FOUND} if the entry
     *         was absent, or of kind {@link ErrorKind#BACKEND_FAILURE} if the store failed
     */
    @NotNull
    TransactionResult<Boolean> delete(@NotNull String name);

    /**
     * @return the names currently stored, in no particular order
     */
    @NotNull
    Collection<String> names();
}
