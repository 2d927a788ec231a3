package io.github.flameyossnowy.filetx.api.backend;

import io.github.flameyossnowy.filetx.api.StorageBackend;
import io.github.flameyossnowy.filetx.api.exceptions.UnitOfWorkException;
import io.github.flameyossnowy.filetx.api.result.TransactionResult;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed {@link StorageBackend}. Thread-safe; meant for tests and for embedding
 * a unit of work in code that has no durable store.
 */
public class InMemoryStorageBackend implements StorageBackend {
    private final Map<String, byte[]> entries = new ConcurrentHashMap<>();

    public InMemoryStorageBackend() {
    }

    public InMemoryStorageBackend(@NotNull Map<String, byte[]> initial) {
        initial.forEach((name, content) -> entries.put(BackendNames.validate(name), content.clone()));
    }

    @Override
    public boolean exists(@NotNull String name) {
        return entries.containsKey(BackendNames.validate(name));
    }

    @Override
    public @NotNull Optional<byte[]> tryRead(@NotNull String name) {
        byte[] content = entries.get(BackendNames.validate(name));
        return content == null ? Optional.empty() : Optional.of(content.clone());
    }

    @Override
    public @NotNull TransactionResult<Boolean> write(@NotNull String name, byte @NotNull [] content) {
        entries.put(BackendNames.validate(name), content.clone());
        return TransactionResult.ok();
    }

    @Override
    public @NotNull TransactionResult<Boolean> delete(@NotNull String name) {
        if (entries.remove(BackendNames.validate(name)) == null) {
            return TransactionResult.failure(UnitOfWorkException.notFound(name));
        }
        return TransactionResult.ok();
    }

    @Override
    public @NotNull Collection<String> names() {
        return Collections.unmodifiableList(new ArrayList<>(entries.keySet()));
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
    }
}
