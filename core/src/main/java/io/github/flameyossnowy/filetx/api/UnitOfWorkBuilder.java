package io.github.flameyossnowy.filetx.api;

import io.github.flameyossnowy.filetx.api.backend.BackendNames;
import io.github.flameyossnowy.filetx.api.listener.UnitOfWorkListener;
import io.github.flameyossnowy.filetx.api.statistics.UnitOfWorkStatistics;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Builder for creating {@link UnitOfWork} instances.
 */
public class UnitOfWorkBuilder {
    private static final AtomicLong ID_GENERATOR = new AtomicLong(0);

    private final StorageBackend backend;
    private final List<UnitOfWorkListener> listeners = new ArrayList<>(2);
    private String id;
    private UnitOfWorkStatistics statistics;

    /**
     * Creates a new builder for units of work over the given backend.
     */
    public UnitOfWorkBuilder(@NotNull StorageBackend backend) {
        this.backend = Objects.requireNonNull(backend, "backend");
    }

    /**
     * Names the unit of work in logs and compensation reports. Defaults to {@code uow-<n>}.
     * The id ends up in report file names, so it follows the same rules as entry names.
     */
    public UnitOfWorkBuilder id(@NotNull String id) {
        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        this.id = BackendNames.validate(id);
        return this;
    }

    public UnitOfWorkBuilder listener(@NotNull UnitOfWorkListener listener) {
        this.listeners.add(Objects.requireNonNull(listener, "listener"));
        return this;
    }

    /**
     * Shares a statistics instance between units of work. Each unit gets its own otherwise.
     */
    public UnitOfWorkBuilder statistics(@NotNull UnitOfWorkStatistics statistics) {
        this.statistics = Objects.requireNonNull(statistics, "statistics");
        return this;
    }

    /**
     * Builds and returns a new, empty {@link UnitOfWork}.
     */
    public UnitOfWork build() {
        return new UnitOfWork(
                id != null ? id : "uow-" + ID_GENERATOR.incrementAndGet(),
                backend,
                listeners,
                statistics != null ? statistics : UnitOfWorkStatistics.empty()
        );
    }
}
