package io.github.flameyossnowy.filetx.file;

import org.jetbrains.annotations.NotNull;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Builder for creating {@link FileStorageBackend} instances.
 */
public class FileStorageBackendBuilder {
    private final Path basePath;
    private boolean compressed = false;
    private CompressionType compressionType = CompressionType.GZIP;
    private boolean sharding = false;
    private int shardCount = 256;
    private boolean sync = false;
    private String extension = ".bin";

    /**
     * Creates a new builder for a backend rooted at the given directory.
     */
    public FileStorageBackendBuilder(@NotNull Path basePath) {
        this.basePath = Objects.requireNonNull(basePath, "basePath");
    }

    public FileStorageBackendBuilder compressed(boolean compressed) {
        this.compressed = compressed;
        return this;
    }

    public FileStorageBackendBuilder compressionType(@NotNull CompressionType compressionType) {
        this.compressionType = Objects.requireNonNull(compressionType, "compressionType");
        return this;
    }

    public FileStorageBackendBuilder sharding(boolean sharding) {
        this.sharding = sharding;
        return this;
    }

    public FileStorageBackendBuilder shardCount(int shardCount) {
        this.shardCount = shardCount;
        return this;
    }

    /**
     * Forces every write to disk before it is moved into place.
     */
    public FileStorageBackendBuilder sync(boolean sync) {
        this.sync = sync;
        return this;
    }

    /**
     * File extension of entry files, with or without the leading dot.
     */
    public FileStorageBackendBuilder extension(@NotNull String extension) {
        this.extension = extension.startsWith(".") ? extension : "." + extension;
        return this;
    }

    /**
     * Builds and returns a new {@link FileStorageBackend}, creating its directories.
     */
    public FileStorageBackend build() {
        if (sharding && shardCount <= 0) {
            throw new IllegalStateException("shardCount must be positive when sharding is enabled");
        }
        if (extension.length() < 2 || extension.endsWith(FileStorageBackend.TEMP_SUFFIX)) {
            throw new IllegalStateException("Illegal extension: " + extension);
        }

        return new FileStorageBackend(
                basePath,
                compressed,
                compressionType,
                sharding,
                shardCount,
                sync,
                extension
        );
    }
}
