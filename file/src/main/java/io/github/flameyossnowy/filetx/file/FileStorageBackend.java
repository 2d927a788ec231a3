package io.github.flameyossnowy.filetx.file;

import io.github.flameyossnowy.filetx.api.StorageBackend;
import io.github.flameyossnowy.filetx.api.backend.BackendNames;
import io.github.flameyossnowy.filetx.api.exceptions.ErrorKind;
import io.github.flameyossnowy.filetx.api.exceptions.UnitOfWorkException;
import io.github.flameyossnowy.filetx.api.result.TransactionResult;
import io.github.flameyossnowy.filetx.api.utils.Logging;
import org.jetbrains.annotations.NotNull;

import java.io.*;
import java.nio.file.*;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.zip.DeflaterOutputStream;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * {@link StorageBackend} keeping one file per entry under a base directory.
 * <p>
 * Layout: {@code <base>/<name><ext>}, or {@code <base>/<shard>/<name><ext>} with sharding.
 * Writes go to a {@code .tmp} sibling first and are moved over the entry file, so a reader
 * sees either the old or the new content. Leftover temporary files are never reported as
 * entries.
 */
public class FileStorageBackend implements StorageBackend {
    static final String TEMP_SUFFIX = ".tmp";

    private static final int STRIPE_COUNT = 64;

    private final Path basePath;
    private final boolean compressed;
    private final CompressionType compressionType;
    private final boolean sharding;
    private final int shardCount;
    private final boolean sync;
    private final String extension;

    private final ReentrantReadWriteLock[] stripes = new ReentrantReadWriteLock[STRIPE_COUNT];

    {
        for (int i = 0; i < STRIPE_COUNT; i++) {
            stripes[i] = new ReentrantReadWriteLock();
        }
    }

    FileStorageBackend(
            @NotNull Path basePath,
            boolean compressed,
            @NotNull CompressionType compressionType,
            boolean sharding,
            int shardCount,
            boolean sync,
            @NotNull String extension
    ) {
        this.basePath = basePath;
        this.compressed = compressed;
        this.compressionType = compressionType;
        this.sharding = sharding;
        this.shardCount = shardCount;
        this.sync = sync;
        this.extension = extension;

        try {
            Files.createDirectories(basePath);
            if (sharding) {
                for (int i = 0; i < shardCount; i++) {
                    Files.createDirectories(basePath.resolve(String.valueOf(i)));
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create base directory: " + basePath, e);
        }
    }

    public static FileStorageBackendBuilder builder(@NotNull Path basePath) {
        return new FileStorageBackendBuilder(basePath);
    }

    private ReentrantReadWriteLock getLockForName(String name) {
        return stripes[(name.hashCode() & Integer.MAX_VALUE) % STRIPE_COUNT];
    }

    public Path getEntryPath(@NotNull String name) {
        String fileName = BackendNames.validate(name) + extension;

        if (sharding) {
            int shard = Math.abs(name.hashCode() % shardCount);
            return basePath.resolve(String.valueOf(shard)).resolve(fileName);
        }

        return basePath.resolve(fileName);
    }

    private Path getTempPath(Path entryPath) {
        return entryPath.resolveSibling(entryPath.getFileName() + TEMP_SUFFIX);
    }

    @Override
    public boolean exists(@NotNull String name) {
        Path path = getEntryPath(name);
        ReentrantReadWriteLock lock = getLockForName(name);
        lock.readLock().lock();
        try {
            return Files.isRegularFile(path);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public @NotNull Optional<byte[]> tryRead(@NotNull String name) {
        Path path = getEntryPath(name);
        ReentrantReadWriteLock lock = getLockForName(name);
        lock.readLock().lock();
        try (InputStream is = Files.newInputStream(path)) {
            InputStream input = compressed ? unwrapCompression(is) : is;
            return Optional.of(input.readAllBytes());
        } catch (NoSuchFileException | FileNotFoundException e) {
            return Optional.empty();
        } catch (IOException e) {
            Logging.error("Error reading entry file " + path, e);
            throw new UncheckedIOException("Failed to read entry: " + name, e);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public @NotNull TransactionResult<Boolean> write(@NotNull String name, byte @NotNull [] content) {
        Path path = getEntryPath(name);
        Path tmpPath = getTempPath(path);
        ReentrantReadWriteLock lock = getLockForName(name);
        lock.writeLock().lock();
        try {
            Files.createDirectories(path.getParent());
            writeFile(tmpPath, content);
            Files.move(tmpPath, path, ATOMIC_MOVE, REPLACE_EXISTING);
            Logging.deepInfo("Wrote entry file " + path + " (" + content.length + " bytes)");
            return TransactionResult.ok();
        } catch (IOException e) {
            Logging.error("Error writing entry file " + path, e);
            discardTemp(tmpPath);
            return TransactionResult.failure(new UnitOfWorkException(ErrorKind.BACKEND_FAILURE, name, null,
                    "Failed to write entry [" + name + "]: " + e.getMessage(), e));
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void writeFile(Path path, byte[] content) throws IOException {
        try (FileOutputStream fos = new FileOutputStream(path.toFile(), false)) {
            if (compressed) {
                DeflaterOutputStream output = wrapCompression(fos);
                output.write(content);
                // finish, not close: the descriptor is still needed for sync
                output.finish();
            } else {
                fos.write(content);
            }

            if (sync) {
                fos.flush();
                fos.getFD().sync();
            }
        }
    }

    private void discardTemp(Path tmpPath) {
        try {
            Files.deleteIfExists(tmpPath);
        } catch (IOException e) {
            Logging.error("Could not remove temporary file " + tmpPath, e);
        }
    }

    @Override
    public @NotNull TransactionResult<Boolean> delete(@NotNull String name) {
        Path path = getEntryPath(name);
        ReentrantReadWriteLock lock = getLockForName(name);
        lock.writeLock().lock();
        try {
            Files.delete(path);
            Logging.deepInfo("Deleted entry file " + path);
            return TransactionResult.ok();
        } catch (NoSuchFileException e) {
            return TransactionResult.failure(UnitOfWorkException.notFound(name));
        } catch (IOException e) {
            Logging.error("Error deleting entry file " + path, e);
            return TransactionResult.failure(new UnitOfWorkException(ErrorKind.BACKEND_FAILURE, name, null,
                    "Failed to delete entry [" + name + "]: " + e.getMessage(), e));
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public @NotNull Collection<String> names() {
        List<String> names = new ArrayList<>();
        try {
            if (sharding) {
                for (int i = 0; i < shardCount; i++) {
                    scanDirectory(basePath.resolve(String.valueOf(i)), names);
                }
            } else {
                scanDirectory(basePath, names);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list entries under " + basePath, e);
        }
        return Collections.unmodifiableList(names);
    }

    private void scanDirectory(Path directory, List<String> names) throws IOException {
        if (!Files.isDirectory(directory)) return;

        try (var files = Files.list(directory)) {
            for (Path path : (Iterable<Path>) files::iterator) {
                if (!Files.isRegularFile(path)) continue;
                String fileName = path.getFileName().toString();
                if (!fileName.endsWith(extension)) continue;
                names.add(fileName.substring(0, fileName.length() - extension.length()));
            }
        }
    }

    private DeflaterOutputStream wrapCompression(OutputStream os) throws IOException {
        return switch (compressionType) {
            case GZIP -> new GZIPOutputStream(os);
        };
    }

    private InputStream unwrapCompression(InputStream is) throws IOException {
        return switch (compressionType) {
            case GZIP -> new GZIPInputStream(is);
        };
    }

    public Path getBasePath() {
        return basePath;
    }

    public boolean isCompressed() {
        return compressed;
    }

    public boolean isSharding() {
        return sharding;
    }
}
