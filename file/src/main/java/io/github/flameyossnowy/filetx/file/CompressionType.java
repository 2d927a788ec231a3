package io.github.flameyossnowy.filetx.file;

/**
 * Compression applied to entry files by {@link FileStorageBackend}.
 */
public enum CompressionType {
    GZIP
}
