package io.github.flameyossnowy.filetx.file;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.flameyossnowy.filetx.api.UnitOfWork;
import io.github.flameyossnowy.filetx.api.backend.BackendNames;
import io.github.flameyossnowy.filetx.api.listener.UnitOfWorkListener;
import io.github.flameyossnowy.filetx.api.report.CompensationReport;
import io.github.flameyossnowy.filetx.api.utils.Logging;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Listener that persists every {@link CompensationReport} as a JSON file, so operators can
 * find entries a rollback could not restore.
 * <p>
 * Files are named {@code <unit-id>-<epoch-millis>.json}. A name that is already taken gets a
 * {@code -1}, {@code -2}, ... suffix, so reports are never overwritten. With
 * {@code onlyUnresolved} set, clean rollbacks are not written.
 */
public class CompensationReportWriter implements UnitOfWorkListener {
    private final Path directory;
    private final boolean onlyUnresolved;
    private final ObjectMapper objectMapper;

    public CompensationReportWriter(@NotNull Path directory) {
        this(directory, false);
    }

    public CompensationReportWriter(@NotNull Path directory, boolean onlyUnresolved) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.onlyUnresolved = onlyUnresolved;

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create report directory: " + directory, e);
        }
    }

    @Override
    public void onRolledBack(@NotNull UnitOfWork unit, @NotNull CompensationReport report) {
        if (onlyUnresolved && report.isClean()) return;

        String prefix = report.unitId() + "-" + report.timestamp().toEpochMilli();
        try {
            BackendNames.validate(report.unitId());
            Path path = createReportFile(prefix);
            try (OutputStream out = Files.newOutputStream(path, StandardOpenOption.WRITE)) {
                objectMapper.writeValue(out, report);
            }
            Logging.info("Wrote compensation report " + path);
        } catch (IOException | IllegalArgumentException e) {
            // report write failures never reach the caller
            Logging.error("Failed to write compensation report " + prefix + " for " + report, e);
        }
    }

    // <prefix>.json, then <prefix>-1.json, <prefix>-2.json, ... until one is free
    private Path createReportFile(String prefix) throws IOException {
        for (int attempt = 0; ; attempt++) {
            Path path = directory.resolve(attempt == 0 ? prefix + ".json" : prefix + "-" + attempt + ".json");
            try {
                return Files.createFile(path);
            } catch (FileAlreadyExistsException e) {
                Logging.deepInfo("Report file " + path + " taken, trying next suffix");
            }
        }
    }

    /**
     * Reads back a report written by this writer.
     */
    public @NotNull CompensationReport read(@NotNull Path path) throws IOException {
        return objectMapper.readValue(path.toFile(), CompensationReport.class);
    }

    /**
     * @return every report file in the directory
     */
    public @NotNull List<Path> reports() throws IOException {
        List<Path> reports = new ArrayList<>();
        try (var files = Files.list(directory)) {
            for (Path path : (Iterable<Path>) files::iterator) {
                if (Files.isRegularFile(path) && path.getFileName().toString().endsWith(".json")) {
                    reports.add(path);
                }
            }
        }
        reports.sort(null);
        return reports;
    }

    public Path getDirectory() {
        return directory;
    }
}
