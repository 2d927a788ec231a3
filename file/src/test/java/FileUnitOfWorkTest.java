import io.github.flameyossnowy.filetx.api.CommitPhase;
import io.github.flameyossnowy.filetx.api.UnitOfWork;
import io.github.flameyossnowy.filetx.api.UnitOfWorkState;
import io.github.flameyossnowy.filetx.api.exceptions.ErrorKind;
import io.github.flameyossnowy.filetx.api.exceptions.UnitOfWorkException;
import io.github.flameyossnowy.filetx.api.report.CompensationReport;
import io.github.flameyossnowy.filetx.api.result.TransactionResult;
import io.github.flameyossnowy.filetx.file.CompensationReportWriter;
import io.github.flameyossnowy.filetx.file.FileStorageBackend;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FileUnitOfWorkTest {

    @TempDir
    Path tempDir;

    FileStorageBackend backend;
    CompensationReportWriter reportWriter;

    @BeforeEach
    void setup() {
        backend = FileStorageBackend.builder(tempDir.resolve("data"))
                .compressed(true)
                .sync(true)
                .build();
        reportWriter = new CompensationReportWriter(tempDir.resolve("reports"));
    }

    static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    String read(String name) {
        return new String(backend.tryRead(name).orElseThrow(), StandardCharsets.UTF_8);
    }

    @Test
    void batchesOnDisk() throws IOException {
        UnitOfWork unit = UnitOfWork.builder(backend).id("disk-unit").listener(reportWriter).build();

        unit.stageCreate("file1", bytes("content"));
        unit.stageCreate("file2", bytes("content"));
        unit.stageCreate("file3", bytes("content"));
        assertTrue(unit.commit().isSuccess());
        assertEquals(Set.of("file1", "file2", "file3"), Set.copyOf(backend.names()));
        assertTrue(reportWriter.reports().isEmpty(), "no report for a successful commit");

        unit.stageCreate("file4", bytes("content"));
        unit.stageCreate("file5", bytes("content"));
        unit.stageDelete("file1");
        unit.stageDelete("file2");
        unit.stageDelete("file3");

        Files.delete(backend.getEntryPath("file3"));

        TransactionResult<Boolean> result = unit.commit();

        assertTrue(result.isError(ErrorKind.BACKEND_FAILURE));
        assertEquals(ErrorKind.NOT_FOUND, result.getError().orElseThrow().getRootKind());
        assertEquals(Set.of("file1", "file2"), Set.copyOf(backend.names()));
        assertEquals("content", read("file1"));
        assertEquals("content", read("file2"));
        assertEquals(UnitOfWorkState.ROLLED_BACK, unit.state());

        List<Path> reports = reportWriter.reports();
        assertEquals(1, reports.size());
        assertTrue(reports.get(0).getFileName().toString().startsWith("disk-unit-"));

        CompensationReport written = reportWriter.read(reports.get(0));
        assertEquals(unit.lastCompensationReport().orElseThrow(), written);
        assertEquals(CommitPhase.APPLY_DELETES, written.failedPhase());
        assertEquals("file3", written.failedName());
        assertEquals(List.of("file5", "file4", "file2", "file1"), written.compensated());
        assertTrue(written.isClean());
    }

    @Test
    void onlyUnresolvedWriterSkipsCleanRollbacks() throws IOException {
        CompensationReportWriter dirtyOnly = new CompensationReportWriter(tempDir.resolve("dirty"), true);
        backend.write("gone", bytes("x"));

        UnitOfWork unit = UnitOfWork.builder(backend).listener(dirtyOnly).build();
        unit.stageCreate("new", bytes("y"));
        unit.stageDelete("gone");
        backend.delete("gone");

        assertTrue(unit.commit().isError());
        assertFalse(backend.exists("new"));
        assertTrue(dirtyOnly.reports().isEmpty());
    }

    @Test
    void committedFilesSurviveNewBackendInstance() {
        try (UnitOfWork unit = UnitOfWork.of(backend)) {
            unit.stageCreate("persisted", bytes("data"));
            assertTrue(unit.commit().isSuccess());
        }

        FileStorageBackend reopened = FileStorageBackend.builder(tempDir.resolve("data")).compressed(true).build();
        assertArrayEquals(bytes("data"), reopened.tryRead("persisted").orElseThrow());
    }

    @Test
    void unreadableEntryFailsStagingInsteadOfThrowing() throws IOException {
        Files.write(backend.getEntryPath("corrupt"), new byte[]{1, 2, 3});
        UnitOfWork unit = UnitOfWork.of(backend);

        TransactionResult<Boolean> result = unit.stageDelete("corrupt");

        assertTrue(result.isError(ErrorKind.BACKEND_FAILURE));
        UnitOfWorkException error = result.getError().orElseThrow();
        assertEquals("corrupt", error.getName().orElseThrow());
        assertTrue(error.getPhase().isEmpty());
        assertInstanceOf(UncheckedIOException.class, error.getCause());
        assertTrue(unit.pendingDeletes().isEmpty());
        assertEquals(UnitOfWorkState.EMPTY, unit.state());
        assertTrue(Files.exists(backend.getEntryPath("corrupt")));
    }

    @Test
    void reportsOfSameUnitAndInstantAreKeptApart() throws IOException {
        Instant now = Instant.now();
        CompensationReport first = new CompensationReport("u", CommitPhase.APPLY_DELETES, "a", "first",
                List.of(), List.of("a"), List.of(), now);
        CompensationReport second = new CompensationReport("u", CommitPhase.APPLY_DELETES, "b", "second",
                List.of(), List.of("b"), List.of(), now);
        UnitOfWork unit = UnitOfWork.of(backend);

        reportWriter.onRolledBack(unit, first);
        reportWriter.onRolledBack(unit, second);

        List<Path> reports = reportWriter.reports();
        assertEquals(2, reports.size());
        Set<String> failed = Set.of(
                reportWriter.read(reports.get(0)).failedName(),
                reportWriter.read(reports.get(1)).failedName());
        assertEquals(Set.of("a", "b"), failed);
    }

    @Test
    void reportWithPathLikeUnitIdIsNotWritten() throws IOException {
        CompensationReport report = new CompensationReport("../escape", CommitPhase.APPLY_CREATES, "a", "boom",
                List.of(), List.of("a"), List.of(), Instant.now());

        reportWriter.onRolledBack(UnitOfWork.of(backend), report);

        assertTrue(reportWriter.reports().isEmpty());
        try (var files = Files.list(tempDir)) {
            assertTrue(files.noneMatch(path -> path.getFileName().toString().endsWith(".json")));
        }
    }
}
