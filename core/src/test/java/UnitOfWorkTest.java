import io.github.flameyossnowy.filetx.api.CommitPhase;
import io.github.flameyossnowy.filetx.api.UnitOfWork;
import io.github.flameyossnowy.filetx.api.UnitOfWorkState;
import io.github.flameyossnowy.filetx.api.backend.InMemoryStorageBackend;
import io.github.flameyossnowy.filetx.api.exceptions.ErrorKind;
import io.github.flameyossnowy.filetx.api.exceptions.UnitOfWorkException;
import io.github.flameyossnowy.filetx.api.report.CompensationReport;
import io.github.flameyossnowy.filetx.api.result.TransactionResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class UnitOfWorkTest {

    InMemoryStorageBackend backend;
    UnitOfWork unit;

    @BeforeEach
    void setup() {
        backend = new InMemoryStorageBackend();
        unit = UnitOfWork.builder(backend).id("test-unit").build();
    }

    static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    String read(String name) {
        return new String(backend.tryRead(name).orElseThrow(), StandardCharsets.UTF_8);
    }

    @Test
    void createThenCommitStoresContent() {
        assertTrue(unit.stageCreate("a", bytes("hello")).isSuccess());
        assertFalse(backend.exists("a"), "Staging must not touch the backend");

        assertTrue(unit.commit().isSuccess());

        assertEquals("hello", read("a"));
        assertEquals(UnitOfWorkState.EMPTY, unit.state());
        assertTrue(unit.isEmpty());
    }

    @Test
    void createOfExistingEntryFailsAndLeavesBackendAlone() {
        backend.write("a", bytes("original"));

        TransactionResult<Boolean> result = unit.stageCreate("a", bytes("other"));

        assertTrue(result.isError(ErrorKind.ALREADY_EXISTS));
        assertEquals("a", result.getError().orElseThrow().getName().orElseThrow());
        assertTrue(unit.commit().isSuccess());
        assertEquals("original", read("a"));
    }

    @Test
    void deleteThenCommitRemovesEntry() {
        backend.write("a", bytes("x"));

        assertTrue(unit.stageDelete("a").isSuccess());
        assertTrue(backend.exists("a"), "Staging must not touch the backend");

        assertTrue(unit.commit().isSuccess());
        assertFalse(backend.exists("a"));
    }

    @Test
    void deleteOfMissingEntryFails() {
        TransactionResult<Boolean> result = unit.stageDelete("ghost");

        assertTrue(result.isError(ErrorKind.NOT_FOUND));
        assertEquals(UnitOfWorkState.EMPTY, unit.state());
    }

    @Test
    void deleteCancelsPendingCreate() {
        unit.stageCreate("temp", bytes("x"));
        assertEquals(UnitOfWorkState.STAGED, unit.state());

        assertTrue(unit.stageDelete("temp").isSuccess());

        assertTrue(unit.pendingCreates().isEmpty());
        assertTrue(unit.pendingDeletes().isEmpty());
        assertEquals(UnitOfWorkState.EMPTY, unit.state());
        assertTrue(unit.commit().isSuccess());
        assertFalse(backend.exists("temp"));
        assertEquals(1, unit.statistics().getCancelledCreates());
    }

    @Test
    void stagingSameNameTwiceKeepsLatestContent() {
        unit.stageCreate("a", bytes("first"));
        unit.stageCreate("a", bytes("second"));

        assertEquals(List.of("a"), unit.pendingCreates());
        assertTrue(unit.commit().isSuccess());
        assertEquals("second", read("a"));
    }

    @Test
    void stagedContentIsCopied() {
        byte[] content = bytes("abc");
        unit.stageCreate("a", content);
        content[0] = 'z';

        unit.commit();

        assertEquals("abc", read("a"));
    }

    @Test
    void createOfNamePendingDeletionIsRejected() {
        backend.write("a", bytes("x"));
        unit.stageDelete("a");
        backend.delete("a");

        assertTrue(unit.stageCreate("a", bytes("y")).isError(ErrorKind.ALREADY_EXISTS));
        assertEquals(List.of("a"), unit.pendingDeletes());
        assertTrue(unit.pendingCreates().isEmpty());
    }

    @Test
    void emptyCommitSucceeds() {
        assertTrue(unit.commit().isSuccess());
        assertTrue(unit.commit().isSuccess());
        assertEquals(UnitOfWorkState.EMPTY, unit.state());
        assertEquals(0, unit.statistics().getCommits());
    }

    @Test
    void pendingNamesKeepStagingOrder() {
        backend.write("d2", bytes("x"));
        backend.write("d1", bytes("x"));

        unit.stageCreate("c", bytes("x"));
        unit.stageCreate("a", bytes("x"));
        unit.stageCreate("b", bytes("x"));
        unit.stageDelete("d2");
        unit.stageDelete("d1");

        assertEquals(List.of("c", "a", "b"), unit.pendingCreates());
        assertEquals(List.of("d2", "d1"), unit.pendingDeletes());
    }

    @Test
    void batchesScenario() {
        assertTrue(unit.stageCreate("file1", bytes("content")).isSuccess());
        assertTrue(unit.stageCreate("file2", bytes("content")).isSuccess());
        assertTrue(unit.stageCreate("file3", bytes("content")).isSuccess());
        assertTrue(unit.commit().isSuccess());

        assertEquals(Set.of("file1", "file2", "file3"), Set.copyOf(backend.names()));
        assertEquals("content", read("file1"));
        assertEquals("content", read("file2"));
        assertEquals("content", read("file3"));

        assertTrue(unit.stageCreate("file4", bytes("content")).isSuccess());
        assertTrue(unit.stageCreate("file5", bytes("content")).isSuccess());
        assertTrue(unit.stageDelete("file1").isSuccess());
        assertTrue(unit.stageDelete("file2").isSuccess());
        assertTrue(unit.stageDelete("file3").isSuccess());

        // removed behind the unit's back
        assertTrue(backend.delete("file3").isSuccess());

        TransactionResult<Boolean> result = unit.commit();

        assertTrue(result.isError(ErrorKind.BACKEND_FAILURE));
        UnitOfWorkException error = result.getError().orElseThrow();
        assertEquals(ErrorKind.NOT_FOUND, error.getRootKind());
        assertEquals(CommitPhase.APPLY_DELETES, error.getPhase().orElseThrow());
        assertEquals("file3", error.getName().orElseThrow());
        assertFalse(error.hasCompensationFailures());

        assertEquals(Set.of("file1", "file2"), Set.copyOf(backend.names()));
        assertEquals("content", read("file1"));
        assertEquals("content", read("file2"));
        assertEquals(UnitOfWorkState.ROLLED_BACK, unit.state());

        CompensationReport report = unit.lastCompensationReport().orElseThrow();
        assertEquals("test-unit", report.unitId());
        assertEquals("file3", report.failedName());
        assertEquals(List.of("file5", "file4", "file2", "file1"), report.compensated());
        assertTrue(report.isClean());
    }

    @Test
    void buffersSurviveRollbackAndCanBeCleared() {
        backend.write("keep", bytes("x"));
        unit.stageCreate("new", bytes("y"));
        unit.stageDelete("keep");
        backend.delete("keep");

        assertTrue(unit.commit().isError());
        assertEquals(List.of("new"), unit.pendingCreates());
        assertEquals(List.of("keep"), unit.pendingDeletes());

        // same cause, same failure
        assertTrue(unit.commit().isError(ErrorKind.BACKEND_FAILURE));

        unit.clear();
        assertEquals(UnitOfWorkState.EMPTY, unit.state());
        assertTrue(unit.isEmpty());
        assertTrue(unit.stageCreate("new", bytes("y")).isSuccess());
        assertTrue(unit.commit().isSuccess());
        assertTrue(backend.exists("new"));
    }

    @Test
    void rolledBackUnitAcceptsMoreStaging() {
        backend.write("gone", bytes("x"));
        unit.stageDelete("gone");
        backend.delete("gone");
        unit.commit();

        assertTrue(unit.stageCreate("extra", bytes("x")).isSuccess());
        assertEquals(UnitOfWorkState.STAGED, unit.state());
    }

    @Test
    void closedUnitRejectsWork() {
        unit.stageCreate("a", bytes("x"));
        unit.close();

        assertEquals(UnitOfWorkState.CLOSED, unit.state());
        assertTrue(unit.stageCreate("b", bytes("x")).isError(ErrorKind.ILLEGAL_STATE));
        assertTrue(unit.stageDelete("a").isError(ErrorKind.ILLEGAL_STATE));
        assertTrue(unit.commit().isError(ErrorKind.ILLEGAL_STATE));
        assertFalse(backend.exists("a"));
    }

    @Test
    void tryWithResourcesDiscardsUncommittedWork() {
        try (UnitOfWork scoped = UnitOfWork.of(backend)) {
            scoped.stageCreate("a", bytes("x"));
        }

        assertFalse(backend.exists("a"));
    }

    @Test
    void nullArgumentsAreRejected() {
        assertThrows(NullPointerException.class, () -> unit.stageCreate(null, bytes("x")));
        assertThrows(NullPointerException.class, () -> unit.stageCreate("a", null));
        assertThrows(NullPointerException.class, () -> unit.stageDelete(null));
    }

    @Test
    void invalidNamesAreRejectedByBackend() {
        assertThrows(IllegalArgumentException.class, () -> unit.stageCreate("../escape", bytes("x")));
        assertThrows(IllegalArgumentException.class, () -> unit.stageCreate("", bytes("x")));
    }

    @Test
    void statisticsCountCommittedEntries() {
        backend.write("old", bytes("x"));
        unit.stageCreate("a", bytes("x"));
        unit.stageCreate("b", bytes("x"));
        unit.stageDelete("old");
        unit.commit();

        assertEquals(1, unit.statistics().getCommits());
        assertEquals(2, unit.statistics().getEntriesWritten());
        assertEquals(1, unit.statistics().getEntriesDeleted());
        assertEquals(0, unit.statistics().getFailedCommits());
    }

    @Test
    void idsThatCannotNameAFileAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> UnitOfWork.builder(backend).id("../x"));
        assertThrows(IllegalArgumentException.class, () -> UnitOfWork.builder(backend).id("a/b"));
        assertThrows(IllegalArgumentException.class, () -> UnitOfWork.builder(backend).id("  "));
        assertEquals("batch-7", UnitOfWork.builder(backend).id("batch-7").build().id());
    }

    @Test
    void generatedIdsAreDistinct() {
        assertNotEquals(UnitOfWork.of(backend).id(), UnitOfWork.of(backend).id());
    }
}
