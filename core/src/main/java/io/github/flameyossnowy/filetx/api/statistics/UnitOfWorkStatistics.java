package io.github.flameyossnowy.filetx.api.statistics;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Counters for commits and rollbacks. Thread-safe, so one instance can be shared by
 * every unit of work of an application.
 */
public class UnitOfWorkStatistics {
    private final AtomicLong commits = new AtomicLong();
    private final AtomicLong failedCommits = new AtomicLong();
    private final AtomicLong dirtyRollbacks = new AtomicLong();
    private final AtomicLong cancelledCreates = new AtomicLong();
    private final LongAdder entriesWritten = new LongAdder();
    private final LongAdder entriesDeleted = new LongAdder();
    private final LongAdder totalCommitTime = new LongAdder();

    public static UnitOfWorkStatistics empty() {
        return new UnitOfWorkStatistics();
    }

    /**
     * Records a successful commit.
     *
     * @param written number of entries written
     * @param deleted number of entries deleted
     * @param elapsedMs the time the commit took in milliseconds
     */
    public void recordCommit(int written, int deleted, long elapsedMs) {
        commits.incrementAndGet();
        entriesWritten.add(written);
        entriesDeleted.add(deleted);
        totalCommitTime.add(elapsedMs);
    }

    /**
     * Records a failed commit and whether its rollback left anything unresolved.
     */
    public void recordFailedCommit(boolean clean, long elapsedMs) {
        failedCommits.incrementAndGet();
        if (!clean) dirtyRollbacks.incrementAndGet();
        totalCommitTime.add(elapsedMs);
    }

    public void recordCancelledCreate() {
        cancelledCreates.incrementAndGet();
    }

    public long getCommits() {
        return commits.get();
    }

    public long getFailedCommits() {
        return failedCommits.get();
    }

    /**
     * @return rollbacks that left at least one entry unresolved
     */
    public long getDirtyRollbacks() {
        return dirtyRollbacks.get();
    }

    public long getCancelledCreates() {
        return cancelledCreates.get();
    }

    public long getEntriesWritten() {
        return entriesWritten.sum();
    }

    public long getEntriesDeleted() {
        return entriesDeleted.sum();
    }

    public double getAverageCommitTime() {
        long total = commits.get() + failedCommits.get();
        return total == 0 ? 0 : (double) totalCommitTime.sum() / total;
    }

    public void reset() {
        commits.set(0);
        failedCommits.set(0);
        dirtyRollbacks.set(0);
        cancelledCreates.set(0);
        entriesWritten.reset();
        entriesDeleted.reset();
        totalCommitTime.reset();
    }

    @Override
    public String toString() {
        return String.format(
                "UnitOfWorkStatistics{commits=%d, failedCommits=%d, dirtyRollbacks=%d, cancelledCreates=%d, written=%d, deleted=%d, avgCommitTime=%.2fms}",
                getCommits(), getFailedCommits(), getDirtyRollbacks(), getCancelledCreates(),
                getEntriesWritten(), getEntriesDeleted(), getAverageCommitTime());
    }
}
