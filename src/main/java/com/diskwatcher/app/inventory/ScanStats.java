package com.diskwatcher.app.inventory;

import java.nio.file.Path;
import java.time.Instant;

import com.diskwatcher.app.service.JobProgress;

/** Final accounting of one archival scan. */
public record ScanStats(
        String volumeId,
        Path root,
        Outcome outcome,
        long filesSeen,
        long dirsSkipped,
        long walkErrors,
        long droppedWrites,
        String lastPath,
        Instant startedAt,
        Instant finishedAt,
        String message
) {
    public enum Outcome {
        COMPLETED,
        STOPPED,
        FAILED
    }

    public JobProgress toProgress() {
        return new JobProgress(filesSeen, filesSeen, lastPath, null)
                .withStat("dirs_skipped", dirsSkipped)
                .withStat("walk_errors", walkErrors)
                .withStat("dropped_writes", droppedWrites);
    }
}
