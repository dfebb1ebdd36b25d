package com.diskwatcher.app.inventory;

import java.io.IOException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.EnumSet;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.LongAdder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.diskwatcher.app.database.CatalogBusyException;
import com.diskwatcher.app.database.CatalogStore;
import com.diskwatcher.app.database.EventRecord;
import com.diskwatcher.app.database.EventType;
import com.diskwatcher.app.database.FileRecord;
import com.diskwatcher.app.inventory.ScanStats.Outcome;
import com.diskwatcher.app.service.JobProgress;
import com.diskwatcher.app.service.JobTracker;
import com.diskwatcher.app.service.TransitionResult;

/**
 * Bulk backfill of one volume: walks the tree and records a {@code discovered} event plus a
 * File row for every regular file. Owns the job transitions of the job id it is given.
 */
public final class ArchivalScanner {

    private static final Logger logger = LoggerFactory.getLogger(ArchivalScanner.class);

    private final CatalogStore store;
    private final JobTracker tracker;
    private final ScanConfig config;

    public ArchivalScanner(CatalogStore store, JobTracker tracker, ScanConfig config) {
        this.store = store;
        this.tracker = tracker;
        this.config = config;
    }

    static final class ScanMetrics {
        final LongAdder filesSeen = new LongAdder();
        final LongAdder dirsSkipped = new LongAdder();
        final LongAdder walkErrors = new LongAdder();
        final LongAdder droppedWrites = new LongAdder();
        volatile String lastPath;
    }

    public ScanStats scan(String volumeId, Path root, String jobId, AtomicBoolean cancel) {
        final Path rootAbs = root.toAbsolutePath().normalize();
        final Instant startedAt = store.clock().instant();
        final ScanMetrics metrics = new ScanMetrics();

        if (tracker.markRunning(jobId) == TransitionResult.CONFLICT) {
            // stopped before a worker picked it up
            return stats(volumeId, rootAbs, Outcome.STOPPED, metrics, startedAt, "cancelled before start");
        }
        logger.info("scan started volume={} root={} job={}", volumeId, rootAbs, jobId);

        if (!Files.isDirectory(rootAbs)) {
            return finish(jobId, stats(volumeId, rootAbs, Outcome.STOPPED, metrics, startedAt, "root missing"));
        }

        try {
            walk(volumeId, rootAbs, jobId, cancel, metrics);
        } catch (NoSuchFileException e) {
            return finish(jobId, stats(volumeId, rootAbs, Outcome.STOPPED, metrics, startedAt, "volume disappeared"));
        } catch (IOException e) {
            Outcome outcome = Files.isDirectory(rootAbs) ? Outcome.FAILED : Outcome.STOPPED;
            return finish(jobId, stats(volumeId, rootAbs, outcome, metrics, startedAt, String.valueOf(e.getMessage())));
        } catch (RuntimeException e) {
            logger.error("scan crashed volume={} root={}", volumeId, rootAbs, e);
            return finish(jobId, stats(volumeId, rootAbs, Outcome.FAILED, metrics, startedAt, e.toString()));
        }

        if (cancel.get() || Thread.currentThread().isInterrupted()) {
            return finish(jobId, stats(volumeId, rootAbs, Outcome.STOPPED, metrics, startedAt, "cancelled"));
        }
        if (!Files.isDirectory(rootAbs)) {
            return finish(jobId, stats(volumeId, rootAbs, Outcome.STOPPED, metrics, startedAt, "volume disappeared"));
        }
        return finish(jobId, stats(volumeId, rootAbs, Outcome.COMPLETED, metrics, startedAt, null));
    }

    private void walk(String volumeId, Path rootAbs, String jobId, AtomicBoolean cancel, ScanMetrics metrics)
            throws IOException {
        final ScanConfig.Excludes excludes = config.compile();
        final String rootText = rootAbs.toString();

        Files.walkFileTree(
            rootAbs,
            EnumSet.noneOf(FileVisitOption.class),
            Integer.MAX_VALUE,
            new SimpleFileVisitor<>() {

                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (cancel.get() || Thread.currentThread().isInterrupted()) return FileVisitResult.TERMINATE;
                    if (dir.equals(rootAbs)) return FileVisitResult.CONTINUE;

                    if (excludes.excludesDirectory(rootAbs.relativize(dir))) {
                        metrics.dirsSkipped.increment();
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (cancel.get() || Thread.currentThread().isInterrupted()) return FileVisitResult.TERMINATE;
                    if (!attrs.isRegularFile()) return FileVisitResult.CONTINUE;
                    if (excludes.excludesFile(rootAbs.relativize(file))) return FileVisitResult.CONTINUE;

                    EventRecord event = EventRecord.of(store.clock().instant(), EventType.DISCOVERED,
                            file.toString(), rootText, volumeId);
                    try {
                        store.recordChange(event, FileRecord.fromAttributes(volumeId, file, attrs));
                    } catch (CatalogBusyException e) {
                        metrics.droppedWrites.increment();
                        logger.warn("scan write dropped volume={} path={} attempts={}", volumeId, file, e.attempts());
                    }

                    metrics.filesSeen.increment();
                    metrics.lastPath = file.toString();
                    long seen = metrics.filesSeen.sum();
                    if (seen % config.heartbeatEvery() == 0) {
                        tracker.heartbeat(jobId, JobProgress.of(seen, metrics.lastPath));
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    if (file.equals(rootAbs) && exc instanceof NoSuchFileException) {
                        return FileVisitResult.TERMINATE;
                    }
                    metrics.walkErrors.increment();
                    logger.debug("scan walk error path={} error={}", file, exc.toString());
                    return FileVisitResult.CONTINUE;
                }
            }
        );
    }

    private ScanStats finish(String jobId, ScanStats stats) {
        switch (stats.outcome()) {
            case COMPLETED -> tracker.complete(jobId, stats.toProgress());
            case STOPPED -> tracker.stop(jobId, stats.message());
            case FAILED -> tracker.fail(jobId, stats.message(), stats.toProgress());
        }
        logger.info("scan finished volume={} outcome={} files={} walkErrors={} dropped={}",
                stats.volumeId(), stats.outcome(), stats.filesSeen(), stats.walkErrors(), stats.droppedWrites());
        return stats;
    }

    private ScanStats stats(String volumeId, Path root, Outcome outcome, ScanMetrics m, Instant startedAt, String message) {
        return new ScanStats(volumeId, root, outcome,
                m.filesSeen.sum(), m.dirsSkipped.sum(), m.walkErrors.sum(), m.droppedWrites.sum(),
                m.lastPath, startedAt, store.clock().instant(), message);
    }
}
