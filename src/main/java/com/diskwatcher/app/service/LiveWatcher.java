package com.diskwatcher.app.service;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_DELETE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;
import static java.nio.file.StandardWatchEventKinds.OVERFLOW;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.diskwatcher.app.database.CatalogBusyException;
import com.diskwatcher.app.database.CatalogStore;
import com.diskwatcher.app.database.EventRecord;
import com.diskwatcher.app.database.EventType;
import com.diskwatcher.app.database.FileRecord;

/**
 * Incremental capture for one volume: forwards OS change notifications into the catalog in
 * delivery order until cancelled. Best effort; an OS overflow is logged and not recovered.
 */
public final class LiveWatcher {

    private static final Logger logger = LoggerFactory.getLogger(LiveWatcher.class);

    public static final Duration DEFAULT_HEARTBEAT = Duration.ofSeconds(30);
    private static final long POLL_MILLIS = 250;

    public enum Outcome { STOPPED, FAILED }

    public record WatchStats(String volumeId, Path directory, Outcome outcome, long eventsSeen,
                             long droppedWrites, long overflows, String message) {}

    private final CatalogStore store;
    private final JobTracker tracker;
    private final Duration heartbeatInterval;

    public LiveWatcher(CatalogStore store, JobTracker tracker) {
        this(store, tracker, DEFAULT_HEARTBEAT);
    }

    public LiveWatcher(CatalogStore store, JobTracker tracker, Duration heartbeatInterval) {
        this.store = store;
        this.tracker = tracker;
        this.heartbeatInterval = heartbeatInterval;
    }

    /** Blocks until cancelled, interrupted, or the volume goes away. Owns the job's transitions. */
    public WatchStats watch(String volumeId, Path directory, String jobId, AtomicBoolean cancel) {
        Session s = new Session(volumeId, directory.toAbsolutePath().normalize(), jobId);
        try (WatchService watcher = FileSystems.getDefault().newWatchService()) {
            s.watcher = watcher;
            s.registerTree(s.root);

            if (tracker.markRunning(jobId) == TransitionResult.CONFLICT) {
                return s.result(Outcome.STOPPED, "cancelled before start");
            }
            logger.info("watch started volume={} dir={} job={} dirs={}", volumeId, s.root, jobId, s.keyToDir.size());

            while (!cancel.get() && !Thread.currentThread().isInterrupted()) {
                WatchKey key = watcher.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (key == null) {
                    if (!Files.isDirectory(s.root)) return s.finish(Outcome.STOPPED, "volume disappeared");
                    s.maybeHeartbeat();
                    continue;
                }

                Path dir = s.keyToDir.get(key);
                if (dir == null) {
                    key.reset();
                    continue;
                }

                for (WatchEvent<?> ev : key.pollEvents()) {
                    s.handle(dir, ev);
                }

                if (!key.reset()) {
                    s.keyToDir.remove(key);
                    if (dir.equals(s.root)) return s.finish(Outcome.STOPPED, "volume disappeared");
                }
                s.maybeHeartbeat();
            }
            return s.finish(Outcome.STOPPED, "cancelled");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return s.finish(Outcome.STOPPED, "cancelled");
        } catch (ClosedWatchServiceException e) {
            return s.finish(Outcome.STOPPED, "watch service closed");
        } catch (NoSuchFileException e) {
            return s.finish(Outcome.STOPPED, "root missing");
        } catch (IOException | RuntimeException e) {
            logger.error("watch crashed volume={} dir={}", volumeId, s.root, e);
            return s.finish(Outcome.FAILED, e.toString());
        }
    }

    private final class Session {
        final String volumeId;
        final Path root;
        final String rootText;
        final String jobId;
        final Map<WatchKey, Path> keyToDir = new HashMap<>();
        WatchService watcher;

        long eventsSeen;
        long droppedWrites;
        long overflows;
        String lastPath;
        Instant lastHeartbeat;

        Session(String volumeId, Path root, String jobId) {
            this.volumeId = volumeId;
            this.root = root;
            this.rootText = root.toString();
            this.jobId = jobId;
            this.lastHeartbeat = store.clock().instant();
        }

        void registerTree(Path start) throws IOException {
            Files.walkFileTree(start, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                    WatchKey key = dir.register(watcher, ENTRY_CREATE, ENTRY_DELETE, ENTRY_MODIFY);
                    keyToDir.put(key, dir);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
                    if (file.equals(root)) throw exc;
                    logger.debug("watch register skipped path={} error={}", file, exc.toString());
                    return FileVisitResult.CONTINUE;
                }
            });
        }

        void handle(Path dir, WatchEvent<?> ev) {
            WatchEvent.Kind<?> kind = ev.kind();
            if (kind == OVERFLOW) {
                overflows++;
                logger.warn("watch overflow, events lost volume={} dir={}", volumeId, dir);
                return;
            }

            Path full = dir.resolve((Path) ev.context());
            Instant now = store.clock().instant();
            eventsSeen++;
            lastPath = full.toString();

            if (kind == ENTRY_DELETE) {
                boolean wasDirectory = keyToDir.containsValue(full);
                EventRecord event = EventRecord.of(now, EventType.DELETED, full.toString(), rootText, volumeId);
                write(() -> {
                    if (wasDirectory) store.recordEvent(event);
                    else store.recordChange(event, null);
                }, full);
                return;
            }

            boolean isDirectory = Files.isDirectory(full, LinkOption.NOFOLLOW_LINKS);
            if (isDirectory && kind == ENTRY_MODIFY) {
                // child churn shows up as directory mtime changes
                eventsSeen--;
                return;
            }

            EventType type = kind == ENTRY_CREATE ? EventType.CREATED : EventType.MODIFIED;
            EventRecord event = EventRecord.of(now, type, full.toString(), rootText, volumeId);

            if (isDirectory) {
                try {
                    registerTree(full);
                } catch (IOException e) {
                    logger.debug("watch register failed dir={} error={}", full, e.toString());
                }
                write(() -> store.recordEvent(event), full);
                return;
            }

            FileRecord file = statOrNull(full);
            write(() -> store.recordChange(event, file), full);
        }

        private FileRecord statOrNull(Path file) {
            try {
                if (!Files.isRegularFile(file, LinkOption.NOFOLLOW_LINKS)) return null;
                return FileRecord.stat(volumeId, file);
            } catch (IOException e) {
                logger.debug("stat failed path={} error={}", file, e.toString());
                return null;
            }
        }

        private void write(Runnable op, Path path) {
            try {
                op.run();
            } catch (CatalogBusyException e) {
                droppedWrites++;
                logger.warn("watch write dropped volume={} path={} attempts={}", volumeId, path, e.attempts());
            }
        }

        void maybeHeartbeat() {
            Instant now = store.clock().instant();
            if (Duration.between(lastHeartbeat, now).compareTo(heartbeatInterval) < 0) return;
            lastHeartbeat = now;
            tracker.heartbeat(jobId, progress());
        }

        JobProgress progress() {
            return new JobProgress(eventsSeen, null, lastPath, null)
                    .withStat("events_seen", eventsSeen)
                    .withStat("dropped_writes", droppedWrites)
                    .withStat("overflows", overflows);
        }

        WatchStats result(Outcome outcome, String message) {
            return new WatchStats(volumeId, root, outcome, eventsSeen, droppedWrites, overflows, message);
        }

        WatchStats finish(Outcome outcome, String message) {
            if (outcome == Outcome.FAILED) {
                tracker.fail(jobId, message, progress());
            } else {
                tracker.heartbeat(jobId, progress());
                tracker.stop(jobId, message);
            }
            logger.info("watch finished volume={} outcome={} events={} dropped={} reason={}",
                    volumeId, outcome, eventsSeen, droppedWrites, message);
            return result(outcome, message);
        }
    }
}
