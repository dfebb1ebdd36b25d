package com.diskwatcher.app.service;

import com.diskwatcher.app.database.BusyRetry;
import com.diskwatcher.app.database.CatalogDatabase;
import com.diskwatcher.app.database.CatalogRows.FileRow;
import com.diskwatcher.app.database.CatalogStore;
import com.diskwatcher.app.database.JobStatus;
import com.diskwatcher.app.database.JobType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

public class LiveWatcherTest {

    @TempDir
    Path tmp;

    private CatalogDatabase database;
    private CatalogStore store;
    private JobTracker tracker;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        database = CatalogDatabase.open(tmp.resolve("watch.db"));
        store = new CatalogStore(database.jdbi(), new BusyRetry(), d -> Optional.empty(), Clock.systemUTC());
        tracker = new JobTracker(store);
        executor = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() {
        if (executor != null) executor.shutdownNow();
        if (database != null) database.close();
    }

    static void waitUntil(BooleanSupplier condition, String message) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(15);
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) return;
            Thread.sleep(50);
        }
        fail("Timed out waiting: " + message);
    }

    @Test
    void recordsCreateModifyDeleteUntilCancelled() throws Exception {
        Path root = Files.createDirectories(tmp.resolve("volume"));
        JobHandle job = tracker.start(JobType.WATCH, "vol-w", root);
        AtomicBoolean cancel = new AtomicBoolean(false);
        LiveWatcher watcher = new LiveWatcher(store, tracker, Duration.ofMillis(100));

        Future<LiveWatcher.WatchStats> future = executor.submit(
                () -> watcher.watch("vol-w", root, job.jobId(), cancel));
        waitUntil(() -> tracker.find(job.jobId()).orElseThrow().jobStatus() == JobStatus.RUNNING, "watch running");

        Path file = root.resolve("notes.txt");
        Files.writeString(file, "hello");
        String path = file.toAbsolutePath().normalize().toString();
        waitUntil(() -> store.findFile("vol-w", path).isPresent(), "file row after create");

        Files.delete(file);
        waitUntil(() -> store.findFile("vol-w", path).map(FileRow::deleted).orElse(false), "tombstone after delete");

        cancel.set(true);
        LiveWatcher.WatchStats stats = future.get(10, TimeUnit.SECONDS);

        assertEquals(LiveWatcher.Outcome.STOPPED, stats.outcome());
        assertTrue(stats.eventsSeen() >= 2, "Expected at least a create and a delete");
        assertEquals(JobStatus.STOPPED, tracker.find(job.jobId()).orElseThrow().jobStatus());

        var volume = store.findVolume("vol-w").orElseThrow();
        assertTrue(volume.createdCount() >= 1);
        assertTrue(volume.deletedCount() >= 1);
        assertEquals(root.toAbsolutePath().normalize().toString(), volume.directory());
    }

    @Test
    void newSubdirectoriesAreWatchedToo() throws Exception {
        Path root = Files.createDirectories(tmp.resolve("volume"));
        JobHandle job = tracker.start(JobType.WATCH, "vol-w", root);
        AtomicBoolean cancel = new AtomicBoolean(false);
        LiveWatcher watcher = new LiveWatcher(store, tracker);

        Future<LiveWatcher.WatchStats> future = executor.submit(
                () -> watcher.watch("vol-w", root, job.jobId(), cancel));
        waitUntil(() -> tracker.find(job.jobId()).orElseThrow().jobStatus() == JobStatus.RUNNING, "watch running");

        Path sub = Files.createDirectory(root.resolve("photos"));
        String subPath = sub.toAbsolutePath().normalize().toString();
        waitUntil(() -> store.listRecentEvents(null, 50).stream().anyMatch(e -> e.path().equals(subPath)),
                "directory create event");
        assertTrue(store.findFile("vol-w", subPath).isEmpty(), "Directories get events but no File row");

        Path nested = sub.resolve("img.jpg");
        Files.writeString(nested, "jpeg");
        String nestedPath = nested.toAbsolutePath().normalize().toString();
        waitUntil(() -> store.findFile("vol-w", nestedPath).isPresent(), "file in new subdirectory");

        cancel.set(true);
        assertEquals(LiveWatcher.Outcome.STOPPED, future.get(10, TimeUnit.SECONDS).outcome());
    }

    @Test
    void missingRootStopsTheJob() throws Exception {
        Path root = tmp.resolve("not-mounted");
        JobHandle job = tracker.start(JobType.WATCH, "vol-x", root);

        LiveWatcher.WatchStats stats = new LiveWatcher(store, tracker)
                .watch("vol-x", root, job.jobId(), new AtomicBoolean(false));

        assertEquals(LiveWatcher.Outcome.STOPPED, stats.outcome());
        assertEquals(JobStatus.STOPPED, tracker.find(job.jobId()).orElseThrow().jobStatus());
    }

    @Test
    void removedRootEndsTheWatch() throws Exception {
        Path root = Files.createDirectories(tmp.resolve("usb"));
        JobHandle job = tracker.start(JobType.WATCH, "vol-u", root);
        LiveWatcher watcher = new LiveWatcher(store, tracker);

        Future<LiveWatcher.WatchStats> future = executor.submit(
                () -> watcher.watch("vol-u", root, job.jobId(), new AtomicBoolean(false)));
        waitUntil(() -> tracker.find(job.jobId()).orElseThrow().jobStatus() == JobStatus.RUNNING, "watch running");

        Files.delete(root);

        LiveWatcher.WatchStats stats = future.get(10, TimeUnit.SECONDS);
        assertEquals(LiveWatcher.Outcome.STOPPED, stats.outcome());
        assertEquals(JobStatus.STOPPED, tracker.find(job.jobId()).orElseThrow().jobStatus());
    }
}
