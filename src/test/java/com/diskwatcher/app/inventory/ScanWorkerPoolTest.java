package com.diskwatcher.app.inventory;

import com.diskwatcher.app.database.BusyRetry;
import com.diskwatcher.app.database.CatalogDatabase;
import com.diskwatcher.app.database.CatalogRows.JobRow;
import com.diskwatcher.app.database.CatalogStore;
import com.diskwatcher.app.database.JobStatus;
import com.diskwatcher.app.database.JobType;
import com.diskwatcher.app.service.JobTracker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class ScanWorkerPoolTest {

    @TempDir
    Path tmp;

    private CatalogDatabase database;
    private CatalogStore store;
    private JobTracker tracker;
    private ScanWorkerPool pool;

    @BeforeEach
    void setUp() {
        database = CatalogDatabase.open(tmp.resolve("pool.db"));
        store = new CatalogStore(database.jdbi(), new BusyRetry(), d -> Optional.empty(), Clock.systemUTC());
        tracker = new JobTracker(store);
    }

    @AfterEach
    void tearDown() {
        if (pool != null) pool.close();
        if (database != null) database.close();
    }

    private Path volume(String name, int files) throws Exception {
        Path root = Files.createDirectories(tmp.resolve(name));
        for (int i = 0; i < files; i++) {
            Files.writeString(root.resolve("f" + i + ".dat"), "x".repeat(i + 1));
        }
        return root;
    }

    @Test
    void scanAllRunsEveryTarget() throws Exception {
        pool = new ScanWorkerPool(new ArchivalScanner(store, tracker, ScanConfig.defaults()), tracker, 2);

        Map<String, Optional<ScanStats>> out = pool.scanAll(List.of(
                new ScanTarget("vol-a", volume("a", 3)),
                new ScanTarget("vol-b", volume("b", 2)),
                new ScanTarget("vol-c", volume("c", 1))));

        assertEquals(3, out.size());
        assertEquals(3, out.get("vol-a").orElseThrow().filesSeen());
        assertEquals(2, out.get("vol-b").orElseThrow().filesSeen());
        assertEquals(1, out.get("vol-c").orElseThrow().filesSeen());
        assertTrue(tracker.activeJobs().isEmpty());
    }

    @Test
    void singleWorkerKeepsSecondScanPending() throws Exception {
        CountDownLatch firstRunning = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        tracker.addListener((jobId, status) -> {
            if (status != JobStatus.RUNNING) return;
            firstRunning.countDown();
            try {
                // holds the only worker inside the first scan
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        pool = new ScanWorkerPool(new ArchivalScanner(store, tracker, ScanConfig.defaults()), tracker, 1);

        Future<ScanStats> first = pool.submit(new ScanTarget("vol-1", volume("one", 2))).orElseThrow();
        assertTrue(firstRunning.await(10, TimeUnit.SECONDS));
        Future<ScanStats> second = pool.submit(new ScanTarget("vol-2", volume("two", 2))).orElseThrow();

        assertEquals(JobStatus.PENDING, tracker.findActive("vol-2", JobType.SCAN).orElseThrow().jobStatus());
        assertTrue(pool.isScanning("vol-2"));

        release.countDown();
        assertEquals(ScanStats.Outcome.COMPLETED, first.get(10, TimeUnit.SECONDS).outcome());
        assertEquals(ScanStats.Outcome.COMPLETED, second.get(10, TimeUnit.SECONDS).outcome());
    }

    @Test
    void duplicateSubmissionIsAlreadySatisfied() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        tracker.addListener((jobId, status) -> {
            if (status != JobStatus.RUNNING) return;
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        pool = new ScanWorkerPool(new ArchivalScanner(store, tracker, ScanConfig.defaults()), tracker, 1);
        Path root = volume("dup", 1);

        Optional<Future<ScanStats>> first = pool.submit(new ScanTarget("vol-d", root));
        Optional<Future<ScanStats>> again = pool.submit(new ScanTarget("vol-d", root));

        assertTrue(first.isPresent());
        assertTrue(again.isEmpty(), "Second scan of an active volume must not create a job");
        release.countDown();
        first.get().get(10, TimeUnit.SECONDS);
    }

    @Test
    void cancellingQueuedScanStopsItsJob() throws Exception {
        CountDownLatch firstRunning = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        tracker.addListener((jobId, status) -> {
            if (status != JobStatus.RUNNING) return;
            firstRunning.countDown();
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        pool = new ScanWorkerPool(new ArchivalScanner(store, tracker, ScanConfig.defaults()), tracker, 1);

        Future<ScanStats> first = pool.submit(new ScanTarget("vol-1", volume("one", 1))).orElseThrow();
        assertTrue(firstRunning.await(10, TimeUnit.SECONDS));
        pool.submit(new ScanTarget("vol-2", volume("two", 1)));
        String queuedJob = tracker.findActive("vol-2", JobType.SCAN).orElseThrow().jobId();

        assertTrue(pool.cancel("vol-2"));
        assertFalse(pool.isScanning("vol-2"));
        assertEquals(JobStatus.STOPPED, tracker.find(queuedJob).orElseThrow().jobStatus());

        release.countDown();
        first.get(10, TimeUnit.SECONDS);
    }

    @Test
    void failingScanDoesNotAffectItsSiblings() throws Exception {
        CatalogStore flaky = new CatalogStore(database.jdbi(), new BusyRetry(), dir -> {
            if (dir.getFileName().toString().equals("bad")) throw new IllegalStateException("disk offline");
            return Optional.empty();
        }, Clock.systemUTC());
        JobTracker jobs = new JobTracker(flaky);
        pool = new ScanWorkerPool(new ArchivalScanner(flaky, jobs, ScanConfig.defaults()), jobs, 2);

        Map<String, Optional<ScanStats>> out = pool.scanAll(List.of(
                new ScanTarget("vol-bad", volume("bad", 2)),
                new ScanTarget("vol-good", volume("good", 3))));

        assertEquals(ScanStats.Outcome.FAILED, out.get("vol-bad").orElseThrow().outcome());
        assertEquals(ScanStats.Outcome.COMPLETED, out.get("vol-good").orElseThrow().outcome());
        assertEquals(3, out.get("vol-good").orElseThrow().filesSeen());

        JobRow failed = scanJob(flaky, "vol-bad");
        assertEquals(JobStatus.FAILED, failed.jobStatus());
        assertNotNull(failed.errorMessage());
        assertTrue(failed.errorMessage().contains("disk offline"), "error message: " + failed.errorMessage());
        assertEquals(JobStatus.COMPLETED, scanJob(flaky, "vol-good").jobStatus());
        assertTrue(jobs.activeJobs().isEmpty());
    }

    @Test
    void cancellingRunningScanLeavesTheJobToItsWorker() throws Exception {
        CountDownLatch running = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        tracker.addListener((jobId, status) -> {
            if (status != JobStatus.RUNNING) return;
            running.countDown();
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        pool = new ScanWorkerPool(new ArchivalScanner(store, tracker, ScanConfig.defaults()), tracker, 1);

        Future<ScanStats> scan = pool.submit(new ScanTarget("vol-r", volume("busy", 3))).orElseThrow();
        assertTrue(running.await(10, TimeUnit.SECONDS));
        String jobId = tracker.findActive("vol-r", JobType.SCAN).orElseThrow().jobId();

        assertTrue(pool.cancel("vol-r"));
        assertEquals(JobStatus.RUNNING, tracker.find(jobId).orElseThrow().jobStatus(),
                "A running scan ends its own job");

        release.countDown();
        ScanStats stats = scan.get(10, TimeUnit.SECONDS);
        assertEquals(ScanStats.Outcome.STOPPED, stats.outcome());
        JobRow row = tracker.find(jobId).orElseThrow();
        assertEquals(JobStatus.STOPPED, row.jobStatus());
        assertEquals("cancelled", row.errorMessage());
    }

    private static JobRow scanJob(CatalogStore store, String volumeId) {
        return store.listJobs(Set.of()).stream()
                .filter(j -> j.volumeId().equals(volumeId))
                .findFirst()
                .orElseThrow();
    }

    @Test
    void rejectsZeroWorkers() {
        ArchivalScanner scanner = new ArchivalScanner(store, tracker, ScanConfig.defaults());
        assertThrows(IllegalArgumentException.class, () -> new ScanWorkerPool(scanner, tracker, 0));
    }
}
