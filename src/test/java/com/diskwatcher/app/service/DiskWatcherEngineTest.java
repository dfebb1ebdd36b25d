package com.diskwatcher.app.service;

import com.diskwatcher.app.config.EngineSettings;
import com.diskwatcher.app.database.BusyRetry;
import com.diskwatcher.app.database.CatalogDatabase;
import com.diskwatcher.app.database.CatalogStore;
import com.diskwatcher.app.database.JobStatus;
import com.diskwatcher.app.database.JobType;
import com.diskwatcher.app.identity.BlockDeviceInfo;
import com.diskwatcher.app.identity.IdentityProbe;
import com.diskwatcher.app.identity.IdentityResolver;
import com.diskwatcher.app.identity.IdentitySource;
import com.diskwatcher.app.identity.MountInfo;
import com.diskwatcher.app.identity.VolumeIdentity;
import com.diskwatcher.app.inventory.ScanStats;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.diskwatcher.app.service.LiveWatcherTest.waitUntil;
import static org.junit.jupiter.api.Assertions.*;

public class DiskWatcherEngineTest {

    /** No tooling: every directory resolves to its own path. */
    private static final IdentityProbe NO_TOOLING = new IdentityProbe() {
        @Override
        public Optional<MountInfo> probeMount(Path directory) {
            return Optional.empty();
        }

        @Override
        public Optional<BlockDeviceInfo> probeBlockDevice(String device) {
            return Optional.empty();
        }
    };

    @TempDir
    Path tmp;

    private CatalogDatabase database;
    private CatalogStore store;
    private DiskWatcherEngine engine;
    private final Set<Path> mounts = new LinkedHashSet<>();

    @BeforeEach
    void setUp() {
        database = CatalogDatabase.open(tmp.resolve("engine.db"));
        store = new CatalogStore(database.jdbi(), new BusyRetry(), d -> Optional.empty(), Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        if (engine != null) engine.close();
        if (database != null) database.close();
    }

    private DiskWatcherEngine newEngine() {
        engine = new DiskWatcherEngine(store, EngineSettings.defaults().withMaxScanWorkers(2),
                new IdentityResolver(NO_TOOLING), () -> Set.copyOf(mounts), Duration.ofMillis(200));
        return engine;
    }

    @Test
    void addDirectoryIsIdempotent() throws Exception {
        Path dir = Files.createDirectories(tmp.resolve("disk"));
        newEngine();

        VolumeIdentity first = engine.addDirectory(dir);
        VolumeIdentity second = engine.addDirectory(dir.resolve("."));

        assertSame(first, second);
        assertEquals(IdentitySource.DIRECTORY, first.source());
        assertEquals(List.of(dir.toAbsolutePath().normalize()), engine.currentPaths());
    }

    @Test
    void initialScansCoverEveryDirectory() throws Exception {
        Path a = Files.createDirectories(tmp.resolve("a"));
        Path b = Files.createDirectories(tmp.resolve("b"));
        Files.writeString(a.resolve("one.txt"), "1");
        Files.writeString(b.resolve("two.txt"), "2");
        Files.writeString(b.resolve("three.txt"), "3");
        newEngine();

        Map<String, Optional<ScanStats>> results = engine.runInitialScans(List.of(a, b));

        assertEquals(2, results.size());
        assertEquals(1, results.get(a.toString()).orElseThrow().filesSeen());
        assertEquals(2, results.get(b.toString()).orElseThrow().filesSeen());
        assertEquals(2, store.listVolumes().size());
    }

    @Test
    void watchingRecordsChangesAndStopAllEndsJobs() throws Exception {
        Path dir = Files.createDirectories(tmp.resolve("live"));
        newEngine();
        engine.addDirectory(dir);

        engine.startWatching();
        String volumeId = dir.toString();
        waitUntil(() -> engine.jobs().findActive(volumeId, JobType.WATCH)
                .map(j -> j.jobStatus() == JobStatus.RUNNING).orElse(false), "watch job running");
        assertTrue(engine.status().directories().get(0).watching());

        Path file = dir.resolve("report.csv");
        Files.writeString(file, "a,b");
        waitUntil(() -> store.findFile(volumeId, file.toString()).isPresent(), "file recorded");

        engine.stopAll();

        assertTrue(engine.jobs().activeJobs().isEmpty(), "No job may stay active after stopAll");
        assertFalse(engine.isRunning());
        assertEquals(JobStatus.STOPPED, store.listJobs(Set.of()).get(0).jobStatus());
    }

    @Test
    void changesDuringTheInitialScanAreRecorded() throws Exception {
        Path dir = Files.createDirectories(tmp.resolve("busy"));
        Files.writeString(dir.resolve("existing.txt"), "old");
        String volumeId = dir.toString();
        newEngine();

        CountDownLatch scanRunning = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        engine.jobs().addListener((jobId, status) -> {
            if (status != JobStatus.RUNNING) return;
            boolean scan = engine.jobs().find(jobId)
                    .map(j -> j.jobType().equals(JobType.SCAN.wire()))
                    .orElse(false);
            if (!scan) return;
            scanRunning.countDown();
            try {
                // keeps the scan in progress while the tree changes
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });

        ExecutorService runner = Executors.newSingleThreadExecutor();
        try {
            Future<Map<String, Optional<ScanStats>>> scans = runner.submit(() -> engine.watchAndScan(List.of(dir)));
            assertTrue(scanRunning.await(10, TimeUnit.SECONDS), "scan running");
            waitUntil(() -> engine.jobs().findActive(volumeId, JobType.WATCH)
                    .map(j -> j.jobStatus() == JobStatus.RUNNING).orElse(false), "watch job running");

            Path late = dir.resolve("late.txt");
            Files.writeString(late, "new");
            waitUntil(() -> store.listRecentEvents(null, 100).stream()
                    .anyMatch(e -> e.path().equals(late.toString()) && e.eventType().equals("created")),
                    "created event recorded while scanning");
            assertTrue(engine.jobs().findActive(volumeId, JobType.SCAN).isPresent(), "scan still in progress");

            release.countDown();
            Map<String, Optional<ScanStats>> results = scans.get(15, TimeUnit.SECONDS);
            assertEquals(ScanStats.Outcome.COMPLETED, results.get(volumeId).orElseThrow().outcome());
        } finally {
            release.countDown();
            runner.shutdownNow();
        }
    }

    @Test
    void removeDirectoryStopsItsWatch() throws Exception {
        Path dir = Files.createDirectories(tmp.resolve("gone"));
        newEngine();
        engine.addDirectory(dir);
        engine.startWatching();
        waitUntil(() -> engine.jobs().findActive(dir.toString(), JobType.WATCH)
                .map(j -> j.jobStatus() == JobStatus.RUNNING).orElse(false), "watch job running");

        assertTrue(engine.removeDirectory(dir));
        assertFalse(engine.removeDirectory(dir));

        waitUntil(() -> engine.jobs().findActive(dir.toString(), JobType.WATCH).isEmpty(), "watch job ended");
        assertTrue(engine.currentPaths().isEmpty());
    }

    @Test
    void autoDiscoveryAttachesMountsUnderRoot() throws Exception {
        Path root = Files.createDirectories(tmp.toRealPath().resolve("media"));
        Path usb = Files.createDirectories(root.resolve("usb"));
        mounts.add(usb);
        newEngine();

        engine.enableAutoDiscovery(List.of(root), false, Duration.ofSeconds(1));

        assertTrue(engine.attached().contains(usb));
        assertTrue(engine.status().autoDiscovery());

        engine.disableAutoDiscovery();
        assertFalse(engine.status().autoDiscovery());
    }

    @Test
    void suggestionsListMountsBelowBases() throws Exception {
        Path base = tmp.resolve("mnt");
        mounts.add(base);
        mounts.add(base.resolve("archive01"));
        mounts.add(tmp.resolve("elsewhere"));
        newEngine();

        List<DiskWatcherEngine.Suggestion> suggestions = engine.suggestDirectories(List.of(base));

        assertEquals(1, suggestions.size());
        assertEquals(base.resolve("archive01"), suggestions.get(0).directory());
        assertEquals(IdentitySource.DIRECTORY, suggestions.get(0).source());
    }

    @Test
    void constructionRecoversOrphanedJobs() throws Exception {
        String host = new JobTracker(store).ownerHost();
        JobTracker dead = new JobTracker(store, 999_999_999L, host);
        JobHandle orphan = dead.start(JobType.SCAN, "vol-o", tmp);

        newEngine();

        assertEquals(JobStatus.STOPPED, store.findJob(orphan.jobId()).orElseThrow().jobStatus());
        assertEquals(JobTracker.ORPHANED, store.findJob(orphan.jobId()).orElseThrow().errorMessage());
    }
}
