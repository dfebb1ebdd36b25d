package com.diskwatcher.app.service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.diskwatcher.app.config.EngineSettings;
import com.diskwatcher.app.database.CatalogRows.JobRow;
import com.diskwatcher.app.database.CatalogStore;
import com.diskwatcher.app.database.JobType;
import com.diskwatcher.app.identity.IdentityProbes;
import com.diskwatcher.app.identity.IdentityResolver;
import com.diskwatcher.app.identity.IdentitySource;
import com.diskwatcher.app.identity.MountTable;
import com.diskwatcher.app.identity.VolumeIdentity;
import com.diskwatcher.app.inventory.ArchivalScanner;
import com.diskwatcher.app.inventory.ScanStats;
import com.diskwatcher.app.inventory.ScanTarget;
import com.diskwatcher.app.inventory.ScanWorkerPool;

/**
 * Owns the registered directories and everything running against them: the scan pool, one
 * watcher thread per watched volume and the optional discovery loop.
 */
public final class DiskWatcherEngine implements VolumeAttachments, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(DiskWatcherEngine.class);

    public static final List<Path> SUGGEST_BASES = List.of(Path.of("/mnt"), Path.of("/media"), Path.of("/run/media"));

    public record Suggestion(Path directory, String volumeId, IdentitySource source) {}

    public record DirectoryStatus(Path directory, String volumeId, IdentitySource source,
                                  boolean watching, boolean scanning) {}

    public record EngineStatus(boolean running, boolean autoDiscovery, List<DirectoryStatus> directories,
                               List<JobRow> activeJobs) {}

    private record WatchSession(JobHandle job, AtomicBoolean cancel, Future<LiveWatcher.WatchStats> future) {}

    private final CatalogStore store;
    private final EngineSettings settings;
    private final IdentityResolver resolver;
    private final MountTable mountTable;
    private final JobTracker tracker;
    private final ScanWorkerPool scanPool;
    private final LiveWatcher liveWatcher;
    private final ExecutorService watchExecutor;

    private final Map<Path, VolumeIdentity> directories = new ConcurrentHashMap<>();
    private final Map<String, WatchSession> watches = new ConcurrentHashMap<>();
    private volatile boolean running;
    private volatile boolean closed;
    private DiscoveryLoop discovery;

    public DiskWatcherEngine(CatalogStore store, EngineSettings settings) {
        this(store, settings, new IdentityResolver(IdentityProbes.platformDefault()),
                MountTable.platformDefault(), LiveWatcher.DEFAULT_HEARTBEAT);
    }

    public DiskWatcherEngine(CatalogStore store, EngineSettings settings, IdentityResolver resolver,
                             MountTable mountTable, Duration watchHeartbeat) {
        this.store = store;
        this.settings = settings;
        this.resolver = resolver;
        this.mountTable = mountTable;
        this.tracker = new JobTracker(store);
        this.scanPool = new ScanWorkerPool(new ArchivalScanner(store, tracker, settings.scanConfig()),
                tracker, settings.maxScanWorkers());
        this.liveWatcher = new LiveWatcher(store, tracker, watchHeartbeat);
        AtomicInteger n = new AtomicInteger();
        this.watchExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "diskwatcher-watch-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        int orphans = tracker.recoverOrphans();
        if (orphans > 0) {
            logger.warn("recovered orphaned jobs count={}", orphans);
        }
    }

    public JobTracker jobs() {
        return tracker;
    }

    public EngineSettings settings() {
        return settings;
    }

    // ----------------- registration -----------------

    /** Resolves and registers a directory. Registering the same directory twice is a no-op. */
    public VolumeIdentity addDirectory(Path path) {
        Path dir = normalize(path);
        VolumeIdentity known = directories.get(dir);
        if (known != null) return known;

        VolumeIdentity identity = resolver.resolve(dir);
        store.persistIdentity(identity);
        VolumeIdentity previous = directories.putIfAbsent(dir, identity);
        if (previous != null) return previous;

        logger.info("directory added path={} volume={} source={}", dir, identity.volumeId(), identity.source());
        return identity;
    }

    /** Unregisters a directory, cancelling its watch and scan. False when it was not registered. */
    public boolean removeDirectory(Path path) {
        Path dir = normalize(path);
        VolumeIdentity identity = directories.remove(dir);
        if (identity == null) return false;

        stopWatch(identity.volumeId(), "removed");
        scanPool.cancel(identity.volumeId());
        logger.info("directory removed path={} volume={}", dir, identity.volumeId());
        return true;
    }

    public List<Path> currentPaths() {
        return List.copyOf(directories.keySet());
    }

    // ----------------- scans -----------------

    /**
     * Scans the given directories (registering them first) through the bounded pool and waits
     * for all of them. Volumes that already have an active scan map to empty.
     */
    public Map<String, Optional<ScanStats>> runInitialScans(Collection<Path> paths) throws InterruptedException {
        List<ScanTarget> targets = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (Path p : paths) {
            Path dir = normalize(p);
            VolumeIdentity identity = addDirectory(dir);
            if (seen.add(identity.volumeId())) {
                targets.add(new ScanTarget(identity.volumeId(), dir));
            }
        }
        if (targets.isEmpty()) return Map.of();
        logger.info("initial scans requested count={} workers={}", targets.size(), settings.maxScanWorkers());
        return scanPool.scanAll(targets);
    }

    public Map<String, Optional<ScanStats>> runInitialScans() throws InterruptedException {
        return runInitialScans(currentPaths());
    }

    /**
     * Registers {@code paths}, starts watching every registered directory and then scans
     * {@code paths}. Changes made while a scan runs are recorded by the watchers. Returns once
     * every scan has finished.
     */
    public Map<String, Optional<ScanStats>> watchAndScan(Collection<Path> paths) throws InterruptedException {
        for (Path p : paths) {
            addDirectory(p);
        }
        startWatching();
        return runInitialScans(paths);
    }

    // ----------------- watching -----------------

    /** Starts a watcher for every registered directory that has none. */
    public void startWatching() {
        running = true;
        int started = 0;
        for (Map.Entry<Path, VolumeIdentity> e : directories.entrySet()) {
            if (startWatch(e.getKey(), e.getValue())) started++;
        }
        logger.info("watchers started count={} directories={}", started, directories.size());
    }

    public boolean isRunning() {
        return running;
    }

    private boolean startWatch(Path dir, VolumeIdentity identity) {
        if (closed) return false;
        String volumeId = identity.volumeId();
        if (watches.containsKey(volumeId)) return false;

        JobHandle job;
        try {
            job = tracker.start(JobType.WATCH, volumeId, dir);
        } catch (JobConflictException e) {
            logger.info("watch already active volume={} path={}", volumeId, dir);
            return false;
        }

        AtomicBoolean cancel = new AtomicBoolean(false);
        FutureTask<LiveWatcher.WatchStats> task = new FutureTask<>(() -> {
            try {
                return liveWatcher.watch(volumeId, dir, job.jobId(), cancel);
            } finally {
                watches.computeIfPresent(volumeId, (k, v) -> v.job().jobId().equals(job.jobId()) ? null : v);
            }
        });
        watches.put(volumeId, new WatchSession(job, cancel, task));
        watchExecutor.execute(task);
        return true;
    }

    private void stopWatch(String volumeId, String reason) {
        WatchSession session = watches.remove(volumeId);
        if (session == null) return;
        session.cancel().set(true);
        if (tracker.stopPending(session.job().jobId(), reason) == TransitionResult.APPLIED) {
            session.future().cancel(false);
            return;
        }
        awaitQuietly(session.future(), volumeId);
    }

    private static void awaitQuietly(Future<?> future, String volumeId) {
        try {
            future.get(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            logger.debug("watch did not finish cleanly volume={} error={}", volumeId, e.toString());
        }
    }

    // ----------------- attachments -----------------

    @Override
    public void attach(Path directory, boolean scan) {
        Path dir = normalize(directory);
        VolumeIdentity identity = addDirectory(dir);
        if (scan) {
            scanPool.submit(new ScanTarget(identity.volumeId(), dir));
        }
        if (running) {
            startWatch(dir, identity);
        }
    }

    @Override
    public boolean detach(Path directory) {
        return removeDirectory(directory);
    }

    @Override
    public Set<Path> attached() {
        return Set.copyOf(directories.keySet());
    }

    // ----------------- discovery -----------------

    /**
     * Attaches current mounts under {@code roots} right away, then keeps following them on a
     * schedule. Replaces any previous discovery loop.
     */
    public synchronized void enableAutoDiscovery(List<Path> roots, boolean scanNew, Duration interval) {
        if (roots == null || roots.isEmpty()) return;
        disableAutoDiscovery();
        DiscoveryLoop loop = new DiscoveryLoop(mountTable, this, roots, scanNew, interval);
        loop.scanOnce();
        loop.start();
        discovery = loop;
    }

    public synchronized void disableAutoDiscovery() {
        if (discovery == null) return;
        discovery.close();
        discovery = null;
    }

    // ----------------- status -----------------

    public EngineStatus status() {
        List<DirectoryStatus> dirs = new ArrayList<>();
        for (Map.Entry<Path, VolumeIdentity> e : directories.entrySet()) {
            String volumeId = e.getValue().volumeId();
            dirs.add(new DirectoryStatus(e.getKey(), volumeId, e.getValue().source(),
                    watches.containsKey(volumeId), scanPool.isScanning(volumeId)));
        }
        dirs.sort((a, b) -> a.directory().compareTo(b.directory()));
        boolean auto;
        synchronized (this) {
            auto = discovery != null;
        }
        return new EngineStatus(running, auto, dirs, tracker.activeJobs());
    }

    /** Mount points below {@link #SUGGEST_BASES} with their resolved ids. */
    public List<Suggestion> suggestDirectories() {
        return suggestDirectories(SUGGEST_BASES);
    }

    public List<Suggestion> suggestDirectories(List<Path> bases) {
        Set<Path> mounts;
        try {
            mounts = mountTable.mountPoints();
        } catch (IOException e) {
            logger.warn("mount table unavailable error={}", e.toString());
            return List.of();
        }

        Map<Path, Suggestion> out = new LinkedHashMap<>();
        for (Path mount : mounts) {
            Path m = mount.toAbsolutePath().normalize();
            for (Path base : bases) {
                if (!m.startsWith(base) || m.equals(base)) continue;
                VolumeIdentity identity = resolver.resolve(m);
                out.putIfAbsent(m, new Suggestion(m, identity.volumeId(), identity.source()));
            }
        }
        return List.copyOf(out.values());
    }

    // ----------------- shutdown -----------------

    /** Cancels every scan and watcher (their jobs end stopped) and releases the threads. */
    public void stopAll() {
        if (closed) return;
        closed = true;
        logger.info("stopping all watchers and scans");
        disableAutoDiscovery();

        for (String volumeId : List.copyOf(watches.keySet())) {
            stopWatch(volumeId, "stopped");
        }
        scanPool.close();

        watchExecutor.shutdown();
        try {
            if (!watchExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
                watchExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            watchExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        running = false;
    }

    @Override
    public void close() {
        stopAll();
    }

    private static Path normalize(Path path) {
        return path.toAbsolutePath().normalize();
    }
}
