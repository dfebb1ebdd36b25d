package com.diskwatcher.app.inventory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.diskwatcher.app.database.JobType;
import com.diskwatcher.app.service.JobConflictException;
import com.diskwatcher.app.service.JobHandle;
import com.diskwatcher.app.service.JobTracker;
import com.diskwatcher.app.service.TransitionResult;

/**
 * Bounded pool of archival scans, one job per volume. Jobs are created {@code pending} at
 * submission; the worker flips them to {@code running}. A failing scan never affects its siblings.
 */
public final class ScanWorkerPool implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ScanWorkerPool.class);

    private final ArchivalScanner scanner;
    private final JobTracker tracker;
    private final ThreadPoolExecutor executor;
    private final Map<String, Submission> inFlight = new ConcurrentHashMap<>();

    private record Submission(JobHandle job, AtomicBoolean cancel, Future<ScanStats> future) {}

    public ScanWorkerPool(ArchivalScanner scanner, JobTracker tracker, int maxWorkers) {
        if (maxWorkers < 1) throw new IllegalArgumentException("maxWorkers must be >= 1");
        this.scanner = scanner;
        this.tracker = tracker;
        this.executor = new ThreadPoolExecutor(maxWorkers, maxWorkers, 30, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(), namedThreads("diskwatcher-scan-"));
        this.executor.allowCoreThreadTimeOut(true);
    }

    public static int defaultMaxWorkers() {
        return Math.max(1, Runtime.getRuntime().availableProcessors());
    }

    /**
     * Queues a scan. Empty when a scan for the volume is already active, which counts as
     * already satisfied.
     */
    public Optional<Future<ScanStats>> submit(ScanTarget target) {
        JobHandle job;
        try {
            job = tracker.start(JobType.SCAN, target.volumeId(), target.root());
        } catch (JobConflictException e) {
            logger.info("scan already active volume={} root={}", target.volumeId(), target.root());
            return Optional.empty();
        }

        AtomicBoolean cancel = new AtomicBoolean(false);
        FutureTask<ScanStats> task = new FutureTask<>(() -> {
            try {
                return scanner.scan(target.volumeId(), target.root(), job.jobId(), cancel);
            } finally {
                inFlight.computeIfPresent(target.volumeId(),
                        (k, v) -> v.job().jobId().equals(job.jobId()) ? null : v);
            }
        });
        inFlight.put(target.volumeId(), new Submission(job, cancel, task));
        executor.execute(task);
        return Optional.of(task);
    }

    /** Submits every target and waits for all of them. Targets that were already active map to empty. */
    public Map<String, Optional<ScanStats>> scanAll(List<ScanTarget> targets) throws InterruptedException {
        Map<String, Optional<Future<ScanStats>>> futures = new LinkedHashMap<>();
        for (ScanTarget t : targets) {
            futures.put(t.volumeId(), submit(t));
        }

        Map<String, Optional<ScanStats>> out = new LinkedHashMap<>();
        for (Map.Entry<String, Optional<Future<ScanStats>>> e : futures.entrySet()) {
            if (e.getValue().isEmpty()) {
                out.put(e.getKey(), Optional.empty());
                continue;
            }
            try {
                out.put(e.getKey(), Optional.of(e.getValue().get().get()));
            } catch (CancellationException ce) {
                out.put(e.getKey(), Optional.empty());
            } catch (ExecutionException ee) {
                logger.error("scan worker crashed volume={}", e.getKey(), ee.getCause());
                out.put(e.getKey(), Optional.empty());
            }
        }
        return out;
    }

    /**
     * Cancels the in-flight or queued scan of a volume; its job ends {@code stopped}. A queued
     * job is stopped here; a running scan sees the flag and closes its own job.
     */
    public boolean cancel(String volumeId) {
        Submission s = inFlight.remove(volumeId);
        if (s == null) return false;
        s.cancel().set(true);
        if (tracker.stopPending(s.job().jobId(), "cancelled") == TransitionResult.APPLIED) {
            s.future().cancel(false);
        }
        logger.info("scan cancel requested volume={} job={}", volumeId, s.job().jobId());
        return true;
    }

    public boolean isScanning(String volumeId) {
        return inFlight.containsKey(volumeId);
    }

    public void cancelAll() {
        for (String volumeId : List.copyOf(inFlight.keySet())) {
            cancel(volumeId);
        }
    }

    @Override
    public void close() {
        cancelAll();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    static ThreadFactory namedThreads(String prefix) {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
