package com.diskwatcher.app.service;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.diskwatcher.app.database.CatalogRows.JobRow;
import com.diskwatcher.app.database.CatalogStore;
import com.diskwatcher.app.database.CatalogTime;
import com.diskwatcher.app.database.JobStatus;
import com.diskwatcher.app.database.JobType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Persists job lifecycle: pending -> running -> completed | failed | stopped.
 *
 * <p>At most one active job exists per (volume, type). Terminal transitions are conditional
 * updates, so only the first one wins; later attempts return {@link TransitionResult#CONFLICT}.
 */
public final class JobTracker {

    private static final Logger logger = LoggerFactory.getLogger(JobTracker.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String ORPHANED = "orphaned";

    // process start instants derive from boot time in whole seconds
    private static final Duration START_SLACK = Duration.ofSeconds(5);

    /** Notified after every applied transition. */
    @FunctionalInterface
    public interface Listener {
        void onTransition(String jobId, JobStatus status);
    }

    private final CatalogStore store;
    private final long ownerPid;
    private final String ownerHost;
    private final List<Listener> listeners = new CopyOnWriteArrayList<>();

    public JobTracker(CatalogStore store) {
        this(store, ProcessHandle.current().pid(), localHostName());
    }

    JobTracker(CatalogStore store, long ownerPid, String ownerHost) {
        this.store = store;
        this.ownerPid = ownerPid;
        this.ownerHost = ownerHost;
    }

    public void addListener(Listener listener) {
        listeners.add(Objects.requireNonNull(listener));
    }

    public JobHandle start(JobType type, String volumeId, Path path) throws JobConflictException {
        String jobId = UUID.randomUUID().toString().replace("-", "");
        String now = CatalogTime.format(store.clock().instant());
        JobRow row = new JobRow(jobId, type.wire(), path.toString(), volumeId, JobStatus.PENDING.wire(),
                toJson(JobProgress.empty()), ownerPid, ownerHost, null, now, now, null);

        if (!store.insertJobIfIdle(row)) {
            throw new JobConflictException(volumeId, type);
        }
        logger.info("job created id={} type={} volume={} path={}", jobId, type.wire(), volumeId, path);
        notifyListeners(jobId, JobStatus.PENDING);
        return new JobHandle(jobId, type, volumeId, path.toString());
    }

    public TransitionResult markRunning(String jobId) {
        return transition(jobId, JobStatus.RUNNING, EnumSet.of(JobStatus.PENDING), null, null);
    }

    /** Refreshes progress of an active job. False when the job is no longer active. */
    public boolean heartbeat(String jobId, JobProgress progress) {
        boolean ok = store.updateJobProgress(jobId, toJson(progress));
        if (!ok) logger.debug("heartbeat ignored, job not active id={}", jobId);
        return ok;
    }

    public TransitionResult complete(String jobId, JobProgress finalStats) {
        return transition(jobId, JobStatus.COMPLETED, JobStatus.ACTIVE, finalStats, null);
    }

    public TransitionResult fail(String jobId, String error, JobProgress lastProgress) {
        return transition(jobId, JobStatus.FAILED, JobStatus.ACTIVE, lastProgress,
                error == null || error.isBlank() ? "failed" : error);
    }

    public TransitionResult stop(String jobId, String reason) {
        return transition(jobId, JobStatus.STOPPED, JobStatus.ACTIVE, null, reason);
    }

    /** Stops a job no worker has picked up yet. A running job is left to its worker. */
    public TransitionResult stopPending(String jobId, String reason) {
        return transition(jobId, JobStatus.STOPPED, EnumSet.of(JobStatus.PENDING), null, reason);
    }

    public Optional<JobRow> find(String jobId) {
        return store.findJob(jobId);
    }

    public Optional<JobRow> findActive(String volumeId, JobType type) {
        return store.findActiveJob(volumeId, type);
    }

    public List<JobRow> activeJobs() {
        return store.listJobs(JobStatus.ACTIVE);
    }

    /**
     * Marks active jobs left behind by dead processes on this host as stopped. A live pid only
     * counts as the owner when that process started before the job did, so a pid reused after a
     * restart does not keep the job alive. Returns how many were recovered.
     */
    public int recoverOrphans() {
        int recovered = 0;
        for (JobRow job : activeJobs()) {
            if (!ownerHost.equals(job.ownerHost())) continue;
            if (ownerStillRunning(job)) continue;

            if (stop(job.jobId(), ORPHANED) == TransitionResult.APPLIED) {
                recovered++;
                logger.warn("orphaned job stopped id={} type={} volume={} ownerPid={}",
                        job.jobId(), job.jobType(), job.volumeId(), job.ownerPid());
            }
        }
        return recovered;
    }

    private TransitionResult transition(String jobId, JobStatus to, Set<JobStatus> from,
                                        JobProgress progress, String error) {
        String progressJson = progress == null ? null : toJson(progress);
        if (!store.transitionJob(jobId, to, from, progressJson, error)) {
            logger.debug("job transition rejected id={} to={} allowedFrom={}", jobId, to.wire(), from);
            return TransitionResult.CONFLICT;
        }
        if (to == JobStatus.FAILED) {
            logger.error("job failed id={} error={}", jobId, error);
        } else {
            logger.info("job {} id={}{}", to.wire(), jobId, error == null ? "" : " reason=" + error);
        }
        notifyListeners(jobId, to);
        return TransitionResult.APPLIED;
    }

    private void notifyListeners(String jobId, JobStatus status) {
        for (Listener l : listeners) {
            try {
                l.onTransition(jobId, status);
            } catch (RuntimeException e) {
                logger.warn("job listener failed id={} status={}", jobId, status.wire(), e);
            }
        }
    }

    static String toJson(JobProgress progress) {
        try {
            return MAPPER.writeValueAsString(progress);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize job progress", e);
        }
    }

    public static JobProgress parseProgress(String json) {
        if (json == null || json.isBlank()) return JobProgress.empty();
        try {
            return MAPPER.readValue(json, JobProgress.class);
        } catch (JsonProcessingException e) {
            logger.debug("unreadable progress json={}", json);
            return JobProgress.empty();
        }
    }

    private static boolean ownerStillRunning(JobRow job) {
        if (job.ownerPid() == null) return false;
        Optional<ProcessHandle> owner = ProcessHandle.of(job.ownerPid()).filter(ProcessHandle::isAlive);
        if (owner.isEmpty()) return false;

        Optional<Instant> ownerStart = owner.get().info().startInstant();
        Instant jobStart = parseInstant(job.startedAt());
        if (ownerStart.isEmpty() || jobStart == null) return true;
        return !jobStart.isBefore(ownerStart.get().minus(START_SLACK));
    }

    private static Instant parseInstant(String text) {
        try {
            return CatalogTime.parse(text);
        } catch (DateTimeParseException e) {
            logger.debug("unreadable job timestamp value={}", text);
            return null;
        }
    }

    private static String localHostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            String env = System.getenv("HOSTNAME");
            logger.debug("local host name unavailable, using env={} error={}", env, e.toString());
            return env == null || env.isBlank() ? "localhost" : env;
        }
    }

    String ownerHost() {
        return ownerHost;
    }
}
