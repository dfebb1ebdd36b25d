package com.diskwatcher.app.database;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.diskwatcher.app.database.CatalogRows.DiskUsage;
import com.diskwatcher.app.database.CatalogRows.EventRow;
import com.diskwatcher.app.database.CatalogRows.EventTotals;
import com.diskwatcher.app.database.CatalogRows.FileRow;
import com.diskwatcher.app.database.CatalogRows.IdentityColumns;
import com.diskwatcher.app.database.CatalogRows.JobRow;
import com.diskwatcher.app.database.CatalogRows.UsageState;
import com.diskwatcher.app.database.CatalogRows.VolumeRow;
import com.diskwatcher.app.database.CatalogRows.VolumeSummary;
import com.diskwatcher.app.identity.BlockDeviceInfo;
import com.diskwatcher.app.identity.MountInfo;
import com.diskwatcher.app.identity.VolumeIdentity;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * The only writer to the catalog. Every logical write is one transaction taken under a
 * process-wide gate; reads go straight to the pool. All calls run under {@link BusyRetry}.
 *
 * <p>Callers do their filesystem I/O (stat, disk usage) before calling in: nothing here
 * touches the disk while the gate is held.
 */
public final class CatalogStore {

    private static final Logger logger = LoggerFactory.getLogger(CatalogStore.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final int USAGE_REFRESH_EVENTS = 100;
    public static final Duration USAGE_REFRESH_AGE = Duration.ofSeconds(300);

    private final Jdbi jdbi;
    private final BusyRetry retry;
    private final UsageProbe usageProbe;
    private final Clock clock;
    private final ReentrantLock writeGate = new ReentrantLock();

    // identities resolved before their volume row exists; applied with the first event
    private final ConcurrentMap<String, VolumeIdentity> pendingIdentities = new ConcurrentHashMap<>();

    public CatalogStore(CatalogDatabase database) {
        this(database.jdbi(), new BusyRetry(), UsageProbe.fileStore(), Clock.systemUTC());
    }

    public CatalogStore(Jdbi jdbi, BusyRetry retry, UsageProbe usageProbe, Clock clock) {
        this.jdbi = jdbi;
        this.retry = retry;
        this.usageProbe = usageProbe;
        this.clock = clock;
    }

    public Clock clock() {
        return clock;
    }

    // ----------------- events -----------------

    /** Appends the event and bumps the volume counters (creating the volume row on first sight). */
    public long recordEvent(EventRecord event) {
        return recordChange(event, null);
    }

    /**
     * Appends the event, bumps counters and updates the File row, atomically. For {@code deleted}
     * events the row is tombstoned; otherwise {@code file} (when given) is upserted.
     * A due usage refresh runs after the transaction, outside the gate.
     */
    public long recordChange(EventRecord event, FileRecord file) {
        Recorded recorded = write("recordEvent", h -> {
            CatalogDao dao = h.attach(CatalogDao.class);
            String ts = CatalogTime.format(event.timestamp());
            String type = event.type().wire();

            long id = dao.insertEvent(ts, type, event.path(), event.directory(), event.volumeId(), event.processId());
            dao.ensureVolume(event.volumeId(), event.directory(), ts);
            dao.bumpCounters(event.volumeId(), type, ts);

            VolumeIdentity pending = pendingIdentities.get(event.volumeId());
            if (pending != null) {
                dao.updateIdentity(identityColumns(pending));
            }

            if (event.type() == EventType.DELETED) {
                if (!FileIgnoreRules.isIgnored(event.path())) {
                    dao.markFileDeleted(event.volumeId(), event.path(), parentOf(event.path()), ts);
                }
            } else if (file != null && !FileIgnoreRules.isIgnored(file.path())) {
                upsertFile(dao, file, ts, type);
            }

            boolean due = dao.usageState(event.volumeId()).map(this::isUsageDue).orElse(false);
            return new Recorded(id, due, pending);
        });

        if (recorded.appliedIdentity() != null) {
            pendingIdentities.remove(event.volumeId(), recorded.appliedIdentity());
        }
        if (recorded.usageDue()) {
            refreshUsageIfDue(event.volumeId());
        }
        return recorded.eventId();
    }

    private record Recorded(long eventId, boolean usageDue, VolumeIdentity appliedIdentity) {}

    // ----------------- files -----------------

    /** Upserts a File row as a {@code modified} observation. Ignored names are skipped. */
    public void upsertFile(FileRecord file) {
        if (FileIgnoreRules.isIgnored(file.path())) return;
        String ts = CatalogTime.format(clock.instant());
        write("upsertFile", h -> upsertFile(h.attach(CatalogDao.class), file, ts, EventType.MODIFIED.wire()));
    }

    public void markFileDeleted(String volumeId, String path, Instant timestamp) {
        if (FileIgnoreRules.isIgnored(path)) return;
        write("markFileDeleted", h -> h.attach(CatalogDao.class)
                .markFileDeleted(volumeId, path, parentOf(path), CatalogTime.format(timestamp)));
    }

    private static int upsertFile(CatalogDao dao, FileRecord f, String ts, String eventType) {
        return dao.upsertFile(f.volumeId(), f.path(), f.directory(), f.sizeBytes(),
                CatalogTime.format(f.modifiedTime()), CatalogTime.format(f.createdTime()), ts, eventType);
    }

    // ----------------- volumes -----------------

    /**
     * Persists a resolved identity snapshot. If the volume has no row yet the snapshot is held
     * and written together with its first event. Returns true when written now.
     */
    public boolean persistIdentity(VolumeIdentity identity) {
        IdentityColumns columns = identityColumns(identity);
        int updated = write("persistIdentity", h -> h.attach(CatalogDao.class).updateIdentity(columns));
        if (updated == 0) {
            pendingIdentities.put(identity.volumeId(), identity);
            return false;
        }
        pendingIdentities.remove(identity.volumeId());
        return true;
    }

    /**
     * Refreshes the usage snapshot when it was never taken, {@value #USAGE_REFRESH_EVENTS} events
     * arrived since the last one, or it is older than {@link #USAGE_REFRESH_AGE}.
     */
    public boolean refreshUsageIfDue(String volumeId) {
        Optional<UsageState> state = read(h -> h.attach(CatalogDao.class).usageState(volumeId));
        if (state.isEmpty() || !isUsageDue(state.get()) || state.get().directory() == null) return false;

        Optional<DiskUsage> usage = usageProbe.probe(Path.of(state.get().directory()));
        if (usage.isEmpty()) {
            logger.debug("usage probe returned nothing volume={} dir={}", volumeId, state.get().directory());
            return false;
        }

        DiskUsage u = usage.get();
        String now = CatalogTime.format(clock.instant());
        write("refreshUsage", h -> h.attach(CatalogDao.class)
                .updateUsage(volumeId, u.totalBytes(), u.usedBytes(), u.freeBytes(), now));
        logger.debug("usage refreshed volume={} total={} used={} free={}",
                volumeId, u.totalBytes(), u.usedBytes(), u.freeBytes());
        return true;
    }

    private boolean isUsageDue(UsageState state) {
        Instant refreshedAt = CatalogTime.parse(state.usageRefreshedAt());
        if (refreshedAt == null) return true;
        if (state.eventsSinceRefresh() >= USAGE_REFRESH_EVENTS) return true;
        return !Duration.between(refreshedAt, clock.instant()).minus(USAGE_REFRESH_AGE).isNegative();
    }

    /**
     * Recomputes the volume counters from its events. Returns true when they had drifted and
     * were corrected.
     */
    public boolean reconcileCounters(String volumeId) {
        return write("reconcileCounters", h -> {
            CatalogDao dao = h.attach(CatalogDao.class);
            Optional<VolumeRow> volume = dao.findVolume(volumeId);
            if (volume.isEmpty()) return false;

            EventTotals actual = dao.eventTotals(volumeId);
            if (actual.equals(volume.get().counters())) return false;

            logger.warn("volume counters drifted volume={} stored={} actual={}",
                    volumeId, volume.get().counters(), actual);
            dao.setCounters(volumeId, actual);
            return true;
        });
    }

    // ----------------- jobs -----------------

    /** Inserts the job unless one is already active for its (volume, type). Check and insert share one gate hold. */
    public boolean insertJobIfIdle(JobRow job) {
        return write("insertJob", h -> {
            CatalogDao dao = h.attach(CatalogDao.class);
            if (dao.countActiveJobs(job.volumeId(), job.jobType()) > 0) return false;
            dao.insertJob(job);
            return true;
        });
    }

    /** Conditional transition; false when the job is not currently in one of {@code from}. */
    public boolean transitionJob(String jobId, JobStatus to, Set<JobStatus> from, String progressJson, String error) {
        Instant now = clock.instant();
        List<String> fromWire = from.stream().map(JobStatus::wire).toList();
        String completedAt = to.isTerminal() ? CatalogTime.format(now) : null;
        int updated = write("transitionJob", h -> h.attach(CatalogDao.class).transitionJob(
                jobId, to.wire(), CatalogTime.format(now), completedAt, error, progressJson, fromWire));
        return updated > 0;
    }

    public boolean updateJobProgress(String jobId, String progressJson) {
        String now = CatalogTime.format(clock.instant());
        return write("updateJobProgress",
                h -> h.attach(CatalogDao.class).updateJobProgress(jobId, progressJson, now)) > 0;
    }

    public Optional<JobRow> findJob(String jobId) {
        return read(h -> h.attach(CatalogDao.class).findJob(jobId));
    }

    public Optional<JobRow> findActiveJob(String volumeId, JobType type) {
        return read(h -> h.attach(CatalogDao.class).findActiveJob(volumeId, type.wire()));
    }

    /** Jobs in any of {@code statuses}, most recently updated first. Empty filter means all jobs. */
    public List<JobRow> listJobs(Set<JobStatus> statuses) {
        if (statuses == null || statuses.isEmpty()) {
            return read(h -> h.attach(CatalogDao.class).listAllJobs());
        }
        List<String> wire = statuses.stream().map(JobStatus::wire).toList();
        return read(h -> h.attach(CatalogDao.class).listJobs(wire));
    }

    // ----------------- read-only queries -----------------

    public List<VolumeSummary> summarizeByVolume() {
        return read(h -> h.attach(CatalogDao.class).summarizeByVolume());
    }

    public List<EventRow> listRecentEvents(Instant since, int limit) {
        String from = since == null ? "" : CatalogTime.format(since);
        return read(h -> h.attach(CatalogDao.class).listRecentEvents(from, Math.max(1, limit)));
    }

    public List<EventRow> listEventsAfter(long lastId, int limit) {
        return read(h -> h.attach(CatalogDao.class).listEventsAfter(lastId, Math.max(1, limit)));
    }

    public List<FileRow> listFiles(String volumeId, int limit) {
        return read(h -> h.attach(CatalogDao.class).listFiles(volumeId, Math.max(1, limit)));
    }

    public Optional<FileRow> findFile(String volumeId, String path) {
        return read(h -> h.attach(CatalogDao.class).findFile(volumeId, path));
    }

    public List<VolumeRow> listVolumes() {
        return read(h -> h.attach(CatalogDao.class).listVolumes());
    }

    public Optional<VolumeRow> findVolume(String volumeId) {
        return read(h -> h.attach(CatalogDao.class).findVolume(volumeId));
    }

    // ----------------- plumbing -----------------

    private <T> T write(String operation, Function<Handle, T> work) {
        return retry.call(operation, () -> {
            writeGate.lock();
            try {
                return jdbi.inTransaction(work::apply);
            } finally {
                writeGate.unlock();
            }
        });
    }

    private <T> T read(Function<Handle, T> work) {
        return retry.call("read", () -> jdbi.withHandle(work::apply));
    }

    private static String parentOf(String path) {
        Path parent = Path.of(path).getParent();
        return parent == null ? path : parent.toString();
    }

    static IdentityColumns identityColumns(VolumeIdentity identity) {
        MountInfo m = identity.mount();
        BlockDeviceInfo b = identity.block();
        return new IdentityColumns(
                identity.volumeId(),
                m == null ? null : m.device(),
                m == null ? null : m.mountPoint().toString(),
                m == null ? null : m.fsType(),
                m == null ? null : m.uuid(),
                m == null ? null : m.label(),
                m == null ? null : m.volumeId(),
                b == null ? null : b.name(),
                b == null ? null : b.path(),
                b == null ? null : b.model(),
                b == null ? null : b.serial(),
                b == null ? null : b.vendor(),
                b == null ? null : b.size(),
                b == null ? null : b.fsver(),
                b == null ? null : b.pttype(),
                b == null ? null : b.ptuuid(),
                b == null ? null : b.parttype(),
                b == null ? null : b.partuuid(),
                b == null ? null : b.parttypename(),
                b == null ? null : b.wwn(),
                b == null ? null : b.majMin(),
                toJson(identity.rawPayload()),
                identity.source().name(),
                CatalogTime.format(identity.resolvedAt())
        );
    }

    private static String toJson(Map<String, String> payload) {
        if (payload == null || payload.isEmpty()) return null;
        try {
            return MAPPER.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new CatalogException("Cannot serialize identity payload", e);
        }
    }
}
