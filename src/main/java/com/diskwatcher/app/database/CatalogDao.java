package com.diskwatcher.app.database;

import java.util.List;
import java.util.Optional;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.customizer.BindList;
import org.jdbi.v3.sqlobject.customizer.BindMethods;
import org.jdbi.v3.sqlobject.statement.GetGeneratedKeys;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import com.diskwatcher.app.database.CatalogRows.EventRow;
import com.diskwatcher.app.database.CatalogRows.EventTotals;
import com.diskwatcher.app.database.CatalogRows.FileRow;
import com.diskwatcher.app.database.CatalogRows.IdentityColumns;
import com.diskwatcher.app.database.CatalogRows.JobRow;
import com.diskwatcher.app.database.CatalogRows.UsageState;
import com.diskwatcher.app.database.CatalogRows.VolumeRow;
import com.diskwatcher.app.database.CatalogRows.VolumeSummary;

public interface CatalogDao {

    String JOB_COLUMNS = """
            job_id AS jobId, job_type AS jobType, path, volume_id AS volumeId, status,
            progress_json AS progressJson, owner_pid AS ownerPid, owner_host AS ownerHost,
            error_message AS errorMessage, started_at AS startedAt, updated_at AS updatedAt,
            completed_at AS completedAt
            """;

    String VOLUME_COLUMNS = """
            volume_id AS volumeId, directory, first_seen AS firstSeen, label_index AS labelIndex,
            event_count AS eventCount, created_count AS createdCount, modified_count AS modifiedCount,
            deleted_count AS deletedCount, discovered_count AS discoveredCount,
            last_event_timestamp AS lastEventTimestamp,
            usage_total_bytes AS usageTotalBytes, usage_used_bytes AS usageUsedBytes,
            usage_free_bytes AS usageFreeBytes, usage_refreshed_at AS usageRefreshedAt,
            events_since_refresh AS eventsSinceRefresh,
            mount_device AS mountDevice, mount_point AS mountPoint, mount_fstype AS mountFstype,
            mount_uuid AS mountUuid, mount_label AS mountLabel, mount_volume_id AS mountVolumeId,
            lsblk_name AS lsblkName, lsblk_path AS lsblkPath, lsblk_model AS lsblkModel,
            lsblk_serial AS lsblkSerial, lsblk_vendor AS lsblkVendor, lsblk_size AS lsblkSize,
            lsblk_fsver AS lsblkFsver, lsblk_pttype AS lsblkPttype, lsblk_ptuuid AS lsblkPtuuid,
            lsblk_parttype AS lsblkParttype, lsblk_partuuid AS lsblkPartuuid,
            lsblk_parttypename AS lsblkParttypename, lsblk_wwn AS lsblkWwn, lsblk_maj_min AS lsblkMajMin,
            lsblk_json AS lsblkJson, identity_source AS identitySource,
            identity_refreshed_at AS identityRefreshedAt
            """;

    String FILE_COLUMNS = """
            volume_id AS volumeId, path, directory, size_bytes AS sizeBytes,
            modified_time AS modifiedTime, created_time AS createdTime,
            last_event_timestamp AS lastEventTimestamp, last_event_type AS lastEventType,
            is_deleted AS deleted
            """;

    String EVENT_COLUMNS = """
            id, timestamp, event_type AS eventType, path, directory, volume_id AS volumeId,
            process_id AS processId
            """;

    // --- Events --------------------------------------------------------------

    @SqlUpdate("""
        INSERT INTO events(timestamp, event_type, path, directory, volume_id, process_id)
        VALUES(:timestamp, :eventType, :path, :directory, :volumeId, :processId)
        """)
    @GetGeneratedKeys("id")
    long insertEvent(@Bind("timestamp") String timestamp,
                     @Bind("eventType") String eventType,
                     @Bind("path") String path,
                     @Bind("directory") String directory,
                     @Bind("volumeId") String volumeId,
                     @Bind("processId") Long processId);

    @SqlQuery("SELECT " + EVENT_COLUMNS + " FROM events WHERE timestamp >= :since ORDER BY id DESC LIMIT :limit")
    @RegisterConstructorMapper(EventRow.class)
    List<EventRow> listRecentEvents(@Bind("since") String since, @Bind("limit") int limit);

    @SqlQuery("SELECT " + EVENT_COLUMNS + " FROM events WHERE id > :lastId ORDER BY id ASC LIMIT :limit")
    @RegisterConstructorMapper(EventRow.class)
    List<EventRow> listEventsAfter(@Bind("lastId") long lastId, @Bind("limit") int limit);

    @SqlQuery("""
        SELECT COUNT(*) AS total,
               COALESCE(SUM(CASE WHEN event_type = 'created' THEN 1 ELSE 0 END), 0) AS created,
               COALESCE(SUM(CASE WHEN event_type = 'modified' THEN 1 ELSE 0 END), 0) AS modified,
               COALESCE(SUM(CASE WHEN event_type = 'deleted' THEN 1 ELSE 0 END), 0) AS deleted,
               COALESCE(SUM(CASE WHEN event_type = 'discovered' THEN 1 ELSE 0 END), 0) AS discovered
          FROM events
         WHERE volume_id = :volumeId
        """)
    @RegisterConstructorMapper(EventTotals.class)
    EventTotals eventTotals(@Bind("volumeId") String volumeId);

    // --- Volumes -------------------------------------------------------------

    /** Creates the row on first sight with the next label ordinal; later calls only refresh the directory. */
    @SqlUpdate("""
        INSERT INTO volumes(volume_id, directory, first_seen, label_index)
        VALUES(:volumeId, :directory, :now, (SELECT COALESCE(MAX(label_index), 0) + 1 FROM volumes))
        ON CONFLICT(volume_id) DO UPDATE SET directory = excluded.directory
        """)
    void ensureVolume(@Bind("volumeId") String volumeId, @Bind("directory") String directory, @Bind("now") String now);

    @SqlUpdate("""
        UPDATE volumes
           SET event_count = event_count + 1,
               created_count = created_count + (CASE WHEN :eventType = 'created' THEN 1 ELSE 0 END),
               modified_count = modified_count + (CASE WHEN :eventType = 'modified' THEN 1 ELSE 0 END),
               deleted_count = deleted_count + (CASE WHEN :eventType = 'deleted' THEN 1 ELSE 0 END),
               discovered_count = discovered_count + (CASE WHEN :eventType = 'discovered' THEN 1 ELSE 0 END),
               last_event_timestamp = :timestamp,
               events_since_refresh = events_since_refresh + 1
         WHERE volume_id = :volumeId
        """)
    int bumpCounters(@Bind("volumeId") String volumeId, @Bind("eventType") String eventType,
                     @Bind("timestamp") String timestamp);

    @SqlUpdate("""
        UPDATE volumes
           SET event_count = :t.total,
               created_count = :t.created,
               modified_count = :t.modified,
               deleted_count = :t.deleted,
               discovered_count = :t.discovered
         WHERE volume_id = :volumeId
        """)
    int setCounters(@Bind("volumeId") String volumeId, @BindMethods("t") EventTotals totals);

    @SqlQuery("""
        SELECT directory, events_since_refresh AS eventsSinceRefresh, usage_refreshed_at AS usageRefreshedAt
          FROM volumes
         WHERE volume_id = :volumeId
        """)
    @RegisterConstructorMapper(UsageState.class)
    Optional<UsageState> usageState(@Bind("volumeId") String volumeId);

    @SqlUpdate("""
        UPDATE volumes
           SET usage_total_bytes = :total,
               usage_used_bytes = :used,
               usage_free_bytes = :free,
               usage_refreshed_at = :now,
               events_since_refresh = 0
         WHERE volume_id = :volumeId
        """)
    int updateUsage(@Bind("volumeId") String volumeId, @Bind("total") long total, @Bind("used") long used,
                    @Bind("free") long free, @Bind("now") String now);

    @SqlUpdate("""
        UPDATE volumes
           SET mount_device = :v.mountDevice,
               mount_point = :v.mountPoint,
               mount_fstype = :v.mountFstype,
               mount_uuid = :v.mountUuid,
               mount_label = :v.mountLabel,
               mount_volume_id = :v.mountVolumeId,
               lsblk_name = :v.lsblkName,
               lsblk_path = :v.lsblkPath,
               lsblk_model = :v.lsblkModel,
               lsblk_serial = :v.lsblkSerial,
               lsblk_vendor = :v.lsblkVendor,
               lsblk_size = :v.lsblkSize,
               lsblk_fsver = :v.lsblkFsver,
               lsblk_pttype = :v.lsblkPttype,
               lsblk_ptuuid = :v.lsblkPtuuid,
               lsblk_parttype = :v.lsblkParttype,
               lsblk_partuuid = :v.lsblkPartuuid,
               lsblk_parttypename = :v.lsblkParttypename,
               lsblk_wwn = :v.lsblkWwn,
               lsblk_maj_min = :v.lsblkMajMin,
               lsblk_json = :v.lsblkJson,
               identity_source = :v.identitySource,
               identity_refreshed_at = :v.identityRefreshedAt
         WHERE volume_id = :v.volumeId
        """)
    int updateIdentity(@BindMethods("v") IdentityColumns columns);

    @SqlQuery("SELECT " + VOLUME_COLUMNS + " FROM volumes WHERE volume_id = :volumeId")
    @RegisterConstructorMapper(VolumeRow.class)
    Optional<VolumeRow> findVolume(@Bind("volumeId") String volumeId);

    @SqlQuery("SELECT " + VOLUME_COLUMNS + " FROM volumes ORDER BY label_index, volume_id")
    @RegisterConstructorMapper(VolumeRow.class)
    List<VolumeRow> listVolumes();

    @SqlQuery("""
        SELECT v.volume_id AS volumeId,
               v.directory AS directory,
               v.label_index AS labelIndex,
               COALESCE(e.total, 0) AS total,
               COALESCE(e.created, 0) AS created,
               COALESCE(e.modified, 0) AS modified,
               COALESCE(e.deleted, 0) AS deleted,
               COALESCE(e.discovered, 0) AS discovered,
               COALESCE(e.last_ts, v.last_event_timestamp) AS lastEventTimestamp,
               v.usage_total_bytes AS usageTotalBytes,
               v.usage_used_bytes AS usageUsedBytes,
               v.usage_free_bytes AS usageFreeBytes,
               v.usage_refreshed_at AS usageRefreshedAt,
               v.mount_label AS mountLabel,
               v.mount_uuid AS mountUuid,
               v.mount_device AS mountDevice,
               v.identity_source AS identitySource
          FROM volumes v
          LEFT JOIN (
                SELECT volume_id,
                       COUNT(*) AS total,
                       SUM(CASE WHEN event_type = 'created' THEN 1 ELSE 0 END) AS created,
                       SUM(CASE WHEN event_type = 'modified' THEN 1 ELSE 0 END) AS modified,
                       SUM(CASE WHEN event_type = 'deleted' THEN 1 ELSE 0 END) AS deleted,
                       SUM(CASE WHEN event_type = 'discovered' THEN 1 ELSE 0 END) AS discovered,
                       MAX(timestamp) AS last_ts
                  FROM events
                 GROUP BY volume_id
          ) e ON e.volume_id = v.volume_id
         ORDER BY v.label_index, v.volume_id
        """)
    @RegisterConstructorMapper(VolumeSummary.class)
    List<VolumeSummary> summarizeByVolume();

    // --- Files ---------------------------------------------------------------

    /**
     * A {@code discovered} upsert over an identical live row is a no-op, so rescans leave rows untouched.
     * Anything else rewrites metadata and clears the deleted flag.
     */
    @SqlUpdate("""
        INSERT INTO files(volume_id, path, directory, size_bytes, modified_time, created_time,
                          last_event_timestamp, last_event_type, is_deleted)
        VALUES(:volumeId, :path, :directory, :size, :mtime, :ctime, :timestamp, :eventType, 0)
        ON CONFLICT(volume_id, path) DO UPDATE SET
               directory = excluded.directory,
               size_bytes = excluded.size_bytes,
               modified_time = excluded.modified_time,
               created_time = COALESCE(files.created_time, excluded.created_time),
               last_event_timestamp = excluded.last_event_timestamp,
               last_event_type = excluded.last_event_type,
               is_deleted = 0
         WHERE excluded.last_event_type != 'discovered'
            OR files.is_deleted != 0
            OR files.size_bytes IS NOT excluded.size_bytes
            OR files.modified_time IS NOT excluded.modified_time
        """)
    int upsertFile(@Bind("volumeId") String volumeId,
                   @Bind("path") String path,
                   @Bind("directory") String directory,
                   @Bind("size") Long size,
                   @Bind("mtime") String modifiedTime,
                   @Bind("ctime") String createdTime,
                   @Bind("timestamp") String timestamp,
                   @Bind("eventType") String eventType);

    /** Keeps size and times; a delete for a never-seen path still leaves a tombstone row. */
    @SqlUpdate("""
        INSERT INTO files(volume_id, path, directory, last_event_timestamp, last_event_type, is_deleted)
        VALUES(:volumeId, :path, :directory, :timestamp, 'deleted', 1)
        ON CONFLICT(volume_id, path) DO UPDATE SET
               is_deleted = 1,
               last_event_timestamp = excluded.last_event_timestamp,
               last_event_type = 'deleted'
        """)
    int markFileDeleted(@Bind("volumeId") String volumeId,
                        @Bind("path") String path,
                        @Bind("directory") String directory,
                        @Bind("timestamp") String timestamp);

    @SqlQuery("SELECT " + FILE_COLUMNS + " FROM files WHERE volume_id = :volumeId AND path = :path")
    @RegisterConstructorMapper(FileRow.class)
    Optional<FileRow> findFile(@Bind("volumeId") String volumeId, @Bind("path") String path);

    @SqlQuery("SELECT " + FILE_COLUMNS + """
          FROM files
         WHERE volume_id = :volumeId
         ORDER BY last_event_timestamp DESC, path
         LIMIT :limit
        """)
    @RegisterConstructorMapper(FileRow.class)
    List<FileRow> listFiles(@Bind("volumeId") String volumeId, @Bind("limit") int limit);

    // --- Jobs ----------------------------------------------------------------

    @SqlQuery("""
        SELECT COUNT(*) FROM jobs
         WHERE volume_id = :volumeId AND job_type = :jobType AND status IN ('pending', 'running')
        """)
    int countActiveJobs(@Bind("volumeId") String volumeId, @Bind("jobType") String jobType);

    @SqlUpdate("""
        INSERT INTO jobs(job_id, job_type, path, volume_id, status, progress_json, owner_pid, owner_host,
                         started_at, updated_at)
        VALUES(:j.jobId, :j.jobType, :j.path, :j.volumeId, :j.status, :j.progressJson, :j.ownerPid, :j.ownerHost,
               :j.startedAt, :j.updatedAt)
        """)
    void insertJob(@BindMethods("j") JobRow job);

    @SqlUpdate("""
        UPDATE jobs
           SET status = :to,
               updated_at = :now,
               completed_at = :completedAt,
               error_message = COALESCE(:error, error_message),
               progress_json = COALESCE(:progress, progress_json)
         WHERE job_id = :jobId
           AND status IN (<from>)
        """)
    int transitionJob(@Bind("jobId") String jobId,
                      @Bind("to") String to,
                      @Bind("now") String now,
                      @Bind("completedAt") String completedAt,
                      @Bind("error") String error,
                      @Bind("progress") String progressJson,
                      @BindList("from") List<String> from);

    @SqlUpdate("""
        UPDATE jobs
           SET progress_json = :progress,
               updated_at = :now
         WHERE job_id = :jobId
           AND status IN ('pending', 'running')
        """)
    int updateJobProgress(@Bind("jobId") String jobId, @Bind("progress") String progressJson, @Bind("now") String now);

    @SqlQuery("SELECT " + JOB_COLUMNS + " FROM jobs WHERE job_id = :jobId")
    @RegisterConstructorMapper(JobRow.class)
    Optional<JobRow> findJob(@Bind("jobId") String jobId);

    @SqlQuery("SELECT " + JOB_COLUMNS + """
          FROM jobs
         WHERE volume_id = :volumeId AND job_type = :jobType AND status IN ('pending', 'running')
         ORDER BY started_at DESC
         LIMIT 1
        """)
    @RegisterConstructorMapper(JobRow.class)
    Optional<JobRow> findActiveJob(@Bind("volumeId") String volumeId, @Bind("jobType") String jobType);

    @SqlQuery("SELECT " + JOB_COLUMNS + " FROM jobs WHERE status IN (<statuses>) ORDER BY updated_at DESC, started_at DESC")
    @RegisterConstructorMapper(JobRow.class)
    List<JobRow> listJobs(@BindList("statuses") List<String> statuses);

    @SqlQuery("SELECT " + JOB_COLUMNS + " FROM jobs ORDER BY updated_at DESC, started_at DESC")
    @RegisterConstructorMapper(JobRow.class)
    List<JobRow> listAllJobs();
}
