package com.diskwatcher.app.database;

/**
 * Row shapes read from and written to the catalog. Timestamps are the stored ISO text.
 */
public final class CatalogRows {

    private CatalogRows() {}

    public record EventRow(long id, String timestamp, String eventType, String path, String directory,
                           String volumeId, Long processId) {}

    public record FileRow(String volumeId, String path, String directory, Long sizeBytes, String modifiedTime,
                          String createdTime, String lastEventTimestamp, String lastEventType, boolean deleted) {}

    public record JobRow(String jobId, String jobType, String path, String volumeId, String status,
                         String progressJson, Long ownerPid, String ownerHost, String errorMessage,
                         String startedAt, String updatedAt, String completedAt) {
        public JobStatus jobStatus() {
            return JobStatus.fromWire(status);
        }

        public JobType type() {
            return JobType.fromWire(jobType);
        }
    }

    public record VolumeSummary(String volumeId, String directory, Integer labelIndex,
                                long total, long created, long modified, long deleted, long discovered,
                                String lastEventTimestamp,
                                Long usageTotalBytes, Long usageUsedBytes, Long usageFreeBytes, String usageRefreshedAt,
                                String mountLabel, String mountUuid, String mountDevice, String identitySource) {}

    /** Full volume row, counters plus usage and identity snapshots. */
    public record VolumeRow(String volumeId, String directory, String firstSeen, Integer labelIndex,
                            long eventCount, long createdCount, long modifiedCount, long deletedCount,
                            long discoveredCount, String lastEventTimestamp,
                            Long usageTotalBytes, Long usageUsedBytes, Long usageFreeBytes, String usageRefreshedAt,
                            long eventsSinceRefresh,
                            String mountDevice, String mountPoint, String mountFstype, String mountUuid,
                            String mountLabel, String mountVolumeId,
                            String lsblkName, String lsblkPath, String lsblkModel, String lsblkSerial,
                            String lsblkVendor, String lsblkSize, String lsblkFsver, String lsblkPttype,
                            String lsblkPtuuid, String lsblkParttype, String lsblkPartuuid, String lsblkParttypename,
                            String lsblkWwn, String lsblkMajMin, String lsblkJson,
                            String identitySource, String identityRefreshedAt) {

        public EventTotals counters() {
            return new EventTotals(eventCount, createdCount, modifiedCount, deletedCount, discoveredCount);
        }
    }

    public record EventTotals(long total, long created, long modified, long deleted, long discovered) {}

    public record UsageState(String directory, long eventsSinceRefresh, String usageRefreshedAt) {}

    public record DiskUsage(long totalBytes, long usedBytes, long freeBytes) {}

    /** Flattened identity snapshot bound into the volumes row. */
    public record IdentityColumns(String volumeId, String mountDevice, String mountPoint, String mountFstype,
                                  String mountUuid, String mountLabel, String mountVolumeId,
                                  String lsblkName, String lsblkPath, String lsblkModel, String lsblkSerial,
                                  String lsblkVendor, String lsblkSize, String lsblkFsver, String lsblkPttype,
                                  String lsblkPtuuid, String lsblkParttype, String lsblkPartuuid,
                                  String lsblkParttypename, String lsblkWwn, String lsblkMajMin, String lsblkJson,
                                  String identitySource, String identityRefreshedAt) {}
}
