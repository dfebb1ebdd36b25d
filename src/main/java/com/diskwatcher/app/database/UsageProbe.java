package com.diskwatcher.app.database;

import java.nio.file.Path;
import java.util.Optional;

/** Disk usage of the filesystem holding a directory. Runs outside the write gate. */
@FunctionalInterface
public interface UsageProbe {

    Optional<CatalogRows.DiskUsage> probe(Path directory);

    static UsageProbe fileStore() {
        return new FileStoreUsageProbe();
    }
}
