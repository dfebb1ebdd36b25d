package com.diskwatcher.app.database;

import java.io.IOException;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class FileStoreUsageProbe implements UsageProbe {

    private static final Logger logger = LoggerFactory.getLogger(FileStoreUsageProbe.class);

    @Override
    public Optional<CatalogRows.DiskUsage> probe(Path directory) {
        try {
            FileStore store = Files.getFileStore(directory);
            long total = store.getTotalSpace();
            long free = store.getUsableSpace();
            long used = Math.max(0, total - store.getUnallocatedSpace());
            return Optional.of(new CatalogRows.DiskUsage(total, used, free));
        } catch (IOException e) {
            logger.debug("usage probe failed dir={} error={}", directory, e.toString());
            return Optional.empty();
        }
    }
}
