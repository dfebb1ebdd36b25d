package com.diskwatcher.app.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import com.diskwatcher.app.inventory.ScanConfig;
import com.diskwatcher.app.inventory.ScanWorkerPool;
import com.diskwatcher.app.service.DiscoveryLoop;

/**
 * Runtime knobs handed to the engine at construction.
 */
public record EngineSettings(int maxScanWorkers, boolean autoScan, List<Path> autoDiscoverRoots,
                             Duration discoveryInterval, ScanConfig scanConfig) {

    public EngineSettings {
        if (maxScanWorkers < 1) throw new IllegalArgumentException("maxScanWorkers must be >= 1");
        autoDiscoverRoots = autoDiscoverRoots == null ? List.of() : List.copyOf(autoDiscoverRoots);
        discoveryInterval = discoveryInterval == null ? DiscoveryLoop.DEFAULT_INTERVAL : discoveryInterval;
        scanConfig = scanConfig == null ? ScanConfig.defaults() : scanConfig;
    }

    public static EngineSettings defaults() {
        return new EngineSettings(ScanWorkerPool.defaultMaxWorkers(), true, List.of(),
                DiscoveryLoop.DEFAULT_INTERVAL, ScanConfig.defaults());
    }

    public EngineSettings withMaxScanWorkers(int n) {
        return new EngineSettings(n, autoScan, autoDiscoverRoots, discoveryInterval, scanConfig);
    }

    public EngineSettings withAutoScan(boolean enabled) {
        return new EngineSettings(maxScanWorkers, enabled, autoDiscoverRoots, discoveryInterval, scanConfig);
    }

    public EngineSettings withAutoDiscoverRoots(List<Path> roots) {
        return new EngineSettings(maxScanWorkers, autoScan, roots, discoveryInterval, scanConfig);
    }
}
