package com.diskwatcher.app.service;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.diskwatcher.app.identity.MountTable;

/**
 * Periodically compares the mount points directly under the configured roots with what is
 * attached, attaching new mounts and detaching the ones this loop attached that went away.
 */
public final class DiscoveryLoop implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(DiscoveryLoop.class);

    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(5);
    public static final Duration MIN_INTERVAL = Duration.ofSeconds(1);

    private final MountTable mountTable;
    private final VolumeAttachments attachments;
    private final List<Path> roots;
    private final Duration interval;
    private volatile boolean scanNew;

    private final Set<Path> autoPaths = new LinkedHashSet<>();
    private final Object tickLock = new Object();
    private ScheduledExecutorService scheduler;

    public DiscoveryLoop(MountTable mountTable, VolumeAttachments attachments, List<Path> roots,
                         boolean scanNew, Duration interval) {
        this.mountTable = mountTable;
        this.attachments = attachments;
        this.roots = normalizeRoots(roots);
        this.scanNew = scanNew;
        Duration requested = interval == null ? DEFAULT_INTERVAL : interval;
        this.interval = requested.compareTo(MIN_INTERVAL) < 0 ? MIN_INTERVAL : requested;
    }

    public List<Path> roots() {
        return roots;
    }

    public Duration interval() {
        return interval;
    }

    public void setScanNew(boolean scanNew) {
        this.scanNew = scanNew;
    }

    public synchronized void start() {
        if (scheduler != null) return;
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "diskwatcher-discovery");
            t.setDaemon(true);
            return t;
        });
        long millis = interval.toMillis();
        scheduler.scheduleWithFixedDelay(this::scanOnce, millis, millis, TimeUnit.MILLISECONDS);
        logger.info("auto discovery started roots={} interval={}s", roots, interval.toSeconds());
    }

    /** One synchronization pass. Never throws; a failing tick is logged and the next one runs. */
    public void scanOnce() {
        synchronized (tickLock) {
            try {
                syncState();
            } catch (IOException | RuntimeException e) {
                logger.error("auto discovery tick failed roots={}", roots, e);
            }
        }
    }

    private void syncState() throws IOException {
        Set<Path> discovered = collectDirectories();
        Set<Path> existing = new LinkedHashSet<>(attachments.attached());

        List<Path> added = new ArrayList<>();
        for (Path path : new TreeSet<>(discovered)) {
            if (existing.contains(path)) continue;
            try {
                attachments.attach(path, scanNew);
                autoPaths.add(path);
                added.add(path);
            } catch (RuntimeException e) {
                logger.warn("auto discovery attach failed path={}", path, e);
            }
        }
        if (!added.isEmpty()) {
            logger.info("auto discovery found count={} paths={}", added.size(), added);
        }

        for (Path path : List.copyOf(autoPaths)) {
            if (discovered.contains(path)) continue;
            attachments.detach(path);
            autoPaths.remove(path);
            logger.info("auto discovery removed path={}", path);
        }
    }

    Set<Path> collectDirectories() throws IOException {
        Set<Path> mounts = new LinkedHashSet<>();
        for (Path m : mountTable.mountPoints()) {
            mounts.add(m.toAbsolutePath().normalize());
        }

        Set<Path> out = new LinkedHashSet<>();
        for (Path root : roots) {
            if (!Files.isDirectory(root)) continue;
            try (DirectoryStream<Path> entries = Files.newDirectoryStream(root, Files::isDirectory)) {
                for (Path entry : entries) {
                    Path candidate = entry.toAbsolutePath().normalize();
                    if (mounts.contains(candidate)) out.add(candidate);
                }
            } catch (IOException e) {
                logger.debug("auto discovery root unreadable root={} error={}", root, e.toString());
            }
        }
        return out;
    }

    private static List<Path> normalizeRoots(List<Path> roots) {
        Set<Path> unique = new LinkedHashSet<>();
        for (Path root : roots) {
            Path p = root.toAbsolutePath().normalize();
            try {
                p = p.toRealPath();
            } catch (IOException e) {
                logger.debug("discovery root not resolvable yet root={} error={}", p, e.toString());
            }
            unique.add(p);
        }
        return List.copyOf(unique);
    }

    @Override
    public synchronized void close() {
        if (scheduler == null) return;
        scheduler.shutdownNow();
        try {
            scheduler.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        scheduler = null;
        logger.info("auto discovery stopped roots={}", roots);
    }
}
