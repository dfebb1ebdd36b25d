package com.diskwatcher.app.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class DiscoveryLoopTest {

    @TempDir
    Path tmp;

    private static final class RecordingAttachments implements VolumeAttachments {
        final Set<Path> current = new LinkedHashSet<>();
        final List<String> calls = new ArrayList<>();

        @Override
        public void attach(Path directory, boolean scan) {
            current.add(directory);
            calls.add("attach " + directory.getFileName() + " scan=" + scan);
        }

        @Override
        public boolean detach(Path directory) {
            calls.add("detach " + directory.getFileName());
            return current.remove(directory);
        }

        @Override
        public Set<Path> attached() {
            return Set.copyOf(current);
        }
    }

    @Test
    void attachesMountedChildrenAndDetachesWhenUnmounted() throws IOException {
        Path root = tmp.toRealPath().resolve("media");
        Path usb = Files.createDirectories(root.resolve("usb"));
        Path disk = Files.createDirectories(root.resolve("disk"));
        Files.createDirectories(root.resolve("plain-folder"));

        Set<Path> mounts = new LinkedHashSet<>(List.of(usb, disk, Path.of("/")));
        RecordingAttachments attachments = new RecordingAttachments();
        DiscoveryLoop loop = new DiscoveryLoop(() -> Set.copyOf(mounts), attachments, List.of(root), true, null);

        loop.scanOnce();
        assertEquals(List.of("attach disk scan=true", "attach usb scan=true"), attachments.calls,
                "Mounted children are attached in path order; plain folders are ignored");

        loop.scanOnce();
        assertEquals(2, attachments.calls.size(), "Second pass with no changes does nothing");

        mounts.remove(usb);
        loop.scanOnce();
        assertEquals("detach usb", attachments.calls.get(2));
        assertEquals(Set.of(disk), attachments.attached());
    }

    @Test
    void neverDetachesManuallyAttachedPaths() throws IOException {
        Path root = tmp.toRealPath().resolve("mnt");
        Path manual = Files.createDirectories(root.resolve("manual"));

        RecordingAttachments attachments = new RecordingAttachments();
        attachments.current.add(manual);
        DiscoveryLoop loop = new DiscoveryLoop(Set::of, attachments, List.of(root), false, Duration.ofSeconds(2));

        loop.scanOnce();

        assertTrue(attachments.calls.isEmpty());
        assertTrue(attachments.attached().contains(manual));
    }

    @Test
    void failingMountTableDoesNotEscape() {
        RecordingAttachments attachments = new RecordingAttachments();
        DiscoveryLoop loop = new DiscoveryLoop(() -> {
            throw new IOException("no /proc");
        }, attachments, List.of(tmp), false, null);

        assertDoesNotThrow(loop::scanOnce);
        assertTrue(attachments.calls.isEmpty());
    }

    @Test
    void intervalDefaultsAndClamp() {
        RecordingAttachments attachments = new RecordingAttachments();
        assertEquals(DiscoveryLoop.DEFAULT_INTERVAL,
                new DiscoveryLoop(Set::of, attachments, List.of(tmp), false, null).interval());
        assertEquals(DiscoveryLoop.MIN_INTERVAL,
                new DiscoveryLoop(Set::of, attachments, List.of(tmp), false, Duration.ofMillis(10)).interval());
    }

    @Test
    void missingRootIsSkipped() throws IOException {
        RecordingAttachments attachments = new RecordingAttachments();
        DiscoveryLoop loop = new DiscoveryLoop(Set::of, attachments, List.of(tmp.resolve("absent")), false, null);

        assertTrue(loop.collectDirectories().isEmpty());
    }
}
