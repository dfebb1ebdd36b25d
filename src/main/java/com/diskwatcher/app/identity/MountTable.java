package com.diskwatcher.app.identity;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import oshi.SystemInfo;
import oshi.software.os.OSFileStore;

/**
 * Lists current mount points. Linux reads the kernel table; other platforms ask OSHI.
 */
@FunctionalInterface
public interface MountTable {

    Set<Path> mountPoints() throws IOException;

    static MountTable platformDefault() {
        String os = System.getProperty("os.name", "generic").toLowerCase(Locale.ROOT);
        Path proc = Path.of("/proc/self/mounts");
        if (os.contains("linux") && Files.isReadable(proc)) {
            return procMounts(proc);
        }
        return oshi();
    }

    static MountTable procMounts(Path file) {
        return () -> parseProcMounts(Files.readAllLines(file, StandardCharsets.UTF_8));
    }

    static MountTable oshi() {
        return () -> {
            Set<Path> out = new LinkedHashSet<>();
            for (OSFileStore store : new SystemInfo().getOperatingSystem().getFileSystem().getFileStores()) {
                String mount = store.getMount();
                if (mount != null && !mount.isBlank()) out.add(Path.of(mount));
            }
            return out;
        };
    }

    static Set<Path> parseProcMounts(List<String> lines) {
        Set<Path> out = new LinkedHashSet<>();
        for (String line : lines) {
            String[] fields = line.trim().split("\\s+");
            if (fields.length < 2) continue;
            out.add(Path.of(decodeOctal(fields[1])));
        }
        return out;
    }

    /** /proc/mounts escapes space, tab, newline and backslash as \ooo. */
    static String decodeOctal(String field) {
        if (field.indexOf('\\') < 0) return field;
        List<Byte> bytes = new ArrayList<>();
        byte[] src = field.getBytes(StandardCharsets.UTF_8);
        for (int i = 0; i < src.length; i++) {
            if (src[i] == '\\' && isOctal(src, i + 1)) {
                bytes.add((byte) Integer.parseInt(new String(src, i + 1, 3, StandardCharsets.US_ASCII), 8));
                i += 3;
            } else {
                bytes.add(src[i]);
            }
        }
        byte[] decoded = new byte[bytes.size()];
        for (int i = 0; i < decoded.length; i++) decoded[i] = bytes.get(i);
        return new String(decoded, StandardCharsets.UTF_8);
    }

    private static boolean isOctal(byte[] src, int from) {
        if (from + 3 > src.length) return false;
        for (int i = from; i < from + 3; i++) {
            if (src[i] < '0' || src[i] > '7') return false;
        }
        return true;
    }
}
