package com.diskwatcher.app.database;

import java.util.List;
import java.util.Set;

/**
 * Editor swap files, lock files and OS litter never get a File row. Their events are still kept.
 */
public final class FileIgnoreRules {

    private static final Set<String> NAMES = Set.of(".DS_Store", "Thumbs.db");
    private static final List<String> SUFFIXES = List.of(".lock", ".tmp", ".swp", ".swx", "~");

    private FileIgnoreRules() {}

    public static boolean isIgnored(String path) {
        if (path == null || path.isEmpty()) return true;
        int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        String name = slash >= 0 ? path.substring(slash + 1) : path;
        if (NAMES.contains(name)) return true;
        for (String suffix : SUFFIXES) {
            if (name.endsWith(suffix)) return true;
        }
        return false;
    }
}
