package com.diskwatcher.app.inventory;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;

/**
 * Exclude globs are matched against the root-relative path with a leading slash, so
 * {@code **}{@code /.git/**} also catches a {@code .git} directly under the root.
 */
public record ScanConfig(List<String> excludeGlobs, int heartbeatEvery) {

    public static final int DEFAULT_HEARTBEAT_EVERY = 250;

    public ScanConfig {
        excludeGlobs = excludeGlobs == null ? List.of() : List.copyOf(excludeGlobs);
        if (heartbeatEvery < 1) throw new IllegalArgumentException("heartbeatEvery must be >= 1");
    }

    public static ScanConfig defaults() {
        return new ScanConfig(List.of(
                "**/.git/**",
                "**/node_modules/**",
                "**/$RECYCLE.BIN/**",
                "**/System Volume Information/**",
                "**/lost+found/**",
                "**/.Trash-*/**",
                "**/.Spotlight-V100/**",
                "**/.fseventsd/**"
        ), DEFAULT_HEARTBEAT_EVERY);
    }

    Excludes compile() {
        var fs = FileSystems.getDefault();
        List<PathMatcher> matchers = new ArrayList<>(excludeGlobs.size());
        for (String g : excludeGlobs) {
            if (g == null || g.isBlank()) continue;
            matchers.add(fs.getPathMatcher("glob:" + g));
        }
        return new Excludes(matchers);
    }

    record Excludes(List<PathMatcher> matchers) {

        boolean excludesFile(Path rel) {
            return matches("/" + norm(rel));
        }

        /** A directory is skipped when its contents would all be excluded. */
        boolean excludesDirectory(Path rel) {
            return matches("/" + norm(rel) + "/x");
        }

        private boolean matches(String candidate) {
            if (matchers.isEmpty()) return false;
            Path p = Path.of(candidate);
            for (PathMatcher m : matchers) {
                if (m.matches(p)) return true;
            }
            return false;
        }

        private static String norm(Path rel) {
            return rel.toString().replace('\\', '/');
        }
    }
}
