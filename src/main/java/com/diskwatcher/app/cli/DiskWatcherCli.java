package com.diskwatcher.app.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.diskwatcher.app.api.DashboardApi;
import com.diskwatcher.app.config.Config;
import com.diskwatcher.app.config.ConfigException;
import com.diskwatcher.app.config.EngineSettings;
import com.diskwatcher.app.config.LoggingSetup;
import com.diskwatcher.app.config.UserSettings;
import com.diskwatcher.app.database.CatalogDatabase;
import com.diskwatcher.app.database.CatalogRows.EventRow;
import com.diskwatcher.app.database.CatalogRows.FileRow;
import com.diskwatcher.app.database.CatalogRows.JobRow;
import com.diskwatcher.app.database.CatalogRows.VolumeSummary;
import com.diskwatcher.app.database.CatalogStore;
import com.diskwatcher.app.database.JobStatus;
import com.diskwatcher.app.inventory.ScanStats;
import com.diskwatcher.app.report.LabelExporter;
import com.diskwatcher.app.report.LabelRows;
import com.diskwatcher.app.report.LabelRows.LabelRow;
import com.diskwatcher.app.service.DiskWatcherEngine;
import com.diskwatcher.app.service.JobTracker;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

public final class DiskWatcherCli {

    private static final Logger logger = LoggerFactory.getLogger(DiskWatcherCli.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String LOG_FILE = "diskwatcher.log";

    private final PrintStream out;
    private final PrintStream err;

    DiskWatcherCli(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int exitCode = execute(args);
        if (exitCode != 0) System.exit(exitCode);
    }

    public static int execute(String[] args) {
        return new DiskWatcherCli(System.out, System.err).run(args);
    }

    int run(String[] args) {
        ParseResult<GlobalArgs> global = GlobalArgs.parse(args);
        if (global.error() != null) {
            err.println(global.error());
            printUsage();
            return 2;
        }
        String[] rest = global.value().rest();
        if (rest.length == 0) {
            printUsage();
            return 0;
        }

        String cmd = safeLower(rest[0]);
        String[] cmdArgs = Arrays.copyOfRange(rest, 1, rest.length);

        try {
            applyLogLevel(global.value().logLevel(), cmd);
            return switch (cmd) {
                case "run" -> runWatch(cmdArgs);
                case "status" -> runStatus(cmdArgs);
                case "jobs" -> runJobs(cmdArgs);
                case "files" -> runFiles(cmdArgs);
                case "events" -> runEvents(cmdArgs);
                case "suggest" -> runSuggest(cmdArgs);
                case "config" -> runConfig(cmdArgs);
                case "labels" -> runLabels(cmdArgs);
                case "dashboard" -> runDashboard(cmdArgs);
                case "log" -> runLog(cmdArgs);
                case "help", "-h", "--help" -> {
                    printUsage();
                    yield 0;
                }
                default -> {
                    err.println("Unknown command: " + rest[0]);
                    printUsage();
                    yield 2;
                }
            };
        } catch (ConfigException e) {
            err.println("Configuration error: " + safeMsg(e));
            return 1;
        } catch (Exception e) {
            logger.debug("command failed cmd={}", cmd, e);
            err.println("Fatal error: " + safeMsg(e));
            return 1;
        }
    }

    private void applyLogLevel(String explicit, String cmd) {
        if (explicit != null) {
            LoggingSetup.apply(explicit);
            return;
        }
        // config subcommands must work even when the file is broken
        if (cmd.equals("config")) return;
        LoggingSetup.apply(UserSettings.load().logLevel());
    }

    // ----------------- run -----------------

    private int runWatch(String[] args) throws InterruptedException {
        ParseResult<RunArgs> parsed = RunArgs.parse(args);
        if (parsed.help()) {
            printRunUsage();
            return 0;
        }
        if (parsed.error() != null) {
            err.println(parsed.error());
            printRunUsage();
            return 2;
        }
        RunArgs a = parsed.value();

        UserSettings user = UserSettings.load();
        EngineSettings settings = user.toEngineSettings();
        List<Path> roots = a.autoDiscoverRoots().isEmpty() ? settings.autoDiscoverRoots() : a.autoDiscoverRoots();
        boolean scan = settings.autoScan() && !a.noScan();

        List<Path> dirs = new ArrayList<>();
        for (String d : a.directories()) {
            Path p = Path.of(d).toAbsolutePath().normalize();
            if (!Files.isDirectory(p)) {
                err.println("Directory does not exist: " + p);
                return 2;
            }
            dirs.add(p);
        }

        CatalogDatabase db = CatalogDatabase.open(Config.getDbFilePath());
        DiskWatcherEngine engine = new DiskWatcherEngine(new CatalogStore(db), settings);

        if (dirs.isEmpty() && roots.isEmpty()) {
            List<DiskWatcherEngine.Suggestion> suggested = engine.suggestDirectories();
            if (suggested.isEmpty()) {
                err.println("No suitable directories found to monitor. Specify one manually.");
                engine.stopAll();
                db.close();
                return 1;
            }
            dirs.add(suggested.get(0).directory());
        }

        CountDownLatch shutdown = new CountDownLatch(1);
        Thread hook = new Thread(() -> {
            logger.info("shutdown requested");
            engine.stopAll();
            db.close();
            shutdown.countDown();
        }, "diskwatcher-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);

        for (Path p : dirs) {
            engine.addDirectory(p);
        }
        if (scan && !dirs.isEmpty()) {
            out.println("Watching " + dirs.size() + " director" + (dirs.size() == 1 ? "y" : "ies")
                    + " while the initial scan runs.");
            Map<String, Optional<ScanStats>> results = engine.watchAndScan(dirs);
            for (Map.Entry<String, Optional<ScanStats>> e : results.entrySet()) {
                out.println(e.getValue()
                        .map(s -> "scan " + s.outcome().name().toLowerCase(Locale.ROOT) + ": " + s.root()
                                + " (volume=" + s.volumeId() + ", files=" + s.filesSeen() + ")")
                        .orElse("scan skipped: volume=" + e.getKey()));
            }
        } else {
            engine.startWatching();
        }
        if (!roots.isEmpty()) {
            engine.enableAutoDiscovery(roots, scan, settings.discoveryInterval());
        }

        out.println("Watching " + engine.currentPaths().size() + " director"
                + (engine.currentPaths().size() == 1 ? "y" : "ies") + ". Press Ctrl+C to stop.");
        shutdown.await();
        return 0;
    }

    // ----------------- status -----------------

    private int runStatus(String[] args) throws JsonProcessingException {
        ParseResult<StatusArgs> parsed = StatusArgs.parse(args);
        if (parsed.help()) {
            printStatusUsage();
            return 0;
        }
        if (parsed.error() != null) {
            err.println(parsed.error());
            printStatusUsage();
            return 2;
        }
        StatusArgs a = parsed.value();

        try (CatalogDatabase db = CatalogDatabase.open(Config.getDbFilePath())) {
            CatalogStore store = new CatalogStore(db);
            List<VolumeSummary> volumes = store.summarizeByVolume();
            List<JobRow> jobs = store.listJobs(JobStatus.ACTIVE);
            List<EventRow> events = store.listRecentEvents(null, a.limit());

            if (a.json()) {
                ObjectNode root = MAPPER.createObjectNode();
                root.set("volumes", MAPPER.valueToTree(volumes));
                root.set("jobs", jobsJson(jobs));
                root.set("events", MAPPER.valueToTree(events));
                out.println(MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(root));
                return 0;
            }

            if (volumes.isEmpty()) {
                out.println("No volumes recorded yet.");
            } else {
                out.println("label | volume | directory | total | created | modified | deleted | discovered | last event");
                for (VolumeSummary v : volumes) {
                    out.printf("%s | %s | %s | %d | %d | %d | %d | %d | %s%n",
                            v.labelIndex() == null ? "-" : v.labelIndex(),
                            v.volumeId(), safeText(v.directory()),
                            v.total(), v.created(), v.modified(), v.deleted(), v.discovered(),
                            safeText(v.lastEventTimestamp()));
                }
            }

            out.println();
            printJobs(jobs, "No active jobs.");

            out.println();
            printEvents(events);
            return 0;
        }
    }

    // ----------------- jobs / files / events -----------------

    private int runJobs(String[] args) {
        boolean all = false;
        for (String t : args) {
            switch (t) {
                case "-h", "--help" -> {
                    out.println("Usage:\n  jobs [--all]");
                    return 0;
                }
                case "--all" -> all = true;
                default -> {
                    err.println("Invalid option: " + t);
                    return 2;
                }
            }
        }
        try (CatalogDatabase db = CatalogDatabase.open(Config.getDbFilePath())) {
            CatalogStore store = new CatalogStore(db);
            List<JobRow> jobs = store.listJobs(all ? EnumSet.allOf(JobStatus.class) : JobStatus.ACTIVE);
            printJobs(jobs, all ? "No jobs recorded." : "No active jobs.");
            return 0;
        }
    }

    private int runFiles(String[] args) {
        ParseResult<FilesArgs> parsed = FilesArgs.parse(args);
        if (parsed.help()) {
            out.println("Usage:\n  files <volume-id> [--limit <n>]");
            return 0;
        }
        if (parsed.error() != null) {
            err.println(parsed.error());
            return 2;
        }
        try (CatalogDatabase db = CatalogDatabase.open(Config.getDbFilePath())) {
            List<FileRow> files = new CatalogStore(db).listFiles(parsed.value().volumeId(), parsed.value().limit());
            if (files.isEmpty()) {
                out.println("No files recorded for volume " + parsed.value().volumeId() + ".");
                return 0;
            }
            out.println("path | size | modified | last event | deleted");
            for (FileRow f : files) {
                out.printf("%s | %s | %s | %s | %s%n",
                        f.path(),
                        f.sizeBytes() == null ? "-" : f.sizeBytes(),
                        safeText(f.modifiedTime()),
                        safeText(f.lastEventType()),
                        f.deleted() ? "yes" : "no");
            }
            return 0;
        }
    }

    private int runEvents(String[] args) {
        ParseResult<Integer> parsed = parseLimitOnly(args, 20);
        if (parsed.help()) {
            out.println("Usage:\n  events [--limit <n>]");
            return 0;
        }
        if (parsed.error() != null) {
            err.println(parsed.error());
            return 2;
        }
        try (CatalogDatabase db = CatalogDatabase.open(Config.getDbFilePath())) {
            printEvents(new CatalogStore(db).listRecentEvents(null, parsed.value()));
            return 0;
        }
    }

    // ----------------- suggest -----------------

    private int runSuggest(String[] args) {
        if (args.length > 0) {
            err.println("Invalid option: " + args[0]);
            return 2;
        }
        try (CatalogDatabase db = CatalogDatabase.open(Config.getDbFilePath())) {
            DiskWatcherEngine engine = new DiskWatcherEngine(new CatalogStore(db), EngineSettings.defaults());
            try {
                List<DiskWatcherEngine.Suggestion> suggested = engine.suggestDirectories();
                if (suggested.isEmpty()) {
                    out.println("No suitable directories found.");
                    return 0;
                }
                out.println("Suggested directories to monitor:");
                for (DiskWatcherEngine.Suggestion s : suggested) {
                    out.println("  - " + s.directory() + " (volume=" + s.volumeId() + ", source="
                            + s.source().name().toLowerCase(Locale.ROOT) + ")");
                }
                return 0;
            } finally {
                engine.stopAll();
            }
        }
    }

    // ----------------- config -----------------

    private int runConfig(String[] args) {
        if (args.length == 0 || args[0].equals("-h") || args[0].equals("--help")) {
            printConfigUsage();
            return args.length == 0 ? 2 : 0;
        }
        UserSettings settings = UserSettings.load();
        String sub = safeLower(args[0]);
        switch (sub) {
            case "list" -> {
                out.println("Config file: " + settings.file());
                for (UserSettings.Entry e : settings.list().values()) {
                    UserSettings.Option o = e.option();
                    out.printf("%s = %s (%s, %s) %s%n", o.key(), formatValue(e.value()), o.type().label(),
                            e.source(), o.description());
                }
                return 0;
            }
            case "get" -> {
                if (args.length != 2) {
                    printConfigUsage();
                    return 2;
                }
                out.println(formatValue(settings.get(args[1])));
                return 0;
            }
            case "set" -> {
                if (args.length != 3) {
                    printConfigUsage();
                    return 2;
                }
                Object stored = settings.set(args[1], args[2]);
                out.println(args[1] + " = " + formatValue(stored));
                return 0;
            }
            case "unset" -> {
                if (args.length != 2) {
                    printConfigUsage();
                    return 2;
                }
                settings.unset(args[1]);
                out.println(args[1] + " reset to default");
                return 0;
            }
            default -> {
                err.println("Unknown config action: " + args[0]);
                printConfigUsage();
                return 2;
            }
        }
    }

    // ----------------- labels -----------------

    private int runLabels(String[] args) throws IOException {
        String csv = null;
        try {
            ArgCursor c = new ArgCursor(args);
            while (c.hasNext()) {
                String t = c.next();
                switch (t) {
                    case "-h", "--help" -> {
                        out.println("Usage:\n  labels [--csv <file>]");
                        return 0;
                    }
                    case "--csv" -> csv = c.requireNext("--csv");
                    default -> {
                        err.println("Invalid option: " + t);
                        return 2;
                    }
                }
            }
        } catch (IllegalArgumentException e) {
            err.println(safeMsg(e));
            return 2;
        }

        try (CatalogDatabase db = CatalogDatabase.open(Config.getDbFilePath())) {
            List<LabelRow> rows = LabelRows.buildRows(new CatalogStore(db).listVolumes());
            if (csv != null) {
                Path file = Path.of(csv).toAbsolutePath().normalize();
                LabelExporter.exportCsv(rows, file);
                out.println("Wrote " + rows.size() + " label rows to " + file);
                return 0;
            }
            if (rows.isEmpty()) {
                out.println("No volumes recorded yet.");
                return 0;
            }
            out.println("# | human id | volume | directory | label");
            for (LabelRow r : rows) {
                out.printf("%d | %s | %s | %s | %s%n", r.labelIndex(), safeText(r.humanId()),
                        r.values().get("volume_id"), safeText((String) r.values().get("directory")),
                        safeText((String) r.values().get("mount_label")));
            }
            return 0;
        }
    }

    // ----------------- dashboard -----------------

    private int runDashboard(String[] args) throws IOException, InterruptedException {
        int port = DashboardApi.DEFAULT_PORT;
        String host = "127.0.0.1";
        try {
            ArgCursor c = new ArgCursor(args);
            while (c.hasNext()) {
                String t = c.next();
                switch (t) {
                    case "-h", "--help" -> {
                        out.println("Usage:\n  dashboard [--port <n>] [--host <addr>]");
                        return 0;
                    }
                    case "--port" -> port = Integer.parseInt(c.requireNext("--port").trim());
                    case "--host" -> host = c.requireNext("--host");
                    default -> {
                        err.println("Invalid option: " + t);
                        return 2;
                    }
                }
            }
        } catch (NumberFormatException e) {
            err.println("Invalid value for --port");
            return 2;
        } catch (IllegalArgumentException e) {
            err.println(safeMsg(e));
            return 2;
        }
        if (port < 0 || port > 65535) {
            err.println("Invalid value for --port");
            return 2;
        }

        CatalogDatabase db = CatalogDatabase.open(Config.getDbFilePath());
        DashboardApi api = new DashboardApi(new CatalogStore(db), host, port);
        api.start();

        CountDownLatch shutdown = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            api.close();
            db.close();
            shutdown.countDown();
        }, "diskwatcher-dashboard-shutdown"));

        out.println("Dashboard API on http://" + host + ":" + api.port() + "/api/summary");
        shutdown.await();
        return 0;
    }

    // ----------------- log -----------------

    private int runLog(String[] args) throws IOException {
        ParseResult<Integer> parsed = parseLimitOnly(args, 50);
        if (parsed.help()) {
            out.println("Usage:\n  log [--limit <lines>]");
            return 0;
        }
        if (parsed.error() != null) {
            err.println(parsed.error());
            return 2;
        }
        Path file = Config.getDataDir().resolve(LOG_FILE);
        if (!Files.isRegularFile(file)) {
            out.println("No logs found.");
            return 0;
        }
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        int from = Math.max(0, lines.size() - parsed.value());
        for (String line : lines.subList(from, lines.size())) {
            out.println(line);
        }
        return 0;
    }

    // ----------------- printing -----------------

    private void printJobs(List<JobRow> jobs, String emptyMessage) {
        if (jobs.isEmpty()) {
            out.println(emptyMessage);
            return;
        }
        out.println("job | type | status | volume | files | updated | message");
        for (JobRow j : jobs) {
            out.printf("%s | %s | %s | %s | %d | %s | %s%n",
                    j.jobId(), j.jobType(), j.status(), safeText(j.volumeId()),
                    JobTracker.parseProgress(j.progressJson()).filesProcessed(),
                    safeText(j.updatedAt()), safeText(j.errorMessage()));
        }
    }

    private void printEvents(List<EventRow> events) {
        if (events.isEmpty()) {
            out.println("No events recorded yet.");
            return;
        }
        out.println("timestamp | type | volume | path");
        for (EventRow e : events) {
            out.printf("%s | %s | %s | %s%n", e.timestamp(), e.eventType(), safeText(e.volumeId()), e.path());
        }
    }

    private static ArrayNode jobsJson(List<JobRow> jobs) {
        ArrayNode arr = MAPPER.createArrayNode();
        for (JobRow j : jobs) {
            ObjectNode it = MAPPER.valueToTree(j);
            it.remove("progressJson");
            it.set("progress", MAPPER.valueToTree(JobTracker.parseProgress(j.progressJson())));
            arr.add(it);
        }
        return arr;
    }

    private static String formatValue(Object value) {
        if (value instanceof List<?> list) {
            return list.isEmpty() ? "[]" : String.join(",", list.stream().map(v -> String.valueOf(v)).toList());
        }
        return String.valueOf(value);
    }

    // ----------------- usage -----------------

    private void printUsage() {
        out.println("""
                DiskWatcher CLI
                Usage: diskwatcher [--log-level <level>] <command> [options]

                Commands:
                  run [dir...] [--no-scan] [--auto-discover <root>]...
                  status [--json] [--limit <n>]
                  jobs [--all]
                  files <volume-id> [--limit <n>]
                  events [--limit <n>]
                  suggest
                  config list|get <key>|set <key> <value>|unset <key>
                  labels [--csv <file>]
                  dashboard [--port <n>] [--host <addr>]
                  log [--limit <lines>]
                  help
                """);
    }

    private void printRunUsage() {
        out.println("""
                Usage:
                  run [dir...] [--no-scan] [--auto-discover <root>]...

                Examples:
                  run /mnt/archive01
                  run --auto-discover /media/$USER --no-scan
                """);
    }

    private void printStatusUsage() {
        out.println("""
                Usage:
                  status [--json] [--limit <n>]
                """);
    }

    private void printConfigUsage() {
        out.println("""
                Usage:
                  config list
                  config get <key>
                  config set <key> <value>
                  config unset <key>

                Keys: log.level, run.auto_scan, run.max_scan_workers,
                      run.auto_discover_roots, run.discovery_interval_seconds
                """);
    }

    // ----------------- parsing -----------------

    private static final class ArgCursor {
        private final String[] args;
        private int i;

        ArgCursor(String[] args) {
            this.args = args == null ? new String[0] : args;
        }

        boolean hasNext() { return i < args.length; }

        String next() { return args[i++]; }

        String peek() { return args[i]; }

        String[] remaining() { return Arrays.copyOfRange(args, i, args.length); }

        String requireNext(String opt) {
            if (!hasNext()) throw new IllegalArgumentException("Missing value for " + opt);
            return next();
        }
    }

    private record ParseResult<T>(T value, boolean help, String error) {
        static <T> ParseResult<T> okResult(T v) { return new ParseResult<>(v, false, null); }
        static <T> ParseResult<T> helpResult() { return new ParseResult<>(null, true, null); }
        static <T> ParseResult<T> errorResult(String e) { return new ParseResult<>(null, false, e); }
    }

    /** Options accepted before the command name. */
    private record GlobalArgs(String logLevel, String[] rest) {
        static ParseResult<GlobalArgs> parse(String[] args) {
            String level = null;
            ArgCursor c = new ArgCursor(args);
            try {
                while (c.hasNext()) {
                    String t = c.peek();
                    if (t.equals("--log-level")) {
                        c.next();
                        level = UserSettings.normalizeLogLevel(c.requireNext("--log-level"));
                    } else if (t.startsWith("--log-level=")) {
                        c.next();
                        level = UserSettings.normalizeLogLevel(t.substring("--log-level=".length()));
                    } else {
                        break;
                    }
                }
            } catch (IllegalArgumentException | ConfigException e) {
                return ParseResult.errorResult(safeMsg(e));
            }
            String[] rest = c.remaining();
            return ParseResult.okResult(new GlobalArgs(level, rest));
        }
    }

    private record RunArgs(List<String> directories, boolean noScan, List<Path> autoDiscoverRoots) {
        static ParseResult<RunArgs> parse(String[] args) {
            List<String> dirs = new ArrayList<>();
            List<Path> roots = new ArrayList<>();
            boolean noScan = false;

            try {
                ArgCursor c = new ArgCursor(args);
                while (c.hasNext()) {
                    String t = c.next();
                    switch (t) {
                        case "-h", "--help" -> { return ParseResult.helpResult(); }
                        case "--no-scan" -> noScan = true;
                        case "--auto-discover" -> roots.add(Path.of(c.requireNext("--auto-discover")));
                        default -> {
                            if (t.startsWith("--")) return ParseResult.errorResult("Invalid option: " + t);
                            dirs.add(t);
                        }
                    }
                }
            } catch (IllegalArgumentException e) {
                return ParseResult.errorResult(safeMsg(e));
            }
            return ParseResult.okResult(new RunArgs(dirs, noScan, roots));
        }
    }

    private record StatusArgs(boolean json, int limit) {
        static ParseResult<StatusArgs> parse(String[] args) {
            boolean json = false;
            int limit = 10;

            try {
                ArgCursor c = new ArgCursor(args);
                while (c.hasNext()) {
                    String t = c.next();
                    switch (t) {
                        case "-h", "--help" -> { return ParseResult.helpResult(); }
                        case "--json" -> json = true;
                        case "--limit" -> limit = Math.max(1, Integer.parseInt(c.requireNext("--limit").trim()));
                        default -> { return ParseResult.errorResult("Invalid option: " + t); }
                    }
                }
            } catch (NumberFormatException e) {
                return ParseResult.errorResult("Invalid value for --limit");
            } catch (IllegalArgumentException e) {
                return ParseResult.errorResult(safeMsg(e));
            }
            return ParseResult.okResult(new StatusArgs(json, limit));
        }
    }

    private record FilesArgs(String volumeId, int limit) {
        static ParseResult<FilesArgs> parse(String[] args) {
            String volumeId = null;
            int limit = 50;

            try {
                ArgCursor c = new ArgCursor(args);
                while (c.hasNext()) {
                    String t = c.next();
                    switch (t) {
                        case "-h", "--help" -> { return ParseResult.helpResult(); }
                        case "--limit" -> limit = Math.max(1, Integer.parseInt(c.requireNext("--limit").trim()));
                        default -> {
                            if (t.startsWith("--") || volumeId != null) {
                                return ParseResult.errorResult("Invalid option: " + t);
                            }
                            volumeId = t;
                        }
                    }
                }
            } catch (NumberFormatException e) {
                return ParseResult.errorResult("Invalid value for --limit");
            } catch (IllegalArgumentException e) {
                return ParseResult.errorResult(safeMsg(e));
            }
            if (isBlank(volumeId)) return ParseResult.errorResult("Missing volume id");
            return ParseResult.okResult(new FilesArgs(volumeId, limit));
        }
    }

    private static ParseResult<Integer> parseLimitOnly(String[] args, int fallback) {
        int limit = fallback;
        try {
            ArgCursor c = new ArgCursor(args);
            while (c.hasNext()) {
                String t = c.next();
                switch (t) {
                    case "-h", "--help" -> { return ParseResult.helpResult(); }
                    case "--limit" -> limit = Math.max(1, Integer.parseInt(c.requireNext("--limit").trim()));
                    default -> { return ParseResult.errorResult("Invalid option: " + t); }
                }
            }
        } catch (NumberFormatException e) {
            return ParseResult.errorResult("Invalid value for --limit");
        } catch (IllegalArgumentException e) {
            return ParseResult.errorResult(safeMsg(e));
        }
        return ParseResult.okResult(limit);
    }

    // ----------------- misc -----------------

    private static String safeLower(String s) {
        return s == null ? "" : s.trim().toLowerCase(Locale.ROOT);
    }

    private static String safeMsg(Throwable t) {
        String m = (t == null) ? null : t.getMessage();
        return (m == null || m.isBlank())
                ? (t == null ? "Error" : t.getClass().getSimpleName())
                : m;
    }

    private static String safeText(String v) {
        return isBlank(v) ? "-" : v;
    }

    private static boolean isBlank(String v) {
        return v == null || v.isBlank();
    }
}
