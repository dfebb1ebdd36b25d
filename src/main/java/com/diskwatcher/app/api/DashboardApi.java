package com.diskwatcher.app.api;

import static com.diskwatcher.app.api.DashboardHttp.clampInt;
import static com.diskwatcher.app.api.DashboardHttp.handlePreflightIfNeeded;
import static com.diskwatcher.app.api.DashboardHttp.isBlank;
import static com.diskwatcher.app.api.DashboardHttp.isMethod;
import static com.diskwatcher.app.api.DashboardHttp.mapper;
import static com.diskwatcher.app.api.DashboardHttp.methodNotAllowed;
import static com.diskwatcher.app.api.DashboardHttp.parseQuery;
import static com.diskwatcher.app.api.DashboardHttp.putNullable;
import static com.diskwatcher.app.api.DashboardHttp.safeMsg;
import static com.diskwatcher.app.api.DashboardHttp.sendError;
import static com.diskwatcher.app.api.DashboardHttp.sendJson;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.diskwatcher.app.database.CatalogRows.EventRow;
import com.diskwatcher.app.database.CatalogRows.FileRow;
import com.diskwatcher.app.database.CatalogRows.JobRow;
import com.diskwatcher.app.database.CatalogRows.VolumeRow;
import com.diskwatcher.app.database.CatalogRows.VolumeSummary;
import com.diskwatcher.app.database.CatalogStore;
import com.diskwatcher.app.database.JobStatus;
import com.diskwatcher.app.report.LabelRows;
import com.diskwatcher.app.report.LabelRows.LabelRow;
import com.diskwatcher.app.service.JobTracker;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

/**
 * Read-only JSON view of the catalog for the dashboard and remote agents.
 */
public final class DashboardApi implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(DashboardApi.class);

    private static final String BASE = "/api";
    private static final String HEALTH = BASE + "/health";
    private static final String SUMMARY = BASE + "/summary";
    private static final String EVENTS = BASE + "/events";
    private static final String JOBS = BASE + "/jobs";
    private static final String FILES = BASE + "/files";
    private static final String LABELS = BASE + "/labels";

    public static final int DEFAULT_PORT = 8765;

    @FunctionalInterface
    private interface Handler {
        void handle() throws IOException;
    }

    private final CatalogStore store;
    private final String bindHost;
    private final int requestedPort;
    private HttpServer server;
    private ExecutorService httpPool;

    public DashboardApi(CatalogStore store, String bindHost, int port) {
        this.store = store;
        this.bindHost = bindHost;
        this.requestedPort = port;
    }

    public synchronized void start() throws IOException {
        if (server != null) return;
        InetAddress bindAddr = InetAddress.getByName(bindHost);
        server = HttpServer.create(new InetSocketAddress(bindAddr, requestedPort), 0);

        AtomicInteger n = new AtomicInteger();
        httpPool = Executors.newFixedThreadPool(2, r -> {
            Thread t = new Thread(r, "diskwatcher-http-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(httpPool);

        server.createContext(HEALTH, ex -> safeHandle(ex, () -> handleHealth(ex)));
        server.createContext(SUMMARY, ex -> safeHandle(ex, () -> handleSummary(ex)));
        server.createContext(EVENTS, ex -> safeHandle(ex, () -> handleEvents(ex)));
        server.createContext(JOBS, ex -> safeHandle(ex, () -> handleJobs(ex)));
        server.createContext(FILES, ex -> safeHandle(ex, () -> handleFiles(ex)));
        server.createContext(LABELS, ex -> safeHandle(ex, () -> handleLabels(ex)));
        server.start();

        logger.info("dashboard api listening url=http://{}:{}{}", bindHost, port(), BASE);
    }

    /** Bound port; differs from the requested one when that was 0. */
    public int port() {
        return server == null ? requestedPort : server.getAddress().getPort();
    }

    @Override
    public synchronized void close() {
        if (server == null) return;
        server.stop(0);
        httpPool.shutdownNow();
        server = null;
        logger.info("dashboard api stopped");
    }

    // ----------------- handlers -----------------

    private void handleHealth(HttpExchange ex) throws IOException {
        if (!requireGet(ex)) return;
        ObjectNode out = mapper().createObjectNode();
        out.put("ok", true);
        out.put("service", "diskwatcher");
        out.put("ts", Instant.now().toString());
        sendJson(ex, 200, out);
    }

    private void handleSummary(HttpExchange ex) throws IOException {
        if (!requireGet(ex)) return;
        List<VolumeSummary> volumes = store.summarizeByVolume();

        ObjectNode out = okBody();
        ArrayNode items = out.putArray("volumes");
        for (VolumeSummary v : volumes) {
            ObjectNode it = items.addObject();
            it.put("volumeId", v.volumeId());
            putNullable(it, "directory", v.directory());
            if (v.labelIndex() == null) it.putNull("labelIndex");
            else it.put("labelIndex", v.labelIndex());
            it.put("total", v.total());
            it.put("created", v.created());
            it.put("modified", v.modified());
            it.put("deleted", v.deleted());
            it.put("discovered", v.discovered());
            putNullable(it, "lastEventTimestamp", v.lastEventTimestamp());
            putNullable(it, "usageTotalBytes", v.usageTotalBytes());
            putNullable(it, "usageUsedBytes", v.usageUsedBytes());
            putNullable(it, "usageFreeBytes", v.usageFreeBytes());
            putNullable(it, "usageRefreshedAt", v.usageRefreshedAt());
            putNullable(it, "mountLabel", v.mountLabel());
            putNullable(it, "mountUuid", v.mountUuid());
            putNullable(it, "mountDevice", v.mountDevice());
            putNullable(it, "identitySource", v.identitySource());
        }
        sendJson(ex, 200, out);
    }

    private void handleEvents(HttpExchange ex) throws IOException {
        if (!requireGet(ex)) return;
        int limit = clampInt(parseQuery(ex.getRequestURI()).get("limit"), 25, 1, 1000);
        List<EventRow> rows = store.listRecentEvents(null, limit);

        ObjectNode out = okBody();
        out.put("limit", limit);
        ArrayNode items = out.putArray("items");
        for (EventRow r : rows) {
            ObjectNode it = items.addObject();
            it.put("id", r.id());
            it.put("timestamp", r.timestamp());
            it.put("eventType", r.eventType());
            it.put("path", r.path());
            putNullable(it, "directory", r.directory());
            putNullable(it, "volumeId", r.volumeId());
            putNullable(it, "processId", r.processId());
        }
        sendJson(ex, 200, out);
    }

    private void handleJobs(HttpExchange ex) throws IOException {
        if (!requireGet(ex)) return;
        Set<JobStatus> filter = parseStatuses(parseQuery(ex.getRequestURI()).get("status"));
        List<JobRow> rows = store.listJobs(filter);

        ObjectNode out = okBody();
        ArrayNode items = out.putArray("items");
        for (JobRow j : rows) {
            ObjectNode it = items.addObject();
            it.put("jobId", j.jobId());
            it.put("jobType", j.jobType());
            putNullable(it, "path", j.path());
            putNullable(it, "volumeId", j.volumeId());
            it.put("status", j.status());
            it.set("progress", mapper().valueToTree(JobTracker.parseProgress(j.progressJson())));
            putNullable(it, "ownerPid", j.ownerPid());
            putNullable(it, "ownerHost", j.ownerHost());
            putNullable(it, "errorMessage", j.errorMessage());
            putNullable(it, "startedAt", j.startedAt());
            putNullable(it, "updatedAt", j.updatedAt());
            putNullable(it, "completedAt", j.completedAt());
        }
        sendJson(ex, 200, out);
    }

    private void handleFiles(HttpExchange ex) throws IOException {
        if (!requireGet(ex)) return;
        Map<String, String> q = parseQuery(ex.getRequestURI());
        String volumeId = q.get("volume");
        if (isBlank(volumeId)) {
            sendError(ex, 400, "bad_request", "Missing 'volume' query parameter");
            return;
        }
        int limit = clampInt(q.get("limit"), 100, 1, 5000);
        List<FileRow> rows = store.listFiles(volumeId, limit);

        ObjectNode out = okBody();
        out.put("volumeId", volumeId);
        out.put("limit", limit);
        ArrayNode items = out.putArray("items");
        for (FileRow f : rows) {
            ObjectNode it = items.addObject();
            it.put("path", f.path());
            putNullable(it, "directory", f.directory());
            putNullable(it, "sizeBytes", f.sizeBytes());
            putNullable(it, "modifiedTime", f.modifiedTime());
            putNullable(it, "createdTime", f.createdTime());
            putNullable(it, "lastEventTimestamp", f.lastEventTimestamp());
            putNullable(it, "lastEventType", f.lastEventType());
            it.put("deleted", f.deleted());
        }
        sendJson(ex, 200, out);
    }

    private void handleLabels(HttpExchange ex) throws IOException {
        if (!requireGet(ex)) return;
        String path = parseQuery(ex.getRequestURI()).get("path");
        List<VolumeRow> volumes = store.listVolumes();
        List<LabelRow> rows = LabelRows.buildRows(volumes);

        if (!isBlank(path)) {
            for (LabelRow row : rows) {
                if (path.equals(row.values().get("directory"))) {
                    ObjectNode out = okBody();
                    out.set("volume", labelJson(row));
                    sendJson(ex, 200, out);
                    return;
                }
            }
            sendError(ex, 404, "not_found", "No volume found for path " + path);
            return;
        }

        ObjectNode out = okBody();
        ArrayNode items = out.putArray("volumes");
        for (LabelRow row : rows) {
            items.add(labelJson(row));
        }
        sendJson(ex, 200, out);
    }

    // ----------------- helpers -----------------

    private static ObjectNode labelJson(LabelRow row) {
        ObjectNode it = mapper().createObjectNode();
        it.put("label_index", row.labelIndex());
        it.put("human_id", row.humanId());
        for (Map.Entry<String, Object> e : row.values().entrySet()) {
            it.set(e.getKey(), mapper().valueToTree(e.getValue()));
        }
        return it;
    }

    private static ObjectNode okBody() {
        ObjectNode out = mapper().createObjectNode();
        out.put("ok", true);
        out.put("updatedAt", Instant.now().toString());
        return out;
    }

    private static Set<JobStatus> parseStatuses(String raw) {
        if (isBlank(raw)) return Set.of();
        Set<JobStatus> out = EnumSet.noneOf(JobStatus.class);
        for (String part : raw.split(",")) {
            if (isBlank(part)) continue;
            if (part.trim().equalsIgnoreCase("active")) out.addAll(JobStatus.ACTIVE);
            else out.add(JobStatus.fromWire(part));
        }
        return out;
    }

    private static boolean requireGet(HttpExchange ex) throws IOException {
        if (handlePreflightIfNeeded(ex)) return false;
        if (!isMethod(ex, "GET")) {
            methodNotAllowed(ex, "GET, OPTIONS");
            return false;
        }
        return true;
    }

    private static void safeHandle(HttpExchange ex, Handler handler) throws IOException {
        try {
            handler.handle();
        } catch (IllegalArgumentException iae) {
            sendError(ex, 400, "bad_request", safeMsg(iae));
        } catch (RuntimeException e) {
            logger.error("dashboard request failed uri={}", ex.getRequestURI(), e);
            sendError(ex, 500, "internal_error", safeMsg(e));
        } finally {
            ex.close();
        }
    }
}
