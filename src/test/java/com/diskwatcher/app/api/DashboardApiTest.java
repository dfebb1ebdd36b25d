package com.diskwatcher.app.api;

import com.diskwatcher.app.database.BusyRetry;
import com.diskwatcher.app.database.CatalogDatabase;
import com.diskwatcher.app.database.CatalogStore;
import com.diskwatcher.app.database.EventRecord;
import com.diskwatcher.app.database.EventType;
import com.diskwatcher.app.database.FileRecord;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class DashboardApiTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path tmp;

    private CatalogDatabase database;
    private DashboardApi api;
    private HttpClient client;

    @BeforeEach
    void setUp() throws Exception {
        database = CatalogDatabase.open(tmp.resolve("api.db"));
        CatalogStore store = new CatalogStore(database.jdbi(), new BusyRetry(), d -> Optional.empty(), Clock.systemUTC());

        Instant t = Instant.parse("2024-05-01T10:00:00Z");
        store.recordChange(EventRecord.of(t, EventType.CREATED, "/mnt/a/one.txt", "/mnt/a", "vol-a"),
                new FileRecord("vol-a", "/mnt/a/one.txt", "/mnt/a", 11L, t, t));
        store.recordEvent(EventRecord.of(t.plusSeconds(1), EventType.MODIFIED, "/mnt/a/one.txt", "/mnt/a", "vol-a"));
        store.recordEvent(EventRecord.of(t.plusSeconds(2), EventType.CREATED, "/mnt/b/two.txt", "/mnt/b", "vol-b"));

        api = new DashboardApi(store, "127.0.0.1", 0);
        api.start();
        client = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();
    }

    @AfterEach
    void tearDown() {
        if (api != null) api.close();
        if (database != null) database.close();
    }

    private HttpResponse<String> get(String pathAndQuery) throws Exception {
        HttpRequest req = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + api.port() + pathAndQuery))
                .timeout(Duration.ofSeconds(10))
                .GET()
                .build();
        return client.send(req, HttpResponse.BodyHandlers.ofString());
    }

    private JsonNode json(HttpResponse<String> res) throws Exception {
        return MAPPER.readTree(res.body());
    }

    @Test
    void healthReportsService() throws Exception {
        HttpResponse<String> res = get("/api/health");

        assertEquals(200, res.statusCode());
        JsonNode body = json(res);
        assertTrue(body.get("ok").asBoolean());
        assertEquals("diskwatcher", body.get("service").asText());
        assertTrue(res.headers().firstValue("Content-Type").orElse("").startsWith("application/json"));
    }

    @Test
    void summaryHasOneEntryPerVolume() throws Exception {
        JsonNode body = json(get("/api/summary"));

        JsonNode volumes = body.get("volumes");
        assertEquals(2, volumes.size());
        JsonNode a = volumes.get(0);
        assertEquals("vol-a", a.get("volumeId").asText());
        assertEquals(1, a.get("labelIndex").asInt());
        assertEquals(2, a.get("total").asInt());
        assertEquals(1, a.get("created").asInt());
        assertEquals(1, a.get("modified").asInt());
        assertTrue(a.get("mountLabel").isNull());
    }

    @Test
    void eventsAreNewestFirstAndLimited() throws Exception {
        JsonNode body = json(get("/api/events?limit=2"));

        assertEquals(2, body.get("limit").asInt());
        JsonNode items = body.get("items");
        assertEquals(2, items.size());
        assertEquals("/mnt/b/two.txt", items.get(0).get("path").asText());
        assertEquals("modified", items.get(1).get("eventType").asText());
    }

    @Test
    void filesRequireVolume() throws Exception {
        HttpResponse<String> missing = get("/api/files");
        assertEquals(400, missing.statusCode());
        assertFalse(json(missing).get("ok").asBoolean());
        assertEquals("bad_request", json(missing).get("error").get("code").asText());

        JsonNode body = json(get("/api/files?volume=vol-a"));
        assertEquals(1, body.get("items").size());
        assertEquals(11, body.get("items").get(0).get("sizeBytes").asInt());
        assertFalse(body.get("items").get(0).get("deleted").asBoolean());
    }

    @Test
    void jobsFilterRejectsUnknownStatus() throws Exception {
        assertEquals(200, get("/api/jobs?status=active").statusCode());
        assertEquals(0, json(get("/api/jobs")).get("items").size());
        assertEquals(400, get("/api/jobs?status=sleeping").statusCode());
    }

    @Test
    void labelsListAndLookupByPath() throws Exception {
        JsonNode all = json(get("/api/labels"));
        assertEquals(2, all.get("volumes").size());
        assertEquals(1, all.get("volumes").get(0).get("label_index").asInt());
        assertEquals("vol-a", all.get("volumes").get(0).get("volume_id").asText());

        JsonNode one = json(get("/api/labels?path=/mnt/b"));
        assertEquals("vol-b", one.get("volume").get("volume_id").asText());

        assertEquals(404, get("/api/labels?path=/mnt/zzz").statusCode());
    }

    @Test
    void onlyGetIsAllowed() throws Exception {
        HttpRequest post = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + api.port() + "/api/summary"))
                .POST(HttpRequest.BodyPublishers.noBody())
                .build();

        HttpResponse<String> res = client.send(post, HttpResponse.BodyHandlers.ofString());

        assertEquals(405, res.statusCode());
    }
}
