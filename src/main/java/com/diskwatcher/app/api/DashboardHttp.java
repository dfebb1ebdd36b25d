package com.diskwatcher.app.api;

import java.io.IOException;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpExchange;

final class DashboardHttp {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private DashboardHttp() {}

    static ObjectMapper mapper() { return MAPPER; }

    static boolean isMethod(HttpExchange ex, String method) {
        return method.equalsIgnoreCase(ex.getRequestMethod());
    }

    // ----------------- common headers -----------------

    static void addCommonHeaders(Headers h) {
        h.set("Access-Control-Allow-Origin", "*");
        h.set("Access-Control-Allow-Methods", "GET, OPTIONS");
        h.set("Cache-Control", "no-store");
        h.set("X-Content-Type-Options", "nosniff");
    }

    static boolean handlePreflightIfNeeded(HttpExchange ex) throws IOException {
        if (!isMethod(ex, "OPTIONS")) return false;
        addCommonHeaders(ex.getResponseHeaders());
        ex.sendResponseHeaders(204, -1);
        return true;
    }

    // ----------------- responses -----------------

    static void methodNotAllowed(HttpExchange ex, String allow) throws IOException {
        ex.getResponseHeaders().set("Allow", allow);
        sendError(ex, 405, "method_not_allowed", "Method not allowed");
    }

    static void sendError(HttpExchange ex, int status, String code, String message) throws IOException {
        ObjectNode out = MAPPER.createObjectNode();
        out.put("ok", false);
        ObjectNode err = out.putObject("error");
        err.put("code", code);
        err.put("message", message);
        sendJson(ex, status, out);
    }

    static void sendJson(HttpExchange ex, int status, JsonNode body) throws IOException {
        byte[] bytes = MAPPER.writeValueAsBytes(body);

        Headers h = ex.getResponseHeaders();
        addCommonHeaders(h);
        h.set("Content-Type", "application/json; charset=utf-8");

        ex.sendResponseHeaders(status, bytes.length);
        ex.getResponseBody().write(bytes);
    }

    // ----------------- query parsing -----------------

    static Map<String, String> parseQuery(URI uri) {
        Map<String, String> out = new HashMap<>();
        String query = (uri == null) ? null : uri.getRawQuery();
        if (isBlank(query)) return out;

        for (String item : query.split("&")) {
            if (isBlank(item)) continue;

            int idx = item.indexOf('=');
            if (idx < 0) {
                out.put(urlDecode(item), "");
            } else {
                out.put(urlDecode(item.substring(0, idx)), urlDecode(item.substring(idx + 1)));
            }
        }
        return out;
    }

    private static String urlDecode(String value) {
        try {
            return URLDecoder.decode(value, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return value;
        }
    }

    static int clampInt(String value, int fallback, int min, int max) {
        if (isBlank(value)) return fallback;
        try {
            int v = Integer.parseInt(value.trim());
            if (v < min) return min;
            if (v > max) return max;
            return v;
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    static void putNullable(ObjectNode obj, String key, String value) {
        if (value == null) obj.putNull(key);
        else obj.put(key, value);
    }

    static void putNullable(ObjectNode obj, String key, Long value) {
        if (value == null) obj.putNull(key);
        else obj.put(key, value);
    }

    static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    static String safeMsg(Throwable t) {
        return (t.getMessage() == null || t.getMessage().isBlank())
                ? t.getClass().getSimpleName()
                : t.getMessage();
    }
}
