package com.diskwatcher.app.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.diskwatcher.app.inventory.ScanConfig;
import com.diskwatcher.app.inventory.ScanWorkerPool;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * User settings persisted as a flat JSON object in {@code config.json}. Unknown keys in the file
 * are kept but ignored.
 */
public final class UserSettings {

    private static final Logger logger = LoggerFactory.getLogger(UserSettings.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    public static final String LOG_LEVEL = "log.level";
    public static final String AUTO_SCAN = "run.auto_scan";
    public static final String MAX_SCAN_WORKERS = "run.max_scan_workers";
    public static final String AUTO_DISCOVER_ROOTS = "run.auto_discover_roots";
    public static final String DISCOVERY_INTERVAL = "run.discovery_interval_seconds";

    public static final List<String> LOG_LEVELS = List.of("debug", "info", "warning", "error", "critical");
    private static final Map<String, String> LOG_LEVEL_ALIASES = Map.of("warn", "warning");

    public enum ValueType {
        STRING("string"), BOOLEAN("boolean"), INTEGER("integer"), PATH_LIST("list");

        private final String label;

        ValueType(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    public record Option(String key, ValueType type, Object defaultValue, String description, List<String> choices) {}

    /** One line of {@code config list}. {@code source} is {@code user} or {@code default}. */
    public record Entry(Option option, Object value, String source) {}

    public static final Map<String, Option> OPTIONS = buildOptions();

    private static Map<String, Option> buildOptions() {
        Map<String, Option> m = new LinkedHashMap<>();
        m.put(LOG_LEVEL, new Option(LOG_LEVEL, ValueType.STRING, "info",
                "Default log level when --log-level is not provided.", LOG_LEVELS));
        m.put(AUTO_SCAN, new Option(AUTO_SCAN, ValueType.BOOLEAN, true,
                "Control whether the run command performs the initial archival scan.", null));
        m.put(MAX_SCAN_WORKERS, new Option(MAX_SCAN_WORKERS, ValueType.INTEGER, ScanWorkerPool.defaultMaxWorkers(),
                "Maximum number of archival scans running at once.", null));
        m.put(AUTO_DISCOVER_ROOTS, new Option(AUTO_DISCOVER_ROOTS, ValueType.PATH_LIST, List.of(),
                "Directories whose mounted children are attached automatically (comma separated).", null));
        m.put(DISCOVERY_INTERVAL, new Option(DISCOVERY_INTERVAL, ValueType.INTEGER, 5,
                "Seconds between auto discovery passes.", null));
        return Collections.unmodifiableMap(m);
    }

    private final Path file;

    public UserSettings(Path file) {
        this.file = file;
    }

    public static UserSettings load() {
        return new UserSettings(Config.getConfigFile());
    }

    public Path file() {
        return file;
    }

    public Map<String, Entry> list() {
        Map<String, Object> user = validatedUserValues();
        Map<String, Entry> out = new LinkedHashMap<>();
        for (Option option : OPTIONS.values()) {
            boolean fromUser = user.containsKey(option.key());
            out.put(option.key(), new Entry(option,
                    fromUser ? user.get(option.key()) : option.defaultValue(),
                    fromUser ? "user" : "default"));
        }
        return out;
    }

    public Object get(String key) {
        Option option = option(key);
        return validatedUserValues().getOrDefault(key, option.defaultValue());
    }

    /** Parses {@code raw} for the option's type, stores it and returns the stored value. */
    public Object set(String key, String raw) {
        Option option = option(key);
        Object parsed = parse(option, raw);
        Map<String, Object> payload = readPayload();
        payload.put(key, parsed);
        writePayload(payload);
        logger.info("config set key={} value={}", key, parsed);
        return parsed;
    }

    public void unset(String key) {
        option(key);
        Map<String, Object> payload = readPayload();
        if (payload.remove(key) != null) {
            writePayload(payload);
            logger.info("config unset key={}", key);
        }
    }

    // ----------------- typed accessors -----------------

    public String logLevel() {
        return (String) get(LOG_LEVEL);
    }

    public boolean autoScan() {
        return (Boolean) get(AUTO_SCAN);
    }

    public int maxScanWorkers() {
        return ((Number) get(MAX_SCAN_WORKERS)).intValue();
    }

    @SuppressWarnings("unchecked")
    public List<Path> autoDiscoverRoots() {
        List<Path> out = new ArrayList<>();
        for (String s : (List<String>) get(AUTO_DISCOVER_ROOTS)) {
            out.add(Path.of(s));
        }
        return out;
    }

    public Duration discoveryInterval() {
        return Duration.ofSeconds(((Number) get(DISCOVERY_INTERVAL)).longValue());
    }

    public EngineSettings toEngineSettings() {
        return new EngineSettings(maxScanWorkers(), autoScan(), autoDiscoverRoots(), discoveryInterval(),
                ScanConfig.defaults());
    }

    // ----------------- parsing -----------------

    public static String normalizeLogLevel(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        normalized = LOG_LEVEL_ALIASES.getOrDefault(normalized, normalized);
        if (!LOG_LEVELS.contains(normalized)) {
            throw new ConfigException("Unsupported log level '" + value + "'. Choose from " + String.join(", ", LOG_LEVELS));
        }
        return normalized;
    }

    private static Object parse(Option option, String raw) {
        String value = raw == null ? "" : raw.trim();
        return switch (option.type()) {
            case STRING -> LOG_LEVEL.equals(option.key()) ? normalizeLogLevel(value) : value;
            case BOOLEAN -> parseBool(value);
            case INTEGER -> parsePositiveInt(option.key(), value);
            case PATH_LIST -> parsePathList(value);
        };
    }

    private static boolean parseBool(String value) {
        String lower = value.toLowerCase(Locale.ROOT);
        if (Set.of("1", "true", "yes", "on").contains(lower)) return true;
        if (Set.of("0", "false", "no", "off").contains(lower)) return false;
        throw new ConfigException("Expected a boolean (true/false)");
    }

    private static int parsePositiveInt(String key, String value) {
        int n;
        try {
            n = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ConfigException("Config key '" + key + "' expects an integer", e);
        }
        if (n < 1) throw new ConfigException("Config key '" + key + "' must be >= 1");
        return n;
    }

    private static List<String> parsePathList(String value) {
        List<String> out = new ArrayList<>();
        for (String part : value.split(",")) {
            String p = part.trim();
            if (!p.isEmpty()) out.add(p);
        }
        return List.copyOf(out);
    }

    private static Option option(String key) {
        Option option = OPTIONS.get(key);
        if (option == null) throw new ConfigException("Unknown config key '" + key + "'");
        return option;
    }

    // ----------------- file io -----------------

    private Map<String, Object> validatedUserValues() {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : readPayload().entrySet()) {
            Option option = OPTIONS.get(e.getKey());
            if (option == null) continue;
            out.put(e.getKey(), validate(option, e.getValue()));
        }
        return out;
    }

    private static Object validate(Option option, Object value) {
        if (value == null) return option.defaultValue();
        switch (option.type()) {
            case STRING -> {
                if (!(value instanceof String s)) throw typeError(option);
                if (option.choices() != null && !option.choices().contains(s)) {
                    throw new ConfigException("Config key '" + option.key() + "' must be one of "
                            + String.join(", ", option.choices()));
                }
                return s;
            }
            case BOOLEAN -> {
                if (!(value instanceof Boolean)) throw typeError(option);
                return value;
            }
            case INTEGER -> {
                if (!(value instanceof Integer || value instanceof Long)) throw typeError(option);
                int n = ((Number) value).intValue();
                if (n < 1) throw new ConfigException("Config key '" + option.key() + "' must be >= 1");
                return n;
            }
            case PATH_LIST -> {
                if (!(value instanceof List<?> list)) throw typeError(option);
                List<String> out = new ArrayList<>();
                for (Object item : list) {
                    if (!(item instanceof String s)) throw typeError(option);
                    out.add(s);
                }
                return List.copyOf(out);
            }
            default -> throw typeError(option);
        }
    }

    private static ConfigException typeError(Option option) {
        return new ConfigException("Config key '" + option.key() + "' expects a " + option.type().label() + " value");
    }

    private Map<String, Object> readPayload() {
        JsonNode node;
        try {
            node = MAPPER.readTree(Files.readString(file));
        } catch (NoSuchFileException e) {
            return new TreeMap<>();
        } catch (JsonProcessingException e) {
            throw new ConfigException("Config file " + file + " is not valid JSON", e);
        } catch (IOException e) {
            throw new ConfigException("Cannot read config file " + file, e);
        }
        if (node == null || !node.isObject()) {
            throw new ConfigException("Config file " + file + " must contain a JSON object");
        }
        return new TreeMap<>(MAPPER.convertValue(node, new TypeReference<Map<String, Object>>() {}));
    }

    private void writePayload(Map<String, Object> payload) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Files.writeString(file, MAPPER.writeValueAsString(payload));
        } catch (IOException e) {
            throw new ConfigException("Cannot write config file " + file, e);
        }
    }
}
