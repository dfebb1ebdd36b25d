package com.diskwatcher.app.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.github.cdimascio.dotenv.Dotenv;

/**
 * Resolves where DiskWatcher keeps its catalog, logs and user settings.
 *
 * <p>Every value is looked up as system property, then environment variable, then a local
 * {@code .env} file, then the default under {@code ~/.diskwatcher}.
 */
public final class Config {

    private static final Logger logger = LoggerFactory.getLogger(Config.class);

    private static final String DEFAULT_DIR_NAME = ".diskwatcher";
    private static final String DEFAULT_DB_NAME = "diskwatcher.db";
    public static final String CONFIG_FILENAME = "config.json";

    private static final String ENV_DATA_DIR = "DISKWATCHER_DATA_DIR";
    private static final String ENV_DB_NAME = "DISKWATCHER_DB_NAME";
    private static final String ENV_CONFIG_DIR = "DISKWATCHER_CONFIG_DIR";

    // system property overrides (tests/CI)
    public static final String PROP_DATA_DIR = "diskwatcher.dataDir";
    public static final String PROP_DB_NAME = "diskwatcher.dbName";
    public static final String PROP_CONFIG_DIR = "diskwatcher.configDir";

    private static final Dotenv dotenv = Dotenv.configure().ignoreIfMissing().load();

    private static volatile String cachedDbPathKey;
    private static volatile Path cachedDbPath;

    private Config() {}

    public static String getDbUrl() {
        return "jdbc:sqlite:" + getDbFilePath().toAbsolutePath();
    }

    public static Path getDbFilePath() {
        String dbFileName = resolveDbFileName();
        String overrideDir = getEnvOrDotenv(ENV_DATA_DIR);

        String key = (overrideDir == null ? "" : overrideDir) + "|" + dbFileName;
        Path current = cachedDbPath;
        if (current != null && key.equals(cachedDbPathKey)) {
            return current;
        }

        synchronized (Config.class) {
            current = cachedDbPath;
            if (current != null && key.equals(cachedDbPathKey)) {
                return current;
            }
            Path resolved = ensureDirectory(getDataDir()).resolve(dbFileName);
            logger.info("catalog database path={}", resolved.toAbsolutePath());
            cachedDbPathKey = key;
            cachedDbPath = resolved;
            return resolved;
        }
    }

    public static Path getDataDir() {
        String overrideDir = getEnvOrDotenv(ENV_DATA_DIR);
        if (overrideDir != null) return Paths.get(expandHome(overrideDir)).toAbsolutePath().normalize();
        return defaultDir();
    }

    public static Path getConfigDir() {
        String overrideDir = getEnvOrDotenv(ENV_CONFIG_DIR);
        if (overrideDir != null) return Paths.get(expandHome(overrideDir)).toAbsolutePath().normalize();
        return defaultDir();
    }

    public static Path getConfigFile() {
        return getConfigDir().resolve(CONFIG_FILENAME);
    }

    private static String resolveDbFileName() {
        String name = getEnvOrDotenv(ENV_DB_NAME);
        return name == null ? DEFAULT_DB_NAME : name;
    }

    private static Path defaultDir() {
        return Paths.get(System.getProperty("user.home"), DEFAULT_DIR_NAME);
    }

    private static Path ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
            return dir;
        } catch (IOException e) {
            throw new ConfigException("Cannot create data directory: " + dir, e);
        }
    }

    private static String expandHome(String raw) {
        if (raw.equals("~")) return System.getProperty("user.home");
        if (raw.startsWith("~/")) return System.getProperty("user.home") + raw.substring(1);
        return raw;
    }

    /**
     * System property first, then the process environment, then {@code .env}. Blank counts as
     * unset.
     */
    static String getEnvOrDotenv(String key) {
        String propKey = mapToSystemPropertyKey(key);
        if (propKey != null) {
            String propVal = System.getProperty(propKey);
            if (propVal != null && !propVal.isBlank()) {
                return propVal.trim();
            }
        }

        String envVal = System.getenv(key);
        if (envVal != null && !envVal.isBlank()) {
            return envVal.trim();
        }

        String fileVal = dotenv.get(key);
        if (fileVal == null || fileVal.isBlank()) {
            return null;
        }
        return fileVal.trim();
    }

    private static String mapToSystemPropertyKey(String envKey) {
        if (envKey == null) return null;
        return switch (envKey) {
            case ENV_DATA_DIR -> PROP_DATA_DIR;
            case ENV_DB_NAME -> PROP_DB_NAME;
            case ENV_CONFIG_DIR -> PROP_CONFIG_DIR;
            default -> null;
        };
    }
}
