package com.diskwatcher.app.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class ConfigTest {

    @TempDir
    Path tmp;

    private String savedDataDir;
    private String savedConfigDir;
    private String savedDbName;

    @BeforeEach
    void saveProperties() {
        savedDataDir = System.getProperty(Config.PROP_DATA_DIR);
        savedConfigDir = System.getProperty(Config.PROP_CONFIG_DIR);
        savedDbName = System.getProperty(Config.PROP_DB_NAME);
    }

    @AfterEach
    void tearDown() {
        restore(Config.PROP_DATA_DIR, savedDataDir);
        restore(Config.PROP_CONFIG_DIR, savedConfigDir);
        restore(Config.PROP_DB_NAME, savedDbName);
    }

    private static void restore(String key, String value) {
        if (value == null) System.clearProperty(key);
        else System.setProperty(key, value);
    }

    @Test
    void dataDirOverrideDrivesDbPathAndUrl() {
        Path data = tmp.resolve("data");
        System.setProperty(Config.PROP_DATA_DIR, data.toString());
        System.clearProperty(Config.PROP_DB_NAME);

        Path db = Config.getDbFilePath();

        assertEquals(data.toAbsolutePath().normalize().resolve("diskwatcher.db"), db);
        assertTrue(Files.isDirectory(data), "Data directory should be created on demand");
        assertTrue(Config.getDbUrl().startsWith("jdbc:sqlite:"));
        assertTrue(Config.getDbUrl().endsWith(db.toAbsolutePath().toString()));
    }

    @Test
    void dbNameOverride() {
        System.setProperty(Config.PROP_DATA_DIR, tmp.toString());
        System.setProperty(Config.PROP_DB_NAME, "other.db");

        assertEquals("other.db", Config.getDbFilePath().getFileName().toString());
    }

    @Test
    void configFileLivesInConfigDir() {
        System.setProperty(Config.PROP_CONFIG_DIR, tmp.resolve("cfg").toString());

        assertEquals(tmp.resolve("cfg").resolve(Config.CONFIG_FILENAME), Config.getConfigFile());
    }

    @Test
    void blankPropertyCountsAsUnset() {
        System.setProperty(Config.PROP_CONFIG_DIR, "   ");

        String fromEnv = System.getenv("DISKWATCHER_CONFIG_DIR");
        if (fromEnv == null || fromEnv.isBlank()) {
            assertTrue(Config.getConfigDir().endsWith(".diskwatcher"));
        }
    }

    @Test
    void tildeExpandsToHome() {
        System.setProperty(Config.PROP_CONFIG_DIR, "~/dw-config");

        assertEquals(Path.of(System.getProperty("user.home"), "dw-config").toAbsolutePath().normalize(),
                Config.getConfigDir());
    }
}
