package com.worklog.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileConfigManagerTest {

    @TempDir
    Path tempDir;

    private final FileConfigManager manager = new FileConfigManager();

    @Test
    void shouldWriteDefaultsWhenFileIsMissing() throws Exception {
        Path path = tempDir.resolve("config").resolve("config.json");

        AppConfig config = manager.load(path);

        assertTrue(Files.exists(path));
        assertEquals(StorageType.SQLITE, config.storage().type());
        assertEquals("WAL", config.storage().sqlite().journalMode());
        assertEquals(5_000, config.storage().sqlite().busyTimeoutMillis());
        assertNull(config.logging().trackingLevel());
        assertEquals("UTC", config.tracking().zone());
        assertEquals(5_000L, config.tracking().lockTimeoutMillis());
        assertEquals("json", config.report().format());
        AppConfig reloaded = manager.load(path);
        assertEquals(config.tracking(), reloaded.tracking());
        assertEquals(config.report(), reloaded.report());
        assertEquals(config.storage().type(), reloaded.storage().type());
    }

    @Test
    void shouldFillGapsAndIgnoreUnknownFields() throws Exception {
        Path path = tempDir.resolve("config.json");
        Path db = tempDir.resolve("db").resolve("custom.db");
        Files.writeString(path, """
                {
                  "storage": { "type": "MEMORY", "sqlite": { "databasePath": "%s" } },
                  "tracking": { "zone": "Europe/Berlin", "maxEntryMinutes": 600, "legacyFlag": true },
                  "report": { "format": "CSV" },
                  "tray": { "enabled": false }
                }
                """.formatted(db.toString().replace("\\", "\\\\")));

        AppConfig config = manager.load(path);

        assertEquals(StorageType.MEMORY, config.storage().type());
        assertEquals(db.toAbsolutePath().normalize().toString(), config.storage().sqlite().databasePath());
        assertEquals("WAL", config.storage().sqlite().journalMode());
        assertEquals(ZoneId.of("Europe/Berlin"), config.tracking().zoneId());
        assertEquals(600, config.tracking().maxEntryMinutes());
        assertEquals(200, config.tracking().maxTitleLength());
        assertEquals("csv", config.report().format());
        assertEquals("INFO", config.logging().level());
    }

    @Test
    void shouldFallBackFromInvalidValues() throws Exception {
        Path path = tempDir.resolve("config.json");
        Files.writeString(path, """
                {
                  "logging": { "level": "chatty", "trackingLevel": "loud", "maxSizeMB": -3 },
                  "storage": { "sqlite": { "journalMode": "bogus", "busyTimeoutMillis": -1 } },
                  "tracking": { "zone": "Mars/Olympus", "lockTimeoutMillis": 0 },
                  "report": { "format": "pdf" }
                }
                """);

        AppConfig config = manager.load(path);

        assertEquals("INFO", config.logging().level());
        assertEquals(5, config.logging().maxSizeMB());
        assertNull(config.logging().trackingLevel());
        assertEquals("WAL", config.storage().sqlite().journalMode());
        assertEquals(5_000, config.storage().sqlite().busyTimeoutMillis());
        assertEquals("UTC", config.tracking().zone());
        assertEquals(5_000L, config.tracking().lockTimeoutMillis());
        assertEquals("json", config.report().format());
    }

    @Test
    void shouldReadStoreAndLoggingTuning() throws Exception {
        Path path = tempDir.resolve("config.json");
        Files.writeString(path, """
                {
                  "logging": { "level": "warn", "trackingLevel": " debug " },
                  "storage": { "sqlite": { "journalMode": "truncate", "busyTimeoutMillis": 750 } }
                }
                """);

        AppConfig config = manager.load(path);

        assertEquals("WARN", config.logging().level());
        assertEquals("DEBUG", config.logging().trackingLevel());
        assertEquals("TRUNCATE", config.storage().sqlite().journalMode());
        assertEquals(750, config.storage().sqlite().busyTimeoutMillis());
        assertTrue(config.storage().sqlite().databasePath().endsWith("worklog.db"));
    }
}
