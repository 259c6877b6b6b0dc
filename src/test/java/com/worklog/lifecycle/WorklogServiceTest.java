package com.worklog.lifecycle;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import com.worklog.config.FileConfigManager;
import com.worklog.config.StorageType;
import com.worklog.tracking.EntryRequest;
import com.worklog.tracking.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorklogServiceTest {

    @TempDir
    Path tempDir;

    private Logger root;
    private Level originalLevel;

    @BeforeEach
    void rememberRootLevel() {
        root = ((LoggerContext) LoggerFactory.getILoggerFactory()).getLogger(Logger.ROOT_LOGGER_NAME);
        originalLevel = root.getLevel();
    }

    @AfterEach
    void restoreRoot() {
        Appender<ILoggingEvent> appender = root.getAppender("WORKLOG_FILE");
        if (appender != null) {
            root.detachAppender(appender);
            appender.stop();
        }
        root.setLevel(originalLevel);
    }

    @Test
    void shouldPersistAcrossRestartsWithSqlite() throws Exception {
        Path configPath = writeConfig("SQLITE");
        MutableClock clock = new MutableClock(Instant.parse("2024-03-01T09:00:00Z"));

        try (WorklogService service = new WorklogService(configPath, new FileConfigManager(), clock)) {
            service.start();
            assertEquals(StorageType.SQLITE, service.config().storage().type());
            service.engine().startWorkDay("alice", "setup");
            service.engine().addEntry("alice", EntryRequest.of("Install tools", 40));
        }
        assertTrue(Files.exists(tempDir.resolve("worklog.db")));

        try (WorklogService service = new WorklogService(configPath, new FileConfigManager(), clock)) {
            service.start();
            assertEquals(40, service.engine().report("alice").entryMinutes());
        }
    }

    @Test
    void shouldUseMemoryStoreWhenConfigured() throws Exception {
        Path configPath = writeConfig("MEMORY");

        try (WorklogService service = new WorklogService(configPath, new FileConfigManager())) {
            service.start();
            service.engine().startWorkDay("alice", null);
            assertTrue(service.engine().status("alice").workDay().isPresent());
        }
        assertTrue(Files.notExists(tempDir.resolve("worklog.db")));
    }

    @Test
    void shouldRequireStartBeforeUse() {
        WorklogService service = new WorklogService(tempDir.resolve("config.json"), new FileConfigManager());

        assertThrows(IllegalStateException.class, service::engine);
    }

    private Path writeConfig(String storageType) throws Exception {
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
                {
                  "storage": { "type": "%s", "sqlite": { "databasePath": "%s" } },
                  "logging": { "level": "WARN", "file": "%s" }
                }
                """.formatted(storageType, json(tempDir.resolve("worklog.db")), json(tempDir.resolve("worklog.log"))));
        return configPath;
    }

    private static String json(Path path) {
        return path.toString().replace("\\", "\\\\");
    }
}
