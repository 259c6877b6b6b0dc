package com.worklog.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import com.worklog.util.PathUtils;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * SQLite session store settings. {@code busyTimeoutMillis} bounds how long a write waits for
 * another process holding the database, e.g. two CLI runs saving the same owner's day.
 */
public record SqliteStorageConfig(
        String databasePath,
        String journalMode,
        Integer busyTimeoutMillis
) {

    private static final String DEFAULT_DB_NAME = "worklog.db";
    private static final String DEFAULT_JOURNAL_MODE = "WAL";
    private static final Set<String> JOURNAL_MODES = Set.of("WAL", "DELETE", "TRUNCATE", "PERSIST", "MEMORY", "OFF");
    private static final int DEFAULT_BUSY_TIMEOUT_MILLIS = 5_000;

    @JsonCreator
    public SqliteStorageConfig(
            @JsonProperty("databasePath") String databasePath,
            @JsonProperty("journalMode") String journalMode,
            @JsonProperty("busyTimeoutMillis") Integer busyTimeoutMillis
    ) {
        this.databasePath = databasePath;
        this.journalMode = journalMode;
        this.busyTimeoutMillis = busyTimeoutMillis;
    }

    public SqliteStorageConfig withDefaults(Path dataDir) {
        Objects.requireNonNull(dataDir, "dataDir");
        Path db = PathUtils.resolveOrDefault(databasePath, dataDir.resolve(DEFAULT_DB_NAME));
        int busyTimeout = (busyTimeoutMillis == null || busyTimeoutMillis < 0)
                ? DEFAULT_BUSY_TIMEOUT_MILLIS
                : busyTimeoutMillis;
        return new SqliteStorageConfig(db.toString(), normalizeJournalMode(journalMode), busyTimeout);
    }

    private static String normalizeJournalMode(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_JOURNAL_MODE;
        }
        String upper = candidate.trim().toUpperCase(Locale.ROOT);
        return JOURNAL_MODES.contains(upper) ? upper : DEFAULT_JOURNAL_MODE;
    }

    public static SqliteStorageConfig defaults(Path dataDir) {
        return new SqliteStorageConfig(dataDir.resolve(DEFAULT_DB_NAME).toString(), DEFAULT_JOURNAL_MODE,
                DEFAULT_BUSY_TIMEOUT_MILLIS);
    }
}
