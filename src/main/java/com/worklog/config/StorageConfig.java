package com.worklog.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;
import java.util.Objects;

public record StorageConfig(
        StorageType type,
        SqliteStorageConfig sqlite
) {

    private static final StorageType DEFAULT_TYPE = StorageType.SQLITE;

    @JsonCreator
    public StorageConfig(
            @JsonProperty("type") StorageType type,
            @JsonProperty("sqlite") SqliteStorageConfig sqlite
    ) {
        this.type = type == null ? DEFAULT_TYPE : type;
        this.sqlite = sqlite;
    }

    public StorageConfig withDefaults(Path rootDir) {
        Objects.requireNonNull(rootDir, "rootDir");
        SqliteStorageConfig sqliteConfig = (sqlite == null)
                ? SqliteStorageConfig.defaults(rootDir.resolve("data"))
                : sqlite.withDefaults(rootDir.resolve("data"));
        return new StorageConfig(type, sqliteConfig);
    }

    public static StorageConfig defaults(Path rootDir) {
        return new StorageConfig(DEFAULT_TYPE, SqliteStorageConfig.defaults(rootDir.resolve("data")));
    }
}
