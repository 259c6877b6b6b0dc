package com.worklog.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import com.worklog.util.PathUtils;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * {@code trackingLevel} applies to the work day and meeting transitions logged by the engine. When
 * absent those loggers follow {@code level}.
 */
public record LoggingConfig(
        String level,
        String trackingLevel,
        String file,
        Integer maxSizeMB,
        Integer rotationCount
) {

    private static final Set<String> ALLOWED_LEVELS = Set.of("TRACE", "DEBUG", "INFO", "WARN", "ERROR");
    private static final String DEFAULT_LEVEL = "INFO";
    private static final String DEFAULT_FILE_NAME = "worklog.log";
    private static final int DEFAULT_MAX_SIZE_MB = 5;
    private static final int DEFAULT_ROTATION_COUNT = 5;

    @JsonCreator
    public LoggingConfig(
            @JsonProperty("level") String level,
            @JsonProperty("trackingLevel") String trackingLevel,
            @JsonProperty("file") String file,
            @JsonProperty("maxSizeMB") Integer maxSizeMB,
            @JsonProperty("rotationCount") Integer rotationCount
    ) {
        this.level = level;
        this.trackingLevel = trackingLevel;
        this.file = file;
        this.maxSizeMB = maxSizeMB;
        this.rotationCount = rotationCount;
    }

    public LoggingConfig withDefaults(Path rootDir) {
        Objects.requireNonNull(rootDir, "rootDir");
        String resolvedLevel = normalizeLevel(level);
        String resolvedTrackingLevel = ALLOWED_LEVELS.contains(upper(trackingLevel)) ? upper(trackingLevel) : null;
        String resolvedFile = PathUtils.resolveOrDefault(file, defaultFile(rootDir)).toString();
        int resolvedMaxSize = (maxSizeMB == null || maxSizeMB <= 0)
                ? DEFAULT_MAX_SIZE_MB
                : maxSizeMB;
        int resolvedRotation = (rotationCount == null || rotationCount <= 0)
                ? DEFAULT_ROTATION_COUNT
                : rotationCount;
        return new LoggingConfig(resolvedLevel, resolvedTrackingLevel, resolvedFile, resolvedMaxSize,
                resolvedRotation);
    }

    private static String normalizeLevel(String candidate) {
        String upper = upper(candidate);
        return ALLOWED_LEVELS.contains(upper) ? upper : DEFAULT_LEVEL;
    }

    private static String upper(String candidate) {
        return candidate == null ? "" : candidate.trim().toUpperCase(Locale.ROOT);
    }

    private static Path defaultFile(Path rootDir) {
        return rootDir.resolve("logs").resolve(DEFAULT_FILE_NAME);
    }

    public static LoggingConfig defaults(Path rootDir) {
        return new LoggingConfig(DEFAULT_LEVEL, null, defaultFile(rootDir).toString(),
                DEFAULT_MAX_SIZE_MB, DEFAULT_ROTATION_COUNT);
    }
}
