package com.worklog.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;
import java.nio.file.Paths;

public record AppConfig(
        StorageConfig storage,
        LoggingConfig logging,
        TrackingConfig tracking,
        ReportConfig report
) {

    @JsonCreator
    public static AppConfig create(
            @JsonProperty("storage") StorageConfig storage,
            @JsonProperty("logging") LoggingConfig logging,
            @JsonProperty("tracking") TrackingConfig tracking,
            @JsonProperty("report") ReportConfig report
    ) {
        Path root = defaultRoot();
        StorageConfig resolvedStorage = storage == null
                ? StorageConfig.defaults(root)
                : storage.withDefaults(root);
        LoggingConfig resolvedLogging = logging == null
                ? LoggingConfig.defaults(root)
                : logging.withDefaults(root);
        TrackingConfig resolvedTracking = tracking == null
                ? TrackingConfig.defaults()
                : tracking.withDefaults();
        ReportConfig resolvedReport = report == null
                ? ReportConfig.defaults()
                : report.withDefaults();

        return new AppConfig(resolvedStorage, resolvedLogging, resolvedTracking, resolvedReport);
    }

    private static Path defaultRoot() {
        String appData = System.getenv("APPDATA");
        if (appData == null || appData.isBlank()) {
            return Paths.get(System.getProperty("user.home"), "Worklog");
        }
        return Paths.get(appData, "Worklog");
    }

    public static AppConfig defaults() {
        return new AppConfig(
                StorageConfig.defaults(defaultRoot()),
                LoggingConfig.defaults(defaultRoot()),
                TrackingConfig.defaults(),
                ReportConfig.defaults()
        );
    }
}
