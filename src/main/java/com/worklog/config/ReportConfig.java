package com.worklog.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;
import java.util.Set;

public record ReportConfig(
        String format
) {

    private static final Set<String> FORMATS = Set.of("csv", "json");
    private static final String DEFAULT_FORMAT = "json";

    @JsonCreator
    public ReportConfig(
            @JsonProperty("format") String format
    ) {
        this.format = format;
    }

    public ReportConfig withDefaults() {
        if (format == null || format.isBlank()) {
            return defaults();
        }
        String lower = format.trim().toLowerCase(Locale.ROOT);
        return new ReportConfig(FORMATS.contains(lower) ? lower : DEFAULT_FORMAT);
    }

    public static boolean isSupported(String candidate) {
        return candidate != null && FORMATS.contains(candidate.trim().toLowerCase(Locale.ROOT));
    }

    public static ReportConfig defaults() {
        return new ReportConfig(DEFAULT_FORMAT);
    }
}
