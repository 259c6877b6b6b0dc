package com.worklog.util;

import org.apache.commons.lang3.StringUtils;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class PathUtils {

    private static final Pattern PERCENT_ENV_PATTERN = Pattern.compile("%([A-Za-z0-9_]+)%");
    private static final Pattern BRACE_ENV_PATTERN = Pattern.compile("\\$\\{([^}]+)}");

    private PathUtils() {
    }

    public static Path resolve(String path) {
        Objects.requireNonNull(path, "path");
        return Path.of(expand(path)).toAbsolutePath().normalize();
    }

    public static Path resolveOrDefault(String candidate, Path defaultPath) {
        Objects.requireNonNull(defaultPath, "defaultPath");
        if (StringUtils.isBlank(candidate)) {
            return defaultPath.toAbsolutePath().normalize();
        }
        return resolve(candidate);
    }

    public static String expand(String path) {
        Objects.requireNonNull(path, "path");
        String expanded = path.trim();
        if (expanded.isEmpty()) {
            return expanded;
        }
        expanded = replaceEnv(expanded, PERCENT_ENV_PATTERN, System.getenv());
        expanded = replaceEnv(expanded, BRACE_ENV_PATTERN, System.getenv());
        if (expanded.startsWith("~")) {
            String home = System.getProperty("user.home");
            if (StringUtils.isNotBlank(home)) {
                expanded = home + expanded.substring(1);
            }
        }
        return expanded;
    }

    static String replaceEnv(String input, Pattern pattern, Map<String, String> env) {
        Matcher matcher = pattern.matcher(input);
        StringBuilder buffer = new StringBuilder();
        while (matcher.find()) {
            String value = lookup(env, matcher.group(1));
            matcher.appendReplacement(buffer, Matcher.quoteReplacement(value == null ? matcher.group(0) : value));
        }
        matcher.appendTail(buffer);
        return buffer.toString();
    }

    private static String lookup(Map<String, String> env, String key) {
        String direct = env.get(key);
        if (direct != null) {
            return direct;
        }
        String upper = env.get(key.toUpperCase(Locale.ROOT));
        return upper != null ? upper : env.get(key.toLowerCase(Locale.ROOT));
    }
}
