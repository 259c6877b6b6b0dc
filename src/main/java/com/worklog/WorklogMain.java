package com.worklog;

import com.worklog.cli.CommandDispatcher;
import com.worklog.config.FileConfigManager;
import com.worklog.lifecycle.WorklogService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class WorklogMain {

    private static final Logger log = LoggerFactory.getLogger(WorklogMain.class);

    private static final Set<String> GLOBAL_OPTIONS = Set.of("--config", "--owner");

    private WorklogMain() {
    }

    public static void main(String[] args) {
        List<String> remaining = new ArrayList<>(args == null ? List.of() : Arrays.asList(args));
        Map<String, String> global = takeGlobalOptions(remaining);
        Path configPath = resolveConfigPath(global.get("--config"));
        String owner = global.getOrDefault("--owner", System.getProperty("user.name"));

        int exitCode;
        try (WorklogService service = new WorklogService(configPath, new FileConfigManager())) {
            service.start();
            CommandDispatcher dispatcher = new CommandDispatcher(
                    service.engine(), owner, service.config().report(), System.out, System.err);
            exitCode = dispatcher.run(remaining);
        } catch (Exception ex) {
            log.error("Worklog failed", ex);
            exitCode = CommandDispatcher.EXIT_FAILURE;
        }
        System.exit(exitCode);
    }

    static Map<String, String> takeGlobalOptions(List<String> args) {
        Map<String, String> options = new HashMap<>();
        while (args.size() >= 2 && GLOBAL_OPTIONS.contains(args.get(0))) {
            options.put(args.remove(0), args.remove(0));
        }
        return options;
    }

    static Path resolveConfigPath(String explicit) {
        if (explicit != null && !explicit.isBlank()) {
            return Path.of(explicit).toAbsolutePath().normalize();
        }
        return Path.of("config", "config.json").toAbsolutePath().normalize();
    }
}
