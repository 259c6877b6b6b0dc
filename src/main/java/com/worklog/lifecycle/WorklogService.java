package com.worklog.lifecycle;

import com.worklog.config.AppConfig;
import com.worklog.config.ConfigManager;
import com.worklog.logging.LoggingConfigurator;
import com.worklog.storage.SessionStore;
import com.worklog.storage.StorageException;
import com.worklog.storage.memory.InMemorySessionStore;
import com.worklog.storage.sqlite.SqliteSessionStore;
import com.worklog.tracking.WorklogEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

public class WorklogService implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorklogService.class);

    private final Path configPath;
    private final ConfigManager configManager;
    private final Clock clock;
    private final AtomicBoolean started = new AtomicBoolean(false);

    private AppConfig config;
    private SessionStore store;
    private WorklogEngine engine;

    public WorklogService(Path configPath, ConfigManager configManager) {
        this(configPath, configManager, Clock.systemUTC());
    }

    public WorklogService(Path configPath, ConfigManager configManager, Clock clock) {
        this.configPath = configPath.toAbsolutePath().normalize();
        this.configManager = Objects.requireNonNull(configManager, "configManager");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public void start() throws IOException, StorageException {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        this.config = configManager.load(configPath);
        LoggingConfigurator.apply(config.logging());
        this.store = createStore(config);
        this.engine = new WorklogEngine(store, clock, config.tracking());
        log.info("Worklog started with {} storage", config.storage().type());
    }

    private SessionStore createStore(AppConfig configuration) throws StorageException {
        return switch (configuration.storage().type()) {
            case MEMORY -> new InMemorySessionStore();
            case SQLITE -> new SqliteSessionStore(configuration.storage().sqlite());
        };
    }

    public WorklogEngine engine() {
        if (engine == null) {
            throw new IllegalStateException("Service has not been started");
        }
        return engine;
    }

    public AppConfig config() {
        if (config == null) {
            throw new IllegalStateException("Service has not been started");
        }
        return config;
    }

    @Override
    public void close() throws StorageException {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        log.debug("Stopping Worklog");
        if (store != null) {
            store.close();
        }
        store = null;
        engine = null;
    }
}
