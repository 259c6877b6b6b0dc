package com.worklog.config;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

public class FileConfigManager implements ConfigManager {

    private static final Logger log = LoggerFactory.getLogger(FileConfigManager.class);

    private final ObjectMapper mapper;

    public FileConfigManager() {
        this.mapper = new ObjectMapper()
                .registerModule(new ParameterNamesModule())
                .registerModule(new Jdk8Module())
                .registerModule(new JavaTimeModule());
        this.mapper.configure(SerializationFeature.INDENT_OUTPUT, true);
        this.mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.mapper.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);
    }

    @Override
    public AppConfig load(Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        ensureParentDirectory(path);
        if (!Files.exists(path)) {
            AppConfig defaults = AppConfig.defaults();
            save(path, defaults);
            return defaults;
        }
        AppConfig config;
        try (var reader = Files.newBufferedReader(path)) {
            config = mapper.readValue(reader, AppConfig.class);
        }
        log.debug("Loaded configuration from {}", path);
        return config;
    }

    @Override
    public void save(Path path, AppConfig config) throws IOException {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(config, "config");
        ensureParentDirectory(path);
        try (var writer = Files.newBufferedWriter(path,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE)) {
            mapper.writeValue(writer, config);
        }
        log.info("Configuration saved to {}", path);
    }

    private void ensureParentDirectory(Path path) throws IOException {
        Path parent = path.getParent();
        if (parent != null && !Files.exists(parent)) {
            Files.createDirectories(parent);
        }
    }
}
