package com.worklog.config;

import java.io.IOException;
import java.nio.file.Path;

public interface ConfigManager {

    AppConfig load(Path path) throws IOException;

    void save(Path path, AppConfig config) throws IOException;
}
