package me.landon.depthsync.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class DepthSyncConfigManager {
    private static final Logger LOGGER = LoggerFactory.getLogger(DepthSyncConfigManager.class);
    public static final String DEFAULT_FILE_NAME = "depth-sync.json";

    private final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
    private final Path configPath;

    private DepthSyncConfig cached;

    public DepthSyncConfigManager(Path configPath) {
        this.configPath = Objects.requireNonNull(configPath, "configPath");
    }

    public static DepthSyncConfigManager inDirectory(Path directory) {
        return new DepthSyncConfigManager(directory.resolve(DEFAULT_FILE_NAME));
    }

    public synchronized DepthSyncConfig load() {
        DepthSyncConfig config;

        if (Files.exists(configPath)) {
            config = readFromDisk();
        } else {
            config = DepthSyncConfig.defaults();
        }

        config.sanitize();
        writeToDisk(config);
        cached = config;
        return config;
    }

    public synchronized DepthSyncConfig getOrLoad() {
        return cached == null ? load() : cached;
    }

    public synchronized void save(DepthSyncConfig config) {
        config.sanitize();
        writeToDisk(config);
        cached = config;
    }

    public Path configPath() {
        return configPath;
    }

    private DepthSyncConfig readFromDisk() {
        try (Reader reader = Files.newBufferedReader(configPath)) {
            DepthSyncConfig config = gson.fromJson(reader, DepthSyncConfig.class);
            return config == null ? DepthSyncConfig.defaults() : config;
        } catch (IOException | JsonParseException ex) {
            LOGGER.warn("Failed to read depth sync config from {}, using defaults", configPath, ex);
            return DepthSyncConfig.defaults();
        }
    }

    private void writeToDisk(DepthSyncConfig config) {
        try {
            Path parent = configPath.toAbsolutePath().getParent();

            if (parent != null) {
                Files.createDirectories(parent);
            }

            try (Writer writer = Files.newBufferedWriter(configPath)) {
                gson.toJson(config, writer);
            }
        } catch (IOException ex) {
            LOGGER.warn("Failed to write depth sync config to {}", configPath, ex);
        }
    }
}
