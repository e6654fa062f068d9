package org.imagebatch.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Loads the task file. JSON is the primary format, {@code .yaml}/{@code .yml} files are read
 * with the same model through the YAML factory.
 */
public final class ConfigManager {
    private static final Logger LOGGER = Logger.getLogger(ConfigManager.class.getName());

    static {
        System.setProperty("java.util.logging.SimpleFormatter.format", "[%1$tF %1$tT] [%4$-7s] %3$s - %5$s %6$s%n");
        Logger rootLogger = Logger.getLogger("");
        for (var existing : rootLogger.getHandlers()) {
            rootLogger.removeHandler(existing);
        }
        ConsoleHandler handler = new ConsoleHandler();
        handler.setFormatter(new SimpleFormatter());
        handler.setLevel(Level.ALL);
        rootLogger.addHandler(handler);
        rootLogger.setLevel(Level.INFO);
    }

    private ConfigManager() {
    }

    /**
     * Reads and validates the task file.
     *
     * @throws IOException              if the file is missing, unreadable or malformed
     * @throws IllegalArgumentException if a task carries an invalid value
     */
    public static AppConfig load(final Path configPath) throws IOException {
        if (!Files.isRegularFile(configPath)) {
            throw new NoSuchFileException(configPath.toString(), null, "config file not found");
        }
        AppConfig appConfig = mapperFor(configPath).readValue(configPath.toFile(), AppConfig.class);
        if (appConfig == null) {
            throw new IOException("Config file is empty: " + configPath);
        }
        for (TaskConfig task : appConfig.tasks()) {
            task.validate();
        }
        LOGGER.info("Loaded " + appConfig.tasks().size() + " task(s) from " + configPath.toAbsolutePath());
        return appConfig;
    }

    /**
     * Raises the console verbosity, used by {@code --verbose} to show per-item lines.
     */
    public static void setLogLevel(final Level level) {
        Logger.getLogger("").setLevel(level);
    }

    static ObjectMapper mapperFor(final Path configPath) {
        String fileName = configPath.getFileName().toString().toLowerCase(Locale.ROOT);
        ObjectMapper mapper = (fileName.endsWith(".yaml") || fileName.endsWith(".yml"))
                ? new ObjectMapper(new YAMLFactory()) : new ObjectMapper();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }
}
