package com.personal.image_converter.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.personal.image_converter.tools.ConversionSettings;
import com.personal.image_converter.tools.OutputFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Application defaults read from a JSON file at start-up.
 *
 * Keys missing from the file keep their built-in values; a missing or
 * malformed file yields the built-in defaults.
 */
public class ConverterConfig {

    private static final Logger log = LoggerFactory.getLogger(ConverterConfig.class);

    public static final Path DEFAULT_CONFIG_FILE = Paths.get("config.json");

    private static final Gson GSON = new GsonBuilder().create();

    // Field initializers are the defaults; Gson leaves them untouched for absent keys.
    private String defaultOutputFormat = "PNG";
    private int defaultQuality = ConversionSettings.DEFAULT_QUALITY;
    private int defaultResizeWidth = 1920;
    private int defaultResizeHeight = 1080;
    private long queuePollIntervalMillis = 100;

    public static ConverterConfig defaults() {
        return new ConverterConfig();
    }

    /**
     * Loads the configuration from {@code file}, merged over the defaults.
     */
    public static ConverterConfig load(Path file) {
        if (!Files.isRegularFile(file)) {
            log.debug("No config file at {}, using defaults", file.toAbsolutePath());
            return defaults();
        }
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            ConverterConfig config = GSON.fromJson(reader, ConverterConfig.class);
            if (config == null) {
                return defaults();
            }
            config.sanitize();
            log.info("Loaded configuration from {}", file.toAbsolutePath());
            return config;
        } catch (IOException | JsonParseException e) {
            log.error("Error loading config {}: {}", file, e.getMessage());
            return defaults();
        }
    }

    /**
     * Replaces out-of-range values with their defaults.
     */
    private void sanitize() {
        ConverterConfig defaults = defaults();
        if (OutputFormat.fromName(defaultOutputFormat) == null) {
            log.warn("Unknown defaultOutputFormat '{}', using {}", defaultOutputFormat, defaults.defaultOutputFormat);
            defaultOutputFormat = defaults.defaultOutputFormat;
        }
        if (defaultQuality < 1 || defaultQuality > 100) {
            log.warn("defaultQuality {} out of range, using {}", defaultQuality, defaults.defaultQuality);
            defaultQuality = defaults.defaultQuality;
        }
        if (!validDimension(defaultResizeWidth) || !validDimension(defaultResizeHeight)) {
            log.warn("Default resize {}x{} out of range, using {}x{}", defaultResizeWidth, defaultResizeHeight,
                    defaults.defaultResizeWidth, defaults.defaultResizeHeight);
            defaultResizeWidth = defaults.defaultResizeWidth;
            defaultResizeHeight = defaults.defaultResizeHeight;
        }
        if (queuePollIntervalMillis <= 0) {
            queuePollIntervalMillis = defaults.queuePollIntervalMillis;
        }
    }

    private static boolean validDimension(int value) {
        return value >= ConversionSettings.MIN_DIMENSION && value <= ConversionSettings.MAX_DIMENSION;
    }

    public OutputFormat getDefaultOutputFormat() {
        OutputFormat format = OutputFormat.fromName(defaultOutputFormat);
        return format != null ? format : OutputFormat.PNG;
    }

    public int getDefaultQuality() { return defaultQuality; }
    public int getDefaultResizeWidth() { return defaultResizeWidth; }
    public int getDefaultResizeHeight() { return defaultResizeHeight; }
    public long getQueuePollIntervalMillis() { return queuePollIntervalMillis; }

    @Override
    public String toString() {
        return "ConverterConfig{" +
                "defaultOutputFormat='" + defaultOutputFormat + '\'' +
                ", defaultQuality=" + defaultQuality +
                ", defaultResize=" + defaultResizeWidth + "x" + defaultResizeHeight +
                ", queuePollIntervalMillis=" + queuePollIntervalMillis +
                '}';
    }
}
