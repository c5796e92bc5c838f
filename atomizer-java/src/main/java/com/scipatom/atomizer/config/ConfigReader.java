package com.scipatom.atomizer.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads the optional atomizer.json run configuration. Problems are reported before any
 * work starts.
 */
public class ConfigReader {

    private static final Gson GSON = new Gson();

    /**
     * @throws ConfigReadException if the file is missing, empty, not JSON, or holds an invalid value
     */
    public AtomizerConfig read(Path configPath) {
        if (!Files.isRegularFile(configPath)) {
            throw new ConfigReadException("Config file not found: " + configPath);
        }
        AtomizerConfig config;
        try (Reader reader = Files.newBufferedReader(configPath, StandardCharsets.UTF_8)) {
            config = GSON.fromJson(reader, AtomizerConfig.class);
        } catch (JsonParseException e) {
            throw new ConfigReadException("Config is not valid JSON: " + configPath + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ConfigReadException("Failed to read config: " + configPath + ": " + e.getMessage(), e);
        }
        if (config == null) {
            throw new ConfigReadException("Config file is empty: " + configPath);
        }
        validate(config, configPath);
        return config;
    }

    private static void validate(AtomizerConfig config, Path configPath) {
        if (config.getFallbackSearchWindow() < 0) {
            throw new ConfigReadException("fallback_search_window must not be negative in " + configPath);
        }
        if (config.getFallbackMaxLines() < 1) {
            throw new ConfigReadException("fallback_max_lines must be at least 1 in " + configPath);
        }
    }

    public static class ConfigReadException extends RuntimeException {
        public ConfigReadException(String message) { super(message); }
        public ConfigReadException(String message, Throwable cause) { super(message, cause); }
    }
}
