package com.depgraph.engine.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public class EngineConfigReader {

    public static final String DEFAULT_FILE_NAME = "depgraph.json";

    private static final Gson GSON = new Gson();

    /**
     * Reads depgraph.json from {@code configPath}. A missing file yields the defaults.
     *
     * @throws ConfigReadException if the file cannot be read, is empty or is not valid JSON
     */
    public EngineConfig read(Path configPath) {
        if (!Files.exists(configPath)) {
            return EngineConfig.defaults();
        }
        try (Reader reader = Files.newBufferedReader(configPath, StandardCharsets.UTF_8)) {
            EngineConfig config = GSON.fromJson(reader, EngineConfig.class);
            if (config == null) {
                throw new ConfigReadException("Config file is empty or invalid JSON: " + configPath);
            }
            return config;
        } catch (JsonParseException e) {
            throw new ConfigReadException("Malformed config " + configPath + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ConfigReadException("Failed to read config: " + configPath + ": " + e.getMessage(), e);
        }
    }

    public static class ConfigReadException extends RuntimeException {
        public ConfigReadException(String message) { super(message); }
        public ConfigReadException(String message, Throwable cause) { super(message, cause); }
    }
}
