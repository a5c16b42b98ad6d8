package com.componenttrace.core.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.FileNotFoundException;
import java.io.FileReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

public class TracerConfigReader {

    /** Classpath resource consulted when no explicit config file is given. */
    public static final String DEFAULT_RESOURCE = "component-tracer.json";

    private static final Gson GSON = new Gson();

    /**
     * Reads and deserializes a tracer config file.
     *
     * @throws ConfigReadException if the file is missing or malformed
     */
    public TracerConfig read(Path configPath) {
        if (!configPath.toFile().exists()) {
            throw new ConfigReadException("Tracer config not found: " + configPath);
        }
        try (FileReader reader = new FileReader(configPath.toFile(), StandardCharsets.UTF_8)) {
            return parse(reader, configPath.toString());
        } catch (FileNotFoundException e) {
            throw new ConfigReadException("Tracer config not found: " + configPath, e);
        } catch (IOException e) {
            throw new ConfigReadException("Failed to read tracer config: " + configPath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Reads a config resource from the classpath, or returns defaults when it is absent.
     *
     * @throws ConfigReadException if the resource exists but is malformed
     */
    public TracerConfig readClasspath(String resource, ClassLoader loader) {
        ClassLoader cl = loader != null ? loader : TracerConfigReader.class.getClassLoader();
        try (InputStream in = cl.getResourceAsStream(resource)) {
            if (in == null) return TracerConfig.defaults();
            return parse(new InputStreamReader(in, StandardCharsets.UTF_8), resource);
        } catch (IOException e) {
            throw new ConfigReadException("Failed to read tracer config resource: " + resource, e);
        }
    }

    private TracerConfig parse(Reader reader, String source) {
        try {
            TracerConfig config = GSON.fromJson(reader, TracerConfig.class);
            if (config == null) {
                throw new ConfigReadException("Tracer config is empty or invalid JSON: " + source);
            }
            return config;
        } catch (JsonParseException e) {
            throw new ConfigReadException("Tracer config is not valid JSON: " + source, e);
        }
    }

    public static class ConfigReadException extends RuntimeException {
        public ConfigReadException(String message) { super(message); }
        public ConfigReadException(String message, Throwable cause) { super(message, cause); }
    }
}
