package com.example.recipematch.storage;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.file.*;

public class SettingsStorage {
    private static final Logger log = LoggerFactory.getLogger(SettingsStorage.class);
    public static final String DEFAULT_RESOURCE = "/matching-settings.json";

    private final ObjectMapper mapper = new ObjectMapper()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    /** Classpath defaults, or built-in values when the resource is missing or broken. */
    public Settings load() {
        try (InputStream in = SettingsStorage.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) return new Settings();
            return read(in);
        } catch (IOException ex) {
            log.warn("Could not read {}, using built-in matching settings", DEFAULT_RESOURCE, ex);
            return new Settings();
        }
    }

    public Settings load(Path file) {
        if (file == null || !Files.exists(file)) return load();
        try (InputStream in = Files.newInputStream(file)) {
            return read(in);
        } catch (IOException ex) {
            log.warn("Could not read settings file {}, using built-in matching settings", file, ex);
            return new Settings();
        }
    }

    public Settings read(InputStream in) throws IOException {
        Settings s = mapper.readValue(in, Settings.class);
        return s == null ? new Settings() : s;
    }
}
