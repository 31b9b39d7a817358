package com.example.recipematch;

import com.example.recipematch.storage.*;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import static org.junit.jupiter.api.Assertions.*;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;

public class SettingsStorageTests {
    private final SettingsStorage storage = new SettingsStorage();

    @Test
    void classpathSettingsMatchDefaults() {
        Settings s = storage.load();
        assertEquals(85, s.containmentScore);
        assertEquals(15, s.categoryBoost);
        assertEquals(70, s.categoryMatchThreshold);
        assertEquals(50, s.minimumScore);
        assertEquals(5, s.maxResults);
        assertTrue(s.searchAllTerms);
    }

    @Test
    void partialJsonKeepsOtherDefaults() throws Exception {
        String json = "{ \"maxResults\": 3, \"searchAllTerms\": false, \"somethingElse\": 1 }";
        Settings s = storage.read(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
        assertEquals(3, s.maxResults);
        assertFalse(s.searchAllTerms);
        assertEquals(50, s.minimumScore);
    }

    @Test
    void fileOverridesOnlyTheFieldsItNames(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("settings.json");
        Files.writeString(file, "{ \"minimumScore\": 60, \"parallelism\": 2 }");
        Settings back = storage.load(file);
        assertEquals(85, back.containmentScore);
        assertEquals(60, back.minimumScore);
        assertEquals(2, back.parallelism);
    }

    @Test
    void unreadableFilesFallBackToDefaults(@TempDir Path dir) throws Exception {
        Path broken = dir.resolve("broken.json");
        try (InputStream in = getClass().getResourceAsStream("/fixtures/broken-settings.json")) {
            Files.copy(in, broken);
        }
        assertEquals(5, storage.load(broken).maxResults);
        assertEquals(5, storage.load(dir.resolve("missing.json")).maxResults);
    }
}
