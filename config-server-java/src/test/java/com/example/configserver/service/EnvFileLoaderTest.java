package com.example.configserver.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EnvFileLoaderTest {

    @TempDir
    Path tempDir;

    private final EnvFileLoader loader = new EnvFileLoader();

    @Test
    void testMergeInto_ParsesKeyValueLines() throws IOException {
        Path file = tempDir.resolve("vars.env");
        Files.writeString(file, """
            # comment
            DB_HOST = db.internal

            URL=jdbc:x://h?a=b
              SPACED=  value with spaces \s
            NO_EQUALS_LINE
            """);
        Map<String, String> target = new HashMap<>();

        loader.mergeInto(file.toString(), target);

        assertEquals(3, target.size());
        assertEquals("db.internal", target.get("DB_HOST"));
        assertEquals("jdbc:x://h?a=b", target.get("URL"));
        assertEquals("value with spaces", target.get("SPACED"));
    }

    @Test
    void testMergeInto_OverridesExistingKeys() throws IOException {
        Path file = tempDir.resolve("override.env");
        Files.writeString(file, "REGION=eu\n");
        Map<String, String> target = new HashMap<>(Map.of("REGION", "us", "KEEP", "x"));

        loader.mergeInto(file.toString(), target);

        assertEquals("eu", target.get("REGION"));
        assertEquals("x", target.get("KEEP"));
    }

    @Test
    void testMergeInto_MissingFileIsSkipped() {
        Map<String, String> target = new HashMap<>(Map.of("A", "1"));

        assertDoesNotThrow(() -> loader.mergeInto(tempDir.resolve("absent.env").toString(), target));
        assertEquals(Map.of("A", "1"), target);
    }

    @Test
    void testMergeInto_NullPathIsNoop() {
        Map<String, String> target = new HashMap<>();

        loader.mergeInto(null, target);

        assertTrue(target.isEmpty());
    }
}
