package com.example.configserver.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Reads {@code KEY=VALUE} env files. Missing or unreadable files are skipped with a warning.
 */
@Component
@Slf4j
public class EnvFileLoader {

    public void mergeInto(String path, Map<String, String> target) {
        if (path == null || path.isBlank()) {
            return;
        }
        String contents;
        try {
            contents = Files.readString(Paths.get(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Failed to read env file {}: {}", path, e.getMessage());
            return;
        }

        int loaded = 0;
        for (String rawLine : contents.split("\\R")) {
            String line = rawLine.trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            int eq = line.indexOf('=');
            if (eq < 0) {
                continue;
            }
            target.put(line.substring(0, eq).trim(), line.substring(eq + 1).trim());
            loaded++;
        }
        log.debug("Loaded {} variables from env file {}", loaded, path);
    }
}
