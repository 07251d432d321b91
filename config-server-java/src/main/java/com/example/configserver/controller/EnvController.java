package com.example.configserver.controller;

import com.example.configserver.service.EnvironmentRegistry;
import com.example.configserver.service.ShellExporter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Exposes an environment's resolved template variables.
 */
@RestController
@RequiredArgsConstructor
public class EnvController {
    private static final MediaType TEXT_PLAIN_UTF8 = new MediaType(MediaType.TEXT_PLAIN, StandardCharsets.UTF_8);

    private final EnvironmentRegistry registry;

    @GetMapping("/{env}/env")
    public ResponseEntity<Map<String, String>> getVariables(@PathVariable String env) {
        return ResponseEntity.ok(registry.get(env).getVariables());
    }

    @GetMapping("/{env}/env/export")
    public ResponseEntity<String> exportVariables(@PathVariable String env) {
        return ResponseEntity.ok()
            .contentType(TEXT_PLAIN_UTF8)
            .body(ShellExporter.render(registry.get(env).getVariables()));
    }
}
