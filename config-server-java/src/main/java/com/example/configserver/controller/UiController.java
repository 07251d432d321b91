package com.example.configserver.controller;

import com.example.configserver.model.UiMetadata;
import com.example.configserver.service.UiMetadataService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Static dashboard with the metadata snapshot inlined.
 */
@RestController
@Slf4j
public class UiController {
    static final String META_MARKER = "__META_JSON__";

    private final UiMetadataService uiMetadataService;
    private final ObjectMapper objectMapper;
    private final String template;

    public UiController(UiMetadataService uiMetadataService, ObjectMapper objectMapper) {
        this.uiMetadataService = uiMetadataService;
        this.objectMapper = objectMapper;
        this.template = loadTemplate();
    }

    @GetMapping("/ui")
    public Mono<ResponseEntity<String>> ui() {
        return Mono.fromCallable(() -> {
                UiMetadata meta = uiMetadataService.snapshot();
                return ResponseEntity.ok()
                    .contentType(MediaType.TEXT_HTML)
                    .body(template.replace(META_MARKER, toJson(meta)));
            })
            .subscribeOn(Schedulers.boundedElastic());
    }

    private String toJson(UiMetadata meta) throws JsonProcessingException {
        // keep "</script>" in values from closing the inline script block
        return objectMapper.writeValueAsString(meta).replace("</", "<\\/");
    }

    private static String loadTemplate() {
        try (InputStream in = new ClassPathResource("templates/ui.html").getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load UI template", e);
        }
    }
}
