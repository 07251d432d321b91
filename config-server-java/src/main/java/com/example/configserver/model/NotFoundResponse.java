package com.example.configserver.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Spring-style 404 body.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotFoundResponse {
    private static final DateTimeFormatter TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSX").withZone(ZoneOffset.UTC);

    @JsonProperty("timestamp")
    private String timestamp;

    @JsonProperty("status")
    private int status;

    @JsonProperty("error")
    private String error;

    @JsonProperty("path")
    private String path;

    public static NotFoundResponse forPath(String path) {
        return NotFoundResponse.builder()
            .timestamp(TIMESTAMP_FORMAT.format(Instant.now()))
            .status(404)
            .error("Not Found")
            .path(path)
            .build();
    }
}
