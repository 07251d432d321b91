package com.example.configserver.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Outcome of the most recent sync attempts for one environment's mirror.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MirrorStatus {
    @JsonProperty("name")
    private String name;

    @JsonProperty("lastSuccessfulSync")
    private Instant lastSuccessfulSync;

    @JsonProperty("lastError")
    private String lastError;

    @JsonIgnore
    public boolean isHealthy() {
        return lastSuccessfulSync != null && lastError == null;
    }
}
