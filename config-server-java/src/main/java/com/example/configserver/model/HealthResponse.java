package com.example.configserver.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthResponse {
    @JsonProperty("status")
    private String status;

    @JsonProperty("environments")
    private List<MirrorStatus> environments;
}
