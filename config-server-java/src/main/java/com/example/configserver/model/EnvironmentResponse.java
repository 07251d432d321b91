package com.example.configserver.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Spring Cloud Config compatible environment envelope.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnvironmentResponse {
    @JsonProperty("name")
    private String name;

    @JsonProperty("profiles")
    private List<String> profiles;

    @JsonProperty("label")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String label;

    @JsonProperty("version")
    private String version;

    /** Reserved for protocol compatibility, always empty. */
    @JsonProperty("state")
    private String state;

    @JsonProperty("propertySources")
    @Builder.Default
    private List<PropertySource> propertySources = new ArrayList<>();
}
