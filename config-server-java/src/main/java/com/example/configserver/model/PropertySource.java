package com.example.configserver.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PropertySource {
    @JsonProperty("name")
    private String name;

    @JsonProperty("source")
    private Map<String, Object> source;
}
