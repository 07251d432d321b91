package com.example.configserver.model;

import lombok.Value;

import java.util.Map;

/**
 * Merged, flattened properties for one request, plus whether any candidate file existed.
 */
@Value
public class AssembledProperties {
    Map<String, Object> properties;
    boolean foundAny;
}
