package com.example.configserver.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * A logical tenant: its git endpoint and the template variables resolved for it at startup.
 * Instances are shared read-only by every request for the environment.
 */
@Value
@Builder
public class TenantEnvironment {
    String name;
    GitEndpoint git;
    Map<String, String> variables;
}
