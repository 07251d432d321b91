package com.example.configserver.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

@ConfigurationProperties(prefix = "")
@Data
public class AppConfig {
    private HttpConfig http = new HttpConfig();
    private AuthConfig auth = new AuthConfig();

    /**
     * Seed template variables from the process environment.
     */
    private boolean envFromProcess = false;

    /**
     * Global env file (KEY=VALUE per line), applied to every environment.
     */
    private String envFile;

    /**
     * Single-instance mode, exposed as the environment named "default".
     */
    private GitConfig git;

    /**
     * Multi-tenant mode. Takes precedence over {@link #git} when non-empty.
     */
    private Map<String, EnvDefinition> environments = new LinkedHashMap<>();

    @Data
    public static class HttpConfig {
        private String basePath = "/";

        public String normalizedBasePath() {
            return normalizeBasePath(basePath);
        }
    }

    @Data
    public static class AuthConfig {
        private String username;
        private String password;

        public boolean isEnabled() {
            return username != null && password != null;
        }
    }

    @Data
    public static class GitConfig {
        private String repoUrl;
        private String branch = "main";
        private String workdir;
        private String subpath;
        private long refreshIntervalSecs = 30;
    }

    @Data
    public static class EnvDefinition {
        private GitConfig git;
        private String envFile;
    }

    public static String normalizeBasePath(String base) {
        if (base == null) {
            return "/";
        }
        String trimmed = base.trim();
        int start = 0;
        int end = trimmed.length();
        while (start < end && trimmed.charAt(start) == '/') {
            start++;
        }
        while (end > start && trimmed.charAt(end - 1) == '/') {
            end--;
        }
        if (start == end) {
            return "/";
        }
        return "/" + trimmed.substring(start, end);
    }
}
