package com.example.configserver.service;

import com.example.configserver.config.AppConfig;
import com.example.configserver.exception.EnvironmentNotFoundException;
import com.example.configserver.model.GitEndpoint;
import com.example.configserver.model.TenantEnvironment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Builds every tenant environment once at startup. Entries are immutable afterwards and
 * shared by all requests without locking.
 */
@Service
@Slf4j
public class EnvironmentRegistry {
    public static final String DEFAULT_ENVIRONMENT = "default";
    static final long DEFAULT_REFRESH_INTERVAL_SECS = 30;
    static final long MIN_REFRESH_INTERVAL_SECS = 1;

    private final Map<String, TenantEnvironment> environments;

    @Autowired
    public EnvironmentRegistry(AppConfig config, EnvFileLoader envFileLoader) {
        this(config, envFileLoader, System.getenv());
    }

    EnvironmentRegistry(AppConfig config, EnvFileLoader envFileLoader, Map<String, String> processEnv) {
        Map<String, String> globalEnv = new HashMap<>();
        if (config.isEnvFromProcess()) {
            globalEnv.putAll(processEnv);
        }
        envFileLoader.mergeInto(config.getEnvFile(), globalEnv);

        Map<String, TenantEnvironment> built = new LinkedHashMap<>();
        if (config.getEnvironments() != null && !config.getEnvironments().isEmpty()) {
            for (Map.Entry<String, AppConfig.EnvDefinition> entry : config.getEnvironments().entrySet()) {
                String name = entry.getKey();
                AppConfig.EnvDefinition definition = entry.getValue();
                if (definition.getGit() == null) {
                    throw new IllegalStateException("Environment '" + name + "' has no git configuration");
                }
                Map<String, String> variables = new HashMap<>(globalEnv);
                envFileLoader.mergeInto(definition.getEnvFile(), variables);
                built.put(name, build(name, definition.getGit(), variables));
            }
        } else if (config.getGit() != null) {
            built.put(DEFAULT_ENVIRONMENT, build(DEFAULT_ENVIRONMENT, config.getGit(), globalEnv));
        } else {
            throw new IllegalStateException("Configuration must contain either `git` or `environments`");
        }

        this.environments = Collections.unmodifiableMap(built);
        log.info("Registered environments: {}", environments.keySet());
    }

    public Optional<TenantEnvironment> find(String name) {
        return Optional.ofNullable(environments.get(name));
    }

    public TenantEnvironment get(String name) {
        return find(name).orElseThrow(() -> new EnvironmentNotFoundException(name));
    }

    /**
     * All environments ordered by name.
     */
    public List<TenantEnvironment> all() {
        List<TenantEnvironment> sorted = new ArrayList<>(environments.values());
        sorted.sort((a, b) -> a.getName().compareTo(b.getName()));
        return sorted;
    }

    private TenantEnvironment build(String name, AppConfig.GitConfig git, Map<String, String> variables) {
        if (git.getRepoUrl() == null || git.getRepoUrl().isBlank()) {
            throw new IllegalStateException("Environment '" + name + "' is missing git.repo-url");
        }
        if (git.getWorkdir() == null || git.getWorkdir().isBlank()) {
            throw new IllegalStateException("Environment '" + name + "' is missing git.workdir");
        }

        GitEndpoint endpoint = GitEndpoint.builder()
            .repoUrl(git.getRepoUrl())
            .branch(git.getBranch() != null && !git.getBranch().isBlank() ? git.getBranch() : "main")
            .workdir(Paths.get(git.getWorkdir()))
            .subpath(normalizeSubpath(git.getSubpath()))
            .refreshInterval(refreshInterval(git.getRefreshIntervalSecs()))
            .build();

        return TenantEnvironment.builder()
            .name(name)
            .git(endpoint)
            .variables(Collections.unmodifiableMap(new TreeMap<>(variables)))
            .build();
    }

    static String normalizeSubpath(String subpath) {
        if (subpath == null) {
            return null;
        }
        String normalized = subpath.trim().replace('\\', '/');
        while (normalized.startsWith("/")) {
            normalized = normalized.substring(1);
        }
        while (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized.isEmpty() ? null : normalized;
    }

    static Duration refreshInterval(long seconds) {
        if (seconds <= 0) {
            return Duration.ofSeconds(DEFAULT_REFRESH_INTERVAL_SECS);
        }
        return Duration.ofSeconds(Math.max(seconds, MIN_REFRESH_INTERVAL_SECS));
    }
}
