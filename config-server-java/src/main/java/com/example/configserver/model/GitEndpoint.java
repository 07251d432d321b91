package com.example.configserver.model;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Immutable view of one environment's git settings, normalized from configuration.
 */
@Value
@Builder
public class GitEndpoint {
    String repoUrl;
    String branch;
    Path workdir;
    /**
     * Repository-relative root with forward slashes and no leading or trailing slash,
     * or {@code null} when the whole repository is served.
     */
    String subpath;
    Duration refreshInterval;

    public boolean hasSubpath() {
        return subpath != null;
    }

    /**
     * Joins the configured subpath ahead of a repository-relative path.
     */
    public String repositoryPath(String relativePath) {
        String rel = relativePath.replace('\\', '/');
        return hasSubpath() ? subpath + "/" + rel : rel;
    }
}
