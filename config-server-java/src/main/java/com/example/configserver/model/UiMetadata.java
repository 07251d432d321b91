package com.example.configserver.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Snapshot consumed by the static dashboard.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UiMetadata {
    @JsonProperty("base_path")
    private String basePath;

    @JsonProperty("environments")
    private List<EnvironmentMetadata> environments;

    @JsonProperty("auth_enabled")
    private boolean authEnabled;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EnvironmentMetadata {
        @JsonProperty("name")
        private String name;

        @JsonProperty("repo_url")
        private String repoUrl;

        @JsonProperty("branch")
        private String branch;

        @JsonProperty("workdir")
        private String workdir;

        @JsonProperty("subpath")
        private String subpath;

        @JsonProperty("last_commit")
        private String lastCommit;

        @JsonProperty("last_commit_date")
        private String lastCommitDate;
    }
}
