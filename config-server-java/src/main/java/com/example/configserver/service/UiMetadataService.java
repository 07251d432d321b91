package com.example.configserver.service;

import com.example.configserver.config.AppConfig;
import com.example.configserver.model.GitEndpoint;
import com.example.configserver.model.ResolvedVersion;
import com.example.configserver.model.TenantEnvironment;
import com.example.configserver.model.UiMetadata;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class UiMetadataService {
    private final AppConfig config;
    private final EnvironmentRegistry registry;
    private final RepositoryReader repositoryReader;

    public UiMetadata snapshot() {
        List<UiMetadata.EnvironmentMetadata> environments = new ArrayList<>();
        for (TenantEnvironment environment : registry.all()) {
            GitEndpoint git = environment.getGit();
            Optional<ResolvedVersion> version = repositoryReader.resolveVersion(git, null);
            environments.add(UiMetadata.EnvironmentMetadata.builder()
                .name(environment.getName())
                .repoUrl(git.getRepoUrl())
                .branch(git.getBranch())
                .workdir(git.getWorkdir().toString())
                .subpath(git.hasSubpath() ? git.getSubpath() : "")
                .lastCommit(version.map(ResolvedVersion::getCommitId).orElse(""))
                .lastCommitDate(version
                    .map(v -> DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(v.getCommitTime()))
                    .orElse(""))
                .build());
        }

        return UiMetadata.builder()
            .basePath(config.getHttp().normalizedBasePath())
            .environments(environments)
            .authEnabled(config.getAuth().isEnabled())
            .build();
    }
}
