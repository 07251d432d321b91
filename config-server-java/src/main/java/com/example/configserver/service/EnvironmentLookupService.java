package com.example.configserver.service;

import com.example.configserver.model.AssembledProperties;
import com.example.configserver.model.EnvironmentResponse;
import com.example.configserver.model.GitEndpoint;
import com.example.configserver.model.PropertySource;
import com.example.configserver.model.ResolvedVersion;
import com.example.configserver.model.TenantEnvironment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Answers Spring Cloud Config style lookups for one tenant environment.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class EnvironmentLookupService {
    private final EnvironmentRegistry registry;
    private final ConfigAssembler configAssembler;
    private final RepositoryReader repositoryReader;

    /**
     * @param profile comma-separated profile list as requested
     * @param label   version label, or {@code null} for the tracked branch
     */
    public EnvironmentResponse lookup(String environmentName, String application, String profile, String label) {
        TenantEnvironment environment = registry.get(environmentName);
        GitEndpoint git = environment.getGit();
        List<String> profiles = parseProfiles(profile);

        AssembledProperties assembled = configAssembler.assemble(
            git, application, profiles, label, environment.getVariables());

        String version = repositoryReader.resolveVersion(git, label)
            .map(ResolvedVersion::getCommitId)
            .orElse("");

        List<PropertySource> propertySources = new ArrayList<>();
        if (assembled.isFoundAny()) {
            propertySources.add(PropertySource.builder()
                .name(propertySourceName(git, profile))
                .source(assembled.getProperties())
                .build());
        }

        log.debug("Lookup env={}, application={}, profiles={}, label={} -> version={}, sources={}",
            environmentName, application, profiles, label, version, propertySources.size());

        return EnvironmentResponse.builder()
            .name(application)
            .profiles(profiles)
            .label(label)
            .version(version)
            .state("")
            .propertySources(propertySources)
            .build();
    }

    public static List<String> parseProfiles(String profile) {
        if (profile == null) {
            return new ArrayList<>();
        }
        return Arrays.stream(profile.split(","))
            .map(String::trim)
            .filter(p -> !p.isEmpty())
            .collect(Collectors.toList());
    }

    static String propertySourceName(GitEndpoint git, String rawProfile) {
        String subpath = git.hasSubpath() ? "/" + git.getSubpath() : "";
        return "git:" + git.getRepoUrl() + subpath + ":" + rawProfile;
    }
}
