package com.example.configserver.service;

import com.example.configserver.config.AppConfig;
import com.example.configserver.model.GitEndpoint;
import com.example.configserver.model.ResolvedVersion;
import com.example.configserver.model.TenantEnvironment;
import com.example.configserver.model.UiMetadata;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class UiMetadataServiceTest {

    private static TenantEnvironment environment(String name, String subpath) {
        return TenantEnvironment.builder()
            .name(name)
            .git(GitEndpoint.builder()
                .repoUrl("https://git.example.com/" + name + ".git")
                .branch("main")
                .workdir(Paths.get("/data/" + name))
                .subpath(subpath)
                .refreshInterval(Duration.ofSeconds(30))
                .build())
            .variables(Map.of())
            .build();
    }

    @Test
    void testSnapshot() {
        AppConfig config = new AppConfig();
        config.getHttp().setBasePath("/config/");
        config.getAuth().setUsername("admin");
        config.getAuth().setPassword("secret");

        TenantEnvironment prod = environment("prod", "configs/prod");
        TenantEnvironment staging = environment("staging", null);
        EnvironmentRegistry registry = mock(EnvironmentRegistry.class);
        when(registry.all()).thenReturn(List.of(prod, staging));

        RepositoryReader reader = mock(RepositoryReader.class);
        OffsetDateTime commitTime = OffsetDateTime.of(2024, 3, 1, 12, 30, 0, 0, ZoneOffset.ofHours(2));
        when(reader.resolveVersion(prod.getGit(), null)).thenReturn(Optional.of(new ResolvedVersion("abc123", commitTime)));
        when(reader.resolveVersion(staging.getGit(), null)).thenReturn(Optional.empty());

        UiMetadata meta = new UiMetadataService(config, registry, reader).snapshot();

        assertEquals("/config", meta.getBasePath());
        assertTrue(meta.isAuthEnabled());
        assertEquals(2, meta.getEnvironments().size());

        UiMetadata.EnvironmentMetadata prodMeta = meta.getEnvironments().get(0);
        assertEquals("prod", prodMeta.getName());
        assertEquals("https://git.example.com/prod.git", prodMeta.getRepoUrl());
        assertEquals("configs/prod", prodMeta.getSubpath());
        assertEquals("abc123", prodMeta.getLastCommit());
        assertEquals("2024-03-01T12:30:00+02:00", prodMeta.getLastCommitDate());

        UiMetadata.EnvironmentMetadata stagingMeta = meta.getEnvironments().get(1);
        assertEquals("", stagingMeta.getSubpath());
        assertEquals("", stagingMeta.getLastCommit());
        assertEquals("", stagingMeta.getLastCommitDate());
    }
}
