package com.example.configserver.service;

import com.example.configserver.model.GitEndpoint;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RefResolverTest {

    private final RefResolver refResolver = new RefResolver();
    private final GitEndpoint endpoint = GitEndpoint.builder()
        .repoUrl("file:///tmp/upstream")
        .branch("main")
        .workdir(Paths.get("/tmp/mirror"))
        .refreshInterval(Duration.ofSeconds(30))
        .build();

    @Test
    void testCandidateRefs_WithLabel() {
        assertEquals(List.of("v1", "origin/v1"), refResolver.candidateRefs(endpoint, "v1"));
    }

    @Test
    void testCandidateRefs_WithoutLabelUsesBranch() {
        assertEquals(List.of("main", "origin/main"), refResolver.candidateRefs(endpoint, null));
        assertEquals(List.of("main", "origin/main"), refResolver.candidateRefs(endpoint, ""));
    }

    @Test
    void testCandidateRefs_CommitId() {
        String sha = "0123456789abcdef0123456789abcdef01234567";

        assertEquals(sha, refResolver.candidateRefs(endpoint, sha).get(0));
    }
}
