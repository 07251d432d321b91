package com.example.configserver.git;

import com.example.configserver.exception.GitOperationException;
import com.example.configserver.model.GitEndpoint;
import com.example.configserver.model.ResolvedVersion;

import java.util.List;
import java.util.Optional;

/**
 * Version-control capability used by the resolution policy. Implementations must never
 * modify the working tree except in {@link #sync}.
 */
public interface GitBackend {

    /**
     * Clones the tracked branch into the endpoint's workdir, or fetches and hard-resets an
     * existing mirror to {@code origin/<branch>}.
     *
     * @throws GitOperationException tagged with the failed stage
     */
    void sync(GitEndpoint endpoint);

    /**
     * Resolves a single ref to a commit.
     *
     * @return empty when the ref does not name a commit in the mirror
     * @throws GitOperationException when the mirror itself cannot be read
     */
    Optional<ResolvedVersion> resolveCommit(GitEndpoint endpoint, String ref);

    /**
     * Reads a blob at {@code ref:repositoryPath}.
     *
     * @return empty when the ref or the path does not exist, or the path is not a file
     * @throws GitOperationException when the mirror itself cannot be read
     */
    Optional<byte[]> readFile(GitEndpoint endpoint, String ref, String repositoryPath);

    /**
     * Lists every file path, relative to the repository root, in the tree of {@code ref}.
     *
     * @throws GitOperationException when the ref cannot be resolved or the tree cannot be read
     */
    List<String> listFiles(GitEndpoint endpoint, String ref);
}
