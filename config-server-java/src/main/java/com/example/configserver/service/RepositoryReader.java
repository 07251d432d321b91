package com.example.configserver.service;

import com.example.configserver.exception.GitOperationException;
import com.example.configserver.git.GitBackend;
import com.example.configserver.model.GitEndpoint;
import com.example.configserver.model.ResolvedVersion;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Read-only access to a mirror, scoped to the endpoint's subpath. Reads walk the candidate
 * refs in order and the first one that yields a result wins.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RepositoryReader {
    private final GitBackend gitBackend;
    private final RefResolver refResolver;

    /**
     * @param relativePath path below the endpoint's subpath, already validated
     */
    public Optional<byte[]> readFile(GitEndpoint endpoint, List<String> candidateRefs, String relativePath) {
        String repositoryPath = endpoint.repositoryPath(relativePath);
        for (String ref : candidateRefs) {
            Optional<byte[]> content = gitBackend.readFile(endpoint, ref, repositoryPath);
            if (content.isPresent()) {
                log.debug("Read {} at {}", repositoryPath, ref);
                return content;
            }
        }
        return Optional.empty();
    }

    /**
     * Files at the tip of the tracked branch, relative to the subpath. Entries outside the
     * subpath are dropped.
     */
    public List<String> listFiles(GitEndpoint endpoint) {
        List<String> all = null;
        GitOperationException lastFailure = null;
        for (String ref : refResolver.candidateRefs(endpoint, null)) {
            try {
                all = gitBackend.listFiles(endpoint, ref);
                break;
            } catch (GitOperationException e) {
                lastFailure = e;
            }
        }
        if (all == null) {
            throw lastFailure;
        }

        if (!endpoint.hasSubpath()) {
            return all;
        }
        String prefix = endpoint.getSubpath() + "/";
        List<String> scoped = new ArrayList<>();
        for (String path : all) {
            if (path.startsWith(prefix)) {
                scoped.add(path.substring(prefix.length()));
            }
        }
        return scoped;
    }

    /**
     * Commit for the label (or tracked branch). Failures are logged and reported as empty so
     * a broken ref never blocks configuration delivery.
     */
    public Optional<ResolvedVersion> resolveVersion(GitEndpoint endpoint, String label) {
        List<String> candidates = refResolver.candidateRefs(endpoint, label);
        try {
            for (String ref : candidates) {
                Optional<ResolvedVersion> version = gitBackend.resolveCommit(endpoint, ref);
                if (version.isPresent()) {
                    return version;
                }
            }
            log.warn("Git version lookup failed: none of {} resolves in {}", candidates, endpoint.getWorkdir());
        } catch (GitOperationException e) {
            log.warn("Git version lookup failed for {}: {}", candidates, e.getMessage());
        }
        return Optional.empty();
    }
}
