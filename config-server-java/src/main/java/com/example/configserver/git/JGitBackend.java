package com.example.configserver.git;

import com.example.configserver.exception.GitOperationException;
import com.example.configserver.exception.GitOperationException.Stage;
import com.example.configserver.model.GitEndpoint;
import com.example.configserver.model.ResolvedVersion;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.ResetCommand.ResetType;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.api.errors.JGitInternalException;
import org.eclipse.jgit.errors.AmbiguousObjectException;
import org.eclipse.jgit.errors.IncorrectObjectTypeException;
import org.eclipse.jgit.errors.MissingObjectException;
import org.eclipse.jgit.errors.RevisionSyntaxException;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.FileMode;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.PersonIdent;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.storage.file.FileRepositoryBuilder;
import org.eclipse.jgit.transport.RemoteConfig;
import org.eclipse.jgit.treewalk.TreeWalk;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link GitBackend} on top of Eclipse JGit. Every call opens the mirror afresh so a
 * concurrent refresh is observed on the next read.
 */
@Component
@Slf4j
public class JGitBackend implements GitBackend {

    @Override
    public void sync(GitEndpoint endpoint) {
        Path workdir = endpoint.getWorkdir();
        try {
            Files.createDirectories(workdir);
        } catch (IOException e) {
            throw new GitOperationException(Stage.CLONE, "cannot create workdir " + workdir + ": " + e.getMessage(), e);
        }

        if (!Files.exists(workdir.resolve(Constants.DOT_GIT))) {
            log.info("Cloning {} into {} (branch {})", endpoint.getRepoUrl(), workdir, endpoint.getBranch());
            cloneRepository(endpoint);
        } else {
            log.info("Fetching & resetting repo in {} (branch {})", workdir, endpoint.getBranch());
            fetchAndReset(endpoint);
        }
    }

    private void cloneRepository(GitEndpoint endpoint) {
        String tracking = Constants.DEFAULT_REMOTE_NAME + "/" + endpoint.getBranch();
        try (Git git = Git.cloneRepository()
                .setURI(endpoint.getRepoUrl())
                .setBranch(endpoint.getBranch())
                .setCloneAllBranches(false)
                .setBranchesToClone(List.of(Constants.R_HEADS + endpoint.getBranch()))
                .setDirectory(endpoint.getWorkdir().toFile())
                .call()) {
            // JGit clones an unknown branch without complaint, leaving nothing checked out
            if (git.getRepository().resolve(tracking) == null) {
                throw new GitOperationException(Stage.CLONE,
                    "Remote branch " + endpoint.getBranch() + " not found in upstream origin");
            }
            log.debug("Clone of {} complete", endpoint.getRepoUrl());
        } catch (GitAPIException | JGitInternalException | IOException e) {
            throw new GitOperationException(Stage.CLONE, e.getMessage(), e);
        }
    }

    private void fetchAndReset(GitEndpoint endpoint) {
        try (Repository repository = openRepository(endpoint, Stage.FETCH); Git git = new Git(repository)) {
            try {
                for (RemoteConfig remote : git.remoteList().call()) {
                    git.fetch()
                        .setRemote(remote.getName())
                        .setRemoveDeletedRefs(true)
                        .call();
                }
            } catch (GitAPIException | JGitInternalException e) {
                throw new GitOperationException(Stage.FETCH, e.getMessage(), e);
            }

            String resetTarget = Constants.DEFAULT_REMOTE_NAME + "/" + endpoint.getBranch();
            try {
                git.reset()
                    .setMode(ResetType.HARD)
                    .setRef(resetTarget)
                    .call();
            } catch (GitAPIException | JGitInternalException e) {
                throw new GitOperationException(Stage.RESET, "reset --hard " + resetTarget + ": " + e.getMessage(), e);
            }
        }
    }

    @Override
    public Optional<ResolvedVersion> resolveCommit(GitEndpoint endpoint, String ref) {
        try (Repository repository = openRepository(endpoint, Stage.RESOLVE);
             RevWalk walk = new RevWalk(repository)) {
            Optional<RevCommit> commit = findCommit(repository, walk, ref);
            return commit.map(c -> {
                PersonIdent committer = c.getCommitterIdent();
                return new ResolvedVersion(c.getId().name(),
                    committer.getWhenAsInstant().atZone(committer.getZoneId()).toOffsetDateTime());
            });
        } catch (IOException e) {
            throw new GitOperationException(Stage.RESOLVE, e.getMessage(), e);
        }
    }

    @Override
    public Optional<byte[]> readFile(GitEndpoint endpoint, String ref, String repositoryPath) {
        if (repositoryPath == null || repositoryPath.isEmpty()) {
            return Optional.empty();
        }
        try (Repository repository = openRepository(endpoint, Stage.SHOW);
             RevWalk walk = new RevWalk(repository)) {
            Optional<RevCommit> commit = findCommit(repository, walk, ref);
            if (commit.isEmpty()) {
                return Optional.empty();
            }
            try (TreeWalk treeWalk = TreeWalk.forPath(repository, repositoryPath, commit.get().getTree())) {
                if (treeWalk == null) {
                    return Optional.empty();
                }
                int mode = treeWalk.getRawMode(0);
                if (!FileMode.REGULAR_FILE.equals(mode)
                        && !FileMode.EXECUTABLE_FILE.equals(mode)
                        && !FileMode.SYMLINK.equals(mode)) {
                    return Optional.empty();
                }
                return Optional.of(repository.open(treeWalk.getObjectId(0), Constants.OBJ_BLOB)
                    .getBytes(Integer.MAX_VALUE));
            }
        } catch (IOException e) {
            throw new GitOperationException(Stage.SHOW, e.getMessage(), e);
        }
    }

    @Override
    public List<String> listFiles(GitEndpoint endpoint, String ref) {
        try (Repository repository = openRepository(endpoint, Stage.LIST);
             RevWalk walk = new RevWalk(repository)) {
            RevCommit commit = findCommit(repository, walk, ref)
                .orElseThrow(() -> new GitOperationException(Stage.LIST, "unknown revision '" + ref + "'"));

            List<String> files = new ArrayList<>();
            try (TreeWalk treeWalk = new TreeWalk(repository)) {
                treeWalk.addTree(commit.getTree());
                treeWalk.setRecursive(true);
                while (treeWalk.next()) {
                    files.add(treeWalk.getPathString());
                }
            }
            return files;
        } catch (IOException e) {
            throw new GitOperationException(Stage.LIST, e.getMessage(), e);
        }
    }

    private Repository openRepository(GitEndpoint endpoint, Stage stage) {
        File gitDir = endpoint.getWorkdir().resolve(Constants.DOT_GIT).toFile();
        try {
            return new FileRepositoryBuilder()
                .setGitDir(gitDir)
                .setMustExist(true)
                .build();
        } catch (IOException e) {
            throw new GitOperationException(stage, "cannot open repository " + gitDir + ": " + e.getMessage(), e);
        }
    }

    private Optional<RevCommit> findCommit(Repository repository, RevWalk walk, String ref) throws IOException {
        try {
            ObjectId id = repository.resolve(ref + "^{commit}");
            if (id == null) {
                return Optional.empty();
            }
            return Optional.of(walk.parseCommit(id));
        } catch (RevisionSyntaxException | AmbiguousObjectException | IncorrectObjectTypeException
                 | MissingObjectException e) {
            log.debug("Ref '{}' does not resolve to a commit: {}", ref, e.getMessage());
            return Optional.empty();
        }
    }
}
