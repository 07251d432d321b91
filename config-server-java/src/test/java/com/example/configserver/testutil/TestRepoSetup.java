package com.example.configserver.testutil;

import com.example.configserver.model.GitEndpoint;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.lib.PersonIdent;
import org.eclipse.jgit.lib.RefUpdate;
import org.eclipse.jgit.revwalk.RevCommit;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Builds throwaway "upstream" git repositories for tests.
 */
public class TestRepoSetup {
    public static final PersonIdent AUTHOR = new PersonIdent("Config Tests", "tests@example.com");

    public static Path setupTestRepo(Path baseDir) throws IOException, GitAPIException {
        Path repoDir = baseDir.resolve("test-config-repo");
        initRepo(repoDir);

        commitFiles(repoDir, "Initial configuration", Map.of(
            "application.yml", """
                shared:
                  timeout: 30
                  region: "{{ REGION }}"
                k: 1
                """,
            "orders.yml", """
                server:
                  port: 8080
                  hosts:
                    - a.example.com
                    - b.example.com
                feature:
                  enabled: true
                  ratio: 0.5
                  missing: null
                """,
            "orders-prod.yml", """
                k: 2
                server:
                  port: 9090
                db:
                  url: "jdbc:postgresql://{{DB_HOST}}:5432/orders"
                  password: "{{ UNSET_VAR }}"
                """,
            "application-dev.yaml", """
                k: dev
                logging:
                  level: debug
                """,
            "templates/nginx.conf", """
                server_name {{ HOSTNAME }};
                listen 80;
                """
        ));
        return repoDir;
    }

    public static String repoUrl(Path repoDir) {
        return "file://" + repoDir.toAbsolutePath();
    }

    public static GitEndpoint endpoint(Path repoDir, Path workdir, String subpath) {
        return GitEndpoint.builder()
            .repoUrl(repoUrl(repoDir))
            .branch("main")
            .workdir(workdir)
            .subpath(subpath)
            .refreshInterval(Duration.ofSeconds(30))
            .build();
    }

    public static void initRepo(Path repoDir) throws IOException, GitAPIException {
        Files.createDirectories(repoDir);
        Git.init().setInitialBranch("main").setDirectory(repoDir.toFile()).call().close();
    }

    public static RevCommit commitFiles(Path repoDir, String message, Map<String, String> files)
            throws IOException, GitAPIException {
        try (Git git = Git.open(repoDir.toFile())) {
            for (Map.Entry<String, String> entry : files.entrySet()) {
                writeFile(repoDir, entry.getKey(), entry.getValue().getBytes(StandardCharsets.UTF_8));
            }
            git.add().addFilepattern(".").call();
            return git.commit()
                .setMessage(message)
                .setAuthor(AUTHOR)
                .setCommitter(AUTHOR)
                .setSign(false)
                .call();
        }
    }

    public static RevCommit commitBytes(Path repoDir, String message, String path, byte[] content)
            throws IOException, GitAPIException {
        try (Git git = Git.open(repoDir.toFile())) {
            writeFile(repoDir, path, content);
            git.add().addFilepattern(path).call();
            return git.commit()
                .setMessage(message)
                .setAuthor(AUTHOR)
                .setCommitter(AUTHOR)
                .setSign(false)
                .call();
        }
    }

    public static void deleteFile(Path repoDir, String message, String path) throws IOException, GitAPIException {
        try (Git git = Git.open(repoDir.toFile())) {
            git.rm().addFilepattern(path).call();
            git.commit()
                .setMessage(message)
                .setAuthor(AUTHOR)
                .setCommitter(AUTHOR)
                .setSign(false)
                .call();
        }
    }

    public static void tag(Path repoDir, String name) throws IOException, GitAPIException {
        try (Git git = Git.open(repoDir.toFile())) {
            git.tag().setName(name).setAnnotated(false).call();
        }
    }

    /**
     * Points {@code refs/remotes/origin/<name>} at a commit, as if it had been fetched.
     */
    public static void createRemoteTrackingRef(Path mirrorDir, String name, RevCommit commit) throws IOException {
        try (Git git = Git.open(mirrorDir.toFile())) {
            RefUpdate update = git.getRepository().updateRef("refs/remotes/origin/" + name);
            update.setNewObjectId(commit);
            update.setForceUpdate(true);
            update.update();
        }
    }

    public static void cleanupTestRepo(Path repoDir) {
        if (repoDir != null) {
            deleteDirectory(repoDir.toFile());
        }
    }

    private static void writeFile(Path repoDir, String path, byte[] content) throws IOException {
        Path target = repoDir.resolve(path);
        if (target.getParent() != null) {
            Files.createDirectories(target.getParent());
        }
        Files.write(target, content);
    }

    private static void deleteDirectory(File directory) {
        if (directory.exists()) {
            File[] files = directory.listFiles();
            if (files != null) {
                for (File file : files) {
                    if (file.isDirectory()) {
                        deleteDirectory(file);
                    } else {
                        file.delete();
                    }
                }
            }
            directory.delete();
        }
    }
}
