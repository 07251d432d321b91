package com.example.configserver.service;

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

/**
 * Performs the initial sync of every mirror once the context is up, then hands over to the
 * background refresh loops. A failed initial sync fails startup.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class GitSyncRunner implements CommandLineRunner {
    private final GitSyncService gitSyncService;
    private final EnvironmentRegistry registry;

    @Override
    public void run(String... args) {
        log.info("Starting config server for environments {}",
            registry.all().stream().map(e -> e.getName() + "=" + e.getGit().getRepoUrl()).collect(Collectors.toList()));
        try {
            gitSyncService.start();
        } catch (RuntimeException e) {
            log.error("Git sync startup failed", e);
            throw e;
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down config server...");
        gitSyncService.stop();
    }
}
