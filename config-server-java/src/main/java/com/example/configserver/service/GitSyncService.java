package com.example.configserver.service;

import com.example.configserver.git.GitBackend;
import com.example.configserver.model.GitEndpoint;
import com.example.configserver.model.MirrorStatus;
import com.example.configserver.model.TenantEnvironment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Keeps one mirror per environment current. Each environment gets its own single-thread
 * scheduler, so refreshes of one mirror never overlap and a hung refresh only stalls its
 * own environment.
 *
 * <p>Readers are not synchronized with refreshes: a request may observe the tree from
 * before or after a concurrent fetch and reset.
 */
@Service
@Slf4j
public class GitSyncService {
    private final GitBackend gitBackend;
    private final EnvironmentRegistry registry;
    private final Map<String, ScheduledExecutorService> schedulers = new ConcurrentHashMap<>();
    private final Map<String, MirrorStatus> statuses = new ConcurrentHashMap<>();
    private volatile boolean running = false;

    public GitSyncService(GitBackend gitBackend, EnvironmentRegistry registry) {
        this.gitBackend = gitBackend;
        this.registry = registry;
    }

    /**
     * Synchronously syncs every environment, then starts the background refresh loops.
     * A failure of the initial sync propagates and aborts startup.
     */
    public void start() {
        List<TenantEnvironment> environments = registry.all();
        for (TenantEnvironment environment : environments) {
            sync(environment);
        }

        running = true;
        for (TenantEnvironment environment : environments) {
            startRefreshLoop(environment);
        }
        log.info("Git sync service started for {} environment(s)", environments.size());
    }

    public void stop() {
        running = false;
        for (Map.Entry<String, ScheduledExecutorService> entry : schedulers.entrySet()) {
            ScheduledExecutorService scheduler = entry.getValue();
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        schedulers.clear();
        log.info("Git sync service stopped");
    }

    /**
     * Clones or refreshes one environment's mirror and records the outcome.
     */
    public void sync(TenantEnvironment environment) {
        GitEndpoint git = environment.getGit();
        log.debug("Syncing environment {}: repository={}, branch={}, workdir={}",
            environment.getName(), git.getRepoUrl(), git.getBranch(), git.getWorkdir());
        MirrorStatus status = statuses.computeIfAbsent(environment.getName(),
            name -> MirrorStatus.builder().name(name).build());
        try {
            gitBackend.sync(git);
            synchronized (status) {
                status.setLastSuccessfulSync(Instant.now());
                status.setLastError(null);
            }
        } catch (RuntimeException e) {
            synchronized (status) {
                status.setLastError(e.getMessage());
            }
            throw e;
        }
    }

    /**
     * Snapshot of every environment's mirror status, ordered by environment name.
     */
    public List<MirrorStatus> statuses() {
        List<MirrorStatus> snapshot = new ArrayList<>();
        for (TenantEnvironment environment : registry.all()) {
            MirrorStatus status = statuses.get(environment.getName());
            if (status == null) {
                snapshot.add(MirrorStatus.builder().name(environment.getName()).build());
            } else {
                synchronized (status) {
                    snapshot.add(MirrorStatus.builder()
                        .name(status.getName())
                        .lastSuccessfulSync(status.getLastSuccessfulSync())
                        .lastError(status.getLastError())
                        .build());
                }
            }
        }
        return snapshot;
    }

    private void startRefreshLoop(TenantEnvironment environment) {
        long intervalSeconds = environment.getGit().getRefreshInterval().toSeconds();
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "git-sync-" + environment.getName());
            t.setDaemon(true);
            return t;
        });
        ScheduledExecutorService previous = schedulers.put(environment.getName(), scheduler);
        if (previous != null) {
            previous.shutdownNow();
        }

        scheduler.scheduleWithFixedDelay(() -> {
            if (running) {
                try {
                    sync(environment);
                } catch (Exception e) {
                    log.warn("Periodic refresh failed for {} ({}): {}",
                        environment.getName(), environment.getGit().getWorkdir(), e.getMessage());
                }
            }
        }, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
        log.info("Refreshing environment {} every {}s", environment.getName(), intervalSeconds);
    }
}
