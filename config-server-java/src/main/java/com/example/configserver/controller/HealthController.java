package com.example.configserver.controller;

import com.example.configserver.model.HealthResponse;
import com.example.configserver.model.MirrorStatus;
import com.example.configserver.service.GitSyncService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequiredArgsConstructor
public class HealthController {
    private final GitSyncService gitSyncService;

    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        List<MirrorStatus> statuses = gitSyncService.statuses();
        boolean healthy = statuses.stream().allMatch(MirrorStatus::isHealthy);
        return ResponseEntity.ok(HealthResponse.builder()
            .status(healthy ? "healthy" : "degraded")
            .environments(statuses)
            .build());
    }
}
