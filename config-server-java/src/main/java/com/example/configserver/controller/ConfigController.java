package com.example.configserver.controller;

import com.example.configserver.model.EnvironmentResponse;
import com.example.configserver.service.EnvironmentLookupService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Spring Cloud Config compatible lookups, scoped by tenant environment.
 */
@RestController
@RequiredArgsConstructor
public class ConfigController {
    private final EnvironmentLookupService lookupService;

    @GetMapping("/{env}/{application}/{profile}")
    public Mono<ResponseEntity<EnvironmentResponse>> getConfig(
            @PathVariable String env,
            @PathVariable String application,
            @PathVariable String profile
    ) {
        return lookup(env, application, profile, null);
    }

    @GetMapping("/{env}/{application}/{profile}/{label}")
    public Mono<ResponseEntity<EnvironmentResponse>> getConfigAtLabel(
            @PathVariable String env,
            @PathVariable String application,
            @PathVariable String profile,
            @PathVariable String label
    ) {
        return lookup(env, application, profile, label);
    }

    private Mono<ResponseEntity<EnvironmentResponse>> lookup(String env, String application, String profile, String label) {
        return Mono.fromCallable(() -> ResponseEntity.ok(lookupService.lookup(env, application, profile, label)))
            .subscribeOn(Schedulers.boundedElastic());
    }
}
