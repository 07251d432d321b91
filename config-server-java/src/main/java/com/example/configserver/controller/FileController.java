package com.example.configserver.controller;

import com.example.configserver.model.FilesResponse;
import com.example.configserver.model.RawFile;
import com.example.configserver.service.EnvironmentRegistry;
import com.example.configserver.service.RawFileService;
import com.example.configserver.service.RepositoryReader;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
@RequiredArgsConstructor
public class FileController {
    private final RawFileService rawFileService;
    private final RepositoryReader repositoryReader;
    private final EnvironmentRegistry registry;

    /**
     * The single-segment pattern keeps {@code /{env}/file/{label}/x.yml} ahead of the
     * four-variable config lookup; the capture-the-rest pattern covers nested paths.
     */
    @GetMapping({"/{env}/file/{label}/{path}", "/{env}/file/{label}/{*path}"})
    public Mono<ResponseEntity<byte[]>> getFile(
            @PathVariable String env,
            @PathVariable String label,
            @PathVariable String path
    ) {
        String relative = path.startsWith("/") ? path.substring(1) : path;
        return Mono.fromCallable(() -> {
                RawFile file = rawFileService.read(env, label, relative);
                return ResponseEntity.ok()
                    .contentType(file.getContentType())
                    .body(file.getContent());
            })
            .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/{env}/files")
    public Mono<ResponseEntity<FilesResponse>> listFiles(@PathVariable String env) {
        return Mono.fromCallable(() -> ResponseEntity.ok(FilesResponse.builder()
                .files(repositoryReader.listFiles(registry.get(env).getGit()))
                .build()))
            .subscribeOn(Schedulers.boundedElastic());
    }
}
