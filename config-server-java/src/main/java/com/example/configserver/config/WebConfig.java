package com.example.configserver.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.method.HandlerTypePredicate;
import org.springframework.web.reactive.config.PathMatchConfigurer;
import org.springframework.web.reactive.config.WebFluxConfigurer;

/**
 * Mounts every controller under the configured base path.
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class WebConfig implements WebFluxConfigurer {
    private final AppConfig config;

    @Override
    public void configurePathMatching(PathMatchConfigurer configurer) {
        String basePath = config.getHttp().normalizedBasePath();
        if (!"/".equals(basePath)) {
            log.info("Serving all routes under base path {}", basePath);
            configurer.addPathPrefix(basePath, HandlerTypePredicate.forAnnotation(RestController.class));
        }
    }
}
