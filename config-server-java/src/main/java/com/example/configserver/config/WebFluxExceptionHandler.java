package com.example.configserver.config;

import com.example.configserver.model.NotFoundResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebExceptionHandler;
import reactor.core.publisher.Mono;

/**
 * Renders the Spring-style 404 body for requests that match no route. Ordered ahead of
 * Spring Boot's default error handler; everything else is passed on.
 */
@Component
@Order(-2)
@Slf4j
@RequiredArgsConstructor
public class WebFluxExceptionHandler implements WebExceptionHandler {
    private final ObjectMapper objectMapper;

    @Override
    public Mono<Void> handle(ServerWebExchange exchange, Throwable ex) {
        if (exchange.getResponse().isCommitted()) {
            return Mono.error(ex);
        }

        if (ex instanceof ResponseStatusException
                && ((ResponseStatusException) ex).getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
            String path = exchange.getRequest().getPath().value();
            log.debug("No route for {}", path);
            byte[] body;
            try {
                body = objectMapper.writeValueAsBytes(NotFoundResponse.forPath(path));
            } catch (JsonProcessingException e) {
                return Mono.error(e);
            }
            exchange.getResponse().setStatusCode(HttpStatus.NOT_FOUND);
            exchange.getResponse().getHeaders().setContentType(MediaType.APPLICATION_JSON);
            var buffer = exchange.getResponse().bufferFactory().wrap(body);
            return exchange.getResponse().writeWith(Mono.just(buffer));
        }

        return Mono.error(ex);
    }
}
