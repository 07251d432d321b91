package com.example.configserver.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Base64;

/**
 * HTTP Basic authentication for every route. Disabled unless both credentials are set
 * (AUTH_USERNAME / AUTH_PASSWORD).
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@Slf4j
public class BasicAuthWebFilter implements WebFilter {
    static final String REALM_HEADER = "Basic realm=\"ConfigServer\"";
    private static final String BASIC_PREFIX = "Basic ";

    private final AppConfig.AuthConfig auth;

    public BasicAuthWebFilter(AppConfig config) {
        this.auth = config.getAuth();
        if (auth.isEnabled()) {
            log.info("Basic auth enabled");
        } else {
            log.warn("Basic auth disabled (env AUTH_USERNAME / AUTH_PASSWORD not set)");
        }
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        if (!auth.isEnabled() || isAuthorized(exchange.getRequest().getHeaders().getFirst(HttpHeaders.AUTHORIZATION))) {
            return chain.filter(exchange);
        }

        log.debug("Rejected unauthenticated request to {}", exchange.getRequest().getPath());
        ServerHttpResponse response = exchange.getResponse();
        response.setStatusCode(HttpStatus.UNAUTHORIZED);
        response.getHeaders().set(HttpHeaders.WWW_AUTHENTICATE, REALM_HEADER);
        response.getHeaders().setContentType(MediaType.TEXT_PLAIN);
        var buffer = response.bufferFactory().wrap("Unauthorized".getBytes(StandardCharsets.UTF_8));
        return response.writeWith(Mono.just(buffer));
    }

    boolean isAuthorized(String header) {
        if (header == null || !header.startsWith(BASIC_PREFIX)) {
            return false;
        }

        byte[] decoded;
        try {
            decoded = Base64.getDecoder().decode(header.substring(BASIC_PREFIX.length()).trim());
        } catch (IllegalArgumentException e) {
            return false;
        }

        String credentials = new String(decoded, StandardCharsets.UTF_8);
        int colon = credentials.indexOf(':');
        String user = colon >= 0 ? credentials.substring(0, colon) : credentials;
        String pass = colon >= 0 ? credentials.substring(colon + 1) : "";

        // evaluate both so timing does not reveal which part mismatched
        boolean userMatches = constantTimeEquals(user, auth.getUsername());
        boolean passMatches = constantTimeEquals(pass, auth.getPassword());
        return userMatches & passMatches;
    }

    private static boolean constantTimeEquals(String actual, String expected) {
        return MessageDigest.isEqual(actual.getBytes(StandardCharsets.UTF_8), expected.getBytes(StandardCharsets.UTF_8));
    }
}
