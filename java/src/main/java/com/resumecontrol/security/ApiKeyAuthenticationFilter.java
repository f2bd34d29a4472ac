package com.resumecontrol.security;

import com.resumecontrol.exception.UnauthenticatedException;
import com.resumecontrol.service.UserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.Collections;

/**
 * Filter for API Key authentication.
 * Validates Bearer tokens and sets the owner id in the security context.
 *
 * Registered inside the security filter chain by {@code SecurityConfig}, not as a bean.
 */
@Slf4j
@RequiredArgsConstructor
public class ApiKeyAuthenticationFilter implements WebFilter {

    private static final String AUTHORIZATION_HEADER = "Authorization";
    private static final String BEARER_PREFIX = "Bearer ";

    private final UserService userService;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().value();

        if (isPublicEndpoint(path)) {
            return chain.filter(exchange);
        }

        String authHeader = exchange.getRequest().getHeaders().getFirst(AUTHORIZATION_HEADER);

        if (authHeader == null || !authHeader.startsWith(BEARER_PREFIX)) {
            log.warn("Missing or invalid Authorization header on {}", path);
            return unauthorized(exchange);
        }

        String apiKey = authHeader.substring(BEARER_PREFIX.length()).trim();
        if (apiKey.isEmpty()) {
            log.warn("Empty bearer token on {}", path);
            return unauthorized(exchange);
        }

        return userService.verifyApiKey(apiKey)
                .map(ownerId -> new UsernamePasswordAuthenticationToken(ownerId, null, Collections.emptyList()))
                .onErrorResume(UnauthenticatedException.class, error -> {
                    log.warn("API key verification failed: {}", error.getMessage());
                    return Mono.empty();
                })
                .flatMap(authentication -> chain.filter(exchange)
                        .contextWrite(ReactiveSecurityContextHolder.withAuthentication(authentication))
                        .thenReturn(true))
                .switchIfEmpty(Mono.defer(() -> unauthorized(exchange).thenReturn(false)))
                .then();
    }

    private Mono<Void> unauthorized(ServerWebExchange exchange) {
        exchange.getResponse().setStatusCode(HttpStatus.UNAUTHORIZED);
        return exchange.getResponse().setComplete();
    }

    static boolean isPublicEndpoint(String path) {
        return path.equals("/") ||
               path.equals("/v1/health") ||
               path.startsWith("/v1/users/register") ||
               path.startsWith("/actuator");
    }
}
