package com.example.honeypot.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.buffer.DataBuffer;
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
import java.util.Set;

/**
 * Requires the shared secret in {@code x-api-key} on everything except the
 * health and info endpoints and the MCP transport.
 */
@Component
public class ApiKeyWebFilter implements WebFilter {

    private static final Logger logger = LoggerFactory.getLogger(ApiKeyWebFilter.class);

    static final String HEADER = "x-api-key";
    private static final Set<String> OPEN_PATHS = Set.of("/", "/health");
    private static final byte[] UNAUTHORIZED_BODY =
            "{\"status\":\"error\",\"reply\":\"\",\"detail\":\"Invalid or missing API key\"}"
                    .getBytes(StandardCharsets.UTF_8);

    @Value("${honeypot.api-key:}")
    private String apiKey;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().pathWithinApplication().value();
        if (OPEN_PATHS.contains(path) || path.startsWith("/sse") || path.startsWith("/mcp")) {
            return chain.filter(exchange);
        }
        String presented = exchange.getRequest().getHeaders().getFirst(HEADER);
        if (matches(presented)) {
            return chain.filter(exchange);
        }
        logger.warn("Rejected {} {}: invalid or missing API key", exchange.getRequest().getMethod(), path);
        ServerHttpResponse response = exchange.getResponse();
        response.setStatusCode(HttpStatus.UNAUTHORIZED);
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
        DataBuffer buffer = response.bufferFactory().wrap(UNAUTHORIZED_BODY);
        return response.writeWith(Mono.just(buffer));
    }

    private boolean matches(String presented) {
        if (apiKey == null || apiKey.isEmpty() || presented == null) {
            return false;
        }
        return MessageDigest.isEqual(apiKey.getBytes(StandardCharsets.UTF_8),
                presented.getBytes(StandardCharsets.UTF_8));
    }
}
