package dev.careeriq.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;

/**
 * One log line per request: method, path, client, status and time. Request and response
 * bodies carry resume text and are never logged.
 */
@Configuration(proxyBeanMethods = false)
@Slf4j
public class RequestLoggingConfig {

    @Bean
    public WebFilter requestLoggingFilter() {
        return (exchange, chain) -> {
            long startNanos = System.nanoTime();
            String method = exchange.getRequest().getMethod().name();
            String path = exchange.getRequest().getPath().value();
            String clientIp = clientIp(exchange.getRequest());

            return chain.filter(exchange)
                    .doOnSuccess(ignored -> logRequest(requestId(exchange), method, path, clientIp,
                            status(exchange), elapsedMillis(startNanos)))
                    .doOnError(error -> log.error("[{}] {} {} from {} - ERROR {} in {}ms",
                            requestId(exchange), method, path, clientIp, error.getMessage(), elapsedMillis(startNanos)));
        };
    }

    private void logRequest(String requestId, String method, String path, String clientIp, int status, long millis) {
        if (path.startsWith("/actuator") || path.startsWith("/swagger") || path.startsWith("/v3/api-docs")) {
            log.trace("[{}] {} {} from {} - {} in {}ms", requestId, method, path, clientIp, status, millis);
        } else if (status >= 400) {
            log.warn("[{}] {} {} from {} - {} in {}ms", requestId, method, path, clientIp, status, millis);
        } else {
            log.info("[{}] {} {} from {} - {} in {}ms", requestId, method, path, clientIp, status, millis);
        }
    }

    private static String requestId(ServerWebExchange exchange) {
        Object id = exchange.getAttribute(RequestIdFilter.REQUEST_ID_CONTEXT_KEY);
        return id != null ? id.toString() : "-";
    }

    private static int status(ServerWebExchange exchange) {
        return exchange.getResponse().getStatusCode() != null ? exchange.getResponse().getStatusCode().value() : 200;
    }

    private static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    private static String clientIp(ServerHttpRequest request) {
        String forwardedFor = request.getHeaders().getFirst("X-Forwarded-For");
        if (forwardedFor != null && !forwardedFor.isEmpty()) {
            return sanitizeHeaderValue(forwardedFor.split(",")[0].trim());
        }
        String realIp = request.getHeaders().getFirst("X-Real-IP");
        if (realIp != null && !realIp.isEmpty()) {
            return sanitizeHeaderValue(realIp);
        }
        if (request.getRemoteAddress() != null && request.getRemoteAddress().getAddress() != null) {
            return request.getRemoteAddress().getAddress().getHostAddress();
        }
        return "unknown";
    }

    /** Strips line breaks and non-printable characters so headers cannot forge log lines. */
    static String sanitizeHeaderValue(String value) {
        return value.replaceAll("[\\r\\n]", "").replaceAll("[^\\x20-\\x7E]", "");
    }
}
