package dev.careeriq.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.util.context.Context;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Tags every exchange with a request ID and a correlation ID.
 * <p>
 * A well-formed {@code X-Request-ID} from an upstream proxy is reused, anything else is
 * replaced by a generated one. The correlation ID defaults to the request ID. Both are
 * echoed on the response, stored as exchange attributes and written to the Reactor context
 * so analysis log lines can be tied back to the request.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@Slf4j
public class RequestIdFilter implements WebFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";
    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String REQUEST_ID_CONTEXT_KEY = "requestId";
    public static final String CORRELATION_ID_CONTEXT_KEY = "correlationId";

    private static final int MAX_ID_LENGTH = 64;
    private static final Pattern VALID_ID = Pattern.compile("^[a-zA-Z0-9\\-_]+$");

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        ServerHttpRequest request = exchange.getRequest();
        String supplied = request.getHeaders().getFirst(REQUEST_ID_HEADER);
        String requestId = sanitizeId(supplied);
        if (requestId == null) {
            if (supplied != null && !supplied.isBlank()) {
                log.warn("Rejected malformed external request ID");
            }
            requestId = newId();
        }
        String suppliedCorrelation = sanitizeId(request.getHeaders().getFirst(CORRELATION_ID_HEADER));
        String correlationId = suppliedCorrelation != null ? suppliedCorrelation : requestId;

        ServerWebExchange tagged = exchange.mutate()
                .request(request.mutate()
                        .header(REQUEST_ID_HEADER, requestId)
                        .header(CORRELATION_ID_HEADER, correlationId)
                        .build())
                .build();
        tagged.getResponse().getHeaders().set(REQUEST_ID_HEADER, requestId);
        tagged.getResponse().getHeaders().set(CORRELATION_ID_HEADER, correlationId);
        tagged.getAttributes().put(REQUEST_ID_CONTEXT_KEY, requestId);
        tagged.getAttributes().put(CORRELATION_ID_CONTEXT_KEY, correlationId);

        return chain.filter(tagged)
                .contextWrite(Context.of(
                        REQUEST_ID_CONTEXT_KEY, requestId,
                        CORRELATION_ID_CONTEXT_KEY, correlationId));
    }

    static String newId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }

    /**
     * Null when the value is blank, longer than 64 characters or contains anything but
     * letters, digits, hyphens and underscores.
     */
    static String sanitizeId(String value) {
        if (value == null || value.isBlank() || value.length() > MAX_ID_LENGTH) {
            return null;
        }
        return VALID_ID.matcher(value).matches() ? value : null;
    }
}
