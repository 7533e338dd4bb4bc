package win.ixuni.quarry.server.filter;

import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Request id filter
 * <p>
 * Runs first so every response, including auth denials and error bodies, carries {@code x-amz-request-id}.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter implements WebFilter {

    public static final String HEADER = "x-amz-request-id";

    public static final String ATTRIBUTE = RequestIdFilter.class.getName() + ".requestId";

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String requestId = generateRequestId();
        exchange.getAttributes().put(ATTRIBUTE, requestId);
        exchange.getResponse().getHeaders().set(HEADER, requestId);
        return chain.filter(exchange);
    }

    /**
     * Request id of the current exchange, or a fresh one if the filter has not run
     */
    public static String requestId(ServerWebExchange exchange) {
        String requestId = exchange.getAttribute(ATTRIBUTE);
        return requestId != null ? requestId : generateRequestId();
    }

    static String generateRequestId() {
        return UUID.randomUUID().toString().replace("-", "").toUpperCase().substring(0, 16);
    }
}
