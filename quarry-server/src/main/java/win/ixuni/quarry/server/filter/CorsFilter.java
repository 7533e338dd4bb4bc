package win.ixuni.quarry.server.filter;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import win.ixuni.quarry.server.config.CorsProperties;

import java.net.URI;
import java.util.List;

/**
 * CORS 过滤器
 * <p>
 * Sits in front of {@link AuthorizationFilter}: browsers never sign preflight requests, so those are answered
 * here and never reach the chain.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 2)
@RequiredArgsConstructor
@EnableConfigurationProperties(CorsProperties.class)
public class CorsFilter implements WebFilter {

    private final CorsProperties cors;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String origin = exchange.getRequest().getHeaders().getOrigin();
        if (!cors.isEnabled() || origin == null || !isOriginAllowed(origin)) {
            return chain.filter(exchange);
        }

        ServerHttpResponse response = exchange.getResponse();
        HttpHeaders headers = response.getHeaders();
        headers.setAccessControlAllowOrigin(origin);
        headers.add(HttpHeaders.VARY, HttpHeaders.ORIGIN);
        headers.setAccessControlAllowCredentials(cors.isAllowCredentials());
        if (!cors.getExposedHeaders().isEmpty()) {
            headers.setAccessControlExposeHeaders(cors.getExposedHeaders());
        }

        if (exchange.getRequest().getMethod() != HttpMethod.OPTIONS) {
            return chain.filter(exchange);
        }
        headers.setAccessControlAllowMethods(cors.getAllowedMethods().stream().map(HttpMethod::valueOf).toList());
        headers.setAccessControlAllowHeaders(cors.getAllowedHeaders());
        headers.setAccessControlMaxAge(cors.getMaxAge());
        response.setStatusCode(HttpStatus.NO_CONTENT);
        return response.setComplete();
    }

    /**
     * Exact origins, {@code *}, or {@code *.example.com} matching any subdomain host of example.com
     */
    boolean isOriginAllowed(String origin) {
        List<String> allowed = cors.getAllowedOrigins();
        if (allowed.contains("*") || allowed.contains(origin)) {
            return true;
        }
        String host = hostOf(origin);
        return host != null && allowed.stream()
                .filter(pattern -> pattern.startsWith("*."))
                .anyMatch(pattern -> host.endsWith(pattern.substring(1)));
    }

    private static String hostOf(String origin) {
        try {
            return URI.create(origin).getHost();
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
