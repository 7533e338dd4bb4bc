package win.ixuni.quarry.server.filter;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import win.ixuni.quarry.core.config.QuarryProperties;

/**
 * Path Prefix 过滤器
 * <p>
 * Strips {@code quarry.server.path-prefix} so the controllers see {@code /{bucket}/{key}}.
 * With prefix {@code /s3}: {@code /s3/my-bucket/photo.jpg -> /my-bucket/photo.jpg}.
 * <p>
 * Runs after {@link AuthorizationFilter}: clients sign the path they sent, prefix included.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 20)
@RequiredArgsConstructor
public class PathPrefixFilter implements WebFilter {

    private final QuarryProperties quarryProperties;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String prefix = normalizePrefix(quarryProperties.getServer().getPathPrefix());
        String path = exchange.getRequest().getURI().getRawPath();
        if (prefix.isEmpty() || !(path.equals(prefix) || path.startsWith(prefix + "/"))) {
            return chain.filter(exchange);
        }

        String stripped = path.length() == prefix.length() ? "/" : path.substring(prefix.length());
        log.trace("{} -> {}", path, stripped);
        return chain.filter(exchange.mutate()
                .request(exchange.getRequest().mutate().path(stripped).build())
                .build());
    }

    /**
     * 以 / 开头、不以 / 结尾；"/" 或空视为未配置
     */
    static String normalizePrefix(String prefix) {
        String trimmed = prefix == null ? "" : prefix.strip();
        int end = trimmed.length();
        while (end > 0 && trimmed.charAt(end - 1) == '/') {
            end--;
        }
        trimmed = trimmed.substring(0, end);
        if (trimmed.isEmpty()) {
            return "";
        }
        return trimmed.startsWith("/") ? trimmed : "/" + trimmed;
    }
}
