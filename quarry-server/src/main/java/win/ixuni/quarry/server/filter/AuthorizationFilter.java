package win.ixuni.quarry.server.filter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import win.ixuni.quarry.server.auth.AccessAuthorizer;
import win.ixuni.quarry.server.auth.AuthDecision;
import win.ixuni.quarry.server.auth.AuthProperties;
import win.ixuni.quarry.server.config.WebFluxConfig;
import win.ixuni.quarry.server.controller.S3ErrorResponse;

/**
 * Authorization filter
 * <p>
 * Asks the {@link AccessAuthorizer} about every S3 request before routing; a denial is answered with its status and
 * an S3 error body. Actuator endpoints are never authenticated.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class AuthorizationFilter implements WebFilter {

    private final AuthProperties authProperties;
    private final AccessAuthorizer accessAuthorizer;
    private final XmlMapper xmlMapper = WebFluxConfig.createXmlMapper();

    public AuthorizationFilter(AuthProperties authProperties, AccessAuthorizer accessAuthorizer) {
        this.authProperties = authProperties;
        this.accessAuthorizer = accessAuthorizer;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        if (!authProperties.isEnabled() || exchange.getRequest().getPath().value().startsWith("/actuator")) {
            return chain.filter(exchange);
        }

        return accessAuthorizer.authorize(exchange.getRequest())
                .flatMap(decision -> decision.isAllowed()
                        ? chain.filter(exchange)
                        : deny(exchange, decision));
    }

    private Mono<Void> deny(ServerWebExchange exchange, AuthDecision decision) {
        log.info("Denied {} {}: {}", exchange.getRequest().getMethod(), exchange.getRequest().getPath(),
                decision.getErrorCode());

        ServerHttpResponse response = exchange.getResponse();
        response.setStatusCode(decision.getStatus());
        if (exchange.getRequest().getMethod() == HttpMethod.HEAD) {
            return response.setComplete();
        }

        S3ErrorResponse error = S3ErrorResponse.builder()
                .code(decision.getErrorCode())
                .message(decision.getMessage())
                .resource(exchange.getRequest().getPath().value())
                .requestId(RequestIdFilter.requestId(exchange))
                .build();
        byte[] body;
        try {
            body = xmlMapper.writeValueAsBytes(error);
        } catch (JsonProcessingException e) {
            return Mono.error(e);
        }
        response.getHeaders().setContentType(MediaType.APPLICATION_XML);
        response.getHeaders().setContentLength(body.length);
        return response.writeWith(Mono.just(response.bufferFactory().wrap(body)));
    }
}
