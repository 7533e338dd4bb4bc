package win.ixuni.quarry.server.auth;

import org.springframework.http.server.reactive.ServerHttpRequest;
import reactor.core.publisher.Mono;

/**
 * Auth layer seam consulted before any request reaches the retrieval engine
 */
public interface AccessAuthorizer {

    /**
     * @return allow or deny; never an error signal
     */
    Mono<AuthDecision> authorize(ServerHttpRequest request);
}
