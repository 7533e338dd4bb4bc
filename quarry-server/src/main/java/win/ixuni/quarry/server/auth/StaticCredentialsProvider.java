package win.ixuni.quarry.server.auth;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import win.ixuni.quarry.core.auth.CredentialsProvider;
import win.ixuni.quarry.core.auth.S3Credentials;

/**
 * Credentials from {@code quarry.auth.credentials}
 */
@Component
@RequiredArgsConstructor
@EnableConfigurationProperties(AuthProperties.class)
public class StaticCredentialsProvider implements CredentialsProvider {

    private final AuthProperties authProperties;

    @Override
    public Mono<S3Credentials> getCredentials(String accessKeyId) {
        return Mono.justOrEmpty(authProperties.getCredentials().stream()
                .filter(c -> accessKeyId.equals(c.getAccessKeyId()))
                .findFirst()
                .map(c -> S3Credentials.builder()
                        .accessKeyId(c.getAccessKeyId())
                        .secretAccessKey(c.getSecretAccessKey())
                        .description(c.getDescription())
                        .enabled(c.isEnabled())
                        .build()));
    }
}
