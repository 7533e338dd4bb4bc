package win.ixuni.quarry.core.auth;

import reactor.core.publisher.Mono;

/**
 * Credentials provider interface
 * <p>
 * Resolves access keys for request authorization (static configuration today).
 */
public interface CredentialsProvider {

    /**
     * Retrieve credentials by Access Key ID
     *
     * @param accessKeyId Access Key ID
     * @return the credentials, or empty if not found
     */
    Mono<S3Credentials> getCredentials(String accessKeyId);
}
