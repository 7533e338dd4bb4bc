package win.ixuni.quarry.server.auth;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import org.springframework.http.HttpStatus;

/**
 * Outcome of {@link AccessAuthorizer#authorize}: allow, or deny with the status and S3 error code to answer with
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AuthDecision {

    private static final AuthDecision ALLOW = new AuthDecision(true, null, null, null);

    boolean allowed;

    HttpStatus status;

    String errorCode;

    String message;

    public static AuthDecision allow() {
        return ALLOW;
    }

    public static AuthDecision deny(String errorCode, String message) {
        return new AuthDecision(false, HttpStatus.FORBIDDEN, errorCode, message);
    }

    public static AuthDecision accessDenied(String message) {
        return deny("AccessDenied", message);
    }

    /**
     * The Authorization header parsed but names a scope this server does not serve
     */
    public static AuthDecision malformed(String message) {
        return new AuthDecision(false, HttpStatus.BAD_REQUEST, "AuthorizationHeaderMalformed", message);
    }
}
