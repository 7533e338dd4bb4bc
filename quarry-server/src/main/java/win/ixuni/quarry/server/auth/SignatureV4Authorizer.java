package win.ixuni.quarry.server.auth;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;
import win.ixuni.quarry.core.auth.CredentialsProvider;
import win.ixuni.quarry.core.auth.S3Credentials;
import win.ixuni.quarry.core.config.QuarryProperties;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * AWS Signature V4 header authorization
 * <p>
 * The signature in the {@code Authorization} header is recomputed with the secret of the access key it names
 * and compared in constant time. Presigned (query-string) requests are not accepted.
 */
@Slf4j
@Component
public class SignatureV4Authorizer implements AccessAuthorizer {

    static final String ALGORITHM = "AWS4-HMAC-SHA256";
    private static final String SERVICE = "s3";
    private static final String TERMINATOR = "aws4_request";
    private static final String MISMATCH =
            "The request signature we calculated does not match the signature you provided.";

    // AWS4-HMAC-SHA256 Credential=<key>/<date>/<region>/<service>/aws4_request, SignedHeaders=<a;b>, Signature=<hex>
    private static final Pattern HEADER = Pattern.compile(
            ALGORITHM + "\\s+Credential=(?<key>[^/]+)/(?<date>\\d{8})/(?<region>[^/]+)/(?<service>[^/]+)/"
                    + TERMINATOR + ",\\s*SignedHeaders=(?<headers>[^,]+),\\s*Signature=(?<signature>[0-9a-f]{64})");

    private static final DateTimeFormatter AMZ_DATE = DateTimeFormatter
            .ofPattern("yyyyMMdd'T'HHmmss'Z'", Locale.US)
            .withZone(ZoneOffset.UTC);

    private final AuthProperties authProperties;
    private final CredentialsProvider credentialsProvider;
    private final String region;
    private final Clock clock = Clock.systemUTC();

    public SignatureV4Authorizer(AuthProperties authProperties, CredentialsProvider credentialsProvider,
                                 QuarryProperties quarryProperties) {
        this.authProperties = authProperties;
        this.credentialsProvider = credentialsProvider;
        this.region = quarryProperties.getServer().getRegion();
    }

    @Override
    public Mono<AuthDecision> authorize(ServerHttpRequest request) {
        String authorization = request.getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (!StringUtils.hasText(authorization)) {
            boolean read = request.getMethod() == HttpMethod.GET || request.getMethod() == HttpMethod.HEAD;
            return Mono.just(read && authProperties.isAllowAnonymousRead()
                    ? AuthDecision.allow()
                    : AuthDecision.accessDenied("Access Denied"));
        }

        Matcher header = HEADER.matcher(authorization.trim());
        if (!header.matches()) {
            return Mono.just(AuthDecision.accessDenied("Unsupported or malformed Authorization header"));
        }
        String scopeRegion = header.group("region");
        if (!SERVICE.equals(header.group("service"))) {
            return Mono.just(AuthDecision.malformed("Credential scope must name service s3"));
        }
        if (StringUtils.hasText(region) && !region.equals(scopeRegion)) {
            return Mono.just(AuthDecision.malformed(
                    "The authorization header is malformed; the region '" + scopeRegion
                            + "' is wrong; expecting '" + region + "'"));
        }

        String dateStamp = header.group("date");
        String amzDate = request.getHeaders().getFirst("x-amz-date");
        AuthDecision staleness = checkTimestamp(amzDate, dateStamp);
        if (staleness != null) {
            return Mono.just(staleness);
        }

        String accessKeyId = header.group("key");
        byte[] provided = header.group("signature").getBytes(StandardCharsets.US_ASCII);
        return credentialsProvider.getCredentials(accessKeyId)
                .map(credentials -> {
                    if (!credentials.isEnabled()) {
                        return AuthDecision.accessDenied("The access key is disabled");
                    }
                    String expected = calculateSignature(request, credentials, amzDate, dateStamp, scopeRegion,
                            header.group("headers"));
                    if (MessageDigest.isEqual(expected.getBytes(StandardCharsets.US_ASCII), provided)) {
                        return AuthDecision.allow();
                    }
                    log.debug("Signature mismatch for access key {}", accessKeyId);
                    return AuthDecision.deny("SignatureDoesNotMatch", MISMATCH);
                })
                .defaultIfEmpty(AuthDecision.deny("InvalidAccessKeyId",
                        "The AWS access key Id you provided does not exist in our records."));
    }

    /**
     * @return a denial, or null when x-amz-date is present, fresh and on the credential scope's day
     */
    private AuthDecision checkTimestamp(String amzDate, String dateStamp) {
        if (amzDate == null) {
            return AuthDecision.accessDenied("Missing x-amz-date header");
        }
        Instant signedAt;
        try {
            signedAt = AMZ_DATE.parse(amzDate, Instant::from);
        } catch (DateTimeParseException e) {
            return AuthDecision.accessDenied("Invalid x-amz-date header");
        }
        if (!amzDate.startsWith(dateStamp)) {
            return AuthDecision.deny("SignatureDoesNotMatch", MISMATCH);
        }
        if (Duration.between(signedAt, clock.instant()).abs().compareTo(authProperties.getMaxClockSkew()) > 0) {
            return AuthDecision.deny("RequestTimeTooSkewed",
                    "The difference between the request time and the current time is too large.");
        }
        return null;
    }

    String calculateSignature(ServerHttpRequest request, S3Credentials credentials, String amzDate,
                              String dateStamp, String scopeRegion, String signedHeaders) {
        String scope = String.join("/", dateStamp, scopeRegion, SERVICE, TERMINATOR);
        String stringToSign = String.join("\n",
                ALGORITHM, amzDate, scope, sha256Hex(CanonicalRequest.of(request, signedHeaders)));

        byte[] key = ("AWS4" + credentials.getSecretAccessKey()).getBytes(StandardCharsets.UTF_8);
        for (String part : new String[]{dateStamp, scopeRegion, SERVICE, TERMINATOR}) {
            key = hmac(key, part);
        }
        return HexFormat.of().formatHex(hmac(key, stringToSign));
    }

    private static byte[] hmac(byte[] key, String data) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(key, "HmacSHA256"));
            return mac.doFinal(data.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }

    private static String sha256Hex(String data) {
        try {
            return HexFormat.of().formatHex(
                    MessageDigest.getInstance("SHA-256").digest(data.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
