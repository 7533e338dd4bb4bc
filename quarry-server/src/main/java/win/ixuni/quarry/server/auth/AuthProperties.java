package win.ixuni.quarry.server.auth;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 认证配置
 */
@Data
@ConfigurationProperties(prefix = "quarry.auth")
public class AuthProperties {

    /**
     * Whether requests must carry a valid AWS Signature V4
     */
    private boolean enabled = false;

    /**
     * 是否允许匿名读取（未签名的 GET / HEAD）
     */
    private boolean allowAnonymousRead = false;

    /**
     * Maximum distance between x-amz-date and the server clock
     */
    private Duration maxClockSkew = Duration.ofMinutes(15);

    private List<StaticCredential> credentials = new ArrayList<>();

    @Data
    public static class StaticCredential {
        private String accessKeyId;
        private String secretAccessKey;
        private String description;
        private boolean enabled = true;
    }
}
