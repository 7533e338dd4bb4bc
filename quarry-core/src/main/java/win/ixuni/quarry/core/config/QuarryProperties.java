package win.ixuni.quarry.core.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Root of the {@code quarry.*} configuration tree
 */
@Data
@ConfigurationProperties(prefix = "quarry")
public class QuarryProperties {

    private List<DriverConfig> drivers = new ArrayList<>();

    private RoutingConfig routing = new RoutingConfig();

    private ServerConfig server = new ServerConfig();

    private ReclaimConfig reclaim = new ReclaimConfig();

    @Data
    public static class RoutingConfig {

        /**
         * Instance name used for buckets no rule matches; unset means such buckets cannot be served
         */
        private String defaultDriver;

        private List<BucketRoutingRule> buckets = new ArrayList<>();
    }

    @Data
    public static class ServerConfig {

        /**
         * 挂载前缀，例如 /s3；为空时 API 直接挂在根路径
         */
        private String pathPrefix = "";

        /**
         * Region expected in SigV4 credential scopes
         */
        private String region = "us-east-1";
    }

    /**
     * 过期存储位置回收配置
     */
    @Data
    public static class ReclaimConfig {

        private boolean enabled = true;

        /**
         * How long a superseded storage location stays readable after the index stops pointing at it
         */
        private Duration gracePeriod = Duration.ofMinutes(10);

        private String cron = "0 */5 * * * *";
    }
}
