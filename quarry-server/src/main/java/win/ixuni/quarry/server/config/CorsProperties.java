package win.ixuni.quarry.server.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * CORS 配置
 */
@Data
@ConfigurationProperties(prefix = "quarry.cors")
public class CorsProperties {

    private boolean enabled = false;

    /**
     * 允许的源（支持 * 和 *.example.com）
     */
    private List<String> allowedOrigins = new ArrayList<>(List.of("*"));

    private List<String> allowedMethods = new ArrayList<>(List.of("GET", "PUT", "DELETE", "HEAD", "OPTIONS"));

    private List<String> allowedHeaders = new ArrayList<>(List.of(
            "Authorization",
            "Content-Type",
            "Content-Length",
            "X-Amz-*",
            "Range",
            "If-Match",
            "If-None-Match",
            "If-Modified-Since",
            "If-Unmodified-Since",
            "If-Range"
    ));

    /**
     * Response headers a browser client may read
     */
    private List<String> exposedHeaders = new ArrayList<>(List.of(
            "ETag",
            "Content-Length",
            "Content-Type",
            "Content-Range",
            "Last-Modified",
            "Accept-Ranges",
            "x-amz-request-id",
            "x-amz-version-id"
    ));

    private boolean allowCredentials = false;

    /**
     * Preflight cache duration in seconds
     */
    private long maxAge = 3600;
}
