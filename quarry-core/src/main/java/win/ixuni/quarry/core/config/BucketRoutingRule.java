package win.ixuni.quarry.core.config;

import lombok.Data;

import java.util.regex.Pattern;

/**
 * Sends buckets whose name matches {@link #pattern} to the driver instance named {@link #driver}.
 * <p>
 * The pattern is a glob: {@code *} spans any run of characters, {@code ?} exactly one, everything else is
 * literal. {@code logs-*}, {@code backup-202?} and {@code photos} are all valid.
 */
@Data
public class BucketRoutingRule {

    private String pattern;

    private String driver;

    /**
     * 数值越小越先匹配
     */
    private int priority = 100;

    public boolean matches(String bucketName) {
        if (pattern == null || bucketName == null) {
            return false;
        }
        StringBuilder regex = new StringBuilder();
        for (String literal : pattern.split("((?<=[*?])|(?=[*?]))")) {
            switch (literal) {
                case "*" -> regex.append(".*");
                case "?" -> regex.append('.');
                default -> regex.append(Pattern.quote(literal));
            }
        }
        return bucketName.matches(regex.toString());
    }
}
