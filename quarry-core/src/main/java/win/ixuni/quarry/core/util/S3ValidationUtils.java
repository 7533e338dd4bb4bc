package win.ixuni.quarry.core.util;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Name and metadata rules shared by every driver. 返回错误信息，合法时返回 null
 */
public final class S3ValidationUtils {

    private static final Pattern BUCKET_NAME = Pattern.compile("^[a-z0-9][a-z0-9.-]{1,61}[a-z0-9]$");
    private static final Pattern IP_ADDRESS = Pattern.compile("^\\d+\\.\\d+\\.\\d+\\.\\d+$");

    public static final int MAX_KEY_BYTES = 1024;
    public static final int MAX_METADATA_BYTES = 2048;

    private S3ValidationUtils() {
    }

    /**
     * 3-63 chars of lowercase letters, digits, '.' and '-', starting and ending with a letter or digit,
     * no ".." and not formatted like an IP address.
     */
    public static String validateBucketName(String bucketName) {
        if (bucketName == null || bucketName.isEmpty()) {
            return "Bucket name must not be empty";
        }
        if (!BUCKET_NAME.matcher(bucketName).matches()) {
            return "Bucket name must be 3-63 lowercase letters, digits, '.' or '-', "
                    + "starting and ending with a letter or digit";
        }
        if (bucketName.contains("..")) {
            return "Bucket name must not contain adjacent periods";
        }
        if (IP_ADDRESS.matcher(bucketName).matches()) {
            return "Bucket name must not be formatted as an IP address";
        }
        return null;
    }

    /**
     * 1-1024 bytes of UTF-8; ".." and "." path segments are rejected because filesystem drivers map keys
     * onto paths.
     */
    public static String validateKey(String key) {
        if (key == null || key.isEmpty()) {
            return "Object key must not be empty";
        }
        int length = utf8Length(key);
        if (length > MAX_KEY_BYTES) {
            return "Object key exceeds " + MAX_KEY_BYTES + " bytes (actual: " + length + " bytes)";
        }
        for (String segment : key.split("/", -1)) {
            if (segment.equals("..") || segment.equals(".")) {
                return "Object key must not contain '.' or '..' path segments: " + key;
            }
        }
        if (key.indexOf('\0') >= 0) {
            return "Object key must not contain NUL characters";
        }
        return null;
    }

    /**
     * User metadata: ASCII names, and names plus values at most 2 KB of UTF-8 in total
     */
    public static String validateMetadata(Map<String, String> metadata) {
        if (metadata == null) {
            return null;
        }
        int totalBytes = 0;
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!StandardCharsets.US_ASCII.newEncoder().canEncode(entry.getKey())) {
                return "Metadata key contains non-ASCII characters: " + entry.getKey();
            }
            totalBytes += utf8Length(entry.getKey()) + utf8Length(entry.getValue());
        }
        return totalBytes > MAX_METADATA_BYTES
                ? "User metadata exceeds " + MAX_METADATA_BYTES + " bytes (actual: " + totalBytes + " bytes)"
                : null;
    }

    private static int utf8Length(String value) {
        return value == null ? 0 : value.getBytes(StandardCharsets.UTF_8).length;
    }
}
