package win.ixuni.quarry.core.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class S3ValidationUtilsTest {

    @ParameterizedTest
    @ValueSource(strings = {"test-bucket", "abc", "my.bucket.01"})
    void acceptsValidBucketNames(String name) {
        assertNull(S3ValidationUtils.validateBucketName(name));
    }

    @ParameterizedTest
    @ValueSource(strings = {"ab", "Test-Bucket", "-bucket", "bucket-", "my..bucket", "192.168.1.1", "under_score"})
    void rejectsInvalidBucketNames(String name) {
        assertNotNull(S3ValidationUtils.validateBucketName(name));
    }

    @Test
    @DisplayName("Key 不允许 .. 路径段")
    void rejectsTraversalSegments() {
        assertNotNull(S3ValidationUtils.validateKey("../etc/passwd"));
        assertNotNull(S3ValidationUtils.validateKey("a/./b"));
        assertNull(S3ValidationUtils.validateKey("a..b/c"));
        assertNull(S3ValidationUtils.validateKey("dir/test-object.txt"));
    }

    @Test
    void rejectsOversizedKey() {
        assertNull(S3ValidationUtils.validateKey("k".repeat(1024)));
        assertNotNull(S3ValidationUtils.validateKey("k".repeat(1025)));
        assertNotNull(S3ValidationUtils.validateKey(""));
    }

    @Test
    void metadataLimits() {
        assertNull(S3ValidationUtils.validateMetadata(Map.of("owner", "alice")));
        assertNotNull(S3ValidationUtils.validateMetadata(Map.of("größe", "1")));
        assertNotNull(S3ValidationUtils.validateMetadata(Map.of("big", "x".repeat(2048))));
    }
}
