package win.ixuni.keel.core.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class S3ValidationUtilsTest {

    @Test
    @DisplayName("Bucket名称 - 合法名称")
    void testValidBucketNames() {
        assertNull(S3ValidationUtils.validateBucketName("mybucket"));
        assertNull(S3ValidationUtils.validateBucketName("my-bucket.v2"));
        assertNull(S3ValidationUtils.validateBucketName("abc"));
        assertNull(S3ValidationUtils.validateBucketName("a".repeat(63)));
    }

    @Test
    @DisplayName("Bucket名称 - 非法名称")
    void testInvalidBucketNames() {
        assertNotNull(S3ValidationUtils.validateBucketName(null));
        assertNotNull(S3ValidationUtils.validateBucketName(""));
        assertNotNull(S3ValidationUtils.validateBucketName("ab"));
        assertNotNull(S3ValidationUtils.validateBucketName("a".repeat(64)));
        assertNotNull(S3ValidationUtils.validateBucketName("MyBucket"));
        assertNotNull(S3ValidationUtils.validateBucketName("-bucket"));
        assertNotNull(S3ValidationUtils.validateBucketName("bucket-"));
        assertNotNull(S3ValidationUtils.validateBucketName("my_bucket"));
        assertNotNull(S3ValidationUtils.validateBucketName("my..bucket"));
        assertNotNull(S3ValidationUtils.validateBucketName("192.168.1.1"));
    }

    @Test
    @DisplayName("Object key length is counted in UTF-8 bytes")
    void testKeyLength() {
        assertNull(S3ValidationUtils.validateKey("hello.txt"));
        assertNull(S3ValidationUtils.validateKey("a".repeat(1024)));
        assertNotNull(S3ValidationUtils.validateKey("a".repeat(1025)));
        // 3 bytes per character
        assertNull(S3ValidationUtils.validateKey("中".repeat(341)));
        assertNotNull(S3ValidationUtils.validateKey("中".repeat(342)));
        assertNotNull(S3ValidationUtils.validateKey(""));
        assertNotNull(S3ValidationUtils.validateKey(null));
    }

    @Test
    @DisplayName("Metadata - 大小与ASCII限制")
    void testMetadata() {
        assertNull(S3ValidationUtils.validateMetadata(null));
        assertNull(S3ValidationUtils.validateMetadata(Map.of("author", "张三")));
        assertNotNull(S3ValidationUtils.validateMetadata(Map.of("作者", "x")));

        Map<String, String> large = new HashMap<>();
        large.put("big", "x".repeat(S3ValidationUtils.MAX_METADATA_BYTES));
        String error = S3ValidationUtils.validateMetadata(large);
        assertNotNull(error);
        assertTrue(error.contains("2KB"));
    }
}
