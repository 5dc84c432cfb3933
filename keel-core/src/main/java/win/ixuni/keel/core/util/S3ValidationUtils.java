package win.ixuni.keel.core.util;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * S3 protocol validation utility class
 * <p>
 * Every method returns an error message, or null when the value is valid.
 */
public class S3ValidationUtils {

    /**
     * AWS S3 limit for the UTF-8 length of an object key
     */
    public static final int MAX_KEY_BYTES = 1024;

    /**
     * AWS S3 limit for the total size of user metadata
     */
    public static final int MAX_METADATA_BYTES = 2048;

    /**
     * Lower-case letters, digits, dots and hyphens; must start and end with a letter or digit
     */
    private static final Pattern BUCKET_NAME_PATTERN = Pattern.compile("^[a-z0-9][a-z0-9.-]{1,61}[a-z0-9]$");

    private static final Pattern IP_ADDRESS_PATTERN = Pattern.compile("^\\d{1,3}(\\.\\d{1,3}){3}$");

    private S3ValidationUtils() {
    }

    /**
     * Verify a bucket name against the S3 naming rules
     *
     * @param bucketName bucket name
     * @return 错误信息，如果验证通过返回 null
     */
    public static String validateBucketName(String bucketName) {
        if (bucketName == null || bucketName.isEmpty()) {
            return "Bucket name must not be empty";
        }
        if (!BUCKET_NAME_PATTERN.matcher(bucketName).matches()) {
            return "Invalid bucket name: " + bucketName;
        }
        if (bucketName.contains("..")) {
            return "Bucket name must not contain adjacent periods: " + bucketName;
        }
        if (IP_ADDRESS_PATTERN.matcher(bucketName).matches()) {
            return "Bucket name must not be formatted as an IP address: " + bucketName;
        }
        return null;
    }

    /**
     * Verify an object key
     *
     * @param key object key
     * @return 错误信息，如果验证通过返回 null
     */
    public static String validateKey(String key) {
        if (key == null || key.isEmpty()) {
            return "Object key must not be empty";
        }
        int length = key.getBytes(StandardCharsets.UTF_8).length;
        if (length > MAX_KEY_BYTES) {
            return "Object key exceeds " + MAX_KEY_BYTES + " bytes (actual: " + length + " bytes)";
        }
        return null;
    }

    /**
     * Verify user metadata
     * <p>
     * AWS S3 limits:
     * - Total size of all user metadata must not exceed 2KB (2048 bytes)
     * - Metadata key 只能包含 ASCII 字符
     *
     * @param metadata user metadata
     * @return 错误信息，如果验证通过返回 null
     */
    public static String validateMetadata(Map<String, String> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return null;
        }

        int totalSize = 0;
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            String key = entry.getKey();
            String value = entry.getValue();

            if (!isAscii(key)) {
                return "Metadata key contains non-ASCII characters: " + key;
            }

            totalSize += key.getBytes(StandardCharsets.UTF_8).length;
            if (value != null) {
                totalSize += value.getBytes(StandardCharsets.UTF_8).length;
            }
        }

        if (totalSize > MAX_METADATA_BYTES) {
            return "User metadata exceeds 2KB limit (actual: " + totalSize + " bytes)";
        }

        return null;
    }

    /**
     * Check whether a string contains only ASCII characters
     */
    public static boolean isAscii(String str) {
        if (str == null) {
            return true;
        }
        for (char c : str.toCharArray()) {
            if (c > 127) {
                return false;
            }
        }
        return true;
    }
}
