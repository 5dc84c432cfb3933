package win.ixuni.keel.core.model;

import lombok.Builder;
import lombok.Data;

/**
 * 列出对象请求参数
 * <p>
 * Listing is single-page: every matching key is returned.
 */
@Data
@Builder
public class ListObjectsRequest {

    /**
     * Bucket名称
     */
    private String bucketName;

    /**
     * 前缀过滤
     */
    private String prefix;

    /**
     * Delimiter (for simulating directory structure), none by default
     */
    private String delimiter;
}
