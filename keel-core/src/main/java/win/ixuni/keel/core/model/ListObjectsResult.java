package win.ixuni.keel.core.model;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 列出对象返回结果
 * <p>
 * Contents are in ascending key order and reflect a single point-in-time view of the bucket.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JacksonXmlRootElement(localName = "ListBucketResult", namespace = "http://s3.amazonaws.com/doc/2006-03-01/")
public class ListObjectsResult {

    @JacksonXmlProperty(localName = "Name")
    private String bucketName;

    /**
     * Echo of the request prefix; omitted when the request had none
     */
    @JacksonXmlProperty(localName = "Prefix")
    private String prefix;

    @JacksonXmlProperty(localName = "Delimiter")
    private String delimiter;

    @JacksonXmlProperty(localName = "MaxKeys")
    private Integer maxKeys;

    @JacksonXmlProperty(localName = "IsTruncated")
    private Boolean isTruncated;

    /**
     * Keys not rolled up by the delimiter, ascending
     */
    @JacksonXmlElementWrapper(useWrapping = false)
    @JacksonXmlProperty(localName = "Contents")
    private List<S3Object> contents;

    /**
     * 按分隔符汇总的 "目录"，升序、去重
     */
    @JacksonXmlElementWrapper(useWrapping = false)
    @JacksonXmlProperty(localName = "CommonPrefixes")
    private List<CommonPrefix> commonPrefixes;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CommonPrefix {
        @JacksonXmlProperty(localName = "Prefix")
        private String prefix;
    }
}
