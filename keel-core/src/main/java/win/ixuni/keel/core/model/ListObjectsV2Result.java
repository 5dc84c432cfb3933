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
 * ListObjectsV2 返回结果
 * <p>
 * Same listing as {@link ListObjectsResult}, rendered in the V2 response shape.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JacksonXmlRootElement(localName = "ListBucketResult", namespace = "http://s3.amazonaws.com/doc/2006-03-01/")
public class ListObjectsV2Result {

    @JacksonXmlProperty(localName = "Name")
    private String name;

    @JacksonXmlProperty(localName = "Prefix")
    private String prefix;

    @JacksonXmlProperty(localName = "Delimiter")
    private String delimiter;

    @JacksonXmlProperty(localName = "MaxKeys")
    private Integer maxKeys;

    /**
     * 返回的对象数量
     */
    @JacksonXmlProperty(localName = "KeyCount")
    private Integer keyCount;

    @JacksonXmlProperty(localName = "IsTruncated")
    private Boolean isTruncated;

    @JacksonXmlElementWrapper(useWrapping = false)
    @JacksonXmlProperty(localName = "Contents")
    private List<S3Object> contents;

    @JacksonXmlElementWrapper(useWrapping = false)
    @JacksonXmlProperty(localName = "CommonPrefixes")
    private List<ListObjectsResult.CommonPrefix> commonPrefixes;

    public static ListObjectsV2Result from(ListObjectsResult v1) {
        int keyCount = v1.getContents().size()
                + (v1.getCommonPrefixes() != null ? v1.getCommonPrefixes().size() : 0);
        return ListObjectsV2Result.builder()
                .name(v1.getBucketName())
                .prefix(v1.getPrefix())
                .delimiter(v1.getDelimiter())
                .maxKeys(v1.getMaxKeys())
                .keyCount(keyCount)
                .isTruncated(v1.getIsTruncated())
                .contents(v1.getContents())
                .commonPrefixes(v1.getCommonPrefixes())
                .build();
    }
}
