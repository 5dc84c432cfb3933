package win.ixuni.keel.core.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * S3 Object 模型
 * <p>
 * Metadata view of the current version of an object. The etag is the bare
 * lower-case hex MD5; the HTTP layer adds the quotes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class S3Object {

    /**
     * 对象Key
     */
    @JacksonXmlProperty(localName = "Key")
    private String key;

    /**
     * Owning bucket (internal use, not serialized)
     */
    @JsonIgnore
    private String bucketName;

    /**
     * Last modified time
     */
    @JacksonXmlProperty(localName = "LastModified")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant lastModified;

    /**
     * ETag (MD5 hex)
     */
    @JacksonXmlProperty(localName = "ETag")
    private String etag;

    /**
     * 对象大小(字节)
     */
    @JacksonXmlProperty(localName = "Size")
    private Long size;

    /**
     * Content type (not serialized in list responses)
     */
    @JsonIgnore
    private String contentType;

    /**
     * User-defined metadata (not serialized in list responses)
     */
    @JsonIgnore
    private Map<String, String> userMetadata;

    /**
     * 存储类型
     */
    @JacksonXmlProperty(localName = "StorageClass")
    @Builder.Default
    private String storageClass = "STANDARD";
}
