package win.ixuni.keel.core.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One {@code <Bucket>} entry of ListAllMyBucketsResult
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class S3Bucket {

    @JacksonXmlProperty(localName = "Name")
    private String name;

    /**
     * 创建时间，ISO-8601 UTC
     */
    @JacksonXmlProperty(localName = "CreationDate")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant creationDate;
}
