package win.ixuni.keel.core.model;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * ListBuckets response result
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JacksonXmlRootElement(localName = "ListAllMyBucketsResult", namespace = "http://s3.amazonaws.com/doc/2006-03-01/")
public class ListAllBucketsResult {

    @JacksonXmlProperty(localName = "Owner")
    private Owner owner;

    @JacksonXmlElementWrapper(localName = "Buckets")
    @JacksonXmlProperty(localName = "Bucket")
    private List<S3Bucket> buckets;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Owner {
        @JacksonXmlProperty(localName = "ID")
        private String id;

        @JacksonXmlProperty(localName = "DisplayName")
        private String displayName;
    }

    public static ListAllBucketsResult of(List<S3Bucket> buckets) {
        return new ListAllBucketsResult(new Owner("keel", "S3Keel"), buckets);
    }
}
