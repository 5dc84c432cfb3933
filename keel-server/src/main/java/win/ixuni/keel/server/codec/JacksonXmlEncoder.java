package win.ixuni.keel.server.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import org.reactivestreams.Publisher;
import org.springframework.core.ResolvableType;
import org.springframework.core.codec.AbstractEncoder;
import org.springframework.core.codec.EncodingException;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferFactory;
import org.springframework.lang.Nullable;
import org.springframework.util.MimeType;
import reactor.core.publisher.Flux;

import java.util.Map;

/**
 * Jackson XML encoder for S3 response bodies
 * <p>
 * Only types annotated as XML roots are handled, so plain strings and byte streams keep their
 * default codecs.
 */
public class JacksonXmlEncoder extends AbstractEncoder<Object> {

    private final XmlMapper mapper;

    public JacksonXmlEncoder(XmlMapper mapper, MimeType... mimeTypes) {
        super(mimeTypes);
        this.mapper = mapper;
    }

    @Override
    public boolean canEncode(ResolvableType elementType, @Nullable MimeType mimeType) {
        Class<?> clazz = elementType.toClass();
        return super.canEncode(elementType, mimeType)
                && clazz.isAnnotationPresent(com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement.class)
                && this.mapper.canSerialize(clazz);
    }

    @Override
    public Flux<DataBuffer> encode(Publisher<?> inputStream, DataBufferFactory bufferFactory,
                                   ResolvableType elementType, @Nullable MimeType mimeType,
                                   @Nullable Map<String, Object> hints) {
        return Flux.from(inputStream)
                .map(value -> encodeValue(value, bufferFactory, elementType, mimeType, hints));
    }

    @Override
    public DataBuffer encodeValue(Object value, DataBufferFactory bufferFactory,
                                  ResolvableType valueType, @Nullable MimeType mimeType,
                                  @Nullable Map<String, Object> hints) {
        try {
            byte[] bytes = this.mapper.writeValueAsBytes(value);
            DataBuffer buffer = bufferFactory.allocateBuffer(bytes.length);
            buffer.write(bytes);
            return buffer;
        } catch (JsonProcessingException e) {
            throw new EncodingException("XML encoding error: " + e.getMessage(), e);
        }
    }
}
