package win.ixuni.keel.server.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.fasterxml.jackson.dataformat.xml.ser.ToXmlGenerator;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerCodecConfigurer;
import org.springframework.web.reactive.config.WebFluxConfigurer;
import win.ixuni.keel.server.codec.JacksonXmlEncoder;

/**
 * WebFlux 配置
 * <p>
 * Registers the XML encoder used for S3 response bodies. The mapper is not exposed as a bean so
 * Spring Boot's JSON mapper stays untouched.
 */
@Configuration
public class WebFluxConfig implements WebFluxConfigurer {

    @Override
    public void configureHttpMessageCodecs(ServerCodecConfigurer configurer) {
        XmlMapper xmlMapper = createXmlMapper();

        configurer.customCodecs().register(
                new JacksonXmlEncoder(xmlMapper, MediaType.APPLICATION_XML, MediaType.TEXT_XML));
    }

    static XmlMapper createXmlMapper() {
        XmlMapper xmlMapper = new XmlMapper();
        xmlMapper.configure(ToXmlGenerator.Feature.WRITE_XML_DECLARATION, true);
        xmlMapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        // Absent Prefix/Delimiter/CommonPrefixes are omitted rather than written empty
        xmlMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        xmlMapper.registerModule(new JavaTimeModule());
        return xmlMapper;
    }
}
