package win.ixuni.quarry.server.config;

import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.fasterxml.jackson.dataformat.xml.ser.ToXmlGenerator;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerCodecConfigurer;
import org.springframework.web.reactive.config.WebFluxConfigurer;
import win.ixuni.quarry.server.codec.S3XmlEncoder;

/**
 * WebFlux 配置
 * <p>
 * Registers the Jackson XML encoder used for S3 error bodies. The XmlMapper is not a bean:
 * an ObjectMapper bean would replace the JSON mapper Spring Boot gives the actuator endpoints.
 */
@Configuration
public class WebFluxConfig implements WebFluxConfigurer {

    private final XmlMapper xmlMapper = createXmlMapper();

    @Override
    public void configureHttpMessageCodecs(ServerCodecConfigurer configurer) {
        configurer.customCodecs().register(new S3XmlEncoder(xmlMapper, MediaType.APPLICATION_XML));
    }

    public static XmlMapper createXmlMapper() {
        XmlMapper mapper = new XmlMapper();
        mapper.configure(ToXmlGenerator.Feature.WRITE_XML_DECLARATION, true);
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.registerModule(new JavaTimeModule());
        return mapper;
    }
}
