package win.ixuni.quarry.server.codec;

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
 * Jackson XML encoder for S3 response documents
 * <p>
 * WebFlux ships only a JAXB XML encoder; this one serializes with the shared {@link XmlMapper} instead.
 */
public class S3XmlEncoder extends AbstractEncoder<Object> {

    private final XmlMapper mapper;

    public S3XmlEncoder(XmlMapper mapper, MimeType... mimeTypes) {
        super(mimeTypes);
        this.mapper = mapper;
    }

    @Override
    public boolean canEncode(ResolvableType elementType, @Nullable MimeType mimeType) {
        Class<?> type = elementType.toClass();
        // 字符串和字节由默认编码器处理
        if (CharSequence.class.isAssignableFrom(type) || DataBuffer.class.isAssignableFrom(type)) {
            return false;
        }
        return super.canEncode(elementType, mimeType) && mapper.canSerialize(type);
    }

    @Override
    public Flux<DataBuffer> encode(Publisher<?> inputStream, DataBufferFactory bufferFactory,
            ResolvableType elementType, @Nullable MimeType mimeType, @Nullable Map<String, Object> hints) {
        return Flux.from(inputStream)
                .map(value -> encodeValue(value, bufferFactory, elementType, mimeType, hints));
    }

    @Override
    public DataBuffer encodeValue(Object value, DataBufferFactory bufferFactory, ResolvableType valueType,
            @Nullable MimeType mimeType, @Nullable Map<String, Object> hints) {
        try {
            byte[] bytes = mapper.writeValueAsBytes(value);
            DataBuffer buffer = bufferFactory.allocateBuffer(bytes.length);
            buffer.write(bytes);
            return buffer;
        } catch (JsonProcessingException e) {
            throw new EncodingException("XML encoding error: " + e.getMessage(), e);
        }
    }
}
