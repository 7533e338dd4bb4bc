package win.ixuni.quarry.server.codec;

import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * AWS S3 Chunked Transfer Encoding 解码器
 * <p>
 * When an SDK streams a signed upload ({@code x-amz-content-sha256: STREAMING-...}) the body is:
 *
 * <pre>
 * &lt;chunk-size-hex&gt;;chunk-signature=&lt;signature&gt;\r\n
 * &lt;chunk-data&gt;\r\n
 * ...
 * 0;chunk-signature=&lt;final-signature&gt;\r\n
 * \r\n
 * </pre>
 * <p>
 * 流式剥离 chunk header 与签名，只输出数据，不缓存整个请求体。Chunk signatures are not verified.
 */
public final class AwsChunkedDecoder {

    private static final String STREAMING_PREFIX = "STREAMING-";
    private static final int MAX_HEADER_LENGTH = 4096;

    private AwsChunkedDecoder() {
    }

    public static boolean isAwsChunkedEncoding(String contentSha256) {
        return contentSha256 != null && contentSha256.startsWith(STREAMING_PREFIX);
    }

    /**
     * @throws IllegalArgumentException (as an error signal) when the framing is malformed or truncated
     */
    public static Flux<ByteBuffer> decode(Flux<DataBuffer> input) {
        return Flux.defer(() -> {
            State state = new State();
            return input
                    .concatMapIterable(dataBuffer -> {
                        byte[] bytes = new byte[dataBuffer.readableByteCount()];
                        dataBuffer.read(bytes);
                        DataBufferUtils.release(dataBuffer);
                        return state.feed(bytes);
                    })
                    .concatWith(Mono.defer(() -> state.finished
                            ? Mono.empty()
                            : Mono.error(new IllegalArgumentException("Truncated aws-chunked request body"))));
        });
    }

    private static final class State {

        private final ByteArrayOutputStream header = new ByteArrayOutputStream();
        private long remaining;
        private int crlfRemaining;
        private boolean inData;
        private boolean finished;

        List<ByteBuffer> feed(byte[] bytes) {
            List<ByteBuffer> out = new ArrayList<>();
            int pos = 0;
            while (pos < bytes.length && !finished) {
                if (inData) {
                    int n = (int) Math.min(remaining, bytes.length - pos);
                    out.add(ByteBuffer.wrap(bytes, pos, n).slice());
                    pos += n;
                    remaining -= n;
                    if (remaining == 0) {
                        inData = false;
                        crlfRemaining = 2;
                    }
                } else if (crlfRemaining > 0) {
                    byte expected = crlfRemaining == 2 ? (byte) '\r' : (byte) '\n';
                    if (bytes[pos++] != expected) {
                        throw new IllegalArgumentException("Missing CRLF after aws-chunked chunk data");
                    }
                    crlfRemaining--;
                } else {
                    byte b = bytes[pos++];
                    if (b == '\n') {
                        startChunk(headerLine());
                    } else {
                        header.write(b);
                        if (header.size() > MAX_HEADER_LENGTH) {
                            throw new IllegalArgumentException("aws-chunked chunk header too long");
                        }
                    }
                }
            }
            return out;
        }

        private String headerLine() {
            String line = header.toString(StandardCharsets.US_ASCII);
            header.reset();
            return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
        }

        private void startChunk(String headerLine) {
            int semicolon = headerLine.indexOf(';');
            String sizeHex = (semicolon >= 0 ? headerLine.substring(0, semicolon) : headerLine).trim();
            long size;
            try {
                size = Long.parseLong(sizeHex, 16);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid aws-chunked chunk size: " + sizeHex, e);
            }
            if (size < 0) {
                throw new IllegalArgumentException("Invalid aws-chunked chunk size: " + sizeHex);
            }
            if (size == 0) {
                // 最后一个 chunk，之后的 trailer 忽略
                finished = true;
                return;
            }
            remaining = size;
            inData = true;
        }
    }
}
