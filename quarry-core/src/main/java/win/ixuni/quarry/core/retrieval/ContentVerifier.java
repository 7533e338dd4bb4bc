package win.ixuni.quarry.core.retrieval;

import reactor.core.publisher.Flux;
import reactor.core.publisher.SynchronousSink;
import win.ixuni.quarry.core.exception.IntegrityException;
import win.ixuni.quarry.core.model.ByteRange;
import win.ixuni.quarry.core.model.ObjectMetadata;
import win.ixuni.quarry.core.util.ETags;

import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Checks a content stream against the metadata it was read for
 * <p>
 * Every read is length-checked as it streams; a full read is also hashed and compared with the ETag. Any
 * disagreement ends the stream with {@link IntegrityException} instead of completing it.
 */
public final class ContentVerifier {

    private ContentVerifier() {
    }

    public static Flux<ByteBuffer> verify(Flux<ByteBuffer> content, ObjectMetadata metadata, ByteRange range) {
        long expected = range.length();
        boolean hashFullRead = range.coversWhole(metadata.getSize()) && metadata.getEtag() != null;

        return Flux.defer(() -> {
            AtomicLong received = new AtomicLong();
            MessageDigest md5 = hashFullRead ? ETags.newMd5() : null;

            return content
                    .handle((ByteBuffer buffer, SynchronousSink<ByteBuffer> sink) -> {
                        long total = received.addAndGet(buffer.remaining());
                        if (total > expected) {
                            sink.error(mismatch(metadata, "read " + total + " bytes, expected " + expected));
                            return;
                        }
                        if (md5 != null) {
                            md5.update(buffer.duplicate());
                        }
                        sink.next(buffer);
                    })
                    .concatWith(Flux.defer(() -> {
                        if (received.get() != expected) {
                            return Flux.error(mismatch(metadata,
                                    "store ended after " + received.get() + " bytes, expected " + expected));
                        }
                        if (md5 != null) {
                            String actual = ETags.toHex(md5);
                            if (!actual.equals(metadata.getEtag())) {
                                return Flux.error(mismatch(metadata,
                                        "content hash " + actual + " does not match ETag " + metadata.getEtag()));
                            }
                        }
                        return Flux.empty();
                    }));
        });
    }

    private static IntegrityException mismatch(ObjectMetadata metadata, String detail) {
        return new IntegrityException(metadata.getBucketName(), metadata.getKey(), detail);
    }
}
