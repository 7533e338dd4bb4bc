package win.ixuni.quarry.core.operation.object;

import lombok.Value;
import reactor.core.publisher.Flux;
import win.ixuni.quarry.core.model.ByteRange;
import win.ixuni.quarry.core.model.ObjectMetadata;
import win.ixuni.quarry.core.operation.Operation;

import java.nio.ByteBuffer;

/**
 * Object store read of one byte range
 * <p>
 * Resolves to a cold content stream; nothing is read until it is subscribed. The metadata is the one a
 * prior lookup returned, so the read targets that exact storage location even if the key was overwritten
 * in between.
 */
@Value
public class ReadObjectOperation implements Operation<Flux<ByteBuffer>> {

    ObjectMetadata metadata;

    /**
     * null for an empty object: the location is still checked, but nothing is streamed
     */
    ByteRange range;
}
