package win.ixuni.quarry.core.model;

import lombok.Value;

import java.util.UUID;

/**
 * Opaque handle to one immutable byte sequence held by a driver's object store
 * <p>
 * Only the store that issued a location knows how to resolve it. Every write gets a fresh location,
 * so a location never changes content once it is referenced from the index.
 */
@Value
public class StorageLocation {

    String id;

    public static StorageLocation generate() {
        return new StorageLocation(UUID.randomUUID().toString().replace("-", ""));
    }

    @Override
    public String toString() {
        return id;
    }
}
