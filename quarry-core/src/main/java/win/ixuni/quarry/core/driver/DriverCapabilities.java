package win.ixuni.quarry.core.driver;

import java.util.Set;

/**
 * What a driver can do. Handlers declare their own capabilities, the driver reports the union.
 */
public interface DriverCapabilities {

    enum Capability {
        /** lookups and whole-object reads */
        READ,
        /** bucket management and object writes */
        WRITE,
        /** reading a byte range without streaming the rest */
        RANGE_READ,
        /** older versions stay addressable by version id */
        VERSIONING
    }

    Set<Capability> getCapabilities();

    default boolean supports(Capability capability) {
        return getCapabilities().contains(capability);
    }
}
