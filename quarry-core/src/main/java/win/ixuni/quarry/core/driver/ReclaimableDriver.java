package win.ixuni.quarry.core.driver;

import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Interface for drivers that defer deletion of superseded storage locations
 * <p>
 * An overwrite only swaps the index pointer; the old bytes stay readable so that a lookup which raced
 * with the overwrite can still finish its read. Reclamation frees them once the grace period has passed.
 */
public interface ReclaimableDriver {

    /**
     * Delete storage locations no index entry has referenced for at least {@code gracePeriod}
     *
     * @param gracePeriod minimum time a location stays readable after being superseded
     * @return number of locations reclaimed
     */
    Mono<Long> reclaimSuperseded(Duration gracePeriod);
}
