package win.ixuni.quarry.core.util;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import win.ixuni.quarry.core.exception.QuarryException;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-key writer lock
 * <p>
 * Serializes index commits for the same (bucket, key) so read-modify-write of the key's version list
 * never loses an update. Different keys commit in parallel. Readers never take this lock.
 */
@Slf4j
public class KeyLockManager {

    private static final int DEFAULT_TIMEOUT_SECONDS = 30;

    // 引用计数归零即移除，空闲 key 不占内存
    private final Map<String, LockEntry> locks = new ConcurrentHashMap<>();

    private final int timeoutSeconds;

    private static final class LockEntry {
        private final Semaphore permit = new Semaphore(1);
        // 只在 locks.compute 内读写
        private int waiters;
    }

    private static final int WAITING = 0;
    private static final int HELD = 1;
    private static final int DONE = 2;

    public KeyLockManager() {
        this(DEFAULT_TIMEOUT_SECONDS);
    }

    public KeyLockManager(int timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    public static String lockKey(String bucketName, String key) {
        return bucketName + "/" + key;
    }

    /**
     * Run {@code operation} while holding the lock for {@code lockKey}
     * <p>
     * Cancelling while still waiting gives the permit back as soon as the blocked acquire returns.
     */
    public <T> Mono<T> withLock(String lockKey, Mono<T> operation) {
        return Mono.defer(() -> {
            AtomicInteger state = new AtomicInteger(WAITING);
            AtomicReference<LockEntry> held = new AtomicReference<>();
            Runnable unlock = () -> {
                if (state.getAndSet(DONE) == HELD) {
                    unlock(lockKey, held.get());
                }
            };

            return Mono.fromCallable(() -> acquire(lockKey, state, held))
                    .subscribeOn(Schedulers.boundedElastic())
                    .flatMap(acquired -> operation)
                    .doOnTerminate(unlock)
                    .doOnCancel(unlock);
        });
    }

    /**
     * Join, wait and hand over in one blocking call, so a waiter that is never scheduled leaves no trace
     *
     * @return {@code true}; {@code null} when the subscriber went away while waiting
     */
    private Boolean acquire(String lockKey, AtomicInteger state, AtomicReference<LockEntry> held)
            throws InterruptedException {
        LockEntry entry = join(lockKey);
        boolean acquired = false;
        try {
            acquired = entry.permit.tryAcquire(timeoutSeconds, TimeUnit.SECONDS);
        } finally {
            if (!acquired) {
                leave(lockKey, entry);
            }
        }
        if (!acquired) {
            throw new QuarryException("SlowDown", "Timed out waiting for a concurrent write to " + lockKey, 503);
        }

        held.set(entry);
        if (!state.compareAndSet(WAITING, HELD)) {
            unlock(lockKey, entry);
            return null;
        }
        log.trace("lock+ {}", lockKey);
        return Boolean.TRUE;
    }

    private void unlock(String lockKey, LockEntry entry) {
        entry.permit.release();
        log.trace("lock- {}", lockKey);
        leave(lockKey, entry);
    }

    private LockEntry join(String lockKey) {
        return locks.compute(lockKey, (k, existing) -> {
            LockEntry entry = existing != null ? existing : new LockEntry();
            entry.waiters++;
            return entry;
        });
    }

    // 计数与移除在同一次 compute 中完成
    private void leave(String lockKey, LockEntry entry) {
        locks.computeIfPresent(lockKey, (k, current) -> {
            if (current != entry) {
                return current;
            }
            return --current.waiters == 0 ? null : current;
        });
    }

    /**
     * Count of keys currently locked or waited on
     */
    public int getActiveLockCount() {
        return locks.size();
    }
}
