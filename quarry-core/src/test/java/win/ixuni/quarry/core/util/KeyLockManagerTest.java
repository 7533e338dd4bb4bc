package win.ixuni.quarry.core.util;

import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class KeyLockManagerTest {

    @Test
    void serializesWritersOfTheSameKey() {
        KeyLockManager lockManager = new KeyLockManager();
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();

        Mono<Integer> critical = Mono.defer(() -> {
            maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
            return Mono.delay(Duration.ofMillis(20)).map(tick -> inside.decrementAndGet());
        });

        StepVerifier.create(Flux.range(0, 5)
                        .flatMap(i -> lockManager.withLock("bucket/key", critical))
                        .then())
                .verifyComplete();

        assertEquals(1, maxInside.get());
        assertEquals(0, lockManager.getActiveLockCount());
    }

    @Test
    void releasesLockWhenOperationFails() {
        KeyLockManager lockManager = new KeyLockManager();

        StepVerifier.create(lockManager.withLock("bucket/key", Mono.error(new IllegalStateException("boom"))))
                .verifyError(IllegalStateException.class);

        StepVerifier.create(lockManager.withLock("bucket/key", Mono.just("ok")))
                .expectNext("ok")
                .verifyComplete();
        assertEquals(0, lockManager.getActiveLockCount());
    }

    @Test
    void cancelledWaiterDoesNotKeepTheLock() throws InterruptedException {
        KeyLockManager lockManager = new KeyLockManager(5);
        CountDownLatch holding = new CountDownLatch(1);
        Sinks.Empty<Void> gate = Sinks.empty();

        Disposable holder = lockManager.withLock("bucket/key",
                Mono.fromRunnable(holding::countDown).then(gate.asMono())).subscribe();
        assertTrue(holding.await(5, TimeUnit.SECONDS));

        AtomicBoolean cancelledRan = new AtomicBoolean();
        Disposable waiter = lockManager.withLock("bucket/key",
                Mono.fromRunnable(() -> cancelledRan.set(true))).subscribe();
        // 让等待者阻塞在 tryAcquire 上
        Thread.sleep(100);
        waiter.dispose();

        gate.tryEmitEmpty();

        StepVerifier.create(lockManager.withLock("bucket/key", Mono.just("next")))
                .expectNext("next")
                .verifyComplete();
        assertFalse(cancelledRan.get());

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (lockManager.getActiveLockCount() > 0 && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(0, lockManager.getActiveLockCount());
    }

    @Test
    void keyThatGoesIdleBetweenWritersStaysExclusive() {
        KeyLockManager lockManager = new KeyLockManager();
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();

        // 每个写者都很短，锁条目频繁归零被移除又重建
        Mono<Integer> critical = Mono.fromCallable(() -> {
            maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
            Thread.onSpinWait();
            return inside.decrementAndGet();
        });

        StepVerifier.create(Flux.range(0, 2000)
                        .parallel(8)
                        .runOn(Schedulers.parallel())
                        .flatMap(i -> lockManager.withLock("bucket/key", critical))
                        .sequential()
                        .then())
                .expectComplete()
                .verify(Duration.ofSeconds(30));

        assertEquals(1, maxInside.get());
        assertEquals(0, lockManager.getActiveLockCount());
    }
}
