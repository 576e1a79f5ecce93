package me.golemcore.scout.domain.service;

import me.golemcore.scout.domain.exception.EvidenceCollectionException;
import me.golemcore.scout.domain.exception.ResearchTimeoutException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InFlightRegistryTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private ExecutorService executor;
    private InFlightRegistry registry;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        registry = new InFlightRegistry(executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldReturnResultAndReleaseKey() {
        String result = registry.execute("research:abc", "deep research", TIMEOUT, () -> "done");

        assertEquals("done", result);
        assertEquals(0, registry.size());
    }

    @Test
    void shouldShareInFlightResultWithConcurrentCaller() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger computations = new AtomicInteger();
        AtomicReference<String> leaderResult = new AtomicReference<>();
        AtomicReference<String> followerResult = new AtomicReference<>();

        Thread leader = new Thread(() -> leaderResult.set(registry.execute("k", "search", TIMEOUT, () -> {
            computations.incrementAndGet();
            release.await();
            return "shared";
        })));
        leader.start();
        waitUntil(() -> registry.size() == 1);

        Thread follower = new Thread(() -> followerResult.set(registry.execute("k", "search", TIMEOUT, () -> {
            computations.incrementAndGet();
            return "separate";
        })));
        follower.start();
        waitUntil(() -> follower.getState() == Thread.State.TIMED_WAITING);

        release.countDown();
        leader.join(TimeUnit.SECONDS.toMillis(5));
        follower.join(TimeUnit.SECONDS.toMillis(5));

        assertEquals("shared", leaderResult.get());
        assertEquals("shared", followerResult.get());
        assertEquals(1, computations.get());
        assertEquals(0, registry.size());
    }

    @Test
    void shouldCancelWorkOnTimeout() throws Exception {
        CountDownLatch interrupted = new CountDownLatch(1);

        assertThrows(ResearchTimeoutException.class,
                () -> registry.execute("k", "deep research", Duration.ofMillis(100), () -> {
                    try {
                        Thread.sleep(10_000);
                    } catch (InterruptedException e) {
                        interrupted.countDown();
                        throw e;
                    }
                    return "late";
                }));

        assertTrue(interrupted.await(5, TimeUnit.SECONDS));
        assertEquals(0, registry.size());
    }

    @Test
    void shouldPropagateRuntimeFailureAndReleaseKey() {
        EvidenceCollectionException failure = new EvidenceCollectionException("collector down");

        EvidenceCollectionException thrown = assertThrows(EvidenceCollectionException.class,
                () -> registry.execute("k", "deep research", TIMEOUT, () -> {
                    throw failure;
                }));

        assertSame(failure, thrown);
        assertEquals("again", registry.execute("k", "deep research", TIMEOUT, () -> "again"));
    }

    @Test
    void shouldWrapCheckedFailure() {
        IllegalStateException thrown = assertThrows(IllegalStateException.class,
                () -> registry.execute("k", "search", TIMEOUT, () -> {
                    throw new IOException("disk");
                }));

        assertInstanceOf(IOException.class, thrown.getCause());
    }

    private static void waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("condition not met within 5s");
            }
            Thread.sleep(5);
        }
    }
}
