package com.ebayseller.scraper;

import org.junit.jupiter.api.*;
import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

public class SessionExecutorTest {

    private SessionExecutor executor;

    @BeforeEach
    void setUp() {
        executor = new SessionExecutor();
    }

    @AfterEach
    void tearDown() {
        executor.shutdown(() -> { }, Duration.ofSeconds(1));
    }

    @Test
    void testCallsFromManyThreadsNeverOverlap() throws Exception {
        int callers = 8;
        int callsEach = 5;
        AtomicInteger active = new AtomicInteger();
        AtomicInteger maxActive = new AtomicInteger();
        AtomicInteger completed = new AtomicInteger();
        Set<String> threadNames = ConcurrentHashMap.newKeySet();
        CountDownLatch start = new CountDownLatch(1);

        ExecutorService pool = Executors.newFixedThreadPool(callers);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int c = 0; c < callers; c++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < callsEach; i++) {
                        executor.call("overlapping action", () -> {
                            int now = active.incrementAndGet();
                            maxActive.accumulateAndGet(now, Math::max);
                            threadNames.add(Thread.currentThread().getName());
                            Thread.sleep(2);
                            active.decrementAndGet();
                            return completed.incrementAndGet();
                        });
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) f.get(10, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertEquals(callers * callsEach, completed.get());
        assertEquals(1, maxActive.get());
        assertEquals(Set.of(SessionExecutor.THREAD_NAME), threadNames);
    }

    @Test
    void testFailureIsWrappedWithDescription() {
        BrowserSessionException e = assertThrows(BrowserSessionException.class,
            () -> executor.call("read page content", () -> { throw new IllegalStateException("Target closed"); }));
        assertTrue(e.getMessage().contains("read page content"));
        assertTrue(e.getMessage().contains("Target closed"));
        assertTrue(e.getCause() instanceof IllegalStateException);
    }

    @Test
    void testSessionExceptionIsRethrownAsIs() {
        NavigationException original = new NavigationException("Cannot reach https://www.ebay.com/");
        NavigationException thrown = assertThrows(NavigationException.class,
            () -> executor.call("navigate", () -> { throw original; }));
        assertSame(original, thrown);
    }

    @Test
    void testShutdownRunsCleanupOnSessionThreadThenRejectsCalls() {
        AtomicReference<String> cleanupThread = new AtomicReference<>();
        assertTrue(executor.shutdown(() -> cleanupThread.set(Thread.currentThread().getName()), Duration.ofSeconds(1)));
        assertEquals(SessionExecutor.THREAD_NAME, cleanupThread.get());
        assertTrue(executor.isShutdown());

        BrowserSessionException e = assertThrows(BrowserSessionException.class,
            () -> executor.call("read current URL", () -> "about:blank"));
        assertTrue(e.getMessage().contains("closed"));
    }

    @Test
    void testSlowCleanupReportsUncleanShutdown() {
        assertFalse(executor.shutdown(() -> {
            try {
                Thread.sleep(2_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, Duration.ofMillis(50)));
        assertTrue(executor.isShutdown());
    }
}
