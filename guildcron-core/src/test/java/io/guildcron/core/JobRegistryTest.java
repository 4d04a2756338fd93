package io.guildcron.core;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobRegistryTest {

    @Test
    void registerShouldCancelPreviousHandleExactlyOnce() {
        JobRegistry registry = new JobRegistry();
        CountingHandle first = new CountingHandle("reminder_1");
        CountingHandle second = new CountingHandle("reminder_1");

        registry.register("reminder_1", first);
        registry.register("reminder_1", second);

        assertEquals(1, first.cancels.get());
        assertEquals(0, second.cancels.get());
        assertSame(second, registry.get("reminder_1"));
        assertEquals(1, registry.size());
    }

    @Test
    void registeringSameHandleAgainShouldNotCancelIt() {
        JobRegistry registry = new JobRegistry();
        CountingHandle handle = new CountingHandle("events_g");

        registry.register("events_g", handle);
        registry.register("events_g", handle);

        assertEquals(0, handle.cancels.get());
    }

    @Test
    void removeShouldCancelAndBeNoopWhenAbsent() {
        JobRegistry registry = new JobRegistry();
        CountingHandle handle = new CountingHandle("reminder_2");
        registry.register("reminder_2", handle);

        assertTrue(registry.remove("reminder_2"));
        assertFalse(registry.remove("reminder_2"));
        assertEquals(1, handle.cancels.get());
        assertFalse(registry.contains("reminder_2"));
    }

    @Test
    void unregisterShouldOnlyDropMatchingHandleWithoutCancelling() {
        JobRegistry registry = new JobRegistry();
        CountingHandle stale = new CountingHandle("reminder_3");
        CountingHandle live = new CountingHandle("reminder_3");
        registry.register("reminder_3", live);

        assertFalse(registry.unregister("reminder_3", stale));
        assertTrue(registry.contains("reminder_3"));

        assertTrue(registry.unregister("reminder_3", live));
        assertEquals(0, live.cancels.get());
        assertFalse(registry.contains("reminder_3"));
    }

    @Test
    void replaceShouldLeaveKeyEmptyWhenFactoryFails() {
        JobRegistry registry = new JobRegistry();
        CountingHandle previous = new CountingHandle("events_g");
        registry.register("events_g", previous);

        assertThrows(ValidationException.class, () -> registry.replace("events_g", () -> {
            throw new ValidationException("Invalid timezone: Nowhere");
        }));

        assertEquals(1, previous.cancels.get());
        assertFalse(registry.contains("events_g"));
    }

    @Test
    void replaceReturningNullShouldLeaveKeyEmpty() {
        JobRegistry registry = new JobRegistry();
        registry.register("reminder_4", new CountingHandle("reminder_4"));

        assertNull(registry.replace("reminder_4", () -> null));
        assertFalse(registry.contains("reminder_4"));
    }

    @Test
    void stopAllShouldCancelEveryHandle() {
        JobRegistry registry = new JobRegistry();
        List<CountingHandle> handles = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            CountingHandle handle = new CountingHandle("reminder_" + i);
            handles.add(handle);
            registry.register(handle.id(), handle);
        }

        registry.stopAll();

        assertEquals(0, registry.size());
        for (CountingHandle handle : handles) {
            assertEquals(1, handle.cancels.get());
        }
    }

    @Test
    void concurrentReplaceShouldLeaveExactlyOneLiveHandle() throws Exception {
        JobRegistry registry = new JobRegistry();
        List<CountingHandle> created = java.util.Collections.synchronizedList(new ArrayList<>());
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);

        for (int t = 0; t < threads; t++) {
            pool.submit(() -> {
                try {
                    go.await();
                    for (int i = 0; i < 200; i++) {
                        registry.replace("events_race", () -> {
                            CountingHandle handle = new CountingHandle("events_race");
                            created.add(handle);
                            return handle;
                        });
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }

        go.countDown();
        assertTrue(done.await(30, TimeUnit.SECONDS));
        pool.shutdownNow();

        long live = created.stream().filter(h -> !h.isCancelled()).count();
        assertEquals(1, live);
        assertEquals(Set.of("events_race"), registry.keys());
        assertFalse(registry.get("events_race").isCancelled());
    }

    private static final class CountingHandle implements ScheduledHandle {
        private final String id;
        private final AtomicInteger cancels = new AtomicInteger();

        private CountingHandle(String id) {
            this.id = id;
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public void cancel() {
            cancels.incrementAndGet();
        }

        @Override
        public boolean isCancelled() {
            return cancels.get() > 0;
        }
    }
}
