package io.guildcron.internal;

import io.guildcron.core.ScheduledHandle;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScheduledExecutorJobTimerTest {

    private final ScheduledExecutorJobTimer timer = new ScheduledExecutorJobTimer(2, Duration.ofSeconds(2));

    @AfterEach
    void tearDown() {
        timer.close();
    }

    @Test
    void armedCallbackShouldRunOnTimerThread() throws Exception {
        CountDownLatch fired = new CountDownLatch(1);
        AtomicReference<String> thread = new AtomicReference<>();

        timer.arm("reminder_1", Duration.ofMillis(50), () -> {
            thread.set(Thread.currentThread().getName());
            fired.countDown();
        });

        assertTrue(fired.await(5, TimeUnit.SECONDS));
        assertTrue(thread.get().startsWith("guildcron.timer-"));
    }

    @Test
    void negativeDelayShouldFireImmediately() throws Exception {
        CountDownLatch fired = new CountDownLatch(1);
        timer.arm("reminder_2", Duration.ofSeconds(-5), fired::countDown);
        assertTrue(fired.await(5, TimeUnit.SECONDS));
    }

    @Test
    void cancelledHandleShouldNotFire() throws Exception {
        AtomicInteger runs = new AtomicInteger();
        ScheduledHandle handle = timer.arm("reminder_3", Duration.ofMillis(200), runs::incrementAndGet);

        handle.cancel();
        handle.cancel();

        CountDownLatch later = new CountDownLatch(1);
        timer.arm("probe", Duration.ofMillis(400), later::countDown);
        assertTrue(later.await(5, TimeUnit.SECONDS));

        assertTrue(handle.isCancelled());
        assertEquals(0, runs.get());
    }

    @Test
    void failingCallbackShouldNotKillTheTimer() throws Exception {
        timer.arm("reminder_4", Duration.ZERO, () -> {
            throw new IllegalStateException("boom");
        });

        CountDownLatch fired = new CountDownLatch(1);
        ScheduledHandle handle = timer.arm("reminder_5", Duration.ofMillis(20), fired::countDown);

        assertTrue(fired.await(5, TimeUnit.SECONDS));
        assertFalse(handle.isCancelled());
    }

    @Test
    void poolSizeMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new ScheduledExecutorJobTimer(0));
    }
}
