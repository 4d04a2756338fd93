package io.guildcron.internal;

import io.guildcron.JobTimer;
import io.guildcron.core.ScheduledHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link JobTimer} backed by a {@link ScheduledThreadPoolExecutor} of daemon threads.
 * Callbacks for different jobs may run concurrently.
 */
public class ScheduledExecutorJobTimer implements JobTimer, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ScheduledExecutorJobTimer.class);

    private final ScheduledThreadPoolExecutor executor;
    private final Duration shutdownTimeout;

    public ScheduledExecutorJobTimer(int poolSize, Duration shutdownTimeout) {
        if (poolSize <= 0) {
            throw new IllegalArgumentException("poolSize must be positive");
        }
        this.shutdownTimeout = Objects.requireNonNull(shutdownTimeout, "shutdownTimeout must not be null");

        AtomicInteger counter = new AtomicInteger();
        this.executor = new ScheduledThreadPoolExecutor(poolSize, r -> {
            Thread t = new Thread(r);
            t.setName("guildcron.timer-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.executor.setRemoveOnCancelPolicy(true);
        this.executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    }

    public ScheduledExecutorJobTimer(int poolSize) {
        this(poolSize, Duration.ofSeconds(10));
    }

    @Override
    public ScheduledHandle arm(String id, Duration delay, Runnable callback) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(delay, "delay must not be null");
        Objects.requireNonNull(callback, "callback must not be null");

        long delayMs = Math.max(0L, delay.toMillis());
        TimerHandle handle = new TimerHandle(id);
        handle.future = executor.schedule(() -> handle.fire(callback), delayMs, TimeUnit.MILLISECONDS);
        log.debug("guildcron timer armed id={} delayMs={}", id, delayMs);
        return handle;
    }

    /**
     * Stop the executor, waiting for running callbacks up to the shutdown timeout.
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    private static final class TimerHandle implements ScheduledHandle {
        private final String id;
        private final AtomicBoolean cancelled = new AtomicBoolean(false);
        private volatile ScheduledFuture<?> future;

        private TimerHandle(String id) {
            this.id = id;
        }

        private void fire(Runnable callback) {
            if (cancelled.get()) {
                return;
            }
            try {
                callback.run();
            } catch (Exception e) {
                log.error("guildcron timer callback failed id={} msg={}", id, e.getMessage(), e);
            }
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public void cancel() {
            if (!cancelled.compareAndSet(false, true)) {
                return;
            }
            ScheduledFuture<?> f = future;
            if (f != null) {
                f.cancel(false);
            }
        }

        @Override
        public boolean isCancelled() {
            return cancelled.get();
        }
    }
}
