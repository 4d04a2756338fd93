package io.guildcron.internal;

import io.guildcron.JobTimer;
import io.guildcron.core.ScheduledHandle;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Registry entry for a one-time reminder. Exists before its timer is armed so the callback can
 * identify its own registration.
 */
final class OneShotHandle implements ScheduledHandle {
    private final String id;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private ScheduledHandle timerHandle;

    OneShotHandle(String id) {
        this.id = id;
    }

    static OneShotHandle arm(String id, JobTimer timer, Duration delay, Consumer<ScheduledHandle> callback) {
        OneShotHandle handle = new OneShotHandle(id);
        synchronized (handle) {
            handle.timerHandle = timer.arm(id, delay, () -> {
                if (!handle.cancelled.get()) {
                    callback.accept(handle);
                }
            });
        }
        return handle;
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
        synchronized (this) {
            if (timerHandle != null) {
                timerHandle.cancel();
            }
        }
    }

    @Override
    public boolean isCancelled() {
        return cancelled.get();
    }
}
