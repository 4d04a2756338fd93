package io.guildcron;

import io.guildcron.core.ScheduledHandle;

import java.time.Duration;

/**
 * Single-shot timer capability. Armed timers do not survive a restart; callers recompute delays from
 * persisted trigger times instead.
 */
public interface JobTimer {

    /**
     * Run {@code callback} once after {@code delay}. A zero or negative delay runs as soon as possible.
     */
    ScheduledHandle arm(String id, Duration delay, Runnable callback);
}
