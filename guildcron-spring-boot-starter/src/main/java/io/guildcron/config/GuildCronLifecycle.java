package io.guildcron.config;

import io.guildcron.GuildScheduler;
import org.springframework.context.SmartLifecycle;

/**
 * Bridges scheduler initialize/shutdown with the Spring container lifecycle.
 */
public class GuildCronLifecycle implements SmartLifecycle {
    private final GuildScheduler scheduler;
    private volatile boolean running = false;

    public GuildCronLifecycle(GuildScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public void start() {
        scheduler.initialize();
        running = true;
    }

    @Override
    public void stop() {
        scheduler.shutdown();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    // last to start, first to stop
    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }
}
