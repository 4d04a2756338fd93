package io.guildcron.config;

import io.guildcron.core.AnnouncementConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Runtime configuration for the guildcron scheduler.
 */
@ConfigurationProperties(prefix = "guildcron")
public class GuildCronProperties {
    private boolean enabled = true;
    private String defaultTimezone = AnnouncementConfig.DEFAULT_TIMEZONE; // reminder crons
    private Duration misfireGrace = Duration.ZERO;
    private int timerPoolSize = 4;
    private Duration timerShutdownTimeout = Duration.ofSeconds(10);
    private Duration eventCacheTtl = Duration.ofHours(1);
    private int eventMaxResults = 10;
    private boolean ensureIndexesOnStartup = false;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getDefaultTimezone() {
        return defaultTimezone;
    }

    public void setDefaultTimezone(String defaultTimezone) {
        this.defaultTimezone = defaultTimezone;
    }

    public Duration getMisfireGrace() {
        return misfireGrace;
    }

    public void setMisfireGrace(Duration misfireGrace) {
        this.misfireGrace = misfireGrace;
    }

    public int getTimerPoolSize() {
        return timerPoolSize;
    }

    public void setTimerPoolSize(int timerPoolSize) {
        this.timerPoolSize = timerPoolSize;
    }

    public Duration getTimerShutdownTimeout() {
        return timerShutdownTimeout;
    }

    public void setTimerShutdownTimeout(Duration timerShutdownTimeout) {
        this.timerShutdownTimeout = timerShutdownTimeout;
    }

    public Duration getEventCacheTtl() {
        return eventCacheTtl;
    }

    public void setEventCacheTtl(Duration eventCacheTtl) {
        this.eventCacheTtl = eventCacheTtl;
    }

    public int getEventMaxResults() {
        return eventMaxResults;
    }

    public void setEventMaxResults(int eventMaxResults) {
        this.eventMaxResults = eventMaxResults;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }
}
