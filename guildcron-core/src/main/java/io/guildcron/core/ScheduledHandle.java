package io.guildcron.core;

/**
 * A live timer or cron registration held by {@link JobRegistry}.
 *
 * <p>{@link #cancel()} may be called any number of times. Once it returns no further firing starts;
 * a firing already running is allowed to finish.
 */
public interface ScheduledHandle {

    String id();

    void cancel();

    boolean isCancelled();
}
