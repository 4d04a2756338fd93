package io.guildcron.core;

/**
 * Base type for all scheduler failures.
 */
public class GuildCronException extends RuntimeException {

    public GuildCronException(String message) {
        super(message);
    }

    public GuildCronException(String message, Throwable cause) {
        super(message, cause);
    }
}
