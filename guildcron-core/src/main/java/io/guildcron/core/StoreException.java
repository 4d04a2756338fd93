package io.guildcron.core;

/**
 * Persistence failure. The operation is abandoned for this cycle; recurring jobs retry on their next fire.
 */
public class StoreException extends GuildCronException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
