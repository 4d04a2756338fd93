package io.guildcron.core;

/**
 * Bad minute/hour/day/timezone input. Always the caller's fault and never retried.
 */
public class ValidationException extends GuildCronException {

    public ValidationException(String message) {
        super(message);
    }
}
