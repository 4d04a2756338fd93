package io.guildcron.core;

/**
 * The outbound channel was unreachable or refused the message.
 */
public class NotifyException extends GuildCronException {

    private final String channelId;

    public NotifyException(String channelId, String message) {
        super(message);
        this.channelId = channelId;
    }

    public NotifyException(String channelId, String message, Throwable cause) {
        super(message, cause);
        this.channelId = channelId;
    }

    public String getChannelId() {
        return channelId;
    }
}
