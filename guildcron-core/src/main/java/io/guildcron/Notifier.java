package io.guildcron;

import io.guildcron.core.AnnouncementPayload;

/**
 * Outbound message channel. Failures surface as {@link io.guildcron.core.NotifyException}.
 */
public interface Notifier {

    void send(String channelId, String content);

    void send(String channelId, AnnouncementPayload payload);
}
