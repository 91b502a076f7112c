package de.bsommerfeld.traderelay.discord;

import java.util.Optional;

/**
 * Channel handles resolved once at startup. Immutable; passed to the relay
 * and the query responder instead of being looked up per message.
 *
 * @param eventChannelId channel receiving relayed trade events
 * @param queryChannelId channel whose messages are answered
 */
public record ChatChannels(Optional<String> eventChannelId, Optional<String> queryChannelId) {

    public static ChatChannels of(String eventChannelId, String queryChannelId) {
        return new ChatChannels(Optional.ofNullable(eventChannelId), Optional.ofNullable(queryChannelId));
    }

    public static ChatChannels none() {
        return new ChatChannels(Optional.empty(), Optional.empty());
    }

    public boolean isQueryChannel(String channelId) {
        return channelId != null && queryChannelId.map(channelId::equals).orElse(false);
    }
}
