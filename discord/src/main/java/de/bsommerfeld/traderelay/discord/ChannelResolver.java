package de.bsommerfeld.traderelay.discord;

import de.bsommerfeld.traderelay.core.config.DiscordConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Looks up the configured channel names once. A missing channel is not
 * fatal: the feature depending on it is disabled and a warning explains
 * why.
 */
public final class ChannelResolver {

    private static final Logger LOG = LoggerFactory.getLogger(ChannelResolver.class);

    private ChannelResolver() {
    }

    public static ChatChannels resolve(ChatGateway gateway, DiscordConfig config) {
        Optional<String> events = lookup(gateway, config.getEventChannel(), "cannot post events");
        Optional<String> queries = lookup(gateway, config.getQueryChannel(), "cannot answer questions");
        return new ChatChannels(events, queries);
    }

    private static Optional<String> lookup(ChatGateway gateway, String name, String consequence) {
        if (name == null || name.isBlank()) {
            LOG.warn("No channel name configured, {}", consequence);
            return Optional.empty();
        }
        Optional<String> id = gateway.findTextChannel(name);
        if (id.isPresent()) {
            LOG.info("Resolved channel #{} -> {}", name, id.get());
        } else {
            LOG.warn("Channel #{} not found, {}", name, consequence);
        }
        return id;
    }
}
