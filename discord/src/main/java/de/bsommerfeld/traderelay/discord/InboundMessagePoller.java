package de.bsommerfeld.traderelay.discord;

import com.google.inject.Singleton;
import de.bsommerfeld.traderelay.core.config.DiscordConfig;
import de.bsommerfeld.traderelay.core.domain.InboundMessage;
import de.bsommerfeld.traderelay.core.event.ApplicationEventBus;
import de.bsommerfeld.traderelay.core.event.RelayEvents;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Watches the query channel and posts one
 * {@link RelayEvents.InboundMessageEvent} per new message.
 *
 * <p>
 * The first successful poll only records the newest message id, so
 * questions asked while the relay was down are never answered. After that,
 * the cursor advances with every message seen. A failed fetch leaves the
 * cursor where it was.
 *
 * <p>
 * Polling runs on its own single thread. Handlers receive the event on that
 * thread and are expected to hand off real work.
 */
@Singleton
public class InboundMessagePoller {

    private static final Logger LOG = LoggerFactory.getLogger(InboundMessagePoller.class);

    /** Cursor used when the channel was empty on the first poll. */
    static final String EMPTY_CHANNEL_CURSOR = "0";

    private final ChatGateway gateway;
    private final ChatChannels channels;
    private final ApplicationEventBus eventBus;
    private final long pollSeconds;
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "InboundPoller");
        t.setDaemon(true);
        return t;
    });

    private volatile String cursor;

    @Inject
    public InboundMessagePoller(ChatGateway gateway, ChatChannels channels, ApplicationEventBus eventBus,
            DiscordConfig config) {
        this.gateway = gateway;
        this.channels = channels;
        this.eventBus = eventBus;
        this.pollSeconds = Math.max(1, config.getInboundPollSeconds());
    }

    public void start() {
        if (channels.queryChannelId().isEmpty()) {
            LOG.warn("No query channel resolved. Questions will not be answered.");
            return;
        }
        LOG.info("Watching query channel {} every {}s", channels.queryChannelId().get(), pollSeconds);
        scheduler.scheduleWithFixedDelay(this::safePoll, 0, pollSeconds, TimeUnit.SECONDS);
    }

    public void shutdown() {
        scheduler.shutdownNow();
    }

    private void safePoll() {
        try {
            pollOnce();
        } catch (Exception e) {
            LOG.error("Inbound poll failed", e);
        }
    }

    /**
     * Runs a single poll.
     *
     * @return number of events posted
     */
    public int pollOnce() {
        Optional<String> channelId = channels.queryChannelId();
        if (channelId.isEmpty()) {
            return 0;
        }

        String current = cursor;
        Optional<List<InboundMessage>> fetched = gateway.fetchMessagesAfter(channelId.get(), current);
        if (fetched.isEmpty()) {
            return 0;
        }
        List<InboundMessage> messages = fetched.get();

        if (current == null) {
            cursor = messages.isEmpty()
                    ? EMPTY_CHANNEL_CURSOR
                    : messages.get(messages.size() - 1).messageId();
            LOG.debug("Inbound cursor initialised at {}", cursor);
            return 0;
        }

        int posted = 0;
        for (InboundMessage message : messages) {
            cursor = message.messageId();
            eventBus.post(new RelayEvents.InboundMessageEvent(message));
            posted++;
        }
        return posted;
    }

    String cursor() {
        return cursor;
    }
}
