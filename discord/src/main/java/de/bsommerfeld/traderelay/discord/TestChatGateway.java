package de.bsommerfeld.traderelay.discord;

import com.google.inject.Singleton;
import de.bsommerfeld.traderelay.core.domain.InboundMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory {@link ChatGateway} for TEST mode. Every channel name resolves,
 * sends are logged and recorded, and inbound messages can be injected with
 * {@link #simulateInbound(String, String)}.
 */
@Singleton
public class TestChatGateway implements ChatGateway {

    private static final Logger LOG = LoggerFactory.getLogger(TestChatGateway.class);

    static final String SELF_ID = "1";
    private static final String CHANNEL_PREFIX = "test-";

    /**
     * A recorded outbound message.
     *
     * @param replyTo id of the answered message, {@code null} for plain sends
     */
    public record SentMessage(String channelId, String replyTo, String content) {
    }

    private final List<SentMessage> sent = new CopyOnWriteArrayList<>();
    private final List<InboundMessage> inbound = new CopyOnWriteArrayList<>();
    private final AtomicLong nextMessageId = new AtomicLong(1000);

    public TestChatGateway() {
        LOG.warn("==========================================================");
        LOG.warn("  TEST MODE: Discord is simulated, nothing is posted");
        LOG.warn("==========================================================");
    }

    @Override
    public Optional<String> selfId() {
        return Optional.of(SELF_ID);
    }

    @Override
    public Optional<String> findTextChannel(String name) {
        return Optional.of(CHANNEL_PREFIX + name);
    }

    @Override
    public boolean send(String channelId, String content) {
        LOG.info("[TEST] #{} <- {}", channelId, content);
        sent.add(new SentMessage(channelId, null, content));
        return true;
    }

    @Override
    public boolean reply(String channelId, String messageId, String content) {
        LOG.info("[TEST] #{} <- (reply to {}) {}", channelId, messageId, content);
        sent.add(new SentMessage(channelId, messageId, content));
        return true;
    }

    @Override
    public void sendTyping(String channelId) {
        LOG.debug("[TEST] #{} typing...", channelId);
    }

    @Override
    public Optional<List<InboundMessage>> fetchMessagesAfter(String channelId, String afterMessageId) {
        long after = afterMessageId == null ? -1 : Long.parseLong(afterMessageId);
        List<InboundMessage> result = new ArrayList<>();
        for (InboundMessage message : inbound) {
            if (message.channelId().equals(channelId) && Long.parseLong(message.messageId()) > after) {
                result.add(message);
            }
        }
        return Optional.of(result);
    }

    /** Queues a user message as if it had been typed into {@code channelId}. */
    public InboundMessage simulateInbound(String channelId, String content) {
        InboundMessage message = new InboundMessage(String.valueOf(nextMessageId.getAndIncrement()),
                channelId, "42", "tester", content, false);
        inbound.add(message);
        return message;
    }

    public List<SentMessage> sentMessages() {
        return List.copyOf(sent);
    }
}
