package de.bsommerfeld.traderelay.discord;

import de.bsommerfeld.traderelay.core.domain.InboundMessage;

import java.util.List;
import java.util.Optional;

/**
 * Outbound sink and inbound source for chat messages. Implementations must
 * be safe for concurrent use: the relay and the query workers send through
 * the same instance.
 *
 * <p>
 * No method throws. Failures are logged by the implementation and surface
 * as {@code false} or an empty result.
 */
public interface ChatGateway {

    /** Id of the account this gateway posts as. */
    Optional<String> selfId();

    /** Id of the first text channel with the given name, across all guilds. */
    Optional<String> findTextChannel(String name);

    /** @return {@code true} once the platform confirmed the message */
    boolean send(String channelId, String content);

    /** Posts {@code content} as a reply to {@code messageId}. */
    boolean reply(String channelId, String messageId, String content);

    /** Shows the typing indicator; best-effort. */
    void sendTyping(String channelId);

    /**
     * Messages newer than {@code afterMessageId}, oldest first. With a
     * {@code null} cursor the most recent page is returned.
     *
     * @return empty if the fetch failed, which callers must not confuse with
     *         "no new messages"
     */
    Optional<List<InboundMessage>> fetchMessagesAfter(String channelId, String afterMessageId);
}
