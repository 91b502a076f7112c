package de.bsommerfeld.traderelay.core.domain;

/**
 * A chat message read from the query channel.
 *
 * @param messageId  Discord snowflake of the message
 * @param channelId  channel the message was posted in
 * @param authorId   snowflake of the author
 * @param authorName display name, for logging only
 * @param content    raw message text
 * @param bot        whether the author is a bot account
 */
public record InboundMessage(
        String messageId,
        String channelId,
        String authorId,
        String authorName,
        String content,
        boolean bot) {
}
