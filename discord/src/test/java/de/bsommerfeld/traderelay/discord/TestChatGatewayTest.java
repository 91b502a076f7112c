package de.bsommerfeld.traderelay.discord;

import de.bsommerfeld.traderelay.core.domain.InboundMessage;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TestChatGatewayTest {

    private final TestChatGateway gateway = new TestChatGateway();

    @Test
    void send_shouldRecordMessages() {
        String channel = gateway.findTextChannel("daily_report").orElseThrow();

        assertTrue(gateway.send(channel, "hello"));
        assertTrue(gateway.reply(channel, "1000", "answer"));

        List<TestChatGateway.SentMessage> sent = gateway.sentMessages();
        assertEquals(2, sent.size());
        assertNull(sent.get(0).replyTo());
        assertEquals("1000", sent.get(1).replyTo());
    }

    @Test
    void fetchMessagesAfter_shouldOnlyReturnNewerMessagesOfThatChannel() {
        InboundMessage first = gateway.simulateInbound("test-dashboard", "one");
        gateway.simulateInbound("test-other", "elsewhere");
        InboundMessage third = gateway.simulateInbound("test-dashboard", "two");

        List<InboundMessage> newer = gateway.fetchMessagesAfter("test-dashboard", first.messageId()).orElseThrow();

        assertEquals(List.of(third), newer);
    }
}
