package de.bsommerfeld.traderelay.app;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.traderelay.agent.DisabledTextGenerator;
import de.bsommerfeld.traderelay.agent.EventRelayService;
import de.bsommerfeld.traderelay.agent.OllamaTextGenerator;
import de.bsommerfeld.traderelay.agent.QueryResponder;
import de.bsommerfeld.traderelay.agent.TextGenerator;
import de.bsommerfeld.traderelay.core.config.ApplicationMode;
import de.bsommerfeld.traderelay.core.config.GlobalConfig;
import de.bsommerfeld.traderelay.dashboard.DashboardClient;
import de.bsommerfeld.traderelay.dashboard.TestDashboardClient;
import de.bsommerfeld.traderelay.discord.ChatChannels;
import de.bsommerfeld.traderelay.discord.ChatGateway;
import de.bsommerfeld.traderelay.discord.TestChatGateway;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Builds the real injector in TEST mode, where no network is touched.
 */
class RelayModuleTest {

    private Injector injector;

    @AfterEach
    void tearDown() {
        if (injector != null) {
            injector.getInstance(QueryResponder.class).shutdown();
        }
    }

    private Injector testInjector(boolean generation) {
        GlobalConfig config = new GlobalConfig();
        config.getAgent().setEnabled(generation);
        injector = Guice.createInjector(new RelayModule(config, ApplicationMode.TEST));
        return injector;
    }

    @Test
    void testMode_shouldBindInMemoryCollaborators() {
        Injector injector = testInjector(false);

        assertInstanceOf(TestDashboardClient.class, injector.getInstance(DashboardClient.class));
        assertInstanceOf(TestChatGateway.class, injector.getInstance(ChatGateway.class));
        assertSame(injector.getInstance(ChatGateway.class), injector.getInstance(ChatGateway.class));
    }

    @Test
    void channels_shouldBeResolvedFromConfiguredNames() {
        ChatChannels channels = testInjector(false).getInstance(ChatChannels.class);

        assertEquals(Optional.of("test-daily_report"), channels.eventChannelId());
        assertEquals(Optional.of("test-dashboard"), channels.queryChannelId());
    }

    @Test
    void textGenerator_shouldFollowAgentSwitch() {
        assertInstanceOf(DisabledTextGenerator.class, testInjector(false).getInstance(TextGenerator.class));

        injector.getInstance(QueryResponder.class).shutdown();
        assertInstanceOf(OllamaTextGenerator.class, testInjector(true).getInstance(TextGenerator.class));
    }

    @Test
    void relayCycle_shouldPostSeededEventsAndAcknowledgeThem() {
        Injector injector = testInjector(false);
        TestChatGateway gateway = (TestChatGateway) injector.getInstance(ChatGateway.class);
        TestDashboardClient client = (TestDashboardClient) injector.getInstance(DashboardClient.class);

        EventRelayService.CycleReport report = injector.getInstance(EventRelayService.class).runCycle();

        assertEquals(new EventRelayService.CycleReport(2, 2, 2), report);
        List<TestChatGateway.SentMessage> sent = gateway.sentMessages();
        assertTrue(sent.get(0).content().startsWith("🚀 **Engine Started** | 12 symbols"));
        assertTrue(sent.get(1).content().startsWith("🟢 **BUY** BTCUSDT @ $65000"));
        assertEquals(2, client.acknowledgedIds().size());
    }
}
