package de.bsommerfeld.traderelay.app;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import de.bsommerfeld.traderelay.agent.DisabledTextGenerator;
import de.bsommerfeld.traderelay.agent.OllamaTextGenerator;
import de.bsommerfeld.traderelay.agent.QueryResponder;
import de.bsommerfeld.traderelay.agent.TextGenerator;
import de.bsommerfeld.traderelay.core.config.AgentConfig;
import de.bsommerfeld.traderelay.core.config.ApiConfig;
import de.bsommerfeld.traderelay.core.config.ApplicationMode;
import de.bsommerfeld.traderelay.core.config.ConfigLoader;
import de.bsommerfeld.traderelay.core.config.DiscordConfig;
import de.bsommerfeld.traderelay.core.config.GlobalConfig;
import de.bsommerfeld.traderelay.core.config.RelayConfig;
import de.bsommerfeld.traderelay.core.util.StorageUtils;
import de.bsommerfeld.traderelay.dashboard.DashboardClient;
import de.bsommerfeld.traderelay.dashboard.TestDashboardClient;
import de.bsommerfeld.traderelay.discord.ChannelResolver;
import de.bsommerfeld.traderelay.discord.ChatChannels;
import de.bsommerfeld.traderelay.discord.ChatGateway;
import de.bsommerfeld.traderelay.discord.DiscordGateway;
import de.bsommerfeld.traderelay.discord.TestChatGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Guice module wiring configuration, the external collaborators and the
 * relay components.
 */
public class RelayModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(RelayModule.class);

    private final GlobalConfig preloaded;
    private final ApplicationMode mode;

    public RelayModule() {
        this(null, ApplicationMode.get());
    }

    /** Uses the given configuration instead of reading {@code config.toml}. */
    RelayModule(GlobalConfig config, ApplicationMode mode) {
        this.preloaded = config;
        this.mode = mode;
    }

    @Override
    protected void configure() {
        GlobalConfig config = preloaded != null ? preloaded : loadConfig();

        bind(GlobalConfig.class).toInstance(config);
        bind(ApiConfig.class).toInstance(config.getApi());
        bind(DiscordConfig.class).toInstance(config.getDiscord());
        bind(AgentConfig.class).toInstance(config.getAgent());
        bind(RelayConfig.class).toInstance(config.getRelay());

        // --- MODE SWITCHING (PROD vs TEST) ---
        LOG.info("Application Mode initialized: {}", mode);
        if (mode.isTest()) {
            bind(DashboardClient.class).to(TestDashboardClient.class);
            bind(ChatGateway.class).to(TestChatGateway.class);
        } else {
            // DashboardClient binds to itself via JIT (@Singleton on class)
            bind(ChatGateway.class).to(DiscordGateway.class);
        }

        if (config.getAgent().isEnabled()) {
            bind(TextGenerator.class).to(OllamaTextGenerator.class);
        } else {
            LOG.info("Text generation disabled, all messages use templates");
            bind(TextGenerator.class).to(DisabledTextGenerator.class).in(Singleton.class);
        }

        // Registers itself on the event bus
        bind(QueryResponder.class).asEagerSingleton();
    }

    @Provides
    @Singleton
    ChatChannels provideChannels(ChatGateway gateway, DiscordConfig config) {
        return ChannelResolver.resolve(gateway, config);
    }

    private static GlobalConfig loadConfig() {
        Path configPath = StorageUtils.getConfigFile();
        LOG.info("Loading Configuration from: {}", configPath.toAbsolutePath());
        try {
            return ConfigLoader.load(configPath);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to load Application Configuration from " + configPath, e);
        }
    }
}
