package de.bsommerfeld.traderelay.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root of {@code config.toml}. Each section maps to one table in the file.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class GlobalConfig {

    @JsonProperty("debug-mode")
    private boolean debugMode = false;

    @JsonProperty("api")
    private ApiConfig api = new ApiConfig();

    @JsonProperty("discord")
    private DiscordConfig discord = new DiscordConfig();

    @JsonProperty("agent")
    private AgentConfig agent = new AgentConfig();

    @JsonProperty("relay")
    private RelayConfig relay = new RelayConfig();

    public boolean isDebugMode() {
        return debugMode;
    }

    public ApiConfig getApi() {
        return api;
    }

    public DiscordConfig getDiscord() {
        return discord;
    }

    public AgentConfig getAgent() {
        return agent;
    }

    public RelayConfig getRelay() {
        return relay;
    }
}
