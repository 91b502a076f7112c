package de.bsommerfeld.traderelay.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Discord bot credentials and the two channel names resolved at startup.
 * The event channel only receives posts; the query channel is read and
 * answered.
 */
public class DiscordConfig {

    @JsonProperty("bot-token")
    private String botToken = "";

    @JsonProperty("event-channel")
    private String eventChannel = "daily_report";

    @JsonProperty("query-channel")
    private String queryChannel = "dashboard";

    @JsonProperty("inbound-poll-seconds")
    private long inboundPollSeconds = 3;

    @JsonProperty("timeout-seconds")
    private long timeoutSeconds = 10;

    public String getBotToken() {
        return botToken;
    }

    public void setBotToken(String botToken) {
        this.botToken = botToken;
    }

    public String getEventChannel() {
        return eventChannel;
    }

    public String getQueryChannel() {
        return queryChannel;
    }

    public long getInboundPollSeconds() {
        return inboundPollSeconds;
    }

    public long getTimeoutSeconds() {
        return timeoutSeconds;
    }
}
