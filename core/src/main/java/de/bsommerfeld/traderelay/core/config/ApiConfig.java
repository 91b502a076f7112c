package de.bsommerfeld.traderelay.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Connection parameters for the trading engine's dashboard API.
 */
public class ApiConfig {

    @JsonProperty("base-url")
    private String baseUrl = "http://localhost:3000";

    @JsonProperty("api-key")
    private String apiKey = "";

    @JsonProperty("timeout-seconds")
    private long timeoutSeconds = 15;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public long getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(long timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }
}
