package de.bsommerfeld.traderelay.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

public class AgentConfig {

    @JsonProperty("enabled")
    private boolean enabled = true;

    @JsonProperty("ollama-base-url")
    private String ollamaBaseUrl = "http://localhost:11434";

    @JsonProperty("model")
    private String model = "llama3.1:8b";

    @JsonProperty("temperature")
    private double temperature = 0.3;

    @JsonProperty("timeout-seconds")
    private long timeoutSeconds = 60;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getOllamaBaseUrl() {
        return ollamaBaseUrl;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public double getTemperature() {
        return temperature;
    }

    public long getTimeoutSeconds() {
        return timeoutSeconds;
    }
}
