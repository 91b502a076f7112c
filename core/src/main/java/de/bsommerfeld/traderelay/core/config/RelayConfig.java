package de.bsommerfeld.traderelay.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Polling cadence of the event relay and sizing of the query context.
 * Loaded once at startup.
 */
public class RelayConfig {

    @JsonProperty("poll-interval-seconds")
    private long pollIntervalSeconds = 30;

    @JsonProperty("initial-delay-seconds")
    private long initialDelaySeconds = 5;

    @JsonProperty("max-positions")
    private int maxPositions = 5;

    @JsonProperty("decision-limit")
    private int decisionLimit = 3;

    @JsonProperty("query-workers")
    private int queryWorkers = 2;

    public long getPollIntervalSeconds() {
        return pollIntervalSeconds;
    }

    public void setPollIntervalSeconds(long pollIntervalSeconds) {
        this.pollIntervalSeconds = pollIntervalSeconds;
    }

    public long getInitialDelaySeconds() {
        return initialDelaySeconds;
    }

    public void setInitialDelaySeconds(long initialDelaySeconds) {
        this.initialDelaySeconds = initialDelaySeconds;
    }

    public int getMaxPositions() {
        return maxPositions;
    }

    public int getDecisionLimit() {
        return decisionLimit;
    }

    public int getQueryWorkers() {
        return queryWorkers;
    }
}
