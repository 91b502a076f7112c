package de.bsommerfeld.traderelay.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Running mode of the relay. {@link #TEST} swaps the dashboard API and the
 * Discord gateway for in-memory stand-ins so the whole pipeline can run
 * without credentials.
 */
public enum ApplicationMode {

    PROD,
    TEST;

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationMode.class);

    /**
     * Resolves the mode from the {@code traderelay.mode} system property or
     * the {@code TRADE_RELAY_MODE} environment variable. Defaults to PROD if
     * neither is set or the value is unknown.
     */
    public static ApplicationMode get() {
        String mode = System.getProperty("traderelay.mode");
        if (mode == null || mode.isEmpty()) {
            mode = System.getenv("TRADE_RELAY_MODE");
        }

        if (mode == null || mode.isEmpty()) {
            return PROD;
        }

        try {
            return ApplicationMode.valueOf(mode.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            LOG.warn("Unknown application mode '{}'. Defaulting to PROD.", mode);
            return PROD;
        }
    }

    public boolean isTest() {
        return this == TEST;
    }
}
