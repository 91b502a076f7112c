package de.bsommerfeld.traderelay.app;

import ch.qos.logback.classic.Level;
import com.google.inject.CreationException;
import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.traderelay.agent.EventRelayService;
import de.bsommerfeld.traderelay.agent.QueryResponder;
import de.bsommerfeld.traderelay.core.config.GlobalConfig;
import de.bsommerfeld.traderelay.core.util.StorageUtils;
import de.bsommerfeld.traderelay.dashboard.DashboardClient;
import de.bsommerfeld.traderelay.discord.InboundMessagePoller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Entry point. Builds the injector, starts the relay and the inbound poller
 * and blocks until the JVM is asked to stop.
 */
public final class RelayMain {

    static final String LOG_DIR_PROPERTY = "traderelay.logs";

    static {
        // Read by logback.xml, so it has to be set before the first logger exists.
        if (System.getProperty(LOG_DIR_PROPERTY) == null) {
            System.setProperty(LOG_DIR_PROPERTY, StorageUtils.getLogsDir(StorageUtils.APP_NAME).toString());
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(RelayMain.class);

    private RelayMain() {
    }

    public static void main(String[] args) throws InterruptedException {
        LOG.info("Starting Trade Relay...");

        Injector injector;
        try {
            injector = Guice.createInjector(new RelayModule());
        } catch (CreationException e) {
            LOG.error("Startup failed: {}", e.getMessage());
            System.exit(1);
            return;
        }

        if (injector.getInstance(GlobalConfig.class).isDebugMode()) {
            ((ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME)).setLevel(Level.DEBUG);
            LOG.debug("Debug logging enabled");
        }

        injector.getInstance(DashboardClient.class).fetchEventStats().ifPresentOrElse(
                stats -> LOG.info("Dashboard event stats: {}", stats),
                () -> LOG.warn("Dashboard API not reachable at startup. Polling anyway."));

        EventRelayService relay = injector.getInstance(EventRelayService.class);
        InboundMessagePoller poller = injector.getInstance(InboundMessagePoller.class);
        QueryResponder responder = injector.getInstance(QueryResponder.class);

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutting down...");
            poller.shutdown();
            relay.shutdown();
            responder.shutdown();
            stopped.countDown();
        }, "Shutdown"));

        relay.start();
        poller.start();
        stopped.await();
    }
}
