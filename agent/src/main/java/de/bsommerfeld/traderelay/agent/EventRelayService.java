package de.bsommerfeld.traderelay.agent;

import com.google.inject.Singleton;
import de.bsommerfeld.traderelay.core.config.RelayConfig;
import de.bsommerfeld.traderelay.core.domain.TradeEvent;
import de.bsommerfeld.traderelay.dashboard.DashboardClient;
import de.bsommerfeld.traderelay.discord.ChatChannels;
import de.bsommerfeld.traderelay.discord.ChatGateway;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Moves pending trade events from the dashboard API into the event channel.
 *
 * <h3>Cycle</h3>
 * Fetch pending events, format and post each one in fetch order, then
 * acknowledge the ids that were actually posted with a single
 * {@code mark_events_posted} call. An event whose post failed is not
 * acknowledged and comes back with the next fetch. If the acknowledgment
 * itself fails, the posted events come back too and are posted again.
 *
 * <h3>Scheduling</h3>
 * Cycles run on one thread with a fixed delay between the end of a cycle
 * and the start of the next, so a slow cycle never overlaps the following
 * one. A cycle that throws is logged and the schedule continues.
 */
@Singleton
public class EventRelayService {

    private static final Logger LOG = LoggerFactory.getLogger(EventRelayService.class);

    private static final long SHUTDOWN_WAIT_SECONDS = 30;

    public enum State {
        IDLE,
        POLLING
    }

    /**
     * Outcome of one cycle.
     *
     * @param fetched      events returned by the fetch, duplicates included
     * @param delivered    events posted to the channel
     * @param acknowledged events confirmed as posted upstream
     */
    public record CycleReport(int fetched, int delivered, int acknowledged) {

        static final CycleReport NOTHING = new CycleReport(0, 0, 0);
    }

    private final DashboardClient client;
    private final MessageFormatter formatter;
    private final ChatGateway gateway;
    private final ChatChannels channels;
    private final long initialDelaySeconds;
    private final long pollIntervalSeconds;

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "EventRelay");
        t.setDaemon(true);
        return t;
    });
    private final AtomicBoolean started = new AtomicBoolean();
    private volatile State state = State.IDLE;

    @Inject
    public EventRelayService(DashboardClient client, MessageFormatter formatter, ChatGateway gateway,
            ChatChannels channels, RelayConfig config) {
        this.client = client;
        this.formatter = formatter;
        this.gateway = gateway;
        this.channels = channels;
        this.initialDelaySeconds = Math.max(0, config.getInitialDelaySeconds());
        this.pollIntervalSeconds = Math.max(1, config.getPollIntervalSeconds());
    }

    // -- Lifecycle --

    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        LOG.info("Event polling started (every {}s, first cycle in {}s)", pollIntervalSeconds, initialDelaySeconds);
        scheduler.scheduleWithFixedDelay(this::safeCycle, initialDelaySeconds, pollIntervalSeconds,
                TimeUnit.SECONDS);
    }

    /**
     * Stops scheduling and gives an in-flight cycle a bounded time to finish.
     * Events of an abandoned cycle were not acknowledged and reappear on the
     * next start.
     */
    public void shutdown() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                LOG.warn("Relay cycle did not finish within {}s, abandoning it", SHUTDOWN_WAIT_SECONDS);
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public State state() {
        return state;
    }

    private void safeCycle() {
        try {
            CycleReport report = runCycle();
            if (report.fetched() > 0) {
                LOG.info("Relay cycle: {}", report);
            }
        } catch (Exception e) {
            LOG.error("Poll error", e);
        }
    }

    // -- Cycle --

    /** Runs one fetch, deliver, acknowledge pass on the calling thread. */
    public synchronized CycleReport runCycle() {
        state = State.POLLING;
        try {
            Optional<List<TradeEvent>> pending = client.fetchPendingEvents();
            if (pending.isEmpty() || pending.get().isEmpty()) {
                return CycleReport.NOTHING;
            }
            List<TradeEvent> events = pending.get();

            Optional<String> channelId = channels.eventChannelId();
            if (channelId.isEmpty()) {
                LOG.warn("{} pending events, but no event channel is resolved. Nothing posted.", events.size());
                return new CycleReport(events.size(), 0, 0);
            }

            List<Long> delivered = deliver(events, channelId.get());
            if (delivered.isEmpty()) {
                return new CycleReport(events.size(), 0, 0);
            }

            boolean acknowledged = client.markEventsPosted(delivered);
            if (acknowledged) {
                LOG.info("Marked {} events as posted", delivered.size());
            } else {
                LOG.error("Could not mark {} events as posted. They will be posted again.", delivered.size());
            }
            return new CycleReport(events.size(), delivered.size(), acknowledged ? delivered.size() : 0);
        } finally {
            state = State.IDLE;
        }
    }

    /** Posts each distinct event once, in order, and returns the ids that went through. */
    private List<Long> deliver(List<TradeEvent> events, String channelId) {
        Set<Long> seen = new HashSet<>();
        List<Long> delivered = new ArrayList<>();
        for (TradeEvent event : events) {
            if (!seen.add(event.id())) {
                LOG.debug("Skipping duplicate event #{} in this batch", event.id());
                continue;
            }
            try {
                String message = formatter.formatEvent(event);
                if (gateway.send(channelId, message)) {
                    delivered.add(event.id());
                    LOG.info("Posted event #{} ({})", event.id(), event.eventType());
                } else {
                    LOG.warn("Posting event #{} failed, retrying next cycle", event.id());
                }
            } catch (Exception e) {
                LOG.error("Event #{} could not be relayed", event.id(), e);
            }
        }
        return delivered;
    }
}
