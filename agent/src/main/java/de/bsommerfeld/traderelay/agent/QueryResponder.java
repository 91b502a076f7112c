package de.bsommerfeld.traderelay.agent;

import com.google.common.eventbus.Subscribe;
import com.google.inject.Singleton;
import de.bsommerfeld.traderelay.core.config.RelayConfig;
import de.bsommerfeld.traderelay.core.domain.DecisionView;
import de.bsommerfeld.traderelay.core.domain.InboundMessage;
import de.bsommerfeld.traderelay.core.domain.PortfolioSnapshot;
import de.bsommerfeld.traderelay.core.domain.PositionView;
import de.bsommerfeld.traderelay.core.event.ApplicationEventBus;
import de.bsommerfeld.traderelay.core.event.RelayEvents.InboundMessageEvent;
import de.bsommerfeld.traderelay.dashboard.DashboardClient;
import de.bsommerfeld.traderelay.discord.ChatChannels;
import de.bsommerfeld.traderelay.discord.ChatGateway;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Answers questions posted in the query channel.
 *
 * <p>
 * Inbound messages arrive on the poller thread via the event bus and are
 * handed to a small worker pool right away. A worker shows the typing
 * indicator, fetches portfolio, positions and decisions in parallel,
 * builds the answer and replies to the original message. A section whose
 * fetch failed is left out of the context; the answer is produced anyway.
 */
@Singleton
public class QueryResponder {

    private static final Logger LOG = LoggerFactory.getLogger(QueryResponder.class);

    private final DashboardClient client;
    private final MessageFormatter formatter;
    private final ChatGateway gateway;
    private final ChatChannels channels;
    private final ApplicationEventBus eventBus;
    private final int maxPositions;
    private final int decisionLimit;
    private final ExecutorService workers;
    private final AtomicBoolean stopped = new AtomicBoolean();

    @Inject
    public QueryResponder(DashboardClient client, MessageFormatter formatter, ChatGateway gateway,
            ChatChannels channels, ApplicationEventBus eventBus, RelayConfig config) {
        this.client = client;
        this.formatter = formatter;
        this.gateway = gateway;
        this.channels = channels;
        this.eventBus = eventBus;
        this.maxPositions = Math.max(0, config.getMaxPositions());
        this.decisionLimit = Math.max(1, config.getDecisionLimit());

        AtomicInteger counter = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(Math.max(1, config.getQueryWorkers()), r -> {
            Thread t = new Thread(r, "QueryWorker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.eventBus.register(this);
    }

    public void shutdown() {
        if (stopped.compareAndSet(false, true)) {
            eventBus.unregister(this);
            workers.shutdownNow();
        }
    }

    // -- Inbound --

    @Subscribe
    public void onInboundMessage(InboundMessageEvent event) {
        InboundMessage message = event.message();
        if (!accepts(message)) {
            return;
        }
        workers.execute(() -> handle(message));
    }

    boolean accepts(InboundMessage message) {
        if (!channels.isQueryChannel(message.channelId())) {
            return false;
        }
        if (message.bot()) {
            return false;
        }
        if (gateway.selfId().map(id -> id.equals(message.authorId())).orElse(false)) {
            return false;
        }
        return message.content() != null && !message.content().isBlank();
    }

    void handle(InboundMessage message) {
        try {
            LOG.info("Question from {}: {}", message.authorName(), message.content());
            gateway.sendTyping(message.channelId());
            String answer = answer(message.content());
            if (!gateway.reply(message.channelId(), message.messageId(), answer)) {
                LOG.error("Reply to message {} could not be posted", message.messageId());
            }
        } catch (Exception e) {
            LOG.error("Answering message {} failed", message.messageId(), e);
        }
    }

    // -- Answering --

    /** Gathers fresh data and answers {@code question}. Never returns an empty string. */
    public String answer(String question) {
        return formatter.answerQuery(question, gatherContext());
    }

    QueryContext gatherContext() {
        CompletableFuture<Optional<PortfolioSnapshot>> portfolio = CompletableFuture
                .supplyAsync(client::fetchPortfolioSummary)
                .exceptionally(e -> failed("portfolio", e, Optional.<PortfolioSnapshot>empty()));
        CompletableFuture<List<PositionView>> positions = CompletableFuture
                .supplyAsync(() -> client.fetchPositions().orElse(List.of()))
                .exceptionally(e -> failed("positions", e, List.of()));
        CompletableFuture<List<DecisionView>> decisions = CompletableFuture
                .supplyAsync(() -> client.fetchDecisions(decisionLimit).orElse(List.of()))
                .exceptionally(e -> failed("decisions", e, List.of()));

        List<PositionView> shownPositions = positions.join();
        if (shownPositions.size() > maxPositions) {
            shownPositions = shownPositions.subList(0, maxPositions);
        }
        return new QueryContext(portfolio.join(), shownPositions, decisions.join());
    }

    private static <T> T failed(String section, Throwable e, T empty) {
        LOG.error("Fetching {} failed", section, e);
        return empty;
    }
}
