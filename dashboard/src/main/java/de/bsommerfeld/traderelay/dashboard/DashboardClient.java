package de.bsommerfeld.traderelay.dashboard;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.inject.Singleton;
import de.bsommerfeld.traderelay.core.config.ApiConfig;
import de.bsommerfeld.traderelay.core.domain.DecisionView;
import de.bsommerfeld.traderelay.core.domain.PortfolioSnapshot;
import de.bsommerfeld.traderelay.core.domain.PositionView;
import de.bsommerfeld.traderelay.core.domain.TradeEvent;
import de.bsommerfeld.traderelay.core.util.TextBounds;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Client for the trading engine's dashboard API.
 *
 * <h3>Wire shape</h3>
 * Every call is a single {@code POST /api/dashboard} with a JSON body
 * {@code {"action": "<name>", ...params}} and the key in the
 * {@code x-api-key} header. The server answers
 * {@code {"success": true, "data": ...}}.
 *
 * <h3>Failure contract</h3>
 * Nothing here throws to the caller. A non-200 status, a transport error, a
 * timeout, an unparsable body or an error payload all end up as
 * {@link Optional#empty()} after the cause has been logged. There is no retry
 * in the client: the relay's next poll cycle is the retry.
 *
 * <p>
 * One {@link HttpClient} and one {@link ObjectMapper} are shared by all
 * calls, so the client is safe to use from the relay thread and the query
 * workers at the same time.
 *
 * @see TestDashboardClient
 */
@Singleton
public class DashboardClient {

    private static final Logger LOG = LoggerFactory.getLogger(DashboardClient.class);

    static final String ENDPOINT_PATH = "/api/dashboard";

    /** Response bodies are cut to this length before they are logged. */
    private static final int LOGGED_BODY_MAX = 200;

    protected final ObjectMapper mapper;
    private final HttpClient httpClient;
    private final URI endpoint;
    private final String apiKey;
    private final Duration timeout;

    @Inject
    public DashboardClient(ApiConfig config) {
        this.mapper = new ObjectMapper();
        this.timeout = Duration.ofSeconds(config.getTimeoutSeconds());
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        this.endpoint = URI.create(stripTrailingSlash(config.getBaseUrl()) + ENDPOINT_PATH);
        this.apiKey = config.getApiKey() == null ? "" : config.getApiKey();
    }

    // -- Generic RPC --

    /**
     * Executes one action against the dashboard endpoint.
     *
     * @param action action to dispatch
     * @param params extra body members, merged next to {@code action}; may be
     *               {@code null}
     * @return the full response document, or empty if the call failed
     */
    public Optional<JsonNode> call(DashboardAction action, Map<String, ?> params) {
        try {
            ObjectNode body = mapper.createObjectNode();
            body.put("action", action.wireName());
            if (params != null) {
                params.forEach((key, value) -> body.set(key, mapper.valueToTree(value)));
            }

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(endpoint)
                    .timeout(timeout)
                    .header("x-api-key", apiKey)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)))
                    .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                LOG.error("API {} returned {}: {}", action, response.statusCode(),
                        TextBounds.truncate(response.body(), LOGGED_BODY_MAX));
                return Optional.empty();
            }

            JsonNode root = mapper.readTree(response.body());
            return acceptPayload(action, root);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.error("API {} interrupted", action);
            return Optional.empty();
        } catch (Exception e) {
            LOG.error("API {} failed: {}", action, e.toString());
            return Optional.empty();
        }
    }

    /**
     * Rejects documents that report failure in-band. The dashboard wraps
     * handler results in {@code data}, so an {@code error} member can sit on
     * either level.
     */
    protected Optional<JsonNode> acceptPayload(DashboardAction action, JsonNode root) {
        if (root == null || !root.isObject()) {
            LOG.error("API {} returned a non-object body", action);
            return Optional.empty();
        }
        JsonNode success = root.path("success");
        if (success.isBoolean() && !success.asBoolean()) {
            LOG.error("API {} reported failure: {}", action,
                    TextBounds.truncate(root.toString(), LOGGED_BODY_MAX));
            return Optional.empty();
        }
        if (root.has("error") || root.path("data").has("error")) {
            LOG.error("API {} returned error: {}", action,
                    TextBounds.truncate(root.toString(), LOGGED_BODY_MAX));
            return Optional.empty();
        }
        return Optional.of(root);
    }

    // -- Typed Operations --

    /** Fetches events that have not been acknowledged yet, oldest first. */
    public Optional<List<TradeEvent>> fetchPendingEvents() {
        return call(DashboardAction.GET_EVENTS, null)
                .map(root -> DashboardPayloads.events(root.path("data"), mapper));
    }

    /**
     * Acknowledges delivered events in one batch. The server ignores ids that
     * are already marked, so repeating a batch is harmless.
     *
     * @return {@code true} if the server accepted the batch or there was
     *         nothing to send
     */
    public boolean markEventsPosted(List<Long> eventIds) {
        if (eventIds == null || eventIds.isEmpty()) {
            return true;
        }
        return call(DashboardAction.MARK_EVENTS_POSTED, Map.of("eventIds", eventIds)).isPresent();
    }

    public Optional<PortfolioSnapshot> fetchPortfolioSummary() {
        return call(DashboardAction.GET_PORTFOLIO_SUMMARY, null)
                .map(root -> root.path("data"))
                .filter(JsonNode::isObject)
                .map(DashboardPayloads::portfolio);
    }

    public Optional<List<PositionView>> fetchPositions() {
        return call(DashboardAction.GET_POSITIONS, null)
                .map(root -> DashboardPayloads.positions(root.path("data")));
    }

    public Optional<List<DecisionView>> fetchDecisions(int limit) {
        return call(DashboardAction.GET_DECISIONS, Map.of("limit", limit))
                .map(root -> DashboardPayloads.decisions(root.path("data")));
    }

    /** Pending/posted counters; only used for the startup log. */
    public Optional<JsonNode> fetchEventStats() {
        return call(DashboardAction.GET_EVENT_STATS, null)
                .map(root -> root.path("data"));
    }

    private static String stripTrailingSlash(String url) {
        String trimmed = url == null ? "" : url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
