package de.bsommerfeld.traderelay.discord;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.inject.Singleton;
import de.bsommerfeld.traderelay.core.config.DiscordConfig;
import de.bsommerfeld.traderelay.core.domain.InboundMessage;
import de.bsommerfeld.traderelay.core.util.JsonFields;
import de.bsommerfeld.traderelay.core.util.TextBounds;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link ChatGateway} over the Discord REST API (v10). Only plain HTTP is
 * used: the relay never needs the websocket gateway because the query
 * channel is polled.
 *
 * <h3>Rate limits</h3>
 * Discord reports the remaining budget of the current bucket with every
 * response. When the bucket is drained the calling thread sleeps for
 * {@code X-RateLimit-Reset-After} before the next request can hit a 429.
 * A 429 that slips through is treated as a failed call after waiting out
 * {@code retry_after}; the caller's next cycle is the retry.
 */
@Singleton
public class DiscordGateway implements ChatGateway {

    private static final Logger LOG = LoggerFactory.getLogger(DiscordGateway.class);

    static final String DEFAULT_API_BASE = "https://discord.com/api/v10";
    private static final String USER_AGENT = "DiscordBot (trade-relay, 1.0)";

    private static final int GUILD_TEXT = 0;
    private static final int GUILD_ANNOUNCEMENT = 5;
    private static final int MESSAGE_PAGE_SIZE = 50;
    private static final int LOGGED_BODY_MAX = 200;
    private static final long MAX_RATE_LIMIT_WAIT_MS = 30_000;

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient httpClient;
    private final String apiBase;
    private final String authorization;
    private final Duration timeout;
    private final AtomicReference<String> selfId = new AtomicReference<>();

    @Inject
    public DiscordGateway(DiscordConfig config) {
        this(config, DEFAULT_API_BASE);
    }

    DiscordGateway(DiscordConfig config, String apiBase) {
        this.timeout = Duration.ofSeconds(config.getTimeoutSeconds());
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        this.apiBase = apiBase.endsWith("/") ? apiBase.substring(0, apiBase.length() - 1) : apiBase;

        String token = config.getBotToken() == null ? "" : config.getBotToken().trim();
        if (token.isEmpty()) {
            LOG.error("No Discord bot token configured (discord.bot-token or TRADE_RELAY_DISCORD_TOKEN). "
                    + "Every Discord call will be rejected.");
        }
        this.authorization = "Bot " + token;
    }

    // -- Identity & channels --

    @Override
    public Optional<String> selfId() {
        String cached = selfId.get();
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<String> fetched = getJson("/users/@me")
                .map(me -> JsonFields.text(me, "", "id"))
                .filter(id -> !id.isEmpty());
        fetched.ifPresent(id -> selfId.compareAndSet(null, id));
        return fetched;
    }

    @Override
    public Optional<String> findTextChannel(String name) {
        Optional<JsonNode> guilds = getJson("/users/@me/guilds");
        if (guilds.isEmpty() || !guilds.get().isArray()) {
            return Optional.empty();
        }
        for (JsonNode guild : guilds.get()) {
            String guildId = guild.path("id").asText("");
            if (guildId.isEmpty()) {
                continue;
            }
            Optional<JsonNode> channels = getJson("/guilds/" + guildId + "/channels");
            if (channels.isEmpty() || !channels.get().isArray()) {
                continue;
            }
            for (JsonNode channel : channels.get()) {
                int type = channel.path("type").asInt(-1);
                if ((type == GUILD_TEXT || type == GUILD_ANNOUNCEMENT)
                        && name.equals(channel.path("name").asText())) {
                    return Optional.of(channel.path("id").asText());
                }
            }
        }
        return Optional.empty();
    }

    // -- Outbound --

    @Override
    public boolean send(String channelId, String content) {
        return postMessage(channelId, content, null);
    }

    @Override
    public boolean reply(String channelId, String messageId, String content) {
        return postMessage(channelId, content, messageId);
    }

    @Override
    public void sendTyping(String channelId) {
        HttpRequest request = baseRequest("/channels/" + channelId + "/typing")
                .POST(HttpRequest.BodyPublishers.noBody())
                .build();
        execute(request, "typing");
    }

    private boolean postMessage(String channelId, String content, String replyTo) {
        ObjectNode body = mapper.createObjectNode();
        body.put("content", content);
        // Generated text must never ping @everyone or roles.
        body.putObject("allowed_mentions").putArray("parse");
        if (replyTo != null) {
            ObjectNode reference = body.putObject("message_reference");
            reference.put("message_id", replyTo);
            reference.put("fail_if_not_exists", false);
        }

        try {
            HttpRequest request = baseRequest("/channels/" + channelId + "/messages")
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)))
                    .build();
            return execute(request, "send message").isPresent();
        } catch (Exception e) {
            LOG.error("Could not encode message for channel {}: {}", channelId, e.toString());
            return false;
        }
    }

    // -- Inbound --

    @Override
    public Optional<List<InboundMessage>> fetchMessagesAfter(String channelId, String afterMessageId) {
        String path = "/channels/" + channelId + "/messages?limit=" + MESSAGE_PAGE_SIZE;
        if (afterMessageId != null && !afterMessageId.isEmpty()) {
            path += "&after=" + afterMessageId;
        }

        Optional<JsonNode> page = getJson(path);
        if (page.isEmpty()) {
            return Optional.empty();
        }
        if (!page.get().isArray()) {
            LOG.error("Unexpected message page for channel {}: {}", channelId,
                    TextBounds.truncate(page.get().toString(), LOGGED_BODY_MAX));
            return Optional.empty();
        }

        List<InboundMessage> messages = new ArrayList<>();
        for (JsonNode node : page.get()) {
            String id = node.path("id").asText("");
            if (id.isEmpty()) {
                continue;
            }
            JsonNode author = node.path("author");
            messages.add(new InboundMessage(
                    id,
                    node.path("channel_id").asText(channelId),
                    author.path("id").asText(""),
                    author.path("username").asText(""),
                    node.path("content").asText(""),
                    author.path("bot").asBoolean(false)));
        }
        // Discord pages newest first; snowflakes order by creation time.
        messages.sort(Comparator.comparing(m -> snowflake(m.messageId())));
        return Optional.of(messages);
    }

    static BigInteger snowflake(String id) {
        try {
            return new BigInteger(id);
        } catch (NumberFormatException e) {
            return BigInteger.ZERO;
        }
    }

    // -- HTTP --

    private Optional<JsonNode> getJson(String path) {
        HttpRequest request = baseRequest(path).GET().build();
        return execute(request, "GET " + path).flatMap(body -> {
            try {
                return Optional.of(mapper.readTree(body));
            } catch (Exception e) {
                LOG.error("Unparsable Discord response for {}: {}", path, e.getMessage());
                return Optional.empty();
            }
        });
    }

    private HttpRequest.Builder baseRequest(String path) {
        return HttpRequest.newBuilder()
                .uri(URI.create(apiBase + path))
                .timeout(timeout)
                .header("Authorization", authorization)
                .header("User-Agent", USER_AGENT);
    }

    /**
     * Sends the request and applies rate-limit handling.
     *
     * @return the response body for any 2xx status, empty otherwise
     */
    private Optional<String> execute(HttpRequest request, String what) {
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            int status = response.statusCode();
            if (status == 429) {
                long waitMs = retryAfterMillis(response);
                LOG.warn("Discord rate limit hit on {}. Waiting {}ms", what, waitMs);
                sleep(waitMs);
                return Optional.empty();
            }
            checkRateLimit(response);
            if (status < 200 || status >= 300) {
                LOG.error("Discord {} returned {}: {}", what, status,
                        TextBounds.truncate(response.body(), LOGGED_BODY_MAX));
                return Optional.empty();
            }
            return Optional.of(response.body() == null ? "" : response.body());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.error("Discord {} interrupted", what);
            return Optional.empty();
        } catch (Exception e) {
            LOG.error("Discord {} failed: {}", what, e.toString());
            return Optional.empty();
        }
    }

    /**
     * Blocks until the current bucket resets when Discord reports no
     * remaining requests in it.
     */
    private void checkRateLimit(HttpResponse<?> response) {
        response.headers().firstValue("X-RateLimit-Remaining").ifPresent(remaining -> {
            try {
                if (Double.parseDouble(remaining) < 1.0) {
                    response.headers().firstValue("X-RateLimit-Reset-After").ifPresent(reset -> {
                        long waitMs = (long) (Double.parseDouble(reset) * 1000);
                        LOG.warn("Discord rate limit bucket drained. Sleeping for {}ms", waitMs);
                        sleep(waitMs);
                    });
                }
            } catch (NumberFormatException e) {
                LOG.debug("Malformed rate limit header: {}", remaining);
            }
        });
    }

    private long retryAfterMillis(HttpResponse<String> response) {
        try {
            JsonNode body = mapper.readTree(response.body());
            double seconds = body.path("retry_after").asDouble(0);
            if (seconds > 0) {
                return (long) (seconds * 1000);
            }
        } catch (Exception e) {
            LOG.debug("429 without JSON body: {}", e.getMessage());
        }
        return response.headers().firstValue("Retry-After")
                .map(value -> {
                    try {
                        return (long) (Double.parseDouble(value) * 1000);
                    } catch (NumberFormatException e) {
                        return 1000L;
                    }
                })
                .orElse(1000L);
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(Math.min(Math.max(millis, 0), MAX_RATE_LIMIT_WAIT_MS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
