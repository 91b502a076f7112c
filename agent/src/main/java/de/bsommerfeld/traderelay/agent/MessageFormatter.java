package de.bsommerfeld.traderelay.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Singleton;
import de.bsommerfeld.traderelay.core.domain.PortfolioSnapshot;
import de.bsommerfeld.traderelay.core.domain.TradeEvent;
import de.bsommerfeld.traderelay.core.util.TextBounds;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Turns events and questions into chat text. The generative path is tried
 * first; whatever it fails to produce is covered by a deterministic
 * rendering, so both operations always return a non-empty, bounded string.
 */
@Singleton
public class MessageFormatter {

    private static final Logger LOG = LoggerFactory.getLogger(MessageFormatter.class);

    static final int EVENT_TOKENS = 200;
    static final int QUERY_TOKENS = 400;

    static final String FINAL_FALLBACK =
            "⚠️ Trading data is unavailable right now and no answer could be generated. Please try again in a minute.";

    private static final int PROMPT_DATA_MAX = 500;
    private static final int RAW_PORTFOLIO_MAX = 1500;

    private final TextGenerator generator;
    private final TemplateFormatter templates;
    private final QueryContextBuilder contextBuilder;
    private final ObjectMapper mapper = new ObjectMapper();

    @Inject
    public MessageFormatter(TextGenerator generator, TemplateFormatter templates,
            QueryContextBuilder contextBuilder) {
        this.generator = generator;
        this.templates = templates;
        this.contextBuilder = contextBuilder;
    }

    // -- Events --

    public String formatEvent(TradeEvent event) {
        String generated = generator.generate(eventPrompt(event), EVENT_TOKENS)
                .map(text -> TextBounds.truncate(text, TextBounds.EVENT_MESSAGE_MAX))
                .filter(text -> !text.isBlank())
                .orElse(null);
        if (generated != null) {
            return generated;
        }
        LOG.debug("Template fallback for event #{} ({})", event.id(), event.eventType());
        return templates.format(event);
    }

    String eventPrompt(TradeEvent event) {
        JsonNode metadata = event.metadata();
        String data = metadata.isMissingNode() ? "null" : metadata.toString();
        return PromptLoader.load("event", Map.of(
                "TYPE", String.valueOf(event.eventType()),
                "SYMBOL", event.symbol() == null ? "N/A" : event.symbol(),
                "DATA", TextBounds.truncate(data, PROMPT_DATA_MAX),
                "TIME", event.createdAt()));
    }

    // -- Queries --

    public String answerQuery(String question, QueryContext context) {
        String prompt = PromptLoader.load("query", Map.of(
                "CONTEXT", contextBuilder.build(context),
                "QUESTION", question == null ? "" : question));

        String generated = generator.generate(prompt, QUERY_TOKENS)
                .map(text -> TextBounds.truncate(text, TextBounds.QUERY_ANSWER_MAX))
                .filter(text -> !text.isBlank())
                .orElse(null);
        if (generated != null) {
            return generated;
        }
        LOG.warn("No generated answer, replying with raw data");
        return rawAnswer(context);
    }

    /** Bounded dump of whatever data is available, or the final fallback line. */
    String rawAnswer(QueryContext context) {
        if (context.isEmpty()) {
            return FINAL_FALLBACK;
        }

        StringBuilder sb = new StringBuilder();
        context.portfolio().ifPresent(p -> sb.append("**Portfolio:**\n```json\n")
                .append(TextBounds.truncate(portfolioJson(p), RAW_PORTFOLIO_MAX))
                .append("\n```\n\n"));
        QueryContextBuilder.appendPositions(sb, context.positions());
        QueryContextBuilder.appendDecisions(sb, context.decisions());

        String text = TextBounds.truncate(sb.toString().strip(), TextBounds.QUERY_ANSWER_MAX);
        return text.isEmpty() ? FINAL_FALLBACK : text;
    }

    private String portfolioJson(PortfolioSnapshot portfolio) {
        JsonNode raw = portfolio.raw();
        if (raw == null || raw.isMissingNode() || raw.isNull()) {
            return QueryContextBuilder.portfolioLine(portfolio);
        }
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(raw);
        } catch (JsonProcessingException e) {
            return raw.toString();
        }
    }
}
