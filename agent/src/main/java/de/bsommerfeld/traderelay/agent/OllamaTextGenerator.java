package de.bsommerfeld.traderelay.agent;

import com.google.inject.Singleton;
import de.bsommerfeld.traderelay.core.config.AgentConfig;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.IntFunction;

/**
 * {@link TextGenerator} backed by a local Ollama server.
 *
 * <p>
 * The token budget is a model option in LangChain4j, so one
 * {@link ChatLanguageModel} is built per distinct budget and reused. In
 * practice there are two: event messages and query answers. Retries are
 * disabled; a failed generation falls back to the template path instead.
 */
@Singleton
public class OllamaTextGenerator implements TextGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(OllamaTextGenerator.class);

    private final IntFunction<ChatLanguageModel> modelFactory;
    private final Map<Integer, ChatLanguageModel> models = new ConcurrentHashMap<>();

    @Inject
    public OllamaTextGenerator(AgentConfig config) {
        this(maxTokens -> OllamaChatModel.builder()
                .baseUrl(config.getOllamaBaseUrl())
                .modelName(config.getModel())
                .temperature(config.getTemperature())
                .numPredict(maxTokens)
                .timeout(Duration.ofSeconds(config.getTimeoutSeconds()))
                .maxRetries(0)
                .build());
        LOG.info("Text generation via Ollama at {} using model {}", config.getOllamaBaseUrl(), config.getModel());
    }

    OllamaTextGenerator(IntFunction<ChatLanguageModel> modelFactory) {
        this.modelFactory = modelFactory;
    }

    @Override
    public Optional<String> generate(String prompt, int maxTokens) {
        try {
            ChatLanguageModel model = models.computeIfAbsent(maxTokens, modelFactory::apply);
            String output = model.generate(prompt);
            if (output == null || output.isBlank()) {
                LOG.warn("Ollama returned an empty completion");
                return Optional.empty();
            }
            return Optional.of(output.strip());
        } catch (Exception e) {
            LOG.error("Ollama error: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
