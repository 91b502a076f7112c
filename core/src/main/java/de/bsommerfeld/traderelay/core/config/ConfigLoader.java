package de.bsommerfeld.traderelay.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Reads {@link GlobalConfig} from a TOML file. A missing file is created
 * with the defaults so the operator has a template to fill in.
 *
 * <p>
 * Secrets can be supplied through the environment instead of the file:
 * {@value #ENV_API_KEY} and {@value #ENV_BOT_TOKEN} win over whatever the
 * file contains.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String ENV_API_KEY = "TRADE_RELAY_API_KEY";
    public static final String ENV_BOT_TOKEN = "TRADE_RELAY_DISCORD_TOKEN";

    private static final TomlMapper MAPPER = TomlMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private ConfigLoader() {
    }

    /** Loads the file at {@code path} and applies the process environment. */
    public static GlobalConfig load(Path path) throws IOException {
        return load(path, System.getenv());
    }

    static GlobalConfig load(Path path, Map<String, String> env) throws IOException {
        GlobalConfig config;
        if (Files.exists(path)) {
            config = MAPPER.readValue(path.toFile(), GlobalConfig.class);
        } else {
            config = new GlobalConfig();
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            MAPPER.writeValue(path.toFile(), config);
            LOG.info("No configuration found, wrote defaults to {}", path.toAbsolutePath());
        }
        applyOverrides(config, env);
        return config;
    }

    private static void applyOverrides(GlobalConfig config, Map<String, String> env) {
        String apiKey = env.get(ENV_API_KEY);
        if (apiKey != null && !apiKey.isBlank()) {
            config.getApi().setApiKey(apiKey);
            LOG.debug("API key taken from {}", ENV_API_KEY);
        }
        String token = env.get(ENV_BOT_TOKEN);
        if (token != null && !token.isBlank()) {
            config.getDiscord().setBotToken(token);
            LOG.debug("Bot token taken from {}", ENV_BOT_TOKEN);
        }
    }
}
