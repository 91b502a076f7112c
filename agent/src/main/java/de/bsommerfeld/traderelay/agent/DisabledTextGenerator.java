package de.bsommerfeld.traderelay.agent;

import java.util.Optional;

/**
 * Bound when generation is switched off in the configuration, so every
 * message takes the template path.
 */
public class DisabledTextGenerator implements TextGenerator {

    @Override
    public Optional<String> generate(String prompt, int maxTokens) {
        return Optional.empty();
    }
}
