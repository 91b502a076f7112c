package de.bsommerfeld.traderelay.agent;

import java.util.Optional;

/**
 * Best-effort text generation. Implementations never throw: an unreachable
 * backend, a timeout or a blank completion are all reported as empty.
 */
public interface TextGenerator {

    /**
     * @param prompt    complete prompt text
     * @param maxTokens upper bound on generated tokens
     * @return the stripped completion, or empty if none was produced
     */
    Optional<String> generate(String prompt, int maxTokens);
}
