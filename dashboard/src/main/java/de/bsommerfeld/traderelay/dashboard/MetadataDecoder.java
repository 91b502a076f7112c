package de.bsommerfeld.traderelay.dashboard;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Best-effort decoding of event metadata. The engine stores metadata as
 * JSONB, but depending on the driver it arrives either as an object or as
 * the JSON text of that object.
 */
final class MetadataDecoder {

    private static final Logger LOG = LoggerFactory.getLogger(MetadataDecoder.class);

    private MetadataDecoder() {
    }

    /**
     * Returns the decoded object or array when {@code raw} is JSON text of
     * one. Any other text is returned unchanged as a text node so it can still
     * be rendered downstream. {@code null} maps to a missing node.
     */
    static JsonNode decode(JsonNode raw, ObjectMapper mapper) {
        if (raw == null || raw.isNull() || raw.isMissingNode()) {
            return MissingNode.getInstance();
        }
        if (!raw.isTextual()) {
            return raw;
        }
        String text = raw.asText();
        if (text.isBlank()) {
            return raw;
        }
        try {
            JsonNode decoded = mapper.readTree(text);
            if (decoded != null && decoded.isContainerNode()) {
                return decoded;
            }
        } catch (JsonProcessingException e) {
            LOG.debug("Metadata is not JSON, keeping raw text: {}", e.getOriginalMessage());
        }
        return raw;
    }
}
