package de.bsommerfeld.traderelay.agent;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads and caches prompt templates from classpath resource files.
 * Placeholders use the {@code {{KEY}}} form.
 */
final class PromptLoader {

    private static final ConcurrentHashMap<String, String> CACHE = new ConcurrentHashMap<>();

    private PromptLoader() {
    }

    /** Returns the raw prompt template from {@code prompts/<name>.txt}. */
    static String load(String name) {
        return CACHE.computeIfAbsent(name, PromptLoader::readResource);
    }

    /**
     * Returns the prompt with every placeholder replaced in a single pass, so
     * substituted values that happen to contain {@code {{...}}} stay as they
     * are. Unknown placeholders are left in place.
     */
    static String load(String name, Map<String, String> vars) {
        String template = load(name);
        StringBuilder out = new StringBuilder(template.length() + 256);
        int pos = 0;
        while (pos < template.length()) {
            int open = template.indexOf("{{", pos);
            int close = open < 0 ? -1 : template.indexOf("}}", open + 2);
            if (open < 0 || close < 0) {
                out.append(template, pos, template.length());
                break;
            }
            String key = template.substring(open + 2, close);
            String value = vars.get(key);
            out.append(template, pos, open);
            out.append(value != null ? value : template.substring(open, close + 2));
            pos = close + 2;
        }
        return out.toString();
    }

    private static String readResource(String name) {
        String path = "prompts/" + name + ".txt";
        try (InputStream in = PromptLoader.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("Prompt resource not found: " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).strip();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read prompt resource: " + path, e);
        }
    }
}
