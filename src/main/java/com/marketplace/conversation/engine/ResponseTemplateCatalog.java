package com.marketplace.conversation.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketplace.conversation.config.EngineConfig;
import com.marketplace.conversation.model.ConversationState;
import com.marketplace.conversation.model.Intent;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reply templates keyed by (intent, state), plus the safety replies used for high-risk messages
 * and the follow-ups sent to buyers who went silent.
 *
 * <pre>
 * { "safety":   { "EXTERNAL_CONTACT_REQUEST": [..], ..., "GENERIC": [..] },
 *   "intents":  { "GREETING": { "INITIAL": [..], "*": [..] }, ... },
 *   "recovery": { "24h": [..], "48h": [..] } }
 * </pre>
 *
 * A state key of {@code *} applies to every state without its own bucket.
 */
@Component
public class ResponseTemplateCatalog {

    private static final Logger log = LoggerFactory.getLogger(ResponseTemplateCatalog.class);

    public static final String ANY_STATE = "*";
    public static final String GENERIC_SAFETY = "GENERIC";

    private final Map<String, List<String>> safety;
    private final Map<Intent, Map<String, List<String>>> intents;
    private final Map<String, List<String>> recovery;

    @Autowired
    public ResponseTemplateCatalog(ResourceLoader resourceLoader, EngineConfig config) {
        this(read(resourceLoader.getResource(config.getTemplatesLocation())));
        log.info("Loaded reply templates from {}: {} intent buckets, {} safety buckets",
                config.getTemplatesLocation(), intents.size(), safety.size());
    }

    ResponseTemplateCatalog(TemplateFile file) {
        this.safety = file.getSafety() != null ? Map.copyOf(file.getSafety()) : Map.of();
        this.intents = toIntentMap(file.getIntents());
        this.recovery = file.getRecovery() != null ? Map.copyOf(file.getRecovery()) : Map.of();
    }

    public static ResponseTemplateCatalog fromStream(InputStream in) throws IOException {
        return new ResponseTemplateCatalog(new ObjectMapper().readValue(in, TemplateFile.class));
    }

    /**
     * Templates for the pair, falling back to the Negotiating bucket for Recovered conversations
     * and then to the intent's {@code *} bucket. Empty when nothing applies.
     */
    public List<String> bucket(Intent intent, ConversationState state) {
        Map<String, List<String>> byState = intents.get(intent);
        if (byState == null) return Collections.emptyList();

        List<String> templates = byState.get(state.name());
        if (isEmpty(templates) && state == ConversationState.RECOVERED) {
            templates = byState.get(ConversationState.NEGOTIATING.name());
        }
        if (isEmpty(templates)) {
            templates = byState.get(ANY_STATE);
        }
        return isEmpty(templates) ? Collections.emptyList() : templates;
    }

    public List<String> safety(String key) {
        List<String> templates = safety.get(key);
        if (isEmpty(templates)) {
            templates = safety.get(GENERIC_SAFETY);
        }
        return isEmpty(templates) ? Collections.emptyList() : templates;
    }

    public List<String> recovery(String key) {
        List<String> templates = recovery.get(key);
        return isEmpty(templates) ? Collections.emptyList() : templates;
    }

    private static boolean isEmpty(List<String> templates) {
        return templates == null || templates.isEmpty();
    }

    private static Map<Intent, Map<String, List<String>>> toIntentMap(Map<String, Map<String, List<String>>> raw) {
        Map<Intent, Map<String, List<String>>> result = new EnumMap<>(Intent.class);
        if (raw == null) return result;
        for (Map.Entry<String, Map<String, List<String>>> entry : raw.entrySet()) {
            Intent intent;
            try {
                intent = Intent.valueOf(entry.getKey());
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException("Unknown intent in reply templates: " + entry.getKey(), e);
            }
            for (String stateKey : entry.getValue().keySet()) {
                if (!ANY_STATE.equals(stateKey)) {
                    try {
                        ConversationState.valueOf(stateKey);
                    } catch (IllegalArgumentException e) {
                        throw new IllegalStateException(
                                "Unknown state '" + stateKey + "' under intent " + intent + " in reply templates", e);
                    }
                }
            }
            result.put(intent, Map.copyOf(entry.getValue()));
        }
        return result;
    }

    private static TemplateFile read(Resource resource) {
        try (InputStream in = resource.getInputStream()) {
            return new ObjectMapper().readValue(in, TemplateFile.class);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot load reply templates from " + resource.getDescription(), e);
        }
    }

    @Data
    static class TemplateFile {
        private Map<String, List<String>> safety = new HashMap<>();
        private Map<String, Map<String, List<String>>> intents = new HashMap<>();
        private Map<String, List<String>> recovery = new HashMap<>();
    }
}
