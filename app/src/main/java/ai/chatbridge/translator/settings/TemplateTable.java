package ai.chatbridge.translator.settings;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Localized message templates: language code, then message key, then template text.
 */
public final class TemplateTable {

    private final Map<String, Map<String, String>> templates;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public TemplateTable(Map<String, Map<String, String>> templates) {
        Map<String, Map<String, String>> copy = new LinkedHashMap<>();
        if (templates != null) {
            templates.forEach((language, messages) ->
                    copy.put(language, messages == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(messages))));
        }
        this.templates = Collections.unmodifiableMap(copy);
    }

    public Optional<String> find(String language, String key) {
        if (language == null || key == null) {
            return Optional.empty();
        }
        Map<String, String> messages = templates.get(language);
        return messages == null ? Optional.empty() : Optional.ofNullable(messages.get(key));
    }

    public boolean hasLanguage(String language) {
        return language != null && templates.containsKey(language);
    }

    public Set<String> languages() {
        return templates.keySet();
    }

    @JsonValue
    public Map<String, Map<String, String>> asMap() {
        return templates;
    }
}
