package ai.chatbridge.translator.keyword;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Per-language keyword table mapping a localized user keyword to a canonical value.
 *
 * <p>All settings, style, model and tone vocabularies share this shape. Keywords are matched
 * case-insensitively; {@link #resolve(String, String)} falls back to the English table when the
 * requested language does not know the keyword.</p>
 */
public final class KeywordTable {

    public static final String FALLBACK_LANGUAGE = "en";

    private final Map<String, Map<String, String>> entries;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public KeywordTable(Map<String, Map<String, String>> entries) {
        Map<String, Map<String, String>> copy = new LinkedHashMap<>();
        if (entries != null) {
            entries.forEach((language, keywords) -> {
                Map<String, String> normalized = new LinkedHashMap<>();
                if (keywords != null) {
                    keywords.forEach((keyword, value) -> normalized.put(normalize(keyword), value));
                }
                copy.put(normalize(language), Collections.unmodifiableMap(normalized));
            });
        }
        this.entries = Collections.unmodifiableMap(copy);
    }

    public static KeywordTable empty() {
        return new KeywordTable(Map.of());
    }

    /**
     * Resolves a keyword in the given language, then in English.
     */
    public Optional<String> resolve(String keyword, String language) {
        if (keyword == null || keyword.isBlank()) {
            return Optional.empty();
        }
        Optional<String> direct = lookup(language, keyword);
        if (direct.isPresent()) {
            return direct;
        }
        return lookup(FALLBACK_LANGUAGE, keyword);
    }

    /**
     * Looks the keyword up in one language only.
     */
    public Optional<String> lookup(String language, String keyword) {
        if (language == null || keyword == null) {
            return Optional.empty();
        }
        Map<String, String> keywords = entries.get(normalize(language));
        if (keywords == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(keywords.get(normalize(keyword)));
    }

    public boolean containsKeyword(String language, String keyword) {
        return lookup(language, keyword).isPresent();
    }

    public boolean hasLanguage(String language) {
        return language != null && entries.containsKey(normalize(language));
    }

    public Set<String> languages() {
        return entries.keySet();
    }

    public Map<String, String> keywordsFor(String language) {
        if (language == null) {
            return Map.of();
        }
        return entries.getOrDefault(normalize(language), Map.of());
    }

    @JsonValue
    public Map<String, Map<String, String>> asMap() {
        return entries;
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof KeywordTable table && entries.equals(table.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }
}
