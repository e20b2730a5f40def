package ai.chatbridge.translator.keyword;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Classifies a free-form pronoun phrase in any configured language as one canonical pronoun.
 *
 * <p>Keywords from every language are matched as whole words. Neutral keywords are tested
 * first, then feminine, then masculine; a phrase matching none is treated as neutral.</p>
 */
public final class PronounNormalizer {

    private final Map<CanonicalPronoun, List<Pattern>> patterns = new EnumMap<>(CanonicalPronoun.class);

    public PronounNormalizer(KeywordTable normalizationTable) {
        Objects.requireNonNull(normalizationTable, "normalizationTable");
        Map<CanonicalPronoun, Set<String>> keywords = new EnumMap<>(CanonicalPronoun.class);
        for (CanonicalPronoun pronoun : CanonicalPronoun.values()) {
            Set<String> words = new LinkedHashSet<>();
            words.add(pronoun.label());
            keywords.put(pronoun, words);
        }
        for (String language : normalizationTable.languages()) {
            normalizationTable.keywordsFor(language).forEach((keyword, canonical) ->
                    CanonicalPronoun.fromLabel(canonical).ifPresent(pronoun -> keywords.get(pronoun).add(keyword)));
        }
        keywords.forEach((pronoun, words) -> {
            List<Pattern> compiled = new ArrayList<>();
            for (String word : words) {
                compiled.add(Pattern.compile("\\b" + Pattern.quote(word) + "\\b",
                        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS));
            }
            patterns.put(pronoun, List.copyOf(compiled));
        });
    }

    public CanonicalPronoun normalize(String phrase) {
        if (phrase == null || phrase.isBlank()) {
            return CanonicalPronoun.NEUTRAL;
        }
        String lowered = phrase.toLowerCase(Locale.ROOT);
        for (CanonicalPronoun pronoun : CanonicalPronoun.values()) {
            for (Pattern pattern : patterns.get(pronoun)) {
                if (pattern.matcher(lowered).find()) {
                    return pronoun;
                }
            }
        }
        return CanonicalPronoun.NEUTRAL;
    }

    /**
     * Gender-select branch for a stored profile pronoun; an unset pronoun selects {@code other}.
     */
    public String genderKey(String profilePronouns) {
        if (profilePronouns == null || profilePronouns.isBlank()) {
            return CanonicalPronoun.NEUTRAL.genderKey();
        }
        return normalize(profilePronouns).genderKey();
    }
}
