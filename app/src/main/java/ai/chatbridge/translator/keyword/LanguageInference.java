package ai.chatbridge.translator.keyword;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks the language a {@code key:value} settings command was typed in.
 *
 * <p>When every pair validates in the caller's current language that language is kept. Otherwise each
 * other non-English language in the settings table is a candidate when all pairs validate there; a single
 * candidate wins, several are broken by the configured priority list, and no winner keeps the current
 * language.</p>
 */
public class LanguageInference {

    private static final Logger LOGGER = LoggerFactory.getLogger(LanguageInference.class);
    static final String STYLE_SETTING = "style";

    private final KeywordTable settingMap;
    private final KeywordTable styleMap;
    private final List<String> priority;

    public LanguageInference(KeywordTable settingMap, KeywordTable styleMap, List<String> priority) {
        this.settingMap = Objects.requireNonNull(settingMap, "settingMap");
        this.styleMap = Objects.requireNonNull(styleMap, "styleMap");
        this.priority = priority == null ? List.of() : List.copyOf(priority);
    }

    public String infer(Map<String, String> arguments, String currentLanguage) {
        if (arguments == null || arguments.isEmpty() || validatesAll(arguments, currentLanguage)) {
            return currentLanguage;
        }
        List<String> candidates = new ArrayList<>();
        for (String language : settingMap.languages()) {
            if (language.equals(KeywordTable.FALLBACK_LANGUAGE)) {
                continue;
            }
            if (validatesAll(arguments, language)) {
                candidates.add(language);
            }
        }
        if (candidates.size() == 1) {
            LOGGER.debug("Inferred settings language {} for {}", candidates.get(0), arguments.keySet());
            return candidates.get(0);
        }
        if (candidates.size() > 1) {
            for (String preferred : priority) {
                if (candidates.contains(preferred)) {
                    LOGGER.debug("Inferred settings language {} by priority among {}", preferred, candidates);
                    return preferred;
                }
            }
        }
        return currentLanguage;
    }

    boolean validatesAll(Map<String, String> arguments, String language) {
        for (Map.Entry<String, String> argument : arguments.entrySet()) {
            if (!validates(argument.getKey(), argument.getValue(), language)) {
                return false;
            }
        }
        return true;
    }

    private boolean validates(String key, String value, String language) {
        return settingMap.lookup(language, key)
                .map(setting -> !STYLE_SETTING.equals(setting) || styleMap.containsKeyword(language, value))
                .orElse(false);
    }
}
