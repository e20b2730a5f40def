package ai.chatbridge.translator.settings;

import ai.chatbridge.translator.keyword.KeywordTable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Persisted bot configuration: defaults, quota limits, blocklists and the per-language keyword tables.
 *
 * <p>Read fresh for every command and only written back by the moderator toggles.</p>
 */
public record BotSettings(
        DefaultSettings defaultSettings,
        ApiLimits apiLimits,
        List<String> wordBlocklist,
        Map<String, String> userBlocklist,
        List<String> inferencePriority,
        Map<String, String> languageMap,
        KeywordTable settingMap,
        KeywordTable styleMap,
        KeywordTable modelMap,
        KeywordTable toneMap,
        Map<String, Map<String, String>> languagePronounMap,
        Map<String, String> helpLinks,
        KeywordTable pronounNormalizationMap,
        List<String> lowercaseLanguageNames,
        Map<String, String> commandAliases
) {

    static final List<String> DEFAULT_LOWERCASE_LANGUAGES = List.of(
            "pt", "ptpt", "es", "fr", "it", "nl", "pl", "sv", "no", "fi", "da", "ru", "tr", "uk", "cs", "bg", "hu",
            "is", "ro");

    public BotSettings {
        defaultSettings = defaultSettings == null ? DefaultSettings.defaults() : defaultSettings;
        apiLimits = apiLimits == null ? ApiLimits.defaults() : apiLimits;
        wordBlocklist = wordBlocklist == null ? List.of() : List.copyOf(wordBlocklist);
        userBlocklist = userBlocklist == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(userBlocklist));
        inferencePriority = inferencePriority == null ? List.of() : List.copyOf(inferencePriority);
        languageMap = languageMap == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(languageMap));
        settingMap = settingMap == null ? KeywordTable.empty() : settingMap;
        styleMap = styleMap == null ? KeywordTable.empty() : styleMap;
        modelMap = modelMap == null ? KeywordTable.empty() : modelMap;
        toneMap = toneMap == null ? KeywordTable.empty() : toneMap;
        languagePronounMap = languagePronounMap == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(languagePronounMap));
        helpLinks = helpLinks == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(helpLinks));
        pronounNormalizationMap = pronounNormalizationMap == null ? KeywordTable.empty() : pronounNormalizationMap;
        lowercaseLanguageNames = lowercaseLanguageNames == null ? DEFAULT_LOWERCASE_LANGUAGES : List.copyOf(lowercaseLanguageNames);
        commandAliases = commandAliases == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(commandAliases));
    }

    public boolean isKnownLanguage(String code) {
        return code != null && languageMap.containsKey(code);
    }

    public boolean isUserBlocked(String userId) {
        return userId != null && userBlocklist.containsKey(userId);
    }

    /**
     * First blocklisted word contained in {@code text}, compared case-insensitively.
     */
    public Optional<String> findBlockedWord(String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        String lowered = text.toLowerCase(Locale.ROOT);
        return wordBlocklist.stream()
                .filter(word -> word != null && !word.isEmpty())
                .filter(word -> lowered.contains(word.toLowerCase(Locale.ROOT)))
                .findFirst();
    }

    /**
     * Grammar hint for a pronoun in a target language. The table may be keyed by language code or by
     * display name; both are tried, ignoring case.
     */
    public Optional<String> pronounHint(String targetCode, String targetName, String pronounLabel) {
        for (Map.Entry<String, Map<String, String>> entry : languagePronounMap.entrySet()) {
            String key = entry.getKey();
            if (key.equalsIgnoreCase(targetCode) || key.equalsIgnoreCase(targetName)) {
                String hint = entry.getValue() == null ? null : entry.getValue().get(pronounLabel);
                if (hint != null && !hint.isBlank()) {
                    return Optional.of(hint);
                }
            }
        }
        return Optional.empty();
    }

    public boolean lowercasesLanguageNames(String language) {
        return language != null && lowercaseLanguageNames.contains(language.toLowerCase(Locale.ROOT));
    }

    public BotSettings withWordBlocklist(List<String> words) {
        return new BotSettings(defaultSettings, apiLimits, words, userBlocklist, inferencePriority, languageMap,
                settingMap, styleMap, modelMap, toneMap, languagePronounMap, helpLinks, pronounNormalizationMap,
                lowercaseLanguageNames, commandAliases);
    }

    public BotSettings withUserBlocklist(Map<String, String> users) {
        return new BotSettings(defaultSettings, apiLimits, wordBlocklist, users, inferencePriority, languageMap,
                settingMap, styleMap, modelMap, toneMap, languagePronounMap, helpLinks, pronounNormalizationMap,
                lowercaseLanguageNames, commandAliases);
    }
}
