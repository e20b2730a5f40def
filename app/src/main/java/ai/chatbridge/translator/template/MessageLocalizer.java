package ai.chatbridge.translator.template;

import ai.chatbridge.translator.keyword.KeywordTable;
import ai.chatbridge.translator.keyword.PronounNormalizer;
import ai.chatbridge.translator.settings.BotSettings;
import ai.chatbridge.translator.settings.TemplateTable;
import ai.chatbridge.translator.settings.UserProfile;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Looks up and renders localized bot messages for a profile.
 *
 * <p>Key resolution tries {@code key_style}, {@code key_normal} and {@code key} in the profile's speaking
 * language, then the same chain in English. A key that resolves nowhere renders as a visible
 * "not found" marker instead of failing.</p>
 */
public class MessageLocalizer {

    public static final String NOT_FOUND_SUFFIX = " (Message template not found)";
    static final String NORMAL_STYLE = "normal";
    static final String QUOTE_START_KEY = "quote_start";
    static final String QUOTE_END_KEY = "quote_end";

    private final TemplateTable templates;
    private final BotSettings settings;
    private final PronounNormalizer pronounNormalizer;

    public MessageLocalizer(TemplateTable templates, BotSettings settings, PronounNormalizer pronounNormalizer) {
        this.templates = Objects.requireNonNull(templates, "templates");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.pronounNormalizer = Objects.requireNonNull(pronounNormalizer, "pronounNormalizer");
    }

    public String message(UserProfile profile, String baseKey, MessageArguments arguments) {
        Objects.requireNonNull(profile, "profile");
        String template = findTemplate(profile.speakingLanguage(), profile.speakingStyle(), baseKey)
                .orElse(null);
        if (template == null) {
            return baseKey + NOT_FOUND_SUFFIX;
        }
        List<Object> positional = arguments == null ? List.of() : arguments.positional();
        return GenderedTemplateFormatter.format(template, pronounNormalizer.genderKey(profile.pronouns()), positional);
    }

    public String message(UserProfile profile, String baseKey) {
        return message(profile, baseKey, MessageArguments.none());
    }

    public Optional<String> findTemplate(String language, String style, String baseKey) {
        Optional<String> own = findInLanguage(language, style, baseKey);
        if (own.isPresent() || KeywordTable.FALLBACK_LANGUAGE.equals(language)) {
            return own;
        }
        return findInLanguage(KeywordTable.FALLBACK_LANGUAGE, style, baseKey);
    }

    private Optional<String> findInLanguage(String language, String style, String baseKey) {
        if (style != null && !style.isBlank()) {
            Optional<String> styled = templates.find(language, baseKey + "_" + style);
            if (styled.isPresent()) {
                return styled;
            }
        }
        return templates.find(language, baseKey + "_" + NORMAL_STYLE)
                .or(() -> templates.find(language, baseKey));
    }

    /**
     * Display name of a language or style code as seen by {@code reader}, lowercased for languages that
     * write language names in lower case.
     */
    public String displayName(String code, UserProfile reader) {
        if (code == null || code.isBlank()) {
            return "";
        }
        String language = reader.speakingLanguage();
        String key = code + "_" + NORMAL_STYLE;
        String name = templates.find(language, key)
                .or(() -> templates.find(KeywordTable.FALLBACK_LANGUAGE, key))
                .or(() -> Optional.ofNullable(settings.languageMap().get(code)))
                .orElse(code);
        return settings.lowercasesLanguageNames(language) ? name.toLowerCase(Locale.forLanguageTag(language)) : name;
    }

    /**
     * Wraps {@code text} in the reader's quote characters, or in {@code fallbackQuote} when none are defined.
     */
    public String quote(String text, UserProfile reader, String fallbackQuote) {
        String start = findTemplate(reader.speakingLanguage(), reader.speakingStyle(), QUOTE_START_KEY).orElse(fallbackQuote);
        String end = findTemplate(reader.speakingLanguage(), reader.speakingStyle(), QUOTE_END_KEY).orElse(fallbackQuote);
        return start + text + end;
    }

    public TemplateTable templates() {
        return templates;
    }

    public BotSettings settings() {
        return settings;
    }

    public PronounNormalizer pronounNormalizer() {
        return pronounNormalizer;
    }
}
