package ai.chatbridge.translator.command;

import ai.chatbridge.translator.settings.BotSettings;
import ai.chatbridge.translator.settings.TemplateTable;
import ai.chatbridge.translator.settings.UserProfile;
import ai.chatbridge.translator.template.MessageArguments;
import ai.chatbridge.translator.template.MessageLocalizer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Parses and applies {@code key:value} profile settings typed in chat, shared by the user and moderator
 * settings commands.
 */
final class ProfileSettingsEditor {

    static final String TARGET = "target";
    static final String SPEAKING = "speaking";
    static final String STYLE = "style";
    static final String PRONOUNS = "pronouns";
    static final String CLEAR = "clear";
    static final String NONE = "none";

    private final BotSettings settings;
    private final TemplateTable templates;

    ProfileSettingsEditor(BotSettings settings, TemplateTable templates) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.templates = Objects.requireNonNull(templates, "templates");
    }

    /**
     * Splits the input into tokens after turning {@code key: value} into {@code key:value}.
     */
    static List<String> tokens(String rawInput) {
        String cleaned = rawInput == null ? "" : rawInput.trim().replaceAll(":\\s+", ":");
        List<String> tokens = new ArrayList<>();
        for (String token : cleaned.split("\\s+")) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    boolean isClear(List<String> tokens, String language) {
        return tokens.size() == 1 && settings.settingMap().resolve(tokens.get(0), language)
                .map(CLEAR::equals)
                .orElse(false);
    }

    /**
     * A lone token without a colon: the shorthand for a target language.
     */
    static boolean isShorthand(List<String> tokens) {
        return tokens.size() == 1 && !tokens.get(0).contains(":");
    }

    Optional<String> shorthandTarget(String token) {
        String code = token.toLowerCase(Locale.ROOT);
        return settings.isKnownLanguage(code) ? Optional.of(code) : Optional.empty();
    }

    /**
     * Applies each pair, resolving keys and styles in {@code keywordLanguage}. Rejected pairs are reported to
     * {@code rejections} and skipped; the others still apply.
     */
    Edit apply(UserProfile profile, Map<String, String> pairs, String keywordLanguage, Rejections rejections) {
        UserProfile updated = profile;
        Map<String, String> changes = new LinkedHashMap<>();
        for (Map.Entry<String, String> pair : pairs.entrySet()) {
            Optional<String> setting = settings.settingMap().resolve(pair.getKey(), keywordLanguage);
            if (setting.isEmpty()) {
                rejections.invalidKey(pair.getKey());
                continue;
            }
            String value = pair.getValue();
            String lowered = value.toLowerCase(Locale.ROOT);
            switch (setting.get()) {
                case TARGET -> {
                    if (settings.isKnownLanguage(lowered)) {
                        updated = updated.withTargetLanguage(lowered);
                        changes.put(TARGET, lowered);
                    } else {
                        rejections.invalidValue(pair.getKey(), value);
                    }
                }
                case SPEAKING -> {
                    if (templates.hasLanguage(lowered)) {
                        updated = updated.withSpeakingLanguage(lowered);
                        changes.put(SPEAKING, lowered);
                    } else {
                        rejections.invalidValue(pair.getKey(), value);
                    }
                }
                case STYLE -> {
                    Optional<String> style = settings.styleMap().resolve(lowered, keywordLanguage);
                    if (style.isPresent()) {
                        updated = updated.withSpeakingStyle(style.get());
                        changes.put(STYLE, style.get());
                    } else {
                        rejections.invalidValue(pair.getKey(), value);
                    }
                }
                case PRONOUNS -> {
                    updated = updated.withPronouns(value);
                    changes.put(PRONOUNS, value);
                }
                default -> rejections.invalidKey(pair.getKey());
            }
        }
        return new Edit(updated, changes);
    }

    /**
     * Joins the localized {@code confirmPart*} fragments for the changed settings, in {@code order}.
     */
    static String confirmationDetails(Map<String, String> changes, List<String> order, MessageLocalizer localizer,
                                      UserProfile reader) {
        List<String> parts = new ArrayList<>();
        for (String setting : order) {
            String value = changes.get(setting);
            if (value == null) {
                continue;
            }
            String shown = PRONOUNS.equals(setting) ? localizer.quote(value, reader, "'") : localizer.displayName(value, reader);
            parts.add(localizer.message(reader, confirmKey(setting), MessageArguments.of(shown)));
        }
        return String.join(", ", parts);
    }

    static String pronounsForDisplay(UserProfile profile, MessageLocalizer localizer, UserProfile reader) {
        return profile.hasPronouns() ? localizer.quote(profile.pronouns(), reader, "'") : localizer.displayName(NONE, reader);
    }

    private static String confirmKey(String setting) {
        return switch (setting) {
            case TARGET -> "confirmPartTarget";
            case SPEAKING -> "confirmPartSpeaking";
            case STYLE -> "confirmPartStyle";
            default -> "confirmPartPronouns";
        };
    }

    record Edit(UserProfile profile, Map<String, String> changes) {
    }

    interface Rejections {

        void invalidKey(String key);

        void invalidValue(String key, String value);
    }
}
