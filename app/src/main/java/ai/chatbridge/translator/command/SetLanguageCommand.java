package ai.chatbridge.translator.command;

import ai.chatbridge.translator.keyword.LanguageInference;
import ai.chatbridge.translator.settings.BotSettings;
import ai.chatbridge.translator.settings.UserProfile;
import ai.chatbridge.translator.template.MessageLocalizer;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code !sl}: shows, changes or clears the caller's own language settings.
 */
public class SetLanguageCommand implements ChatCommand {

    private static final Logger LOGGER = LoggerFactory.getLogger(SetLanguageCommand.class);
    private static final List<String> CONFIRM_ORDER = List.of(
            ProfileSettingsEditor.SPEAKING, ProfileSettingsEditor.TARGET, ProfileSettingsEditor.STYLE,
            ProfileSettingsEditor.PRONOUNS);

    @Override
    public String name() {
        return "setlanguage";
    }

    @Override
    public List<String> tokens() {
        return List.of("!sl");
    }

    @Override
    public void execute(CommandContext context) {
        BotSettings settings = context.settings();
        UserProfile profile = context.caller();
        if (settings.isUserBlocked(context.request().userId())) {
            context.reply("userBlockedSl");
            return;
        }
        String input = context.request().rawInput().trim();
        if (input.isEmpty()) {
            showSettings(context, profile);
            return;
        }
        ProfileSettingsEditor editor = new ProfileSettingsEditor(settings, context.localizer().templates());
        List<String> tokens = ProfileSettingsEditor.tokens(input);
        if (editor.isClear(tokens, profile.speakingLanguage())) {
            clear(context, profile);
            return;
        }

        Map<String, String> pairs = new LinkedHashMap<>();
        for (String token : tokens) {
            if (!token.contains(":")) {
                continue;
            }
            String[] pair = token.split(":", 2);
            if (pair[1].isEmpty()) {
                context.reply("invalidPair", context.quote(token));
                return;
            }
            pairs.put(pair[0].toLowerCase(Locale.ROOT), pair[1]);
        }

        String originalLanguage = profile.speakingLanguage();
        String processingLanguage = new LanguageInference(settings.settingMap(), settings.styleMap(), settings.inferencePriority())
                .infer(pairs, originalLanguage);
        Map<String, String> changes = new LinkedHashMap<>();
        UserProfile updated = profile;
        if (!processingLanguage.equals(originalLanguage)) {
            LOGGER.info("Settings typed in {} rather than {}, switching speaking language", processingLanguage, originalLanguage);
            updated = updated.withSpeakingLanguage(processingLanguage);
            changes.put(ProfileSettingsEditor.SPEAKING, processingLanguage);
        }

        UserProfile voice = updated;
        ProfileSettingsEditor.Edit edit = editor.apply(updated, pairs, processingLanguage, new ProfileSettingsEditor.Rejections() {
            @Override
            public void invalidKey(String key) {
                context.reply(voice, "invalidKey", context.quote(key));
            }

            @Override
            public void invalidValue(String key, String value) {
                context.reply(voice, "invalidValue", context.quote(value), context.quote(key));
            }
        });
        updated = edit.profile();
        changes.putAll(edit.changes());

        if (ProfileSettingsEditor.isShorthand(tokens)) {
            Optional<String> target = editor.shorthandTarget(tokens.get(0));
            if (target.isEmpty()) {
                context.reply("invalidCode", context.quote(tokens.get(0)));
                return;
            }
            updated = updated.withTargetLanguage(target.get());
            changes.put(ProfileSettingsEditor.TARGET, target.get());
        }

        if (changes.isEmpty()) {
            return;
        }
        context.profiles().save(context.request().userId(), updated);
        LOGGER.info("Updated settings for {}: {}", context.request().username(), changes);
        MessageLocalizer localizer = context.localizer();
        String details = ProfileSettingsEditor.confirmationDetails(changes, CONFIRM_ORDER, localizer, updated);
        context.reply(updated, "setLangConfirmMulti", details);
    }

    private void showSettings(CommandContext context, UserProfile profile) {
        MessageLocalizer localizer = context.localizer();
        context.reply("setLangCheck",
                localizer.displayName(profile.targetLanguage(), profile),
                localizer.displayName(profile.speakingLanguage(), profile),
                localizer.displayName(profile.speakingStyle(), profile),
                ProfileSettingsEditor.pronounsForDisplay(profile, localizer, profile));
    }

    private void clear(CommandContext context, UserProfile profile) {
        UserProfile defaults = context.profiles().createDefault().withUsername(context.request().username());
        if (profile.sameSettingsAs(defaults)) {
            context.reply("clearNone");
            return;
        }
        context.profiles().save(context.request().userId(), defaults);
        LOGGER.info("Reset settings for {}", context.request().username());
        context.reply(defaults, "clearConfirm");
    }
}
