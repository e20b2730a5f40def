package ai.chatbridge.translator.command;

import ai.chatbridge.translator.reply.ChatReplier;
import ai.chatbridge.translator.settings.UserProfile;
import ai.chatbridge.translator.template.MessageLocalizer;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code !sul @user [settings]}: a moderator shows, changes or clears another user's settings. Keywords are
 * read in the moderator's language and invalid pairs are skipped without a reply.
 */
public class SetUserLanguageCommand implements ChatCommand {

    private static final Logger LOGGER = LoggerFactory.getLogger(SetUserLanguageCommand.class);
    private static final List<String> CONFIRM_ORDER = List.of(
            ProfileSettingsEditor.TARGET, ProfileSettingsEditor.SPEAKING, ProfileSettingsEditor.STYLE,
            ProfileSettingsEditor.PRONOUNS);

    private final UserDirectory directory;

    public SetUserLanguageCommand(UserDirectory directory) {
        this.directory = Objects.requireNonNull(directory, "directory");
    }

    @Override
    public String name() {
        return "setuserlanguage";
    }

    @Override
    public List<String> tokens() {
        return List.of("!sul");
    }

    @Override
    public boolean moderatorOnly() {
        return true;
    }

    @Override
    public void execute(CommandContext context) {
        String input = context.request().rawInput().trim();
        String[] parts = input.split("\\s+", 2);
        if (parts[0].isEmpty()) {
            context.reply("sulNoUser");
            return;
        }
        Optional<UserDirectory.DirectoryUser> target = new UserTargetResolver(context.profiles(), directory)
                .resolve(context.request().platform(), parts[0]);
        if (target.isEmpty()) {
            context.reply("sulNoUser");
            return;
        }
        String targetId = target.get().userId();
        String targetName = target.get().displayName();
        String targetMention = ChatReplier.mention(targetName);
        UserProfile targetProfile = context.profiles().find(targetId)
                .orElseGet(() -> context.profiles().createDefault().withUsername(targetName));
        String arguments = parts.length > 1 ? parts[1].trim() : "";
        MessageLocalizer localizer = context.localizer();
        UserProfile moderator = context.caller();

        if (arguments.isEmpty()) {
            context.reply("sulCheck", targetMention,
                    localizer.displayName(targetProfile.targetLanguage(), moderator),
                    localizer.displayName(targetProfile.speakingLanguage(), moderator),
                    localizer.displayName(targetProfile.speakingStyle(), moderator),
                    ProfileSettingsEditor.pronounsForDisplay(targetProfile, localizer, moderator));
            return;
        }

        ProfileSettingsEditor editor = new ProfileSettingsEditor(context.settings(), localizer.templates());
        List<String> tokens = ProfileSettingsEditor.tokens(arguments);
        if (editor.isClear(tokens, moderator.speakingLanguage())) {
            context.profiles().save(targetId, context.profiles().createDefault().withUsername(targetName));
            LOGGER.info("Moderator {} reset settings of {}", context.request().username(), targetName);
            context.reply("sulClearConfirm", targetMention);
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
        ProfileSettingsEditor.Edit edit = editor.apply(targetProfile, pairs, moderator.speakingLanguage(),
                new ProfileSettingsEditor.Rejections() {
                    @Override
                    public void invalidKey(String key) {
                        context.reply("invalidKey", context.quote(key));
                    }

                    @Override
                    public void invalidValue(String key, String value) {
                        context.reply("invalidValue", context.quote(value), context.quote(key));
                    }
                });
        UserProfile updated = edit.profile();
        Map<String, String> changes = new LinkedHashMap<>(edit.changes());
        if (ProfileSettingsEditor.isShorthand(tokens)) {
            Optional<String> shorthand = editor.shorthandTarget(tokens.get(0));
            if (shorthand.isEmpty()) {
                context.reply("invalidCode", context.quote(tokens.get(0)));
                return;
            }
            updated = updated.withTargetLanguage(shorthand.get());
            changes.put(ProfileSettingsEditor.TARGET, shorthand.get());
        }
        if (changes.isEmpty()) {
            LOGGER.debug("No valid settings in '{}' for {}", arguments, targetName);
            return;
        }
        context.profiles().save(targetId, updated.withUsername(targetName));
        LOGGER.info("Moderator {} updated settings of {}: {}", context.request().username(), targetName, changes);
        String details = ProfileSettingsEditor.confirmationDetails(changes, CONFIRM_ORDER, localizer, moderator);
        context.reply("sulConfirmMulti", targetMention, details);
    }
}
