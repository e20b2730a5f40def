package ai.chatbridge.translator.command;

import ai.chatbridge.translator.reply.ChatReplier;
import ai.chatbridge.translator.settings.BotSettings;
import ai.chatbridge.translator.settings.UserProfile;
import ai.chatbridge.translator.store.BotStore;
import ai.chatbridge.translator.store.ProfileRepository;
import ai.chatbridge.translator.template.MessageArguments;
import ai.chatbridge.translator.template.MessageLocalizer;

/**
 * Everything a command needs for one invocation: freshly loaded settings, the caller's profile and the
 * reply channel.
 */
public record CommandContext(
        CommandRequest request,
        BotSettings settings,
        MessageLocalizer localizer,
        UserProfile caller,
        ProfileRepository profiles,
        BotStore store,
        ChatReplier replier
) {

    public String mention() {
        return ChatReplier.mention(request.username());
    }

    /**
     * Renders {@code key} for the caller with the caller's mention as {@code {0}} and sends it.
     */
    public void reply(String key, Object... values) {
        reply(caller, key, values);
    }

    public void reply(UserProfile voice, String key, Object... values) {
        String text = localizer.message(voice, key, MessageArguments.mentioning(mention(), values));
        replier.reply(request.username(), text);
    }

    public String quote(String text) {
        return localizer.quote(text, caller, "'");
    }
}
