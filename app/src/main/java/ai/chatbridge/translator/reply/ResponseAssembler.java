package ai.chatbridge.translator.reply;

import ai.chatbridge.translator.segment.CommandSegmenter;
import ai.chatbridge.translator.settings.BotSettings;
import ai.chatbridge.translator.settings.UserProfile;
import ai.chatbridge.translator.template.MessageArguments;
import ai.chatbridge.translator.template.MessageLocalizer;
import java.util.List;
import java.util.Objects;

/**
 * Wraps translated segments in the localized header and quotes of the streamer persona.
 */
public class ResponseAssembler {

    static final String HEADER_KEY = "translationHeader";
    static final String FALLBACK_QUOTE = "\"";

    private final MessageLocalizer localizer;
    private final BotSettings settings;

    public ResponseAssembler(MessageLocalizer localizer, BotSettings settings) {
        this.localizer = Objects.requireNonNull(localizer, "localizer");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public String assemble(String username, String targetCode, List<String> translatedSegments, UserProfile caller) {
        UserProfile streamer = streamerVoice(caller);
        String targetName = localizer.displayName(targetCode, streamer);
        String header = localizer.message(streamer, HEADER_KEY,
                MessageArguments.mentioning(ChatReplier.mention(username), targetName));
        String body = localizer.quote(String.join(" ", translatedSegments), streamer, FALLBACK_QUOTE);
        return (header + " " + body).replace(CommandSegmenter.ESCAPE_MARKER, "%");
    }

    /**
     * The persona's language with the caller's style; no pronouns.
     */
    UserProfile streamerVoice(UserProfile caller) {
        String persona = settings.defaultSettings().defaultBotPersona();
        String language = persona.contains("-") ? persona.substring(0, persona.indexOf('-')) : UserProfile.DEFAULT_LANGUAGE;
        return new UserProfile("", UserProfile.DEFAULT_TARGET, language, caller.speakingStyle(), null);
    }
}
