package ai.chatbridge.translator.translate;

import ai.chatbridge.translator.settings.UserProfile;
import java.util.Objects;

/**
 * One translate invocation as seen by the orchestrator.
 */
public record TranslationRequest(String userId, String username, String commandToken, String rawInput,
                                 UserProfile profile) {

    public TranslationRequest {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(username, "username");
        commandToken = commandToken == null ? "" : commandToken;
        rawInput = rawInput == null ? "" : rawInput;
        Objects.requireNonNull(profile, "profile");
    }
}
