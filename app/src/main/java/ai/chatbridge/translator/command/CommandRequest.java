package ai.chatbridge.translator.command;

import ai.chatbridge.translator.reply.ChatPlatform;
import java.util.Objects;

/**
 * A chat command as delivered by the platform.
 */
public record CommandRequest(ChatPlatform platform, String userId, String username, boolean moderator,
                             String commandToken, String rawInput) {

    public CommandRequest {
        Objects.requireNonNull(platform, "platform");
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(username, "username");
        commandToken = commandToken == null ? "" : commandToken.trim();
        rawInput = rawInput == null ? "" : rawInput;
    }
}
