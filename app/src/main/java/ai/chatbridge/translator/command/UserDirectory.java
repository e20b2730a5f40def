package ai.chatbridge.translator.command;

import ai.chatbridge.translator.reply.ChatPlatform;
import java.util.Optional;

/**
 * Platform lookup of a typed username, used when no stored profile carries that name.
 */
@FunctionalInterface
public interface UserDirectory {

    Optional<DirectoryUser> lookup(ChatPlatform platform, String username);

    static UserDirectory none() {
        return (platform, username) -> Optional.empty();
    }

    record DirectoryUser(String userId, String displayName) {
    }
}
