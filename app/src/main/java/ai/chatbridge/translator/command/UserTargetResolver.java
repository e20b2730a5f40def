package ai.chatbridge.translator.command;

import ai.chatbridge.translator.reply.ChatPlatform;
import ai.chatbridge.translator.store.ProfileRepository;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves the user a moderator command names: stored profiles first, then the platform directory, and on
 * YouTube the typed name itself.
 */
final class UserTargetResolver {

    private final ProfileRepository profiles;
    private final UserDirectory directory;

    UserTargetResolver(ProfileRepository profiles, UserDirectory directory) {
        this.profiles = Objects.requireNonNull(profiles, "profiles");
        this.directory = Objects.requireNonNull(directory, "directory");
    }

    Optional<UserDirectory.DirectoryUser> resolve(ChatPlatform platform, String typedName) {
        String name = stripMention(typedName);
        if (name.isEmpty()) {
            return Optional.empty();
        }
        Optional<String> localId = profiles.findUserIdByUsername(name);
        if (localId.isPresent()) {
            String storedName = profiles.find(localId.get()).map(profile -> profile.username()).orElse(name);
            return Optional.of(new UserDirectory.DirectoryUser(localId.get(), storedName.isEmpty() ? name : storedName));
        }
        Optional<UserDirectory.DirectoryUser> found = directory.lookup(platform, name);
        if (found.isPresent()) {
            return found;
        }
        if (platform == ChatPlatform.YOUTUBE) {
            return Optional.of(new UserDirectory.DirectoryUser(name, name));
        }
        return Optional.empty();
    }

    static String stripMention(String typedName) {
        if (typedName == null) {
            return "";
        }
        String trimmed = typedName.trim();
        return trimmed.startsWith("@") ? trimmed.substring(1).trim() : trimmed;
    }
}
