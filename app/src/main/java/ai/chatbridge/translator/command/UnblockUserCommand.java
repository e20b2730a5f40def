package ai.chatbridge.translator.command;

import ai.chatbridge.translator.settings.BotSettings;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code !unblock @user}: removes a user from the blocklist. The blocklist's stored names are searched too,
 * so users without a profile can still be unblocked.
 */
public class UnblockUserCommand implements ChatCommand {

    private static final Logger LOGGER = LoggerFactory.getLogger(UnblockUserCommand.class);

    private final UserDirectory directory;

    public UnblockUserCommand(UserDirectory directory) {
        this.directory = Objects.requireNonNull(directory, "directory");
    }

    @Override
    public String name() {
        return "unblock";
    }

    @Override
    public List<String> tokens() {
        return List.of("!unblock");
    }

    @Override
    public boolean moderatorOnly() {
        return true;
    }

    @Override
    public void execute(CommandContext context) {
        String typed = UserTargetResolver.stripMention(context.request().rawInput());
        if (typed.isEmpty()) {
            context.reply("adminUnblockNoUser");
            return;
        }
        BotSettings settings = context.settings();
        Optional<String> userId = new UserTargetResolver(context.profiles(), directory)
                .resolve(context.request().platform(), typed)
                .map(UserDirectory.DirectoryUser::userId)
                .filter(settings.userBlocklist()::containsKey)
                .or(() -> findByStoredName(settings.userBlocklist(), typed));
        if (userId.isEmpty()) {
            context.reply("adminUnblockNotFound", context.quote(typed));
            return;
        }
        Map<String, String> blocked = new LinkedHashMap<>(settings.userBlocklist());
        String storedName = blocked.remove(userId.get());
        String shownName = storedName == null || storedName.isBlank() ? typed : storedName;
        context.store().saveSettings(settings.withUserBlocklist(blocked));
        LOGGER.info("Unblocked user {} ({})", shownName, userId.get());
        context.reply("adminUnblockConfirm", context.quote(shownName));
    }

    private static Optional<String> findByStoredName(Map<String, String> blocklist, String name) {
        return blocklist.entrySet().stream()
                .filter(entry -> entry.getKey().equals(name) || name.equalsIgnoreCase(entry.getValue()))
                .map(Map.Entry::getKey)
                .findFirst();
    }
}
