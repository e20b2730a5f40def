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
 * {@code !block @user}: adds a user to the blocklist. Blocking an already blocked user changes nothing.
 */
public class BlockUserCommand implements ChatCommand {

    private static final Logger LOGGER = LoggerFactory.getLogger(BlockUserCommand.class);

    private final UserDirectory directory;

    public BlockUserCommand(UserDirectory directory) {
        this.directory = Objects.requireNonNull(directory, "directory");
    }

    @Override
    public String name() {
        return "block";
    }

    @Override
    public List<String> tokens() {
        return List.of("!block");
    }

    @Override
    public boolean moderatorOnly() {
        return true;
    }

    @Override
    public void execute(CommandContext context) {
        String typed = UserTargetResolver.stripMention(context.request().rawInput());
        if (typed.isEmpty()) {
            context.reply("adminBlockNoUser");
            return;
        }
        Optional<UserDirectory.DirectoryUser> target = new UserTargetResolver(context.profiles(), directory)
                .resolve(context.request().platform(), typed);
        if (target.isEmpty()) {
            LOGGER.info("Cannot block '{}': user not found", typed);
            return;
        }
        if (target.get().userId().equals(context.request().userId())) {
            LOGGER.info("Moderator {} tried to block themself", context.request().username());
            return;
        }
        BotSettings settings = context.settings();
        String shownName = context.quote(target.get().displayName());
        if (settings.userBlocklist().containsKey(target.get().userId())) {
            context.reply("adminBlockAlreadyExists", shownName);
            return;
        }
        Map<String, String> blocked = new LinkedHashMap<>(settings.userBlocklist());
        blocked.put(target.get().userId(), target.get().displayName());
        context.store().saveSettings(settings.withUserBlocklist(blocked));
        LOGGER.info("Blocked user {} ({})", target.get().displayName(), target.get().userId());
        context.reply("adminBlockConfirm", shownName);
    }
}
