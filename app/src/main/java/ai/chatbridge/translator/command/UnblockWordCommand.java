package ai.chatbridge.translator.command;

import ai.chatbridge.translator.settings.BotSettings;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code !unblockword word}: removes a word from the translation blocklist.
 */
public class UnblockWordCommand implements ChatCommand {

    private static final Logger LOGGER = LoggerFactory.getLogger(UnblockWordCommand.class);

    @Override
    public String name() {
        return "unblockword";
    }

    @Override
    public List<String> tokens() {
        return List.of("!unblockword");
    }

    @Override
    public boolean moderatorOnly() {
        return true;
    }

    @Override
    public void execute(CommandContext context) {
        String word = context.request().rawInput().trim();
        if (word.isEmpty()) {
            context.reply("blocklistNoWord");
            return;
        }
        BotSettings settings = context.settings();
        Optional<String> stored = settings.wordBlocklist().stream().filter(word::equalsIgnoreCase).findFirst();
        if (stored.isEmpty()) {
            context.reply("blocklistNotFound", context.quote(word));
            return;
        }
        List<String> words = new ArrayList<>(settings.wordBlocklist());
        words.remove(stored.get());
        context.store().saveSettings(settings.withWordBlocklist(words));
        LOGGER.info("Removed '{}' from the word blocklist", stored.get());
        context.reply("blocklistRemoveConfirm", context.quote(word));
    }
}
