package ai.chatbridge.translator.command;

import ai.chatbridge.translator.settings.BotSettings;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code !blockword word}: adds a word to the translation blocklist, ignoring case for duplicates.
 */
public class BlockWordCommand implements ChatCommand {

    private static final Logger LOGGER = LoggerFactory.getLogger(BlockWordCommand.class);

    @Override
    public String name() {
        return "blockword";
    }

    @Override
    public List<String> tokens() {
        return List.of("!blockword");
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
        if (settings.wordBlocklist().stream().anyMatch(word::equalsIgnoreCase)) {
            context.reply("blocklistAlreadyExists", context.quote(word));
            return;
        }
        List<String> words = new ArrayList<>(settings.wordBlocklist());
        words.add(word);
        context.store().saveSettings(settings.withWordBlocklist(words));
        LOGGER.info("Added '{}' to the word blocklist", word);
        context.reply("blocklistAddConfirm", context.quote(word));
    }
}
