package ai.chatbridge.translator.command;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * {@code !translatehelp [lang]}: replies with the help link for a language.
 */
public class HelpCommand implements ChatCommand {

    static final String DEFAULT_LINK_KEY = "default";

    @Override
    public String name() {
        return "help";
    }

    @Override
    public List<String> tokens() {
        return List.of("!translatehelp");
    }

    @Override
    public void execute(CommandContext context) {
        String requested = context.request().rawInput().trim().split("\\s+", 2)[0].toLowerCase(Locale.ROOT);
        Optional<String> link = findLink(context.settings().helpLinks(), requested, context.caller().speakingLanguage());
        if (link.isEmpty()) {
            context.reply("helpLinkNotFound");
            return;
        }
        context.reply("translateHelp", link.get());
    }

    static Optional<String> findLink(Map<String, String> links, String requested, String speakingLanguage) {
        List<String> candidates = new ArrayList<>();
        if (!requested.isEmpty()) {
            candidates.add(requested);
        }
        candidates.add(speakingLanguage);
        candidates.add(DEFAULT_LINK_KEY);
        for (String candidate : candidates) {
            String link = links.get(candidate);
            if (link != null && !link.isBlank()) {
                return Optional.of(link);
            }
        }
        return Optional.empty();
    }
}
