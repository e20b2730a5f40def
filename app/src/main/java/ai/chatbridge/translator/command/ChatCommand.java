package ai.chatbridge.translator.command;

import java.util.List;

/**
 * A chat command handled by {@link CommandDispatcher}.
 */
public interface ChatCommand {

    /** Internal name, used as the target of configured aliases. */
    String name();

    /** Tokens that invoke the command, lowercase and including the leading {@code !}. */
    List<String> tokens();

    default boolean moderatorOnly() {
        return false;
    }

    void execute(CommandContext context);
}
