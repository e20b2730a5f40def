package ai.chatbridge.translator.reply;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Writes each chat message as one line, for the stream-bot action that relays stdout to chat.
 */
public class ConsoleChatSender implements ChatSender {

    private final PrintStream out;

    public ConsoleChatSender(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    @Override
    public void send(ChatPlatform platform, String message) {
        out.println(message);
        out.flush();
    }
}
