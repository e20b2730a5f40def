package ai.chatbridge.translator.reply;

/**
 * Delivers one chat message, already within the platform's length limit.
 */
@FunctionalInterface
public interface ChatSender {

    void send(ChatPlatform platform, String message);
}
