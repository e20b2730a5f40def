package ai.chatbridge.translator.reply;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends bot replies: applies the mention prefix and splits long text into paced chunks.
 */
public class ChatReplier {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChatReplier.class);

    private final ChatSender sender;
    private final ChatPlatform platform;
    private final Duration chunkDelay;

    public ChatReplier(ChatSender sender, ChatPlatform platform, Duration chunkDelay) {
        this.sender = Objects.requireNonNull(sender, "sender");
        this.platform = Objects.requireNonNull(platform, "platform");
        this.chunkDelay = chunkDelay == null ? Duration.ZERO : chunkDelay;
    }

    public static String mention(String username) {
        return "@" + username;
    }

    /**
     * Sends {@code text} addressed to {@code username}, prefixing {@code @username, } unless the text
     * already starts with the mention.
     */
    public void reply(String username, String text) {
        String mention = mention(username);
        send(text.startsWith(mention) ? text : mention + ", " + text);
    }

    public void send(String text) {
        List<String> chunks = MessageChunker.split(text, platform.messageLimit());
        for (int i = 0; i < chunks.size(); i++) {
            if (i > 0) {
                pause();
            }
            sender.send(platform, chunks.get(i));
        }
        if (chunks.size() > 1) {
            LOGGER.debug("Sent reply in {} chunks on {}", chunks.size(), platform.id());
        }
    }

    public ChatPlatform platform() {
        return platform;
    }

    private void pause() {
        if (chunkDelay.isZero()) {
            return;
        }
        try {
            Thread.sleep(chunkDelay.toMillis());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while pacing chat messages", ex);
        }
    }
}
