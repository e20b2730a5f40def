package ai.chatbridge.translator.reply;

import java.util.Locale;

/**
 * Chat surfaces the bot answers on, with the per-message character limit of each.
 */
public enum ChatPlatform {
    TWITCH(500),
    YOUTUBE(200);

    private final int messageLimit;

    ChatPlatform(int messageLimit) {
        this.messageLimit = messageLimit;
    }

    public int messageLimit() {
        return messageLimit;
    }

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ChatPlatform from(String raw) {
        if (raw == null || raw.isBlank()) {
            return TWITCH;
        }
        String normalized = raw.trim();
        for (ChatPlatform platform : values()) {
            if (platform.name().equalsIgnoreCase(normalized)) {
                return platform;
            }
        }
        throw new IllegalArgumentException("Unsupported chat platform: " + raw);
    }
}
