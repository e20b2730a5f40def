package ai.chatbridge.translator.reply;

import static org.assertj.core.api.Assertions.assertThat;

import ai.chatbridge.translator.RecordingChatSender;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class ChatReplierTest {

    private final RecordingChatSender sender = new RecordingChatSender();

    @Test
    void prefixesMentionWhenMissing() {
        new ChatReplier(sender, ChatPlatform.TWITCH, Duration.ZERO).reply("ana", "done");

        assertThat(sender.messages()).containsExactly("@ana, done");
    }

    @Test
    void keepsExistingMention() {
        new ChatReplier(sender, ChatPlatform.TWITCH, Duration.ZERO).reply("ana", "@ana your settings were saved");

        assertThat(sender.messages()).containsExactly("@ana your settings were saved");
    }

    @Test
    void usesPlatformLimit() {
        String text = "z ".repeat(150).trim();

        new ChatReplier(sender, ChatPlatform.YOUTUBE, Duration.ZERO).send(text);
        assertThat(sender.messages()).hasSize(2);

        sender.messages().clear();
        new ChatReplier(sender, ChatPlatform.TWITCH, Duration.ZERO).send(text);
        assertThat(sender.messages()).containsExactly(text);
    }

    @Test
    void parsesPlatformNames() {
        assertThat(ChatPlatform.from("YouTube")).isEqualTo(ChatPlatform.YOUTUBE);
        assertThat(ChatPlatform.from(null)).isEqualTo(ChatPlatform.TWITCH);
        assertThat(ChatPlatform.YOUTUBE.id()).isEqualTo("youtube");
    }
}
