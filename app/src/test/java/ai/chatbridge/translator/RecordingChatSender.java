package ai.chatbridge.translator;

import ai.chatbridge.translator.reply.ChatPlatform;
import ai.chatbridge.translator.reply.ChatSender;
import java.util.ArrayList;
import java.util.List;

public final class RecordingChatSender implements ChatSender {

    private final List<String> messages = new ArrayList<>();

    @Override
    public void send(ChatPlatform platform, String message) {
        messages.add(message);
    }

    public List<String> messages() {
        return messages;
    }

    public String last() {
        return messages.isEmpty() ? null : messages.get(messages.size() - 1);
    }
}
