package ai.chatbridge.translator.cli;

import ai.chatbridge.translator.reply.ChatPlatform;
import picocli.CommandLine;

public class ChatPlatformConverter implements CommandLine.ITypeConverter<ChatPlatform> {

    @Override
    public ChatPlatform convert(String value) {
        return ChatPlatform.from(value);
    }
}
