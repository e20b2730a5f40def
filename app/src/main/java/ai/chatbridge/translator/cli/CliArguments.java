package ai.chatbridge.translator.cli;

import ai.chatbridge.translator.config.LogFormat;
import ai.chatbridge.translator.reply.ChatPlatform;
import ai.chatbridge.translator.translate.TranslationMode;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

@CommandLine.Command(name = "chat-translator", mixinStandardHelpOptions = true,
        description = "Runs one chat command (translate, settings, help, moderation) and prints the replies")
public class CliArguments {

    @CommandLine.Option(names = "--data-dir", description = "Directory holding settings, templates, profiles and quota counters", paramLabel = "DIR")
    private Path dataDirectory;

    @CommandLine.Option(names = "--platform", converter = ChatPlatformConverter.class, defaultValue = "twitch",
            description = "Chat surface the command came from: twitch or youtube")
    private ChatPlatform platform = ChatPlatform.TWITCH;

    @CommandLine.Option(names = "--user", required = true, description = "Display name of the caller", paramLabel = "NAME")
    private String user;

    @CommandLine.Option(names = "--user-id", required = true, description = "Stable platform id of the caller", paramLabel = "ID")
    private String userId;

    @CommandLine.Option(names = "--moderator", description = "Caller holds moderator rights")
    private boolean moderator;

    @CommandLine.Option(names = "--command", defaultValue = "!tr", description = "Command token as typed, e.g. !tr, !tr!, !sl", paramLabel = "TOKEN")
    private String command = "!tr";

    @CommandLine.Option(names = "--translation-mode", converter = TranslationModeConverter.class,
            description = "Backend mode: production or mock")
    private TranslationMode translationMode;

    @CommandLine.Option(names = "--log-format", converter = LogFormatConverter.class, description = "Log format: text or json")
    private LogFormat logFormat;

    @CommandLine.Parameters(arity = "0..*", paramLabel = "INPUT", description = "Raw command input")
    private List<String> input = new ArrayList<>();

    public Path dataDirectory() {
        return dataDirectory;
    }

    public ChatPlatform platform() {
        return platform;
    }

    public String user() {
        return user;
    }

    public String userId() {
        return userId;
    }

    public boolean moderator() {
        return moderator;
    }

    public String command() {
        return command;
    }

    public TranslationMode translationMode() {
        return translationMode;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public String rawInput() {
        return input == null ? "" : String.join(" ", input);
    }
}
