package ai.chatbridge.translator.cli;

import ai.chatbridge.translator.command.BlockUserCommand;
import ai.chatbridge.translator.command.BlockWordCommand;
import ai.chatbridge.translator.command.ChatCommand;
import ai.chatbridge.translator.command.CommandDispatcher;
import ai.chatbridge.translator.command.CommandRequest;
import ai.chatbridge.translator.command.HelpCommand;
import ai.chatbridge.translator.command.SetLanguageCommand;
import ai.chatbridge.translator.command.SetUserLanguageCommand;
import ai.chatbridge.translator.command.TranslateCommand;
import ai.chatbridge.translator.command.UnblockUserCommand;
import ai.chatbridge.translator.command.UnblockWordCommand;
import ai.chatbridge.translator.command.UserDirectory;
import ai.chatbridge.translator.config.Config;
import ai.chatbridge.translator.config.ConfigLoader;
import ai.chatbridge.translator.config.Secrets;
import ai.chatbridge.translator.config.SystemEnvironmentReader;
import ai.chatbridge.translator.config.TranslatorConfig;
import ai.chatbridge.translator.logging.LoggingConfigurator;
import ai.chatbridge.translator.quota.JsonFileCounterStore;
import ai.chatbridge.translator.quota.QuotaTracker;
import ai.chatbridge.translator.quota.QuotaWindowClock;
import ai.chatbridge.translator.reply.ChatSender;
import ai.chatbridge.translator.reply.ConsoleChatSender;
import ai.chatbridge.translator.store.JsonFileBotStore;
import ai.chatbridge.translator.translate.ChatModelCompletionClient;
import ai.chatbridge.translator.translate.CompletionClient;
import ai.chatbridge.translator.translate.CompletionClientFactory;
import ai.chatbridge.translator.translate.MockCompletionClient;
import ai.chatbridge.translator.translate.TranslationException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point: parses one chat command from the command line, wires the collaborators and dispatches it.
 * Replies go to stdout, one chat message per line; logs go to stderr.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    private final ConfigLoader configLoader;
    private final ChatSender chatSender;
    private final CompletionClient completionOverride;
    private final Clock clock;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), new ConsoleChatSender(System.out), null, Clock.systemUTC());
    }

    CliApplication(ConfigLoader configLoader, ChatSender chatSender, CompletionClient completionOverride, Clock clock) {
        this.configLoader = configLoader;
        this.chatSender = chatSender;
        this.completionOverride = completionOverride;
        this.clock = clock;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);
        commandLine.setUnmatchedOptionsArePositionalParams(true);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config = configLoader.load(cliArguments);
        LoggingConfigurator.configure(config.logFormat(), config.logLevel());
        LOGGER.debug("Handling {} from {} on {} (mode {})", cliArguments.command(), cliArguments.user(),
                cliArguments.platform().id(), config.translationMode());

        JsonFileBotStore store = new JsonFileBotStore(config.dataDirectory());
        QuotaTracker quotaTracker = new QuotaTracker(new JsonFileCounterStore(config.dataDirectory()),
                new QuotaWindowClock(clock, config.quotaTimeZones()));
        CompletionClient completionClient = completionOverride != null ? completionOverride
                : new CompletionClientFactory(() -> createProductionClient(config), new MockCompletionClient())
                        .select(config.translationMode());
        UserDirectory directory = UserDirectory.none();
        List<ChatCommand> commands = List.of(
                new TranslateCommand(completionClient, quotaTracker),
                new HelpCommand(),
                new SetLanguageCommand(),
                new SetUserLanguageCommand(directory),
                new BlockUserCommand(directory),
                new UnblockUserCommand(directory),
                new BlockWordCommand(),
                new UnblockWordCommand());
        CommandDispatcher dispatcher = new CommandDispatcher(store, chatSender, config.chunkDelay(), commands);

        CommandDispatcher.DispatchResult result = dispatcher.dispatch(new CommandRequest(cliArguments.platform(),
                cliArguments.userId(), cliArguments.user(), cliArguments.moderator(), cliArguments.command(),
                cliArguments.rawInput()));
        LOGGER.debug("Dispatch result: {}", result);
        return 0;
    }

    private CompletionClient createProductionClient(Config config) {
        TranslatorConfig translatorConfig = config.translatorConfig();
        return new ChatModelCompletionClient(
                createChatModel(translatorConfig, translatorConfig.fastModelName(), config.secrets()),
                createChatModel(translatorConfig, translatorConfig.strongModelName(), config.secrets()));
    }

    private ChatModel createChatModel(TranslatorConfig translatorConfig, String modelName, Secrets secrets) {
        return switch (translatorConfig.provider()) {
            case OLLAMA -> createOllamaChatModel(translatorConfig, modelName);
            case GEMINI -> createGeminiChatModel(modelName, secrets);
        };
    }

    private ChatModel createOllamaChatModel(TranslatorConfig translatorConfig, String modelName) {
        try {
            String baseUrl = translatorConfig.baseUrl()
                    .orElseThrow(() -> new TranslationException("OLLAMA_BASE_URL must be configured when LLM_PROVIDER=ollama"));
            LOGGER.debug("Using Ollama model '{}' via {}", modelName, baseUrl);
            return OllamaChatModel.builder()
                    .baseUrl(baseUrl)
                    .modelName(modelName)
                    .temperature(0.2)
                    .timeout(Duration.ofSeconds(30))
                    .build();
        } catch (RuntimeException ex) {
            throw new TranslationException("Failed to initialize Ollama chat model", ex);
        }
    }

    private ChatModel createGeminiChatModel(String modelName, Secrets secrets) {
        String apiKey = secrets.geminiApiKey()
                .filter(value -> !value.isBlank())
                .orElseThrow(() -> new TranslationException("GEMINI_API_KEY must be provided when LLM_PROVIDER=gemini"));
        try {
            LOGGER.debug("Using Gemini model '{}'", modelName);
            return GoogleAiGeminiChatModel.builder()
                    .apiKey(apiKey)
                    .modelName(modelName)
                    .temperature(0.2)
                    .timeout(Duration.ofSeconds(30))
                    .build();
        } catch (RuntimeException ex) {
            throw new TranslationException("Failed to initialize Gemini chat model", ex);
        }
    }
}
