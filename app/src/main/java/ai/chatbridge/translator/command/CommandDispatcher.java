package ai.chatbridge.translator.command;

import ai.chatbridge.translator.keyword.PronounNormalizer;
import ai.chatbridge.translator.reply.ChatReplier;
import ai.chatbridge.translator.reply.ChatSender;
import ai.chatbridge.translator.settings.BotSettings;
import ai.chatbridge.translator.settings.TemplateTable;
import ai.chatbridge.translator.settings.UserProfile;
import ai.chatbridge.translator.store.BotStore;
import ai.chatbridge.translator.store.ProfileRepository;
import ai.chatbridge.translator.store.StoreException;
import ai.chatbridge.translator.template.MessageLocalizer;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Routes a command token to its {@link ChatCommand} and runs it as one isolated invocation.
 *
 * <p>Each run loads settings and templates afresh, upserts the caller's profile, then executes the
 * command. No exception leaves {@link #dispatch(CommandRequest)}: failures are logged and turned into the
 * generic error reply, or into silence for moderator commands that cannot load their data.</p>
 */
public class CommandDispatcher {

    public static final String CRITICAL_ERROR_MESSAGE = "Bot Admin: Critical error loading config. Translation disabled.";

    private static final Logger LOGGER = LoggerFactory.getLogger(CommandDispatcher.class);

    private final BotStore store;
    private final ChatSender sender;
    private final Duration chunkDelay;
    private final Map<String, ChatCommand> commandsByToken = new LinkedHashMap<>();
    private final Map<String, ChatCommand> commandsByName = new LinkedHashMap<>();

    public CommandDispatcher(BotStore store, ChatSender sender, Duration chunkDelay, List<ChatCommand> commands) {
        this.store = Objects.requireNonNull(store, "store");
        this.sender = Objects.requireNonNull(sender, "sender");
        this.chunkDelay = chunkDelay == null ? Duration.ZERO : chunkDelay;
        for (ChatCommand command : Objects.requireNonNull(commands, "commands")) {
            commandsByName.put(command.name(), command);
            for (String token : command.tokens()) {
                commandsByToken.put(token.toLowerCase(Locale.ROOT), command);
            }
        }
    }

    /**
     * @return the outcome of routing; replies have already been sent
     */
    public DispatchResult dispatch(CommandRequest request) {
        Objects.requireNonNull(request, "request");
        MDC.put("platform", request.platform().id());
        MDC.put("command", request.commandToken());
        MDC.put("userId", request.userId());
        try {
            return dispatchInternal(request);
        } finally {
            MDC.remove("platform");
            MDC.remove("command");
            MDC.remove("userId");
        }
    }

    private DispatchResult dispatchInternal(CommandRequest request) {
        ChatReplier replier = new ChatReplier(sender, request.platform(), chunkDelay);
        BotSettings settings;
        TemplateTable templates;
        try {
            settings = store.loadSettings();
            templates = store.loadTemplates();
        } catch (StoreException ex) {
            LOGGER.error("Cannot load bot settings or templates: {}", ex.getMessage(), ex);
            Optional<ChatCommand> builtIn = findBuiltIn(request.commandToken());
            if (builtIn.isPresent() && !builtIn.get().moderatorOnly()) {
                replier.send(CRITICAL_ERROR_MESSAGE);
            }
            return DispatchResult.CONFIGURATION_MISSING;
        }

        Optional<ChatCommand> command = resolve(request.commandToken(), settings);
        if (command.isEmpty()) {
            LOGGER.warn("Unknown command token '{}'", request.commandToken());
            return DispatchResult.UNKNOWN_COMMAND;
        }
        if (command.get().moderatorOnly() && !request.moderator()) {
            LOGGER.info("Ignoring moderator command {} from non-moderator {}", command.get().name(), request.username());
            return DispatchResult.NOT_PERMITTED;
        }

        MessageLocalizer localizer = new MessageLocalizer(templates, settings,
                new PronounNormalizer(settings.pronounNormalizationMap()));
        ProfileRepository profiles = new ProfileRepository(store, settings);
        CommandContext context = null;
        try {
            UserProfile caller = profiles.getOrUpdate(request.userId(), request.username());
            context = new CommandContext(request, settings, localizer, caller, profiles, store, replier);
            command.get().execute(context);
            return DispatchResult.HANDLED;
        } catch (RuntimeException ex) {
            LOGGER.error("Command {} failed for user {} ({}), input '{}'", command.get().name(), request.username(),
                    request.userId(), request.rawInput(), ex);
            replyApiError(context, replier, request, localizer);
            return DispatchResult.FAILED;
        }
    }

    private void replyApiError(CommandContext context, ChatReplier replier, CommandRequest request,
                               MessageLocalizer localizer) {
        try {
            if (context != null) {
                context.reply("apiError");
            } else {
                UserProfile fallback = new UserProfile(request.username(), null, null, null, null);
                replier.reply(request.username(), localizer.message(fallback, "apiError"));
            }
        } catch (RuntimeException ex) {
            LOGGER.error("Could not send the error reply", ex);
        }
    }

    Optional<ChatCommand> resolve(String token, BotSettings settings) {
        String normalized = token == null ? "" : token.trim().toLowerCase(Locale.ROOT);
        Optional<ChatCommand> builtIn = findBuiltIn(normalized);
        if (builtIn.isPresent()) {
            return builtIn;
        }
        for (String candidate : List.of(normalized, withoutForceMarker(normalized))) {
            for (Map.Entry<String, String> alias : settings.commandAliases().entrySet()) {
                if (alias.getKey().equalsIgnoreCase(candidate)) {
                    return Optional.ofNullable(commandsByName.get(alias.getValue().toLowerCase(Locale.ROOT)));
                }
            }
        }
        return Optional.empty();
    }

    private Optional<ChatCommand> findBuiltIn(String token) {
        String normalized = token == null ? "" : token.trim().toLowerCase(Locale.ROOT);
        ChatCommand command = commandsByToken.get(normalized);
        if (command == null) {
            command = commandsByToken.get(withoutForceMarker(normalized));
        }
        return Optional.ofNullable(command);
    }

    private static String withoutForceMarker(String token) {
        return token.length() > 1 && token.endsWith("!") ? token.substring(0, token.length() - 1) : token;
    }

    public enum DispatchResult {
        HANDLED,
        FAILED,
        UNKNOWN_COMMAND,
        NOT_PERMITTED,
        CONFIGURATION_MISSING
    }
}
