package ai.chatbridge.translator.command;

import ai.chatbridge.translator.Fixtures;
import ai.chatbridge.translator.RecordingChatSender;
import ai.chatbridge.translator.quota.InMemoryCounterStore;
import ai.chatbridge.translator.quota.QuotaTracker;
import ai.chatbridge.translator.quota.QuotaWindowClock;
import ai.chatbridge.translator.reply.ChatPlatform;
import ai.chatbridge.translator.settings.BotSettings;
import ai.chatbridge.translator.settings.UserProfile;
import ai.chatbridge.translator.store.JsonFileBotStore;
import ai.chatbridge.translator.translate.MockCompletionClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Dispatcher over a JSON store in a temporary directory, with every command registered and the mock backend.
 */
final class CommandHarness {

    final RecordingChatSender sender = new RecordingChatSender();
    final JsonFileBotStore store;
    final CommandDispatcher dispatcher;

    CommandHarness(Path dataDir) {
        this(dataDir, UserDirectory.none(), List.of());
    }

    CommandHarness(Path dataDir, UserDirectory directory, List<ChatCommand> extraCommands) {
        this.store = new JsonFileBotStore(dataDir);
        QuotaTracker quota = new QuotaTracker(new InMemoryCounterStore(),
                new QuotaWindowClock(Clock.systemUTC(), List.of("America/Los_Angeles")));
        List<ChatCommand> commands = new ArrayList<>(List.of(
                new TranslateCommand(new MockCompletionClient(), quota),
                new SetLanguageCommand(),
                new SetUserLanguageCommand(directory),
                new HelpCommand(),
                new BlockUserCommand(directory),
                new UnblockUserCommand(directory),
                new BlockWordCommand(),
                new UnblockWordCommand()));
        commands.addAll(extraCommands);
        this.dispatcher = new CommandDispatcher(store, sender, Duration.ZERO, commands);
    }

    static CommandHarness installed(Path dataDir) {
        return new CommandHarness(Fixtures.installInto(dataDir));
    }

    CommandDispatcher.DispatchResult user(String userId, String username, String token, String input) {
        return dispatcher.dispatch(new CommandRequest(ChatPlatform.TWITCH, userId, username, false, token, input));
    }

    CommandDispatcher.DispatchResult moderator(String token, String input) {
        return moderator(ChatPlatform.TWITCH, token, input);
    }

    CommandDispatcher.DispatchResult moderator(ChatPlatform platform, String token, String input) {
        return dispatcher.dispatch(new CommandRequest(platform, "1", "mod", true, token, input));
    }

    UserProfile profile(String userId) {
        return store.loadProfiles().get(userId);
    }

    BotSettings settings() {
        return store.loadSettings();
    }

    List<String> messages() {
        return sender.messages();
    }
}
