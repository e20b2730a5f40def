package ai.chatbridge.translator.command;

import ai.chatbridge.translator.quota.QuotaTracker;
import ai.chatbridge.translator.translate.CompletionClient;
import ai.chatbridge.translator.translate.TranslationOrchestrator;
import ai.chatbridge.translator.translate.TranslationOutcome;
import ai.chatbridge.translator.translate.TranslationRequest;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code !tr} and {@code !tr!}: translates the input through {@link TranslationOrchestrator}.
 */
public class TranslateCommand implements ChatCommand {

    private static final Logger LOGGER = LoggerFactory.getLogger(TranslateCommand.class);

    private final CompletionClient completionClient;
    private final QuotaTracker quotaTracker;

    public TranslateCommand(CompletionClient completionClient, QuotaTracker quotaTracker) {
        this.completionClient = Objects.requireNonNull(completionClient, "completionClient");
        this.quotaTracker = Objects.requireNonNull(quotaTracker, "quotaTracker");
    }

    @Override
    public String name() {
        return "translate";
    }

    @Override
    public List<String> tokens() {
        return List.of("!tr", "!tr!");
    }

    @Override
    public void execute(CommandContext context) {
        TranslationOrchestrator orchestrator = new TranslationOrchestrator(context.settings(), context.localizer(),
                completionClient, quotaTracker, context.replier());
        CommandRequest request = context.request();
        TranslationOutcome outcome = orchestrator.translate(new TranslationRequest(request.userId(), request.username(),
                request.commandToken(), request.rawInput(), context.caller()));
        LOGGER.debug("Translate command finished with {}", outcome);
    }
}
