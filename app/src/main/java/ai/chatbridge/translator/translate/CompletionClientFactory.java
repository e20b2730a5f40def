package ai.chatbridge.translator.translate;

import ai.chatbridge.translator.settings.ModelTier;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Provides the completion backend for the configured translation mode.
 *
 * <p>The production backend is only built when a prompt is first sent, so commands that never reach the
 * backend do not need model credentials. A backend that cannot be built answers every prompt with an
 * empty result.</p>
 */
public class CompletionClientFactory {

    private static final Logger LOGGER = LoggerFactory.getLogger(CompletionClientFactory.class);

    private final Supplier<CompletionClient> productionClient;
    private final CompletionClient mockClient;

    public CompletionClientFactory(Supplier<CompletionClient> productionClient, CompletionClient mockClient) {
        this.productionClient = Objects.requireNonNull(productionClient, "productionClient");
        this.mockClient = Objects.requireNonNull(mockClient, "mockClient");
    }

    public CompletionClient select(TranslationMode mode) {
        return switch (mode) {
            case PRODUCTION -> new DeferredCompletionClient(productionClient);
            case MOCK -> mockClient;
        };
    }

    static final class DeferredCompletionClient implements CompletionClient {

        private final Supplier<CompletionClient> supplier;
        private CompletionClient delegate;
        private boolean failed;

        DeferredCompletionClient(Supplier<CompletionClient> supplier) {
            this.supplier = supplier;
        }

        @Override
        public synchronized Optional<String> complete(ModelTier tier, String prompt) {
            if (failed) {
                return Optional.empty();
            }
            if (delegate == null) {
                try {
                    delegate = supplier.get();
                } catch (RuntimeException ex) {
                    failed = true;
                    LOGGER.error("Completion backend is unavailable: {}", ex.getMessage(), ex);
                    return Optional.empty();
                }
            }
            return delegate.complete(tier, prompt);
        }
    }
}
