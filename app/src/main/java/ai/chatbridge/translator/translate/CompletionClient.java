package ai.chatbridge.translator.translate;

import ai.chatbridge.translator.settings.ModelTier;
import java.util.Optional;

/**
 * Text-completion backend. Any failure, including a safety refusal, is reported as an empty result.
 */
@FunctionalInterface
public interface CompletionClient {

    Optional<String> complete(ModelTier tier, String prompt);
}
