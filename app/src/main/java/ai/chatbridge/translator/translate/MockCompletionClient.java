package ai.chatbridge.translator.translate;

import ai.chatbridge.translator.settings.ModelTier;
import java.util.Optional;

/**
 * Offline backend: detects every text as English and echoes translations with a {@code [MOCK]} marker.
 */
public class MockCompletionClient implements CompletionClient {

    @Override
    public Optional<String> complete(ModelTier tier, String prompt) {
        if (prompt.startsWith(PromptBuilder.DETECTION_INSTRUCTION)) {
            return Optional.of("en");
        }
        int marker = prompt.lastIndexOf(PromptBuilder.TEXT_MARKER);
        String text = marker < 0 ? prompt : prompt.substring(marker + PromptBuilder.TEXT_MARKER.length()).trim();
        return Optional.of("[MOCK] " + text);
    }
}
