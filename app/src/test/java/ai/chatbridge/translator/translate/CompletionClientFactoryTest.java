package ai.chatbridge.translator.translate;

import static org.assertj.core.api.Assertions.assertThat;

import ai.chatbridge.translator.settings.ModelTier;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class CompletionClientFactoryTest {

    @Test
    void mockModeUsesMockClient() {
        MockCompletionClient mock = new MockCompletionClient();
        CompletionClientFactory factory = new CompletionClientFactory(() -> {
            throw new IllegalStateException("not expected");
        }, mock);

        assertThat(factory.select(TranslationMode.MOCK)).isSameAs(mock);
    }

    @Test
    void productionClientIsBuiltOnFirstPromptOnly() {
        AtomicInteger builds = new AtomicInteger();
        CompletionClientFactory factory = new CompletionClientFactory(() -> {
            builds.incrementAndGet();
            return (tier, prompt) -> Optional.of("ok");
        }, new MockCompletionClient());

        CompletionClient client = factory.select(TranslationMode.PRODUCTION);
        assertThat(builds).hasValue(0);

        client.complete(ModelTier.FAST, "a");
        client.complete(ModelTier.STRONG, "b");
        assertThat(builds).hasValue(1);
    }

    @Test
    void unbuildableBackendAnswersEmpty() {
        CompletionClientFactory factory = new CompletionClientFactory(() -> {
            throw new TranslationException("GEMINI_API_KEY is not set");
        }, new MockCompletionClient());

        assertThat(factory.select(TranslationMode.PRODUCTION).complete(ModelTier.FAST, "a")).isEmpty();
    }

    @Test
    void mockClientDetectsEnglishAndEchoes() {
        MockCompletionClient mock = new MockCompletionClient();

        assertThat(mock.complete(ModelTier.FAST, PromptBuilder.DETECTION_INSTRUCTION + " Text: \"hi\"")).contains("en");
        assertThat(mock.complete(ModelTier.FAST, "Translate. " + PromptBuilder.TEXT_MARKER + " good day"))
                .contains("[MOCK] good day");
    }
}
