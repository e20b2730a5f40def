package ai.chatbridge.translator.translate;

import static org.assertj.core.api.Assertions.assertThat;

import ai.chatbridge.translator.settings.ModelTier;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.FinishReason;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ChatModelCompletionClientTest {

    private static ChatModel replying(String text, FinishReason reason, List<String> prompts) {
        return new ChatModel() {
            @Override
            public ChatResponse doChat(ChatRequest request) {
                prompts.add(request.messages().toString());
                return ChatResponse.builder()
                        .aiMessage(AiMessage.from(text))
                        .finishReason(reason)
                        .build();
            }
        };
    }

    @Test
    @DisplayName("Routes each tier to its own model and trims the reply")
    void routesByTier() {
        List<String> fastPrompts = new ArrayList<>();
        List<String> strongPrompts = new ArrayList<>();
        ChatModelCompletionClient client = new ChatModelCompletionClient(
                replying(" es \n", FinishReason.STOP, fastPrompts),
                replying("Hola", FinishReason.STOP, strongPrompts));

        assertThat(client.complete(ModelTier.FAST, "detect")).contains("es");
        assertThat(client.complete(ModelTier.STRONG, "translate")).contains("Hola");
        assertThat(fastPrompts).hasSize(1);
        assertThat(strongPrompts).hasSize(1);
    }

    @Test
    @DisplayName("Safety refusals count as no result")
    void contentFilterIsEmpty() {
        ChatModel model = replying("blocked", FinishReason.CONTENT_FILTER, new ArrayList<>());
        ChatModelCompletionClient client = new ChatModelCompletionClient(model, model);

        assertThat(client.complete(ModelTier.FAST, "x")).isEmpty();
    }

    @Test
    void blankReplyIsEmpty() {
        ChatModel model = replying("   ", FinishReason.STOP, new ArrayList<>());
        ChatModelCompletionClient client = new ChatModelCompletionClient(model, model);

        assertThat(client.complete(ModelTier.STRONG, "x")).isEmpty();
    }

    @Test
    void failingModelIsEmpty() {
        ChatModel model = new ChatModel() {
            @Override
            public ChatResponse doChat(ChatRequest request) {
                throw new IllegalStateException("quota exhausted upstream");
            }
        };
        ChatModelCompletionClient client = new ChatModelCompletionClient(model, model);

        assertThat(client.complete(ModelTier.FAST, "x")).isEmpty();
    }
}
