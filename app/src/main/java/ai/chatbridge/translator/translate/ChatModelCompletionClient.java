package ai.chatbridge.translator.translate;

import ai.chatbridge.translator.settings.ModelTier;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.FinishReason;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link CompletionClient} backed by one LangChain4j {@link ChatModel} per tier.
 */
public class ChatModelCompletionClient implements CompletionClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChatModelCompletionClient.class);

    private final Map<ModelTier, ChatModel> models = new EnumMap<>(ModelTier.class);

    public ChatModelCompletionClient(ChatModel fastModel, ChatModel strongModel) {
        models.put(ModelTier.FAST, Objects.requireNonNull(fastModel, "fastModel"));
        models.put(ModelTier.STRONG, Objects.requireNonNull(strongModel, "strongModel"));
    }

    @Override
    public Optional<String> complete(ModelTier tier, String prompt) {
        ChatModel model = models.get(Objects.requireNonNull(tier, "tier"));
        try {
            ChatResponse response = model.chat(ChatRequest.builder()
                    .messages(UserMessage.from(prompt))
                    .build());
            if (response == null) {
                LOGGER.warn("{} model returned no response", tier.id());
                return Optional.empty();
            }
            if (response.finishReason() == FinishReason.CONTENT_FILTER) {
                LOGGER.warn("{} model refused the prompt on safety grounds", tier.id());
                return Optional.empty();
            }
            AiMessage message = response.aiMessage();
            String text = message == null ? null : message.text();
            if (text == null || text.isBlank()) {
                LOGGER.warn("{} model returned an empty reply (finish reason {})", tier.id(), response.finishReason());
                return Optional.empty();
            }
            return Optional.of(text.trim());
        } catch (RuntimeException ex) {
            LOGGER.warn("{} model call failed: {}", tier.id(), ex.getMessage(), ex);
            return Optional.empty();
        }
    }
}
