package ai.gamedata.translator.translate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.gamedata.translator.context.HistoryEntry;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.ModelNotFoundException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ChatModelTranslatorTest {

    private final TranslationPromptBuilder promptBuilder = new TranslationPromptBuilder("Japanese", "English");

    @Test
    @DisplayName("Sends instructions, history turns and the masked text as chat messages")
    void sendsHistoryAsConversationTurns() {
        List<ChatRequest> requests = new ArrayList<>();
        ChatModel stubModel = respondingWith("⟦1⟧, good morning.", requests);
        ChatModelTranslator translator = new ChatModelTranslator(stubModel, "Ollama", "qwen2.5:14b", promptBuilder);
        TranslationRequest request = TranslationRequest.of(TranslationRequests.context("\\N[1]、おはよう。", PassMode.TRANSLATE,
                Optional.empty(), List.of(), List.of(), List.of(new HistoryEntry("こんにちは", "Hello"))));

        String result = translator.translate(request);

        assertThat(result).isEqualTo("⟦1⟧, good morning.");
        List<ChatMessage> messages = requests.get(0).messages();
        assertThat(messages).hasSize(4);
        assertThat(messages.get(0)).isInstanceOf(SystemMessage.class);
        assertThat(((UserMessage) messages.get(1)).singleText()).isEqualTo("こんにちは");
        assertThat(((AiMessage) messages.get(2)).text()).isEqualTo("Hello");
        assertThat(((UserMessage) messages.get(3)).singleText()).isEqualTo("⟦1⟧、おはよう。");
    }

    @Test
    void passesTemperatureOverride() {
        List<ChatRequest> requests = new ArrayList<>();
        ChatModelTranslator translator = new ChatModelTranslator(respondingWith("Hello", requests), "Ollama", "qwen2.5:14b",
                promptBuilder);

        translator.translate(TranslationRequests.dialogue("こんにちは").withTemperature(0.7));

        assertThat(requests.get(0).parameters().temperature()).isEqualTo(0.7);
    }

    @Test
    void stripsSurroundingCodeFence() {
        ChatModelTranslator translator = new ChatModelTranslator(respondingWith("```text\nGood morning\n```", new ArrayList<>()),
                "Gemini", "models/test", promptBuilder);

        assertThat(translator.translate(TranslationRequests.dialogue("おはよう"))).isEqualTo("Good morning");
    }

    @Test
    void blankResponseIsAFailure() {
        ChatModelTranslator translator = new ChatModelTranslator(respondingWith("  ", new ArrayList<>()),
                "Gemini", "models/test", promptBuilder);

        assertThatThrownBy(() -> translator.translate(TranslationRequests.dialogue("おはよう")))
                .isInstanceOf(TranslationException.class)
                .hasMessageContaining("empty translation");
    }

    @Test
    void missingModelIsReportedByName() {
        ChatModel missing = new ChatModel() {
            @Override
            public ChatResponse doChat(ChatRequest chatRequest) {
                throw new ModelNotFoundException("model 'qwen2.5:14b' not found");
            }
        };
        ChatModelTranslator translator = new ChatModelTranslator(missing, "Ollama", "qwen2.5:14b", promptBuilder);

        assertThatThrownBy(() -> translator.translate(TranslationRequests.dialogue("おはよう")))
                .isInstanceOf(TranslationException.class)
                .hasMessage("Ollama model 'qwen2.5:14b' is not available.");
    }

    private static ChatModel respondingWith(String text, List<ChatRequest> requests) {
        return new ChatModel() {
            @Override
            public ChatResponse doChat(ChatRequest chatRequest) {
                requests.add(chatRequest);
                return ChatResponse.builder().aiMessage(AiMessage.from(text)).build();
            }
        };
    }
}
