package ai.gamedata.translator.translate;

import dev.langchain4j.exception.ModelNotFoundException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import java.util.Objects;

/**
 * Translator backed by a LangChain4j {@link ChatModel} implementation.
 */
public class ChatModelTranslator implements Translator {

    private static final String CODE_FENCE = "```";

    private final ChatModel model;
    private final String providerName;
    private final String modelName;
    private final TranslationPromptBuilder promptBuilder;

    public ChatModelTranslator(ChatModel model, String providerName, String modelName, TranslationPromptBuilder promptBuilder) {
        this.model = Objects.requireNonNull(model, "model");
        this.providerName = requireNonBlank(providerName, "providerName");
        this.modelName = requireNonBlank(modelName, "modelName");
        this.promptBuilder = Objects.requireNonNull(promptBuilder, "promptBuilder");
    }

    @Override
    public String translate(TranslationRequest request) {
        ChatRequest.Builder chatRequest = ChatRequest.builder().messages(promptBuilder.messages(request));
        request.temperature().ifPresent(chatRequest::temperature);
        ChatResponse response;
        try {
            response = model.chat(chatRequest.build());
        } catch (RuntimeException ex) {
            if (isModelMissing(ex)) {
                throw new TranslationException("%s model '%s' is not available.".formatted(providerName, modelName), ex);
            }
            throw new TranslationException("LangChain translation failed", ex);
        }
        String text = response == null || response.aiMessage() == null ? null : response.aiMessage().text();
        if (text == null || text.isBlank()) {
            throw new TranslationException("%s model '%s' returned an empty translation".formatted(providerName, modelName));
        }
        return clean(text);
    }

    private static String clean(String response) {
        String cleaned = response.strip();
        if (cleaned.startsWith(CODE_FENCE) && cleaned.endsWith(CODE_FENCE) && cleaned.length() > 2 * CODE_FENCE.length()) {
            int firstLineEnd = cleaned.indexOf('\n');
            int closing = cleaned.lastIndexOf(CODE_FENCE);
            if (firstLineEnd > 0 && firstLineEnd < closing) {
                cleaned = cleaned.substring(firstLineEnd + 1, closing).strip();
            }
        }
        return cleaned;
    }

    private boolean isModelMissing(Throwable throwable) {
        Throwable cause = throwable;
        while (cause != null) {
            if (cause instanceof ModelNotFoundException) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value;
    }
}
