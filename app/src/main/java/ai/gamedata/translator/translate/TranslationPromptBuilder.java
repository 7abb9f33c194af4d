package ai.gamedata.translator.translate;

import ai.gamedata.translator.consistency.GlossaryEntry;
import ai.gamedata.translator.context.HistoryEntry;
import ai.gamedata.translator.context.TranslationContext;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns a {@link TranslationRequest} into chat messages: instructions as the system message, the history
 * window as earlier user/assistant turns, and the masked text as the final user message.
 */
public class TranslationPromptBuilder {

    private final String sourceLanguage;
    private final String targetLanguage;

    public TranslationPromptBuilder(String sourceLanguage, String targetLanguage) {
        this.sourceLanguage = Objects.requireNonNull(sourceLanguage, "sourceLanguage");
        this.targetLanguage = Objects.requireNonNull(targetLanguage, "targetLanguage");
    }

    public List<ChatMessage> messages(TranslationRequest request) {
        TranslationContext context = request.context();
        List<ChatMessage> messages = new ArrayList<>();
        messages.add(SystemMessage.from(systemPrompt(request)));
        for (HistoryEntry entry : context.history()) {
            messages.add(UserMessage.from(entry.source()));
            messages.add(AiMessage.from(entry.translation()));
        }
        messages.add(UserMessage.from(context.maskedSource()));
        return messages;
    }

    String systemPrompt(TranslationRequest request) {
        TranslationContext context = request.context();
        StringBuilder prompt = new StringBuilder();
        if (request.mode() == PassMode.POLISH) {
            prompt.append("You are editing an existing ").append(targetLanguage)
                    .append(" translation of a ").append(sourceLanguage).append(" role-playing game.\n")
                    .append("Improve fluency and grammar so it reads like natural ").append(targetLanguage)
                    .append(" game text, without changing the meaning.\n");
        } else {
            prompt.append("You translate text from a ").append(sourceLanguage).append(" role-playing game into natural ")
                    .append(targetLanguage).append(".\n");
        }
        prompt.append("Rules:\n")
                .append("- Tokens such as ⟦1⟧ and ⟦/1⟧ stand for game control codes. Copy every token exactly once ")
                .append("and keep opening and closing tokens around the words they enclose.\n");
        int lines = context.maskedSource().split("\n", -1).length;
        if (lines > 1) {
            prompt.append("- The text has ").append(lines).append(" lines. Keep the line breaks.\n");
        }
        prompt.append("- Output only the ").append(targetLanguage)
                .append(" text. Do not add notes, quotes or explanations.\n");
        prompt.append("Text type: ").append(context.category().label()).append('\n');
        context.speakerName().ifPresent(name -> prompt.append("Speaker: ").append(name).append('\n'));

        if (!context.glossary().isEmpty()) {
            prompt.append("\nGlossary (always use these translations):\n");
            for (GlossaryEntry entry : context.glossary()) {
                prompt.append("- ").append(entry.sourceTerm()).append(" = ").append(entry.targetTerm()).append('\n');
            }
        }
        if (!context.genderHints().isEmpty()) {
            prompt.append("\nCharacters in this game (ALWAYS use the listed pronouns):\n");
            for (String hint : context.genderHints()) {
                prompt.append("- ").append(hint).append('\n');
            }
        }
        request.correction().ifPresent(correction -> {
            prompt.append("\nA reviewer rejected the translation \"").append(correction.rejectedTranslation()).append("\".");
            if (!correction.hint().isEmpty()) {
                prompt.append(" Reviewer note: ").append(correction.hint());
            }
            prompt.append('\n');
        });
        if (request.strict()) {
            prompt.append("\nIMPORTANT: your previous answer still contained ").append(sourceLanguage)
                    .append(" characters. Translate every word; the answer must not contain any ")
                    .append(sourceLanguage).append(" script.\n");
        }
        return prompt.toString();
    }
}
