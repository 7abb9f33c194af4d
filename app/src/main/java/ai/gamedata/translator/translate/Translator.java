package ai.gamedata.translator.translate;

/**
 * Low-level translator turning one masked unit text into the target language.
 */
public interface Translator {

    /**
     * @throws TranslationException when the backing service fails
     */
    String translate(TranslationRequest request);
}
