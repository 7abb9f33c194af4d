package ai.gamedata.translator.translate;

/**
 * Translator used for dry-run scenarios that echoes the masked source without invoking remote APIs.
 */
public class PassThroughTranslator implements Translator {

    @Override
    public String translate(TranslationRequest request) {
        return request.context().maskedSource();
    }
}
