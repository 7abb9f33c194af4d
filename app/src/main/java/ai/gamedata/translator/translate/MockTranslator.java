package ai.gamedata.translator.translate;

/**
 * Mock translator that tags the masked source, leaving placeholders in place.
 */
public class MockTranslator implements Translator {

    static final String PREFIX = "[MOCK] ";

    @Override
    public String translate(TranslationRequest request) {
        return PREFIX + request.context().maskedSource();
    }
}
