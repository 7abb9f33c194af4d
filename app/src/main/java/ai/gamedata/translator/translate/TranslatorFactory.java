package ai.gamedata.translator.translate;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Provides translator instances based on the desired execution mode. The production translator is
 * created lazily so that dry runs never need model credentials.
 */
public class TranslatorFactory {

    private final Supplier<Translator> productionTranslator;
    private final Translator dryRunTranslator;
    private final Translator mockTranslator;

    public TranslatorFactory(Supplier<Translator> productionTranslator,
                             Translator dryRunTranslator,
                             Translator mockTranslator) {
        this.productionTranslator = Objects.requireNonNull(productionTranslator, "productionTranslator");
        this.dryRunTranslator = Objects.requireNonNull(dryRunTranslator, "dryRunTranslator");
        this.mockTranslator = Objects.requireNonNull(mockTranslator, "mockTranslator");
    }

    public Translator select(TranslationMode mode) {
        return switch (mode) {
            case PRODUCTION -> Objects.requireNonNull(productionTranslator.get(), "production translator");
            case DRY_RUN -> dryRunTranslator;
            case MOCK -> mockTranslator;
        };
    }
}
