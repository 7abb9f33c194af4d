package ai.gamedata.translator.translate;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class TranslatorFactoryTest {

    @Test
    void productionTranslatorIsOnlyCreatedWhenSelected() {
        AtomicInteger created = new AtomicInteger();
        Translator production = request -> "translated";
        TranslatorFactory factory = new TranslatorFactory(() -> {
            created.incrementAndGet();
            return production;
        }, new PassThroughTranslator(), new MockTranslator());

        assertThat(factory.select(TranslationMode.MOCK)).isInstanceOf(MockTranslator.class);
        assertThat(factory.select(TranslationMode.DRY_RUN)).isInstanceOf(PassThroughTranslator.class);
        assertThat(created.get()).isZero();

        assertThat(factory.select(TranslationMode.PRODUCTION)).isSameAs(production);
        assertThat(created.get()).isEqualTo(1);
    }

    @Test
    void mockAndDryRunLeavePlaceholdersInPlace() {
        TranslationRequest request = TranslationRequests.dialogue("\\N[1]、おはよう");

        assertThat(new MockTranslator().translate(request)).isEqualTo("[MOCK] ⟦1⟧、おはよう");
        assertThat(new PassThroughTranslator().translate(request)).isEqualTo("⟦1⟧、おはよう");
    }

    @Test
    void parsesModeNames() {
        assertThat(TranslationMode.from("dry-run")).isEqualTo(TranslationMode.DRY_RUN);
        assertThat(TranslationMode.from("MOCK")).isEqualTo(TranslationMode.MOCK);
        assertThat(TranslationMode.from(null)).isEqualTo(TranslationMode.PRODUCTION);
        assertThat(PassMode.from("polish")).isEqualTo(PassMode.POLISH);
    }
}
