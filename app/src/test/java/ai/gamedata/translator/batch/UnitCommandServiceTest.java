package ai.gamedata.translator.batch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.gamedata.translator.consistency.ActorRegistry;
import ai.gamedata.translator.consistency.ConsistencyStore;
import ai.gamedata.translator.consistency.Glossary;
import ai.gamedata.translator.consistency.TranslationMemory;
import ai.gamedata.translator.context.ContextAssembler;
import ai.gamedata.translator.context.HistoryWindow;
import ai.gamedata.translator.placeholder.PlaceholderTransformer;
import ai.gamedata.translator.project.ContentCategory;
import ai.gamedata.translator.project.TranslatableUnit;
import ai.gamedata.translator.project.UnitId;
import ai.gamedata.translator.project.UnitStatus;
import ai.gamedata.translator.translate.Correction;
import ai.gamedata.translator.translate.TranslationRequest;
import ai.gamedata.translator.translate.Translator;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class UnitCommandServiceTest {

    private final List<TranslationRequest> requests = new ArrayList<>();
    private final HistoryWindow history = new HistoryWindow(3);
    private final InFlightRegistry inFlight = new InFlightRegistry();
    private TranslatableUnit unit;

    @BeforeEach
    void setUp() {
        unit = new TranslatableUnit(new UnitId("Map001.json", "/events/1/pages/0/list/1/parameters/0"), "おはよう",
                ContentCategory.DIALOGUE, 1, null, 1);
    }

    @Test
    void retranslateForwardsTheCorrection() {
        unit.markTranslated("Good morrow");
        UnitCommandService commands = service(request -> "Morning!");

        String result = commands.retranslate(unit, Optional.of(new Correction("more casual", unit.translation())));

        assertThat(result).isEqualTo("Morning!");
        assertThat(unit.translation()).isEqualTo("Morning!");
        assertThat(requests.get(0).correction()).contains(new Correction("more casual", "Good morrow"));
        assertThat(history.snapshot()).isEmpty();
    }

    @Test
    void variantsUseRisingTemperaturesAndLeaveTheUnitAlone() {
        UnitCommandService commands = service(request -> "Variant " + request.temperature().orElseThrow());

        List<String> variants = commands.generateVariants(unit);

        assertThat(variants).containsExactly("Variant 0.3", "Variant 0.7", "Variant 1.0");
        assertThat(unit.status()).isEqualTo(UnitStatus.UNTRANSLATED);

        commands.applyVariant(unit, variants.get(1));
        assertThat(unit.translation()).isEqualTo("Variant 0.7");
        assertThat(unit.status()).isEqualTo(UnitStatus.TRANSLATED);
    }

    @Test
    void commandsAreRejectedWhileAWorkerHoldsTheUnit() {
        UnitCommandService commands = service(request -> "Good morning");
        inFlight.tryClaim(unit.id());

        assertThatThrownBy(() -> commands.retranslate(unit, Optional.empty()))
                .isInstanceOf(UnitBusyException.class)
                .hasMessageContaining(unit.id().toString());
        assertThatThrownBy(() -> commands.skip(unit)).isInstanceOf(UnitBusyException.class);
        assertThat(requests).isEmpty();

        inFlight.release(unit.id());
        commands.skip(unit);
        assertThat(unit.status()).isEqualTo(UnitStatus.SKIPPED);
    }

    @Test
    void commandReleasesTheUnitEvenWhenItFails() {
        UnitCommandService commands = service(request -> "unused");

        assertThatThrownBy(() -> commands.polish(unit)).isInstanceOf(IllegalStateException.class);

        assertThat(inFlight.isInFlight(unit.id())).isFalse();
    }

    @Test
    void polishAndReviewWorkOnTranslatedUnits() {
        unit.markTranslated("Good mornin");
        UnitCommandService commands = service(request -> "Good morning.");

        assertThat(commands.polish(unit)).isEqualTo("Good morning.");
        commands.markReviewed(unit);

        assertThat(unit.status()).isEqualTo(UnitStatus.REVIEWED);
        assertThat(unit.translation()).isEqualTo("Good morning.");
    }

    private UnitCommandService service(Translator translator) {
        Translator recording = request -> {
            requests.add(request);
            return translator.translate(request);
        };
        ConsistencyStore store = new ConsistencyStore(new Glossary(), new TranslationMemory(), new ActorRegistry());
        PlaceholderTransformer transformer = new PlaceholderTransformer();
        UnitTranslationPipeline pipeline = new UnitTranslationPipeline(recording,
                new ContextAssembler(store, transformer, 3), transformer);
        return new UnitCommandService(pipeline, history, inFlight);
    }
}
