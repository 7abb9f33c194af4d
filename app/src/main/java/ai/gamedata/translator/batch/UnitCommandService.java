package ai.gamedata.translator.batch;

import ai.gamedata.translator.context.HistoryWindow;
import ai.gamedata.translator.project.TranslatableUnit;
import ai.gamedata.translator.translate.Correction;
import ai.gamedata.translator.translate.PassMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-unit commands issued by an operator. Every command claims the unit first and is rejected with
 * {@link UnitBusyException} while a worker holds it. None of them write to the history window.
 */
public class UnitCommandService {

    private static final Logger LOGGER = LoggerFactory.getLogger(UnitCommandService.class);
    static final List<Double> VARIANT_TEMPERATURES = List.of(0.3, 0.7, 1.0);

    private final UnitTranslationPipeline pipeline;
    private final HistoryWindow history;
    private final InFlightRegistry inFlight;

    public UnitCommandService(UnitTranslationPipeline pipeline, HistoryWindow history, InFlightRegistry inFlight) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.history = Objects.requireNonNull(history, "history");
        this.inFlight = Objects.requireNonNull(inFlight, "inFlight");
    }

    /**
     * Translates the unit again, optionally telling the model what was wrong with the current translation.
     */
    public String retranslate(TranslatableUnit unit, Optional<Correction> correction) {
        return claimed(unit, () -> {
            PipelineResult result = pipeline.run(unit, PassMode.TRANSLATE, history.snapshot(),
                    correction == null ? Optional.empty() : correction, Optional.empty());
            unit.markTranslated(result.text());
            LOGGER.info("Retranslated {}", unit.id());
            return result.text();
        });
    }

    /**
     * Candidate translations at increasing temperatures. The unit is not modified.
     */
    public List<String> generateVariants(TranslatableUnit unit) {
        return claimed(unit, () -> {
            List<String> variants = new ArrayList<>(VARIANT_TEMPERATURES.size());
            for (Double temperature : VARIANT_TEMPERATURES) {
                variants.add(pipeline.run(unit, PassMode.TRANSLATE, history.snapshot(), Optional.empty(),
                        Optional.of(temperature)).text());
            }
            return List.copyOf(variants);
        });
    }

    public void applyVariant(TranslatableUnit unit, String text) {
        Objects.requireNonNull(text, "text");
        claimed(unit, () -> {
            unit.markTranslated(text);
            return text;
        });
    }

    public String polish(TranslatableUnit unit) {
        return claimed(unit, () -> {
            if (!unit.status().carriesTranslation() || unit.translation().isBlank()) {
                throw new IllegalStateException("Unit " + unit.id() + " has no translation to polish");
            }
            PipelineResult result = pipeline.run(unit, PassMode.POLISH, history.snapshot(), Optional.empty(), Optional.empty());
            unit.markTranslated(result.text());
            return result.text();
        });
    }

    public void markReviewed(TranslatableUnit unit) {
        claimed(unit, () -> {
            unit.markReviewed();
            return null;
        });
    }

    public void skip(TranslatableUnit unit) {
        claimed(unit, () -> {
            unit.markSkipped();
            return null;
        });
    }

    private <T> T claimed(TranslatableUnit unit, Supplier<T> command) {
        Objects.requireNonNull(unit, "unit");
        if (!inFlight.tryClaim(unit.id())) {
            throw new UnitBusyException(unit.id());
        }
        try {
            return command.get();
        } finally {
            inFlight.release(unit.id());
        }
    }
}
