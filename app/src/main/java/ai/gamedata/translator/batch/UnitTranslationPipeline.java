package ai.gamedata.translator.batch;

import ai.gamedata.translator.codec.SourceScript;
import ai.gamedata.translator.context.ContextAssembler;
import ai.gamedata.translator.context.HistoryEntry;
import ai.gamedata.translator.context.TranslationContext;
import ai.gamedata.translator.placeholder.PlaceholderTransformer;
import ai.gamedata.translator.placeholder.UnmaskResult;
import ai.gamedata.translator.project.TranslatableUnit;
import ai.gamedata.translator.translate.Correction;
import ai.gamedata.translator.translate.PassMode;
import ai.gamedata.translator.translate.TranslationException;
import ai.gamedata.translator.translate.TranslationRequest;
import ai.gamedata.translator.translate.Translator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Context, translator call, leakage check and placeholder restoration for a single unit. At most two
 * translator calls are made per run.
 */
public class UnitTranslationPipeline {

    private static final Logger LOGGER = LoggerFactory.getLogger(UnitTranslationPipeline.class);

    private final Translator translator;
    private final ContextAssembler assembler;
    private final PlaceholderTransformer transformer;

    public UnitTranslationPipeline(Translator translator, ContextAssembler assembler, PlaceholderTransformer transformer) {
        this.translator = Objects.requireNonNull(translator, "translator");
        this.assembler = Objects.requireNonNull(assembler, "assembler");
        this.transformer = Objects.requireNonNull(transformer, "transformer");
    }

    PipelineResult run(TranslatableUnit unit, PassMode mode, List<HistoryEntry> history,
                       Optional<Correction> correction, Optional<Double> temperature) {
        TranslationContext context = assembler.build(unit, mode, history);
        TranslationRequest request = new TranslationRequest(context, false, correction, temperature);
        String output = translator.translate(request);
        boolean retried = false;
        boolean retryFailed = false;
        if (SourceScript.containsResidualSource(output)) {
            LOGGER.info("Source script left in translation of {}; asking once more", unit.id());
            retried = true;
            try {
                output = translator.translate(request.intensified());
            } catch (TranslationException ex) {
                LOGGER.warn("Second attempt for {} failed, keeping the first translation: {}", unit.id(), ex.getMessage());
                retryFailed = true;
            }
            if (SourceScript.containsResidualSource(output)) {
                LOGGER.warn("Accepting translation of {} with residual source script", unit.id());
            }
        }
        UnmaskResult restored = transformer.restore(output, context.source());
        if (!restored.complete()) {
            LOGGER.warn("Reinserted {} dropped placeholder(s) in {}", restored.missingTokens().size(), unit.id());
        }
        String text = unit.category().isName() ? NameCasing.titleCase(restored.text()) : restored.text();
        return new PipelineResult(text, new HistoryEntry(context.maskedSource(), output), retried,
                retryFailed, restored.missingTokens());
    }
}
