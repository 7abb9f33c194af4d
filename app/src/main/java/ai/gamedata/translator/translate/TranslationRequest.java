package ai.gamedata.translator.translate;

import ai.gamedata.translator.context.TranslationContext;
import java.util.Objects;
import java.util.Optional;

/**
 * A single translator call: the assembled context plus per-call options.
 *
 * @param strict ask the model, more forcefully, to leave no source-language text behind
 * @param temperature overrides the model's default sampling temperature
 */
public record TranslationRequest(TranslationContext context,
                                 boolean strict,
                                 Optional<Correction> correction,
                                 Optional<Double> temperature) {

    public TranslationRequest {
        Objects.requireNonNull(context, "context");
        correction = correction == null ? Optional.empty() : correction;
        temperature = temperature == null ? Optional.empty() : temperature;
    }

    public static TranslationRequest of(TranslationContext context) {
        return new TranslationRequest(context, false, Optional.empty(), Optional.empty());
    }

    public TranslationRequest intensified() {
        return new TranslationRequest(context, true, correction, temperature);
    }

    public TranslationRequest withTemperature(double value) {
        return new TranslationRequest(context, strict, correction, Optional.of(value));
    }

    public TranslationRequest withCorrection(Correction value) {
        return new TranslationRequest(context, strict, Optional.of(value), temperature);
    }

    public PassMode mode() {
        return context.mode();
    }
}
