package ai.gamedata.translator.batch;

import ai.gamedata.translator.project.UnitId;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome counts of one batch run.
 *
 * @param translated units translated by a translator call
 * @param memoryHits units filled from the translation memory
 * @param glossaryHits units filled because their whole text is a glossary term
 * @param skipped units that needed no work
 * @param failed units left failed
 * @param pending units never reached because the batch was cancelled
 */
public record BatchReport(int translated,
                          int memoryHits,
                          int glossaryHits,
                          int skipped,
                          int failed,
                          int pending,
                          Map<ErrorKind, Integer> errors,
                          Map<UnitId, String> failures,
                          boolean cancelled) {

    public BatchReport {
        errors = Map.copyOf(errors);
        failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    public int errorCount(ErrorKind kind) {
        return errors.getOrDefault(kind, 0);
    }

    public int completed() {
        return translated + memoryHits + glossaryHits;
    }

    public static BatchReport empty() {
        return new BatchReport(0, 0, 0, 0, 0, 0, new EnumMap<>(ErrorKind.class), Map.of(), false);
    }
}
