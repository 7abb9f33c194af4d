package ai.gamedata.translator.batch;

import ai.gamedata.translator.project.UnitId;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Thread-safe accumulator behind {@link BatchReport}.
 */
final class BatchTally {

    private int translated;
    private int memoryHits;
    private int glossaryHits;
    private int skipped;
    private int failed;
    private int processed;
    private int completed;
    private final Map<ErrorKind, Integer> errors = new EnumMap<>(ErrorKind.class);
    private final Map<UnitId, String> failures = new LinkedHashMap<>();

    synchronized int translated() {
        translated++;
        return ++completed;
    }

    synchronized int memoryHit() {
        memoryHits++;
        return ++completed;
    }

    synchronized int glossaryHit() {
        glossaryHits++;
        return ++completed;
    }

    synchronized int failed(UnitId unitId, String message) {
        failed++;
        failures.put(unitId, message == null ? "" : message);
        error(ErrorKind.TRANSIENT);
        return ++completed;
    }

    synchronized void skipped() {
        skipped++;
    }

    synchronized void error(ErrorKind kind) {
        errors.merge(kind, 1, Integer::sum);
    }

    synchronized int completedCount() {
        return completed;
    }

    synchronized int processed() {
        return ++processed;
    }

    synchronized BatchReport toReport(int pending, boolean cancelled) {
        return new BatchReport(translated, memoryHits, glossaryHits, skipped, failed, pending, errors, failures, cancelled);
    }
}
