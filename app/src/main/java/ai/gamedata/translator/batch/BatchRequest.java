package ai.gamedata.translator.batch;

import ai.gamedata.translator.project.TranslatableUnit;
import ai.gamedata.translator.translate.PassMode;
import java.util.List;
import java.util.Objects;

public record BatchRequest(List<TranslatableUnit> units, int workerCount, PassMode mode, BatchOrdering ordering,
                           boolean autoGlossary) {

    public BatchRequest {
        units = List.copyOf(units);
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be at least 1");
        }
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(ordering, "ordering");
    }
}
