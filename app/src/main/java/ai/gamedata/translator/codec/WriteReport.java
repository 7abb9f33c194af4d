package ai.gamedata.translator.codec;

import ai.gamedata.translator.project.UnitId;
import java.util.List;
import java.util.Set;

/**
 * Outcome of applying units to a document set.
 */
public record WriteReport(int appliedUnits, List<UnitId> refittedUnits, List<UnitId> lossyMerges,
                          int insertedCommands, Set<String> touchedFiles) {

    public WriteReport {
        refittedUnits = List.copyOf(refittedUnits);
        lossyMerges = List.copyOf(lossyMerges);
        touchedFiles = Set.copyOf(touchedFiles);
    }
}
