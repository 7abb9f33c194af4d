package ai.gamedata.translator.batch;

import ai.gamedata.translator.project.UnitId;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Units currently claimed by a worker or a command. A unit can be claimed by one party at a time.
 */
public final class InFlightRegistry {

    private final Set<UnitId> claimed = ConcurrentHashMap.newKeySet();

    public boolean tryClaim(UnitId unitId) {
        return claimed.add(unitId);
    }

    public void release(UnitId unitId) {
        claimed.remove(unitId);
    }

    public boolean isInFlight(UnitId unitId) {
        return claimed.contains(unitId);
    }
}
