package ai.gamedata.translator.batch;

import ai.gamedata.translator.project.UnitId;

/**
 * A command targeted a unit that a worker is currently translating.
 */
public class UnitBusyException extends RuntimeException {

    public UnitBusyException(UnitId unitId) {
        super("Unit " + unitId + " is being translated");
    }
}
