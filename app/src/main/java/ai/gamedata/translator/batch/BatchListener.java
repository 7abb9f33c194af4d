package ai.gamedata.translator.batch;

import ai.gamedata.translator.project.UnitId;

/**
 * Receives batch notifications. Callbacks run on worker threads.
 */
public interface BatchListener {

    BatchListener NONE = new BatchListener() {
    };

    default void onProgress(ProgressEvent event) {
    }

    default void onCheckpoint(CheckpointEvent event) {
    }

    default void onUnitFailed(UnitId unitId, ErrorKind kind, String message) {
    }
}
