package ai.gamedata.translator.batch;

import ai.gamedata.translator.project.ProjectState;

/**
 * Emitted on a worker thread every N completed units with a consistent copy of the project.
 */
public record CheckpointEvent(int completedUnits, ProjectState snapshot) {
}
