package ai.gamedata.translator.batch;

import ai.gamedata.translator.project.UnitId;
import java.time.Duration;
import java.util.Optional;

public record ProgressEvent(int completed, int total, UnitId unitId, String preview, Optional<Duration> eta) {
}
