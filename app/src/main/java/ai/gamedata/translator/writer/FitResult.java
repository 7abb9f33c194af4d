package ai.gamedata.translator.writer;

import java.util.List;

/**
 * Lines to write into a run of {@code segmentCount} commands. Under
 * {@link SegmentOverflowPolicy#INSERT_COMMANDS} {@code lines} may be longer than the run.
 */
public record FitResult(List<String> lines, int segmentCount, boolean padded, boolean merged) {

    public FitResult {
        lines = List.copyOf(lines);
    }

    public int extraLines() {
        return Math.max(0, lines.size() - segmentCount);
    }

    public boolean refitted() {
        return padded || merged || extraLines() > 0;
    }
}
