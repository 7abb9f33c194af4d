package ai.gamedata.translator.writer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Fits translated lines onto a run of consecutive text commands.
 */
public class SegmentFitter {

    private final SegmentOverflowPolicy overflowPolicy;

    public SegmentFitter(SegmentOverflowPolicy overflowPolicy) {
        this.overflowPolicy = Objects.requireNonNull(overflowPolicy, "overflowPolicy");
    }

    public SegmentOverflowPolicy overflowPolicy() {
        return overflowPolicy;
    }

    public FitResult fit(String translation, int segmentCount) {
        return fit(translation, segmentCount, overflowPolicy);
    }

    /**
     * Fits with an explicit overflow policy, used for units whose line breaks must survive export.
     */
    public FitResult fit(String translation, int segmentCount, SegmentOverflowPolicy policy) {
        Objects.requireNonNull(policy, "policy");
        if (segmentCount < 1) {
            throw new IllegalArgumentException("segmentCount must be positive");
        }
        List<String> lines = translation == null ? List.of("") : List.of(translation.split("\n", -1));
        if (lines.size() == segmentCount) {
            return new FitResult(lines, segmentCount, false, false);
        }
        if (lines.size() < segmentCount) {
            List<String> padded = new ArrayList<>(lines);
            padded.addAll(Collections.nCopies(segmentCount - lines.size(), ""));
            return new FitResult(padded, segmentCount, true, false);
        }
        if (policy == SegmentOverflowPolicy.INSERT_COMMANDS) {
            return new FitResult(lines, segmentCount, false, false);
        }
        List<String> merged = new ArrayList<>(lines.subList(0, segmentCount - 1));
        merged.add(String.join(" ", lines.subList(segmentCount - 1, lines.size())));
        return new FitResult(merged, segmentCount, false, true);
    }
}
