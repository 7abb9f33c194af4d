package ai.gamedata.translator.batch;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Rolling average over the most recent unit latencies.
 */
final class LatencyTracker {

    private final int window;
    private final Deque<Long> samples = new ArrayDeque<>();
    private long sum;

    LatencyTracker(int window) {
        this.window = window;
    }

    synchronized void record(Duration latency) {
        long nanos = latency.toNanos();
        samples.addLast(nanos);
        sum += nanos;
        while (samples.size() > window) {
            sum -= samples.removeFirst();
        }
    }

    synchronized Optional<Duration> estimateRemaining(int remainingUnits, int workers) {
        if (samples.isEmpty() || remainingUnits <= 0) {
            return samples.isEmpty() ? Optional.empty() : Optional.of(Duration.ZERO);
        }
        long average = sum / samples.size();
        return Optional.of(Duration.ofNanos(average * remainingUnits / Math.max(1, workers)));
    }
}
