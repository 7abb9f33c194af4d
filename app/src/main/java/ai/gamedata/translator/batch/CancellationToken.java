package ai.gamedata.translator.batch;

/**
 * Cooperative cancellation flag checked by workers between units.
 */
public final class CancellationToken {

    private volatile boolean cancelled;

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }
}
