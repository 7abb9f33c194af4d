package ai.gamedata.translator.context;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Bounded record of the most recent successful translations, shared by all workers.
 * Concurrent workers see each other's entries on a best-effort basis.
 */
public class HistoryWindow {

    private final int capacity;
    private final Deque<HistoryEntry> entries = new ArrayDeque<>();

    public HistoryWindow(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must not be negative");
        }
        this.capacity = capacity;
    }

    public synchronized void add(HistoryEntry entry) {
        if (capacity == 0) {
            return;
        }
        entries.addLast(entry);
        while (entries.size() > capacity) {
            entries.removeFirst();
        }
    }

    /**
     * Oldest first.
     */
    public synchronized List<HistoryEntry> snapshot() {
        return List.copyOf(entries);
    }

    public int capacity() {
        return capacity;
    }
}
