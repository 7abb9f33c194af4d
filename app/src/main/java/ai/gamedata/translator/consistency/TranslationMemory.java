package ai.gamedata.translator.consistency;

import ai.gamedata.translator.project.TranslatableUnit;
import java.util.Collection;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Exact-match memory from source text to the first successful translation of the session.
 * A source text that is being translated is represented by an incomplete future so that other
 * workers wait for it instead of calling the model again.
 */
public final class TranslationMemory {

    private final ConcurrentMap<String, CompletableFuture<String>> entries = new ConcurrentHashMap<>();

    public Optional<String> lookup(String sourceText) {
        CompletableFuture<String> future = entries.get(sourceText);
        if (future == null || !future.isDone() || future.isCompletedExceptionally()) {
            return Optional.empty();
        }
        return Optional.of(future.join());
    }

    /**
     * Records a finished translation unless the source text already has one.
     */
    public boolean putIfAbsent(String sourceText, String translation) {
        Objects.requireNonNull(translation, "translation");
        return entries.putIfAbsent(sourceText, CompletableFuture.completedFuture(translation)) == null;
    }

    /**
     * Seeds the memory from units that already carry a translation.
     *
     * @return number of new entries
     */
    public int seed(Collection<TranslatableUnit> units) {
        int added = 0;
        for (TranslatableUnit unit : units) {
            TranslatableUnit copy = unit.snapshot();
            if (copy.status().carriesTranslation() && !copy.translation().isEmpty()
                    && putIfAbsent(copy.sourceText(), copy.translation())) {
                added++;
            }
        }
        return added;
    }

    /**
     * Claims the right to translate a source text, or returns a handle on the claim somebody else holds.
     */
    public MemoryClaim claim(String sourceText) {
        Objects.requireNonNull(sourceText, "sourceText");
        CompletableFuture<String> mine = new CompletableFuture<>();
        CompletableFuture<String> existing = entries.putIfAbsent(sourceText, mine);
        if (existing == null) {
            return new MemoryClaim(this, sourceText, mine, true);
        }
        return new MemoryClaim(this, sourceText, existing, false);
    }

    public int size() {
        return (int) entries.values().stream()
                .filter(future -> future.isDone() && !future.isCompletedExceptionally())
                .count();
    }

    void abandon(String sourceText, CompletableFuture<String> future, Throwable cause) {
        if (future.isDone()) {
            return;
        }
        entries.remove(sourceText, future);
        future.completeExceptionally(cause);
    }
}
