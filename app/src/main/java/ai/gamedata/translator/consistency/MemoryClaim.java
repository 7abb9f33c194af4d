package ai.gamedata.translator.consistency;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Result of {@link TranslationMemory#claim(String)}. The owner must either {@link #complete(String)} or
 * {@link #abandon(Throwable)} the claim; a waiter calls {@link #await()}.
 */
public final class MemoryClaim {

    private static final Logger LOGGER = LoggerFactory.getLogger(MemoryClaim.class);

    private final TranslationMemory memory;
    private final String sourceText;
    private final CompletableFuture<String> future;
    private final boolean owner;

    MemoryClaim(TranslationMemory memory, String sourceText, CompletableFuture<String> future, boolean owner) {
        this.memory = memory;
        this.sourceText = sourceText;
        this.future = future;
        this.owner = owner;
    }

    public boolean isOwner() {
        return owner;
    }

    public void complete(String translation) {
        requireOwner();
        future.complete(Objects.requireNonNull(translation, "translation"));
    }

    public void abandon(Throwable cause) {
        requireOwner();
        memory.abandon(sourceText, future, cause);
    }

    /**
     * Blocks until the owning worker finishes.
     *
     * @return the owner's translation, or empty when the owner failed and the caller should claim again
     */
    public Optional<String> await() {
        if (owner) {
            throw new IllegalStateException("Owner cannot wait on its own claim");
        }
        try {
            return Optional.of(future.join());
        } catch (CompletionException ex) {
            LOGGER.debug("Owner of '{}' gave up: {}", sourceText, ex.getMessage());
            return Optional.empty();
        }
    }

    private void requireOwner() {
        if (!owner) {
            throw new IllegalStateException("Claim on '" + sourceText + "' is held by another worker");
        }
    }
}
