package ai.gamedata.translator.consistency;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class TranslationMemoryTest {

    @Test
    void keepsTheFirstTranslation() {
        TranslationMemory memory = new TranslationMemory();

        assertThat(memory.putIfAbsent("おはよう", "Good morning")).isTrue();
        assertThat(memory.putIfAbsent("おはよう", "Morning!")).isFalse();

        assertThat(memory.lookup("おはよう")).contains("Good morning");
        assertThat(memory.size()).isEqualTo(1);
    }

    @Test
    void pendingClaimIsNotVisibleToLookup() {
        TranslationMemory memory = new TranslationMemory();

        MemoryClaim claim = memory.claim("おはよう");

        assertThat(claim.isOwner()).isTrue();
        assertThat(memory.lookup("おはよう")).isEmpty();
        assertThat(memory.size()).isZero();

        claim.complete("Good morning");
        assertThat(memory.lookup("おはよう")).contains("Good morning");
    }

    @Test
    void waiterReceivesTheOwnersTranslation() throws Exception {
        TranslationMemory memory = new TranslationMemory();
        MemoryClaim owner = memory.claim("おはよう");
        MemoryClaim waiter = memory.claim("おはよう");
        assertThat(waiter.isOwner()).isFalse();

        CompletableFuture<Optional<String>> awaited = CompletableFuture.supplyAsync(waiter::await);
        owner.complete("Good morning");

        assertThat(awaited.get(5, TimeUnit.SECONDS)).contains("Good morning");
    }

    @Test
    void abandonedClaimLetsTheNextWorkerClaimAgain() {
        TranslationMemory memory = new TranslationMemory();
        MemoryClaim owner = memory.claim("おはよう");
        MemoryClaim waiter = memory.claim("おはよう");

        owner.abandon(new IllegalStateException("model unavailable"));

        assertThat(waiter.await()).isEmpty();
        assertThat(memory.claim("おはよう").isOwner()).isTrue();
    }

    @Test
    void onlyTheOwnerMayCompleteAClaim() {
        TranslationMemory memory = new TranslationMemory();
        memory.claim("おはよう");
        MemoryClaim waiter = memory.claim("おはよう");

        assertThatThrownBy(() -> waiter.complete("Hi")).isInstanceOf(IllegalStateException.class);
    }
}
