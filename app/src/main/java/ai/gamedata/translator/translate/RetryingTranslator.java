package ai.gamedata.translator.translate;

import dev.langchain4j.exception.RateLimitException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retries rate-limited calls with exponential back-off and jitter, honouring a provider supplied
 * retry delay when the error carries one. Other failures propagate immediately.
 */
public class RetryingTranslator implements Translator {

    private static final Logger LOGGER = LoggerFactory.getLogger(RetryingTranslator.class);
    private static final Pattern RETRY_DELAY_PATTERN = Pattern.compile("(?:retry in |retryDelay\"?:\\s*\")([0-9]+(?:\\.[0-9]+)?)s", Pattern.CASE_INSENSITIVE);

    private final Translator delegate;
    private final RetryPolicy policy;
    private final Sleeper sleeper;

    public RetryingTranslator(Translator delegate, RetryPolicy policy) {
        this(delegate, policy, duration -> Thread.sleep(duration.toMillis()));
    }

    RetryingTranslator(Translator delegate, RetryPolicy policy, Sleeper sleeper) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    @Override
    public String translate(TranslationRequest request) {
        TranslationException lastFailure = null;
        int maxAttempts = policy.maxAttempts();
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            try {
                return delegate.translate(request);
            } catch (TranslationException ex) {
                lastFailure = ex;
                Optional<Duration> maybeDelay = calculateRetryDelay(ex, attempt);
                if (maybeDelay.isEmpty() || attempt == maxAttempts - 1) {
                    if (isRateLimitError(ex)) {
                        LOGGER.error("Translation rate limited; max retries ({}) exceeded", maxAttempts);
                    }
                    throw ex;
                }
                Duration delay = maybeDelay.get();
                LOGGER.warn("Translation rate limited (429/RESOURCE_EXHAUSTED); retrying in {} ms (attempt {}/{})",
                        delay.toMillis(), attempt + 1, maxAttempts);
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException interruptedException) {
                    Thread.currentThread().interrupt();
                    LOGGER.warn("Translation retry interrupted");
                    throw ex;
                }
            }
        }
        throw lastFailure == null ? new TranslationException("Unknown translation failure", null) : lastFailure;
    }

    Optional<Duration> calculateRetryDelay(Throwable throwable, int attemptNumber) {
        if (!isRateLimitError(throwable)) {
            return Optional.empty();
        }
        Optional<Duration> providerDelay = extractProviderRetryAfter(throwable);
        if (providerDelay.isPresent()) {
            return providerDelay;
        }
        // initialBackoff * 2^attempt, capped, then spread by +/- jitterFactor
        long baseDelaySeconds = policy.initialBackoffSeconds() * (1L << Math.min(attemptNumber, 30));
        long cappedDelaySeconds = Math.min(baseDelaySeconds, policy.maxBackoffSeconds());
        double jitterMultiplier = 1.0 + (Math.random() * 2.0 - 1.0) * policy.jitterFactor();
        long finalDelaySeconds = Math.max(1, (long) (cappedDelaySeconds * jitterMultiplier));
        return Optional.of(Duration.ofSeconds(finalDelaySeconds));
    }

    static boolean isRateLimitError(Throwable throwable) {
        Throwable cause = throwable;
        while (cause != null) {
            if (cause instanceof RateLimitException) {
                return true;
            }
            String message = cause.getMessage();
            if (message != null && (message.contains("RESOURCE_EXHAUSTED") || message.contains("429"))) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }

    private Optional<Duration> extractProviderRetryAfter(Throwable throwable) {
        Throwable cause = throwable;
        while (cause != null) {
            String message = cause.getMessage();
            if (message != null) {
                Matcher matcher = RETRY_DELAY_PATTERN.matcher(message);
                if (matcher.find()) {
                    double seconds = Double.parseDouble(matcher.group(1));
                    return Optional.of(Duration.ofMillis(Math.max(0, (long) (seconds * 1000))));
                }
            }
            cause = cause.getCause();
        }
        return Optional.empty();
    }

    @FunctionalInterface
    interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }
}
