package mail.taxonomy.app.provider;

import lombok.Value;

import java.time.Duration;

/**
 * Attempt budget and exponential backoff for one provider.
 */
@Value
public class RetryPolicy {
    int maxAttempts;
    Duration baseDelay;
    Duration maxDelay;

    public RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
    }

    /**
     * Delay to wait after the given failed attempt (1-based): base * 2^(attempt-1), capped at maxDelay.
     */
    public Duration delayAfter(int attempt) {
        long factor = 1L << Math.min(Math.max(attempt - 1, 0), 20);
        long millis = baseDelay.toMillis() * factor;
        return Duration.ofMillis(Math.min(millis, maxDelay.toMillis()));
    }
}
