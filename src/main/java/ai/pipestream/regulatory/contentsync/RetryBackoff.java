package ai.pipestream.regulatory.contentsync;

import java.time.Duration;

/**
 * Exponential backoff: {@code initial * 2^(attempt-1)}, capped at {@code max}.
 */
public record RetryBackoff(Duration initial, Duration max) {

    public Duration delayFor(int attempt) {
        if (attempt <= 1) {
            return min(initial, max);
        }
        int shift = Math.min(attempt - 1, 30);
        long millis = initial.toMillis();
        if (millis > max.toMillis() >> shift) {
            return max;
        }
        return min(Duration.ofMillis(millis << shift), max);
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }
}
