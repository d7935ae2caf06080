package com.example.cardlobby.delivery;

import java.time.Duration;

/**
 * Retry policy of one emission. Delay before attempt n+1 is
 * {@code min(baseDelay * multiplier^(n-1), maxDelay)}; at most {@code maxRetries} attempts are made.
 */
public record EmitOptions(
        int maxRetries,
        Duration baseDelay,
        Duration maxDelay,
        double multiplier,
        boolean awaitConfirmation,
        Duration confirmationTimeout
) {

    public static final EmitOptions DEFAULTS = new EmitOptions(
            3, Duration.ofSeconds(1), Duration.ofSeconds(8), 2.0, false, Duration.ofSeconds(5));

    public EmitOptions {
        maxRetries = Math.max(1, maxRetries);
        baseDelay = (baseDelay == null || baseDelay.isNegative()) ? Duration.ZERO : baseDelay;
        maxDelay = (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) ? baseDelay : maxDelay;
        multiplier = multiplier < 1.0 ? 1.0 : multiplier;
        confirmationTimeout = (confirmationTimeout == null) ? Duration.ofSeconds(5) : confirmationTimeout;
    }

    /** Single attempt, no retries. */
    public static EmitOptions once() {
        return DEFAULTS.withMaxRetries(1);
    }

    public EmitOptions withMaxRetries(int n) {
        return new EmitOptions(n, baseDelay, maxDelay, multiplier, awaitConfirmation, confirmationTimeout);
    }

    public EmitOptions withAwaitConfirmation(boolean await) {
        return new EmitOptions(maxRetries, baseDelay, maxDelay, multiplier, await, confirmationTimeout);
    }

    public Duration delayBeforeRetry(int attemptsSoFar) {
        double factor = Math.pow(multiplier, Math.max(0, attemptsSoFar - 1));
        long ms = (long) Math.min(baseDelay.toMillis() * factor, (double) maxDelay.toMillis());
        return Duration.ofMillis(ms);
    }
}
