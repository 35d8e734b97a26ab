package org.openebs.events.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Delay settings for retries against the message bus.
 *
 * <p>The first {@code cutoff} attempts wait {@code initDelay}; every attempt after
 * that waits one {@code step} longer, capped at {@code maxDelay}. A retry loop gives
 * up once it has made {@code maxRetries} attempts.</p>
 *
 * @param initDelay  delay used for the first {@code cutoff} attempts
 * @param cutoff     number of attempts that use the initial delay
 * @param step       increase in delay for each attempt past the cutoff
 * @param maxDelay   ceiling for the delay
 * @param maxRetries number of retries before a loop gives up
 */
public record BackoffOptions(
        Duration initDelay,
        int cutoff,
        Duration step,
        Duration maxDelay,
        int maxRetries
) {
    public BackoffOptions {
        Objects.requireNonNull(initDelay, "initDelay is required");
        Objects.requireNonNull(step, "step is required");
        Objects.requireNonNull(maxDelay, "maxDelay is required");
        if (initDelay.isNegative() || step.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("Backoff durations must not be negative");
        }
        if (maxDelay.compareTo(initDelay) < 0) {
            throw new IllegalArgumentException(
                    "maxDelay " + maxDelay + " is shorter than initDelay " + initDelay);
        }
        if (cutoff < 0 || maxRetries < 0) {
            throw new IllegalArgumentException("cutoff and maxRetries must not be negative");
        }
    }

    /**
     * General purpose options: 5s for four attempts, then +2s per attempt up to 10s,
     * giving up after 10 retries.
     */
    public static BackoffOptions defaults() {
        return new BackoffOptions(Duration.ofSeconds(5), 4, Duration.ofSeconds(2),
                Duration.ofSeconds(10), 10);
    }

    /**
     * Options for the publish retry loop. Same values as {@link #defaults()} for now.
     */
    public static BackoffOptions publishDefaults() {
        return new BackoffOptions(Duration.ofSeconds(5), 4, Duration.ofSeconds(2),
                Duration.ofSeconds(10), 10);
    }

    /**
     * Options for connecting to the server. The connect loop never gives up, so
     * {@code maxRetries} is not consulted.
     */
    public static BackoffOptions connection() {
        return new BackoffOptions(Duration.ofSeconds(5), 4, Duration.ofSeconds(2),
                Duration.ofSeconds(10), Integer.MAX_VALUE);
    }

    public BackoffOptions withInitDelay(Duration initDelay) {
        return new BackoffOptions(initDelay, cutoff, step, maxDelay, maxRetries);
    }

    public BackoffOptions withCutoff(int cutoff) {
        return new BackoffOptions(initDelay, cutoff, step, maxDelay, maxRetries);
    }

    public BackoffOptions withStep(Duration step) {
        return new BackoffOptions(initDelay, cutoff, step, maxDelay, maxRetries);
    }

    public BackoffOptions withMaxDelay(Duration maxDelay) {
        return new BackoffOptions(initDelay, cutoff, step, maxDelay, maxRetries);
    }

    public BackoffOptions withMaxRetries(int maxRetries) {
        return new BackoffOptions(initDelay, cutoff, step, maxDelay, maxRetries);
    }
}
