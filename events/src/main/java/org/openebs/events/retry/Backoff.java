package org.openebs.events.retry;

import java.time.Duration;

/**
 * Attempt counter and delay policy for a single retry loop.
 *
 * <p>The delay stays flat at {@link BackoffOptions#initDelay()} for the first
 * {@link BackoffOptions#cutoff()} attempts and then grows linearly by
 * {@link BackoffOptions#step()} up to {@link BackoffOptions#maxDelay()}.
 * There is no exponential growth, so reconnect latency stays predictable.</p>
 *
 * <p>Create one instance per retry loop and keep it for the loop's lifetime. The
 * counter is incremented only by {@link #backoff()} and {@link #skip()}. Instances
 * are not thread-safe and must not be shared between concurrent loops.</p>
 *
 * <pre>
 * var backoff = new Backoff(BackoffOptions.defaults());
 * while (true) {
 *     try {
 *         return attempt();
 *     } catch (IOException e) {
 *         if (backoff.isExhausted()) throw wrap(e);
 *         backoff.backoff();
 *     }
 * }
 * </pre>
 */
public final class Backoff {

    private final BackoffOptions options;
    private final Sleeper sleeper;
    private int attempts;

    public Backoff(BackoffOptions options) {
        this(options, Sleeper.THREAD);
    }

    public Backoff(BackoffOptions options, Sleeper sleeper) {
        this.options = options;
        this.sleeper = sleeper;
    }

    /**
     * Delay for the given attempt number (1-based, already incremented).
     */
    public static Duration delay(int attempts, BackoffOptions options) {
        if (attempts <= options.cutoff()) {
            return options.initDelay();
        }
        Duration grown = options.initDelay()
                .plus(options.step().multipliedBy((long) attempts - options.cutoff() - 1));
        return grown.compareTo(options.maxDelay()) < 0 ? grown : options.maxDelay();
    }

    /**
     * Count an attempt and sleep for its delay.
     *
     * @return the delay that was slept
     */
    public Duration backoff() throws InterruptedException {
        attempts++;
        Duration delay = delay(attempts, options);
        sleeper.sleep(delay);
        return delay;
    }

    /**
     * Count an attempt without sleeping.
     */
    public void skip() {
        attempts++;
    }

    public int attempts() {
        return attempts;
    }

    /**
     * @return true once the loop has used up {@link BackoffOptions#maxRetries()}
     */
    public boolean isExhausted() {
        return attempts >= options.maxRetries();
    }

    public BackoffOptions options() {
        return options;
    }
}
