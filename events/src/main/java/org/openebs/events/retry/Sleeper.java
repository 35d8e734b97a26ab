package org.openebs.events.retry;

import java.time.Duration;

/**
 * Suspends the calling thread between retry attempts.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
