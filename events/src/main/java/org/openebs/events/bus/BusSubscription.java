package org.openebs.events.bus;

import java.io.Closeable;
import java.util.Optional;

/**
 * Ordered stream of decoded messages from a bus consumer.
 *
 * <p>Not thread-safe: one thread owns the pull cursor. To stop early, stop calling
 * {@link #next()} and {@link #close()} the subscription.</p>
 */
public interface BusSubscription<T> extends Closeable {

    /**
     * Block until the next message that decodes as {@code T} is delivered.
     *
     * <p>Delivery errors and undecodable payloads never end the subscription; they are
     * logged and skipped.</p>
     *
     * @return the next value, or empty once the subscription has been closed
     */
    Optional<T> next();

    /**
     * Stop delivery. Idempotent. Subsequent {@link #next()} calls return empty.
     */
    @Override
    void close();
}
