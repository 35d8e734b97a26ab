package org.openebs.events.publisher;

import org.openebs.events.bus.MessageBus;
import org.openebs.events.config.EventBusConfig;
import org.openebs.events.model.EventMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Fire-and-forget event publishing for services that must never wait on the bus.
 *
 * <p>{@link #offer(EventMessage)} puts the event into a bounded buffer and returns
 * immediately. A single background thread drains the buffer and publishes each event
 * through the {@link MessageBus}, retries included. Events are dropped, never
 * blocked on, when the buffer is full or the publisher is closed, and when the bus
 * finally gives up on them.</p>
 *
 * <h3>Usage:</h3>
 * <pre>
 * var publisher = new EventPublisher(bus, 1024);
 * publisher.start();
 * publisher.offer(event);
 * // ...
 * publisher.close();
 * </pre>
 */
public class EventPublisher implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(EventPublisher.class);

    private static final long POLL_MILLIS = 200;

    private final MessageBus bus;
    private final BlockingQueue<EventMessage> buffer;
    private final boolean enabled;

    private volatile boolean running = false;
    private volatile boolean closed = false;
    private Thread worker;

    public EventPublisher(MessageBus bus, int bufferSize) {
        this(bus, bufferSize, true);
    }

    private EventPublisher(MessageBus bus, int bufferSize, boolean enabled) {
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("bufferSize must be positive: " + bufferSize);
        }
        this.bus = bus;
        this.buffer = new ArrayBlockingQueue<>(bufferSize);
        this.enabled = enabled;
    }

    public static EventPublisher fromConfig(MessageBus bus, EventBusConfig config) {
        return new EventPublisher(bus, config.getPublisher().getBufferSize(), config.isEnabled());
    }

    // ========== Lifecycle ==========

    public synchronized void start() {
        if (running) {
            log.warn("EventPublisher is already running");
            return;
        }
        if (closed) {
            log.warn("EventPublisher is closed and cannot be restarted");
            return;
        }
        if (!enabled) {
            log.info("Event publishing is disabled by configuration");
            return;
        }
        worker = new Thread(this::drain, "mbus-event-publisher");
        worker.setDaemon(true);
        running = true;
        worker.start();
        log.info("EventPublisher started (buffer capacity: {})", buffer.remainingCapacity() + buffer.size());
    }

    /**
     * Stop accepting events. Events still buffered are published until the worker
     * has drained them or {@code timeout} passes; anything left after that is dropped.
     */
    public synchronized void close(long timeout, TimeUnit unit) {
        if (closed) return;
        closed = true;
        running = false;
        if (worker != null) {
            try {
                worker.join(unit.toMillis(timeout));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (worker.isAlive()) {
                worker.interrupt();
            }
        }
        int dropped = buffer.size();
        buffer.clear();
        if (dropped > 0) {
            log.warn("EventPublisher closed, dropped {} buffered events", dropped);
        }
        log.info("EventPublisher stopped");
    }

    @Override
    public void close() {
        close(5, TimeUnit.SECONDS);
    }

    // ========== Publishing ==========

    /**
     * Queue an event for publishing without blocking.
     *
     * @return true if the event was buffered
     */
    public boolean offer(EventMessage message) {
        if (!enabled) {
            log.trace("Event publishing is disabled, dropping event {}", message.eventId());
            return false;
        }
        if (closed) {
            log.warn("Event publisher is closed, dropping event {}", message.eventId());
            return false;
        }
        if (!buffer.offer(message)) {
            log.trace("Event buffer is full, dropping event {}", message.eventId());
            return false;
        }
        return true;
    }

    private void drain() {
        while (running || !buffer.isEmpty()) {
            EventMessage message;
            try {
                message = buffer.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (message == null) {
                continue;
            }
            try {
                bus.publish(message);
            } catch (RuntimeException e) {
                log.debug("Error publishing event {}: {}", message.eventId(), e.getMessage());
                if (Thread.currentThread().isInterrupted()) {
                    return;
                }
            }
        }
    }

    // ========== Status ==========

    public boolean isRunning() {
        return running;
    }

    public int getPending() {
        return buffer.size();
    }
}
