package org.openebs.events.bus.memory;

import org.openebs.events.bus.BusSubscription;
import org.openebs.events.bus.ConsumerSpec;
import org.openebs.events.bus.EventCodec;
import org.openebs.events.bus.MessageBus;
import org.openebs.events.bus.MessageBusException;
import org.openebs.events.bus.StreamSpec;
import org.openebs.events.bus.Subjects;
import org.openebs.events.model.EventMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Broker-less {@link MessageBus} with the same log semantics as the JetStream bus.
 *
 * <ul>
 *   <li>Sequence numbers start at 1 and only grow.</li>
 *   <li>A subject keeps at most {@link StreamSpec#maxMessagesPerSubject()} messages; older ones are dropped.</li>
 *   <li>Stored payloads stay within {@link StreamSpec#maxBytes()}; the oldest messages are dropped first.</li>
 *   <li>Publishing the id of a stored message returns its sequence and stores nothing.</li>
 *   <li>Each durable name has one cursor; subscriptions sharing a name share it.</li>
 * </ul>
 *
 * <p>Payloads are stored encoded, so subscribers decode them the same way they would
 * off the wire. Intended for tests and demos.</p>
 */
public class InMemoryMessageBus implements MessageBus, Closeable {

    private static final Logger log = LoggerFactory.getLogger(InMemoryMessageBus.class);

    private final StreamSpec stream;
    private final ConsumerSpec consumer;
    private final EventCodec codec;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition published = lock.newCondition();

    /** sequence → stored message */
    private final NavigableMap<Long, Stored> messages = new TreeMap<>();
    /** message id → sequence it was first stored at, while that message is stored */
    private final Map<String, Long> seen = new HashMap<>();
    /** subject → stored sequences, oldest first */
    private final Map<String, Deque<Long>> bySubject = new HashMap<>();
    /** durable name → last delivered sequence */
    private final Map<String, Long> cursors = new HashMap<>();

    private long lastSequence = 0;
    private long storedBytes = 0;
    private boolean closed = false;

    public InMemoryMessageBus() {
        this(StreamSpec.defaults(1), ConsumerSpec.defaults(), new EventCodec());
    }

    public InMemoryMessageBus(StreamSpec stream, ConsumerSpec consumer, EventCodec codec) {
        this.stream = stream;
        this.consumer = consumer;
        this.codec = codec;
    }

    private record Stored(String subject, String id, byte[] payload) {}

    // ========== MessageBus ==========

    @Override
    public long publish(EventMessage message) {
        String subject = Subjects.of(message);
        return append(subject, message.eventId(), codec.encode(message));
    }

    /**
     * Store a raw payload. Lets tests put undecodable data on the bus.
     *
     * @param id de-duplication id, or null to always store
     */
    public long publishRaw(String subject, String id, byte[] payload) {
        return append(subject, id, payload);
    }

    private long append(String subject, String id, byte[] payload) {
        lock.lock();
        try {
            if (closed) {
                throw new MessageBusException("Message bus " + stream.name() + " is closed");
            }
            if (id != null && seen.containsKey(id)) {
                long sequence = seen.get(id);
                log.debug("Message {} was already stored at sequence {}", id, sequence);
                return sequence;
            }
            long sequence = ++lastSequence;
            messages.put(sequence, new Stored(subject, id, payload));
            storedBytes += payload.length;
            bySubject.computeIfAbsent(subject, k -> new ArrayDeque<>()).addLast(sequence);
            if (id != null) {
                seen.put(id, sequence);
            }
            trimSubject(subject);
            trimBytes();
            published.signalAll();
            return sequence;
        } finally {
            lock.unlock();
        }
    }

    private void trimSubject(String subject) {
        Deque<Long> sequences = bySubject.get(subject);
        while (sequences.size() > stream.maxMessagesPerSubject()) {
            remove(sequences.peekFirst());
        }
    }

    private void trimBytes() {
        while (storedBytes > stream.maxBytes() && !messages.isEmpty()) {
            remove(messages.firstKey());
        }
    }

    private void remove(long sequence) {
        Stored stored = messages.remove(sequence);
        storedBytes -= stored.payload().length;
        Deque<Long> sequences = bySubject.get(stored.subject());
        sequences.remove(sequence);
        if (sequences.isEmpty()) {
            bySubject.remove(stored.subject());
        }
        if (stored.id() != null) {
            seen.remove(stored.id(), sequence);
        }
    }

    @Override
    public <T> BusSubscription<T> subscribe(Class<T> type) {
        return subscribe(type, consumer.durableName());
    }

    public <T> BusSubscription<T> subscribe(Class<T> type, String durableName) {
        lock.lock();
        try {
            if (closed) {
                throw new MessageBusException("Message bus " + stream.name() + " is closed");
            }
            cursors.putIfAbsent(durableName, 0L);
        } finally {
            lock.unlock();
        }
        return new Subscription<>(type, durableName);
    }

    /**
     * Number of messages currently stored.
     */
    public int size() {
        lock.lock();
        try {
            return messages.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Total payload size of the stored messages.
     */
    public long storedBytes() {
        lock.lock();
        try {
            return storedBytes;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            closed = true;
            published.signalAll();
        } finally {
            lock.unlock();
        }
    }

    // ========== Inner: durable cursor ==========

    private class Subscription<T> implements BusSubscription<T> {
        final Class<T> type;
        final String durableName;
        boolean subscriptionClosed = false;

        Subscription(Class<T> type, String durableName) {
            this.type = type;
            this.durableName = durableName;
        }

        @Override
        public Optional<T> next() {
            while (true) {
                Map.Entry<Long, Stored> entry = take();
                if (entry == null) {
                    return Optional.empty();
                }
                try {
                    T value = codec.decode(entry.getValue().payload(), type);
                    if (value != null) {
                        return Optional.of(value);
                    }
                } catch (IOException e) {
                    log.warn("Error parsing message {} on subject {}: {}. Message ignored",
                            entry.getKey(), entry.getValue().subject(), e.getMessage());
                }
            }
        }

        private Map.Entry<Long, Stored> take() {
            lock.lock();
            try {
                while (true) {
                    if (closed || subscriptionClosed) {
                        return null;
                    }
                    Map.Entry<Long, Stored> entry = messages.higherEntry(cursors.get(durableName));
                    if (entry != null) {
                        cursors.put(durableName, entry.getKey());
                        return entry;
                    }
                    published.await();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return null;
            } finally {
                lock.unlock();
            }
        }

        @Override
        public void close() {
            lock.lock();
            try {
                subscriptionClosed = true;
                published.signalAll();
            } finally {
                lock.unlock();
            }
        }
    }
}
