package org.openebs.events.model;

import java.time.Clock;
import java.util.UUID;

/**
 * Creates event sources and metadata on behalf of one emitting component.
 *
 * <p>Each service builds one factory at startup from its service name and hands it
 * to whatever produces events. Factories are independent, so several components can
 * emit from the same process.</p>
 *
 * <pre>
 * var events = EventSourceFactory.forService("agent-core");
 * var message = EventMessage.builder()
 *         .category(Category.POOL)
 *         .action(Action.CREATE)
 *         .target("pool-1")
 *         .metadata(events.meta(events.source("node-1")))
 *         .build();
 * </pre>
 */
public class EventSourceFactory {

    private final Component component;
    private final Clock clock;

    public EventSourceFactory(Component component) {
        this(component, Clock.systemUTC());
    }

    public EventSourceFactory(Component component, Clock clock) {
        this.component = component != null ? component : Component.UNKNOWN;
        this.clock = clock;
    }

    /**
     * Factory for a service name such as "agent-core" or "io-engine".
     * Unknown names yield {@link Component#UNKNOWN}.
     */
    public static EventSourceFactory forService(String serviceName) {
        return new EventSourceFactory(Component.fromServiceName(serviceName));
    }

    public Component getComponent() {
        return component;
    }

    public EventSource source(String node) {
        return new EventSource(component, node);
    }

    /**
     * Metadata with a fresh UUIDv4 id, the current time and format {@link Version#V1}.
     */
    public EventMeta meta(EventSource source) {
        return new EventMeta(UUID.randomUUID().toString(), source, clock.instant(), Version.V1);
    }

    /**
     * Metadata for an event emitted from the given node without extra details.
     */
    public EventMeta meta(String node) {
        return meta(source(node));
    }
}
