package org.openebs.events.publisher;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.openebs.events.bus.BusSubscription;
import org.openebs.events.bus.MessageBus;
import org.openebs.events.bus.PublishException;
import org.openebs.events.bus.memory.InMemoryMessageBus;
import org.openebs.events.config.EventBusConfig;
import org.openebs.events.model.Action;
import org.openebs.events.model.Category;
import org.openebs.events.model.Component;
import org.openebs.events.model.EventMessage;
import org.openebs.events.model.EventSourceFactory;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("EventPublisher Tests")
class EventPublisherTest {

    private final EventSourceFactory identity = new EventSourceFactory(Component.HA_NODE_AGENT);
    private EventPublisher publisher;

    @AfterEach
    void tearDown() {
        if (publisher != null) {
            publisher.close(1, TimeUnit.SECONDS);
        }
    }

    private EventMessage event(String target) {
        return EventMessage.builder()
                .category(Category.NVME_PATH)
                .action(Action.NVME_PATH_FAIL)
                .target(target)
                .metadata(identity.meta("node-1"))
                .build();
    }

    @Test
    @DisplayName("Should publish offered events in the background")
    void shouldPublishInBackground() {
        try (var bus = new InMemoryMessageBus()) {
            publisher = new EventPublisher(bus, 8);
            publisher.start();
            EventMessage a = event("a");
            EventMessage b = event("b");

            assertThat(publisher.offer(a)).isTrue();
            assertThat(publisher.offer(b)).isTrue();

            BusSubscription<EventMessage> subscription = bus.subscribe(EventMessage.class);
            assertThat(subscription.next()).contains(a);
            assertThat(subscription.next()).contains(b);
        }
    }

    @Test
    @DisplayName("Should drop events when the buffer is full")
    void shouldDropWhenFull() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch publishing = new CountDownLatch(1);
        MessageBus bus = mock(MessageBus.class);
        when(bus.publish(any())).thenAnswer(invocation -> {
            publishing.countDown();
            release.await(5, TimeUnit.SECONDS);
            return 1L;
        });
        publisher = new EventPublisher(bus, 1);
        publisher.start();

        assertThat(publisher.offer(event("in-flight"))).isTrue();
        assertThat(publishing.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(publisher.offer(event("buffered"))).isTrue();
        assertThat(publisher.offer(event("dropped"))).isFalse();

        release.countDown();
        verify(bus, timeout(5000).times(2)).publish(any());
    }

    @Test
    @DisplayName("Should keep going after a failed publish")
    void shouldContinueAfterPublishError() {
        MessageBus bus = mock(MessageBus.class);
        when(bus.publish(any()))
                .thenThrow(new PublishException(10, "payload", new RuntimeException("down")))
                .thenReturn(2L);
        publisher = new EventPublisher(bus, 4);
        publisher.start();

        publisher.offer(event("lost"));
        publisher.offer(event("kept"));

        verify(bus, timeout(5000).times(2)).publish(any());
    }

    @Test
    @DisplayName("Should drop events offered after close")
    void shouldDropAfterClose() {
        publisher = new EventPublisher(mock(MessageBus.class), 4);
        publisher.start();
        publisher.close();

        assertThat(publisher.offer(event("late"))).isFalse();
        assertThat(publisher.isRunning()).isFalse();
    }

    @Test
    @DisplayName("Should ignore repeated start and close")
    void shouldBeIdempotent() {
        publisher = new EventPublisher(mock(MessageBus.class), 4);
        publisher.start();
        publisher.start();
        assertThat(publisher.isRunning()).isTrue();

        publisher.close();
        publisher.close();
        publisher.start();
        assertThat(publisher.isRunning()).isFalse();
    }

    @Test
    @DisplayName("Should not start when disabled by configuration")
    void shouldHonourDisabledConfig() {
        var config = new EventBusConfig();
        config.setEnabled(false);
        config.getPublisher().setBufferSize(2);
        publisher = EventPublisher.fromConfig(mock(MessageBus.class), config);

        publisher.start();

        assertThat(publisher.isRunning()).isFalse();
        assertThat(publisher.offer(event("a"))).isFalse();
        assertThat(publisher.getPending()).isZero();
    }

    @Test
    @DisplayName("Should reject a non-positive buffer size")
    void shouldRejectInvalidBufferSize() {
        assertThatThrownBy(() -> new EventPublisher(mock(MessageBus.class), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
