package demo;

import org.openebs.events.bus.BusSubscription;
import org.openebs.events.bus.memory.InMemoryMessageBus;
import org.openebs.events.model.Action;
import org.openebs.events.model.Category;
import org.openebs.events.model.Component;
import org.openebs.events.model.EventMessage;
import org.openebs.events.model.EventSourceFactory;
import org.openebs.events.model.RebuildStatus;
import org.openebs.events.publisher.EventPublisher;

/**
 * 不需要 NATS 服务器：内存 bus + 异步 EventPublisher。
 * 同一进程里可以有多个身份（io-engine 和 agent-core）。
 */
public class InMemoryExample {

    public static void main(String[] args) throws InterruptedException {
        try (var bus = new InMemoryMessageBus();
             var publisher = new EventPublisher(bus, 16)) {

            // ========== 1. 两个组件身份 ==========

            var ioEngine = new EventSourceFactory(Component.IO_ENGINE);
            var core = new EventSourceFactory(Component.CORE_AGENT);

            // ========== 2. 异步发布（offer 不会阻塞）==========

            publisher.start();

            var rebuild = ioEngine.source("node-2")
                    .withRebuildData(RebuildStatus.STARTED, "nvmf://node-1/r1", "nvmf://node-2/r2", null);
            publisher.offer(EventMessage.builder()
                    .category(Category.NEXUS)
                    .action(Action.REBUILD_BEGIN)
                    .target("nexus-1")
                    .metadata(ioEngine.meta(rebuild))
                    .build());

            publisher.offer(EventMessage.builder()
                    .category(Category.VOLUME)
                    .action(Action.CREATE)
                    .target("volume-1")
                    .metadata(core.meta("node-1"))
                    .build());

            // ========== 3. 消费 ==========

            try (BusSubscription<EventMessage> subscription = bus.subscribe(EventMessage.class)) {
                for (int i = 0; i < 2; i++) {
                    subscription.next().ifPresent(event -> System.out.printf("%s %s %s from %s%n",
                            event.getCategory(), event.getAction(), event.getTarget(),
                            event.getMetadata().source().component()));
                }
            }
        }
    }
}
