package demo;

import org.openebs.events.bus.BusSubscription;
import org.openebs.events.bus.nats.NatsConfig;
import org.openebs.events.bus.nats.NatsMessageBus;
import org.openebs.events.config.EventBusConfigLoader;
import org.openebs.events.model.Category;
import org.openebs.events.model.EventMessage;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * 统计服务：用 durable consumer 按顺序消费全部事件，按 category 计数。
 *
 * 重启后从上次确认的位置继续。
 */
public class StatsConsumerExample {

    public static void main(String[] args) {
        var config = NatsConfig.from(EventBusConfigLoader.fromClasspath("events.yml"));
        var bus = NatsMessageBus.init(config);

        Map<Category, Integer> counts = new EnumMap<>(Category.class);
        BusSubscription<EventMessage> subscription = bus.subscribe(EventMessage.class);

        // Ctrl+C：关闭订阅，next() 返回 empty，循环结束
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            System.out.println("Shutting down...");
            subscription.close();
            bus.close();
        }));

        System.out.println("Consuming events... (Ctrl+C to stop)");

        Optional<EventMessage> next;
        while ((next = subscription.next()).isPresent()) {
            EventMessage event = next.get();
            int total = counts.merge(event.getCategory(), 1, Integer::sum);
            System.out.printf("%-20s %-14s %s  (total %s: %d)%n",
                    event.getCategory(), event.getAction(), event.getTarget(),
                    event.getCategory(), total);
        }
    }
}
