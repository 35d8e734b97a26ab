package demo;

import org.openebs.events.bus.nats.ConnectionState;
import org.openebs.events.bus.nats.NatsConfig;
import org.openebs.events.bus.nats.NatsMessageBus;
import org.openebs.events.config.EventBusConfig;
import org.openebs.events.config.EventBusConfigLoader;
import org.openebs.events.model.Action;
import org.openebs.events.model.Category;
import org.openebs.events.model.EventMessage;
import org.openebs.events.model.EventSourceFactory;

import java.nio.file.Path;
import java.util.UUID;

/**
 * 最简单的用法：YAML 配置 + 发布一个事件。
 *
 * 运行: java -cp "lib/*" demo.PublishExample events.yml
 */
public class PublishExample {

    public static void main(String[] args) throws Exception {
        // 1. 加载配置（文件不存在时用 classpath 里的 events.yml）
        EventBusConfig config = args.length > 0
                ? EventBusConfigLoader.fromYaml(Path.of(args[0]))
                : EventBusConfigLoader.fromClasspath("events.yml");

        // 2. 连接 NATS，并确保 stream 存在（连不上会一直重试）
        NatsConfig natsConfig = NatsConfig.from(config);
        try (var bus = NatsMessageBus.connect(natsConfig, PublishExample::onStateChange)) {
            bus.ensureStream();

            // 3. 以 agent-core 的身份构造事件
            var identity = EventSourceFactory.forService("agent-core");
            var source = identity.source("node-1")
                    .withStateChangeData("Online", "Degraded");

            EventMessage event = EventMessage.builder()
                    .category(Category.POOL)
                    .action(Action.STATE_CHANGE)
                    .target(UUID.randomUUID().toString())
                    .metadata(identity.meta(source))
                    .build();

            // 4. 发布，返回 stream 序号
            long sequence = bus.publish(event);
            System.out.printf("Published %s as sequence %d%n", event.eventId(), sequence);
        }
    }

    private static void onStateChange(ConnectionState previous, ConnectionState current) {
        System.out.printf("NATS connection: %s → %s%n", previous, current);
    }
}
