package demo;

import org.openstack4j.amqp.consumer.manager.DeliveredMessage;
import org.openstack4j.amqp.consumer.manager.QueueConsumer;
import org.openstack4j.amqp.consumer.model.ExchangeDefinition;
import org.openstack4j.amqp.consumer.model.QueueDefinition;
import org.openstack4j.amqp.consumer.provider.MessageProvider;

import java.nio.file.Path;

/**
 * 最简单的用法：YAML 配置 + 一个 provider。
 *
 * 运行: java -cp "lib/*" demo.BasicExample consumer.yml
 */
public class BasicExample {

    public static void main(String[] args) {
        // 1. 从 YAML 加载配置并创建 consumer
        var consumer = args.length > 0
                ? QueueConsumer.fromYaml(Path.of(args[0]))
                : QueueConsumer.fromClasspath("consumer.yml");

        // 2. 注册 provider（同一个 channel 上可以注册多个）
        var queue = new QueueDefinition("ham", new ExchangeDefinition("spam"));
        consumer.registerProvider(new MessageProvider() {
            @Override
            public QueueDefinition getQueue() {
                return queue;
            }

            @Override
            public void handleMessage(byte[] body, DeliveredMessage message) {
                System.out.printf("[%s] #%d %s%n", queue.name(), message.getDeliveryTag(),
                        message.getBodyAsString());
                consumer.ackMessage(message);
            }
        });

        // 3. 启动（后台线程连接 RabbitMQ，连不上会一直重试）
        consumer.start();

        // 4. Ctrl+C 退出时等待未 ack 的消息处理完
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            System.out.println("Shutting down...");
            consumer.close();
        }));

        System.out.println("Consuming from queue 'ham'... (Ctrl+C to stop)");

        // 阻塞主线程
        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
