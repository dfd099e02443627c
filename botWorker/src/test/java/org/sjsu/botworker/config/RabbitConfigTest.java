package org.sjsu.botworker.config;

import org.junit.jupiter.api.Test;
import org.sjsu.botworker.service.channel.BotChannelNames;
import org.springframework.amqp.core.Queue;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RabbitConfigTest {

    private final RabbitConfig rabbitConfig = new RabbitConfig();

    @Test
    void shouldDeclareDurableQueueForEveryListenChannel() {
        BotWorkerProperties properties = new BotWorkerProperties();
        properties.setListenCharRange("ab");

        List<Queue> queues = rabbitConfig.botInputQueues(new BotChannelNames(properties)).getDeclarablesByType(Queue.class);

        assertThat(queues).extracting(Queue::getName).containsExactly("browser-bots-a", "browser-bots-b");
        assertThat(queues).allMatch(Queue::isDurable);
        assertThat(queues).allMatch(queue -> !queue.getArguments().containsKey("x-expires"));
    }

    @Test
    void shouldDeclareDurableCompletionExchange() {
        assertThat(rabbitConfig.botCompletionExchange(new BotWorkerProperties()).isDurable()).isTrue();
    }
}
