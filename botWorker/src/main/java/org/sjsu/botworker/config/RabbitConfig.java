package org.sjsu.botworker.config;

import org.sjsu.botworker.service.channel.BotChannelNames;
import org.springframework.amqp.core.Declarable;
import org.springframework.amqp.core.Declarables;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.amqp.core.TopicExchange;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.stream.Collectors;

@Configuration
public class RabbitConfig {

    /**
     * Exchange that completion notifications are broadcast on. Anything interested in a
     * session binds a queue with routing key {@code browser-bots-client-<sessionCode>}.
     */
    @Bean
    public TopicExchange botCompletionExchange(BotWorkerProperties properties) {
        return new TopicExchange(properties.getCompletionExchange(), true, false);
    }

    /**
     * Durable input queues the botworker consumes. RabbitAdmin declares them on connect and
     * again when the listener finds one missing after a flush.
     */
    @Bean
    public Declarables botInputQueues(BotChannelNames channelNames) {
        List<Declarable> queues = channelNames.listenChannels().stream()
                .map(channel -> QueueBuilder.durable(channel).build())
                .collect(Collectors.toList());
        return new Declarables(queues);
    }
}
