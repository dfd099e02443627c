package org.sjsu.botworker.service.channel;

import lombok.extern.slf4j.Slf4j;
import org.sjsu.botworker.config.BotWorkerProperties;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageDeliveryMode;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collection;
import java.util.Optional;

/**
 * {@link ChannelBroker} on RabbitMQ: one queue per channel, published through the default
 * exchange. Input channels are durable queues; response channels are transient queues the
 * broker deletes once nobody has used them for {@code botworker.response-key-ttl}.
 */
@Component
@Slf4j
public class RabbitChannelBroker implements ChannelBroker {

    private static final String DEFAULT_EXCHANGE = "";

    private final RabbitTemplate rabbitTemplate;
    private final AmqpAdmin amqpAdmin;
    private final BotChannelNames channelNames;
    private final int responseKeyTtlMillis;

    @Autowired
    public RabbitChannelBroker(RabbitTemplate rabbitTemplate,
                               AmqpAdmin amqpAdmin,
                               BotChannelNames channelNames,
                               BotWorkerProperties properties) {
        this.rabbitTemplate = rabbitTemplate;
        this.amqpAdmin = amqpAdmin;
        this.channelNames = channelNames;
        this.responseKeyTtlMillis = (int) properties.getResponseKeyTtl().toMillis();
    }

    @Override
    public void push(String channel, String payload) {
        declare(channel);
        boolean durable = channelNames.isInputChannel(channel);
        rabbitTemplate.convertAndSend(DEFAULT_EXCHANGE, channel, payload, message -> {
            message.getMessageProperties().setContentType(MessageProperties.CONTENT_TYPE_JSON);
            message.getMessageProperties().setContentEncoding(StandardCharsets.UTF_8.name());
            message.getMessageProperties().setDeliveryMode(
                    durable ? MessageDeliveryMode.PERSISTENT : MessageDeliveryMode.NON_PERSISTENT);
            return message;
        });
        log.debug("Pushed {} bytes to '{}'", payload.length(), channel);
    }

    @Override
    public Optional<ChannelMessage> pop(String channel, Duration timeout) {
        declare(channel);
        Message message = rabbitTemplate.receive(channel, timeout.toMillis());
        return Optional.ofNullable(message).map(m -> toChannelMessage(channel, m));
    }

    @Override
    public int delete(Collection<String> channels) {
        int deleted = 0;
        for (String channel : channels) {
            if (amqpAdmin.deleteQueue(channel)) {
                deleted++;
            }
        }
        log.info("Deleted {} of {} channel(s)", deleted, channels.size());
        return deleted;
    }

    private void declare(String channel) {
        Queue queue = channelNames.isInputChannel(channel)
                ? QueueBuilder.durable(channel).build()
                : QueueBuilder.nonDurable(channel).expires(responseKeyTtlMillis).build();
        amqpAdmin.declareQueue(queue);
    }

    private static ChannelMessage toChannelMessage(String channel, Message message) {
        return new ChannelMessage(channel, new String(message.getBody(), StandardCharsets.UTF_8));
    }
}
