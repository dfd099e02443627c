package org.sjsu.botworker.service;

import lombok.extern.slf4j.Slf4j;
import org.sjsu.botworker.config.BotWorkerProperties;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.MessageDeliveryMode;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class BotCompletionPublisher {

    public static final String ROUTING_KEY_PREFIX = "browser-bots-client-";

    private final RabbitTemplate rabbitTemplate;
    private final String completionExchange;

    @Autowired
    public BotCompletionPublisher(RabbitTemplate rabbitTemplate, BotWorkerProperties properties) {
        this.rabbitTemplate = rabbitTemplate;
        this.completionExchange = properties.getCompletionExchange();
    }

    /**
     * Tells whoever follows the session that a participant's bot has finished. Fire and forget:
     * nothing acknowledges the message and a broker failure is only logged.
     *
     * @param sessionCode     The session the participant belongs to.
     * @param participantCode The participant whose bot finished.
     */
    public void publishCompletion(String sessionCode, String participantCode) {
        if (sessionCode == null || sessionCode.isBlank()) {
            log.warn("Attempted to publish completion of participant {} without a session code. Aborting.", participantCode);
            return;
        }
        String routingKey = ROUTING_KEY_PREFIX + sessionCode;
        log.info("Publishing completion of participant {} to '{}' with routing key '{}'",
                participantCode, completionExchange, routingKey);

        try {
            rabbitTemplate.convertAndSend(completionExchange, routingKey, participantCode, message -> {
                message.getMessageProperties().setDeliveryMode(MessageDeliveryMode.NON_PERSISTENT);
                return message;
            });
        } catch (AmqpException e) {
            log.error("Failed to publish completion of participant {}. Error: {}", participantCode, e.getMessage(), e);
        }
    }
}
