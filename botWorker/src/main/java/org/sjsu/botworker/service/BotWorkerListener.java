package org.sjsu.botworker.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.sjsu.botworker.model.dto.BotRequestDto;
import org.sjsu.botworker.model.dto.BotResponse;
import org.sjsu.botworker.service.channel.ChannelBroker;
import org.sjsu.botworker.util.ExceptionUtil;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.amqp.rabbit.listener.ListenerContainerIdleEvent;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;

/**
 * The botworker's receive side. A single consumer takes requests from every listen channel,
 * runs them against the {@link BotWorker} one at a time and pushes exactly one response per
 * request. A failing request is answered with a {@code response_error}; it never stops the consumer.
 */
@Service
@Slf4j
@ConditionalOnProperty(prefix = "botworker.listener", name = "enabled", havingValue = "true")
public class BotWorkerListener {

    public static final String LISTENER_ID = "botworker";

    private final BotWorker botWorker;
    private final ChannelBroker channelBroker;
    private final ObjectMapper objectMapper;

    private volatile long idleSince = System.nanoTime();

    @Autowired
    public BotWorkerListener(BotWorker botWorker, ChannelBroker channelBroker, ObjectMapper objectMapper) {
        this.botWorker = botWorker;
        this.channelBroker = channelBroker;
        this.objectMapper = objectMapper;
    }

    @RabbitListener(id = LISTENER_ID, queues = "#{@botChannelNames.listenChannelNames()}", concurrency = "1")
    public void onRequest(Message message) {
        long busyStart = System.nanoTime();
        log.info("idle for {}", seconds(busyStart - idleSince));
        try {
            handle(message.getMessageProperties().getConsumerQueue(),
                    new String(message.getBody(), StandardCharsets.UTF_8));
        } finally {
            idleSince = System.nanoTime();
            log.info("busy for {}", seconds(idleSince - busyStart));
        }
    }

    @EventListener(condition = "event.listenerId == '" + LISTENER_ID + "'")
    public void onIdle(ListenerContainerIdleEvent event) {
        log.debug("botworker has been idle for {}s, queues: {}", event.getIdleTime() / 1000, event.getQueueNames());
    }

    void handle(String channel, String payload) {
        JsonNode tree;
        try {
            tree = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.error("Discarding message on '{}' that is not JSON: {}", channel, e.getMessage());
            return;
        }
        String responseKey = tree.path("response_key").asText("");
        if (responseKey.isEmpty()) {
            log.error("Discarding message on '{}' without a response_key: {}", channel, payload);
            return;
        }

        BotResponse response;
        try {
            BotRequestDto request = objectMapper.treeToValue(tree, BotRequestDto.class);
            BotCommand command = BotCommand.fromWireName(request.getCommand());
            log.debug("Running {} for response key {}", command.getWireName(), responseKey);
            response = command.invoke(botWorker, request.getArgs(), request.getKwargs());
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            // bot logic checks pages with assertions, so AssertionError is answered like any failure
            log.error("Command failed for response key {}: {}", responseKey, ExceptionUtil.describe(e), e);
            response = BotResponse.responseError(ExceptionUtil.describe(e), ExceptionUtil.stackTrace(e));
        }
        channelBroker.push(responseKey, toJson(response));
    }

    private String toJson(BotResponse response) {
        try {
            return objectMapper.writeValueAsString(response);
        } catch (JsonProcessingException e) {
            log.error("Could not serialize botworker response: {}", e.getMessage(), e);
            try {
                return objectMapper.writeValueAsString(
                        BotResponse.responseError(ExceptionUtil.describe(e), ExceptionUtil.stackTrace(e)));
            } catch (JsonProcessingException unexpected) {
                throw new IllegalStateException("Could not serialize botworker failure response", unexpected);
            }
        }
    }

    private static String seconds(long nanos) {
        return String.format("%.3f", nanos / 1_000_000_000.0);
    }
}
