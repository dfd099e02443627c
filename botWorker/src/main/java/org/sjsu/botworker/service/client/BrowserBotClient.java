package org.sjsu.botworker.service.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.sjsu.botworker.config.BotWorkerProperties;
import org.sjsu.botworker.exception.BotWorkerException;
import org.sjsu.botworker.exception.BotWorkerResponseException;
import org.sjsu.botworker.exception.BotWorkerUnreachableException;
import org.sjsu.botworker.exception.BotWorkerUnresponsiveException;
import org.sjsu.botworker.model.dto.BotRequestDto;
import org.sjsu.botworker.model.dto.BotResponse;
import org.sjsu.botworker.service.BotCommand;
import org.sjsu.botworker.service.BotCompletionPublisher;
import org.sjsu.botworker.service.channel.BotChannelNames;
import org.sjsu.botworker.service.channel.ChannelBroker;
import org.sjsu.botworker.service.channel.ChannelMessage;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Caller side of the botworker protocol. Each call pushes one request to the participant's
 * input channel and blocks on that call's response channel. Stateless; request handlers get a
 * per-request {@link EphemeralBrowserBot} from {@link #forRequest}.
 */
@Service
@Slf4j
public class BrowserBotClient {

    private final ChannelBroker channelBroker;
    private final BotChannelNames channelNames;
    private final ObjectMapper objectMapper;
    private final BotCompletionPublisher completionPublisher;
    private final BotWorkerProperties properties;

    @Autowired
    public BrowserBotClient(ChannelBroker channelBroker,
                            BotChannelNames channelNames,
                            ObjectMapper objectMapper,
                            BotCompletionPublisher completionPublisher,
                            BotWorkerProperties properties) {
        this.channelBroker = channelBroker;
        this.channelNames = channelNames;
        this.objectMapper = objectMapper;
        this.completionPublisher = completionPublisher;
        this.properties = properties;
    }

    public EphemeralBrowserBot forRequest(String participantCode, String sessionCode, String path) {
        return new EphemeralBrowserBot(this, participantCode, sessionCode, path);
    }

    /**
     * Checks that a botworker consumes the participant's input channel.
     *
     * @throws BotWorkerUnreachableException if the ping is not answered in time
     */
    public void ping(String participantCode) {
        Optional<BotResponse> pong = call(BotCommand.PING, participantCode, Map.of(), properties.getPingTimeout());
        if (pong.isEmpty()) {
            log.error("Ping to botworker for participant {} timed out after {}", participantCode, properties.getPingTimeout());
            throw new BotWorkerUnreachableException();
        }
    }

    /**
     * Loads the participant's bot into the botworker.
     *
     * @return false if browser bots are disabled and nothing was sent
     */
    public boolean initializeBot(String participantCode) {
        if (!properties.isBrowserBotsEnabled()) {
            log.info("Browser bots are disabled, not initializing a bot for participant {}", participantCode);
            return false;
        }
        ping(participantCode);

        Duration timeout = properties.getInitializeTimeout();
        BotResponse response = call(BotCommand.INITIALIZE_PARTICIPANT, participantCode,
                Map.of("participant_code", participantCode), timeout)
                .orElseThrow(() -> new BotWorkerUnresponsiveException(String.format(
                        "botworker is running but could not initialize the session within %d seconds.",
                        timeout.toSeconds())));
        if (response.hasResponseError()) {
            log.error("botworker failed to initialize participant {}. See the botworker output for the traceback.", participantCode);
            throw new BotWorkerResponseException(response.getResponseError(), response.getTraceback());
        }
        log.info("Initialized browser bot for participant {}", participantCode);
        return true;
    }

    /**
     * Deletes the input channels of the given first characters, dropping queued requests.
     * Response channels are left alone; they expire by themselves.
     *
     * @param charRange participant code first characters; empty means all of them
     */
    public int flushBots(String charRange) {
        int deleted = channelBroker.delete(channelNames.inputChannels(charRange));
        log.info("Flushed {} botworker input channel(s)", deleted);
        return deleted;
    }

    void publishCompletion(String sessionCode, String participantCode) {
        completionPublisher.publishCompletion(sessionCode, participantCode);
    }

    BotWorkerProperties getProperties() {
        return properties;
    }

    /**
     * Sends a request and waits for its response; on timeout, pings to tell a dead botworker
     * from one that just did not answer.
     *
     * @throws BotWorkerUnreachableException  if the ping times out as well
     * @throws BotWorkerUnresponsiveException if the ping is answered
     */
    BotResponse callOrDiagnose(BotCommand command, String participantCode, Map<String, Object> kwargs,
                               Duration timeout, String unresponsiveMessage) {
        Optional<BotResponse> response = call(command, participantCode, kwargs, timeout);
        if (response.isPresent()) {
            return response.get();
        }
        log.warn("No answer to {} for participant {} within {}, pinging botworker", command.getWireName(), participantCode, timeout);
        ping(participantCode);
        throw new BotWorkerUnresponsiveException(unresponsiveMessage);
    }

    Optional<BotResponse> call(BotCommand command, String participantCode, Map<String, Object> kwargs, Duration timeout) {
        String responseKey = channelNames.responseKey(command, participantCode);
        BotRequestDto request = BotRequestDto.builder()
                .command(command.getWireName())
                .kwargs(kwargs)
                .responseKey(responseKey)
                .build();

        channelBroker.push(channelNames.inputChannel(participantCode), encode(request));
        Optional<ChannelMessage> answer = channelBroker.pop(responseKey, timeout);
        return answer.map(message -> decode(message.getPayload()));
    }

    private String encode(BotRequestDto request) {
        try {
            return objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new BotWorkerException("Could not encode botworker request " + request.getCommand(), e);
        }
    }

    private BotResponse decode(String payload) {
        try {
            return objectMapper.readValue(payload, BotResponse.class);
        } catch (JsonProcessingException e) {
            throw new BotWorkerException("Could not decode botworker response: " + payload, e);
        }
    }
}
