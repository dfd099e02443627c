package org.sjsu.botworker.service.channel;

import org.sjsu.botworker.config.BotWorkerProperties;
import org.sjsu.botworker.service.BotCommand;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Channel naming. Requests for a participant go to the input channel of the participant code's
 * first character, so botworkers can split the code space between them. Every request gets its
 * own response channel named after the command and the participant.
 */
@Component
public class BotChannelNames {

    private final String prefix;
    private final String charset;
    private final String listenCharRange;

    public BotChannelNames(BotWorkerProperties properties) {
        this.prefix = properties.getKeyPrefix();
        this.charset = properties.getCharset();
        this.listenCharRange = properties.effectiveListenCharRange();
    }

    public String inputChannel(String participantCode) {
        if (participantCode == null || participantCode.isEmpty()) {
            throw new IllegalArgumentException("Participant code must not be empty");
        }
        return prefix + "-" + participantCode.charAt(0);
    }

    public String responseKey(BotCommand command, String participantCode) {
        return prefix + "-" + command.getWireName() + "-" + participantCode;
    }

    /** Input channels this botworker consumes. */
    public List<String> listenChannels() {
        return inputChannels(listenCharRange);
    }

    /** Same as {@link #listenChannels()}, in the form {@code @RabbitListener(queues = ...)} resolves. */
    public String[] listenChannelNames() {
        return listenChannels().toArray(new String[0]);
    }

    public List<String> inputChannels(String charRange) {
        String range = charRange == null || charRange.isEmpty() ? charset : charRange;
        List<String> channels = new ArrayList<>(range.length());
        range.chars().distinct().forEach(c -> channels.add(prefix + "-" + (char) c));
        return channels;
    }

    public boolean isInputChannel(String channel) {
        String head = prefix + "-";
        return channel.length() == head.length() + 1
                && channel.startsWith(head)
                && charset.indexOf(channel.charAt(head.length())) >= 0;
    }
}
