package org.sjsu.botworker.service.channel;

import java.time.Duration;
import java.util.Collection;
import java.util.Optional;

/**
 * Named FIFO queues. Callers push requests and wait for the botworker's answers through this.
 */
public interface ChannelBroker {

    /** Appends a message to the tail of the channel. */
    void push(String channel, String payload);

    /**
     * Removes the head message of the channel, waiting up to {@code timeout} for one to arrive.
     *
     * @return the message, or empty if the timeout passed
     */
    Optional<ChannelMessage> pop(String channel, Duration timeout);

    /**
     * Deletes the channels and any messages still in them.
     *
     * @return how many channels existed and were deleted
     */
    int delete(Collection<String> channels);
}
