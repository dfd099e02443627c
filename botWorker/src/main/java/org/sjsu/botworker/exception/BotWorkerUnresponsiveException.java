package org.sjsu.botworker.exception;

/**
 * The botworker answers pings but did not answer a specific request in time.
 */
public class BotWorkerUnresponsiveException extends BotWorkerException {

    public BotWorkerUnresponsiveException(String message) {
        super(message);
    }
}
