package org.sjsu.botworker.exception;

/**
 * Base type for failures raised by the botworker or by the browser bot client.
 */
public class BotWorkerException extends RuntimeException {

    public BotWorkerException(String message) {
        super(message);
    }

    public BotWorkerException(String message, Throwable cause) {
        super(message, cause);
    }
}
