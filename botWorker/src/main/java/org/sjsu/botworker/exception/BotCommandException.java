package org.sjsu.botworker.exception;

/**
 * A request named an unknown command or passed arguments the command does not accept.
 */
public class BotCommandException extends BotWorkerException {

    public BotCommandException(String message) {
        super(message);
    }
}
