package org.sjsu.botworker.exception;

public class PreparedSubmitNotFoundException extends BotWorkerException {

    public PreparedSubmitNotFoundException(String participantCode) {
        super("No prepared submit for participant " + participantCode
                + ". prepare_next_submit must be called before consume_next_submit.");
    }
}
