package org.sjsu.botworker.exception;

/**
 * The participant's bot has played all of its submissions.
 */
public class NoMoreSubmitsException extends Exception {

    public NoMoreSubmitsException(String participantCode) {
        super("No more submits for participant " + participantCode);
    }
}
