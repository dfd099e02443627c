package org.sjsu.botworker.exception;

public class ParticipantNotFoundException extends BotWorkerException {

    public ParticipantNotFoundException(String participantCode) {
        super("Participant " + participantCode + " does not exist");
    }
}
