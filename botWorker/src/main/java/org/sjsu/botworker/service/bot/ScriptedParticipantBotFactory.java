package org.sjsu.botworker.service.bot;

import lombok.extern.slf4j.Slf4j;
import org.sjsu.botworker.model.entity.Participant;
import org.springframework.stereotype.Component;

/**
 * Builds bots from the submissions stored on the participant record.
 */
@Component
@Slf4j
public class ScriptedParticipantBotFactory implements ParticipantBotFactory {

    @Override
    public SubmissionSequence createSequence(Participant participant, PageContext page) {
        int steps = participant.getBotSubmits() == null ? 0 : participant.getBotSubmits().size();
        log.info("Creating scripted bot for participant {} with {} submits", participant.getCode(), steps);
        return new ScriptedSubmissionSequence(participant.getCode(), participant.getBotSubmits(), page);
    }
}
