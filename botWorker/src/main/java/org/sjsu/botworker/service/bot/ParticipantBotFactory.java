package org.sjsu.botworker.service.bot;

import org.sjsu.botworker.model.entity.Participant;

public interface ParticipantBotFactory {

    /**
     * Creates the submission sequence for a freshly initialized bot session.
     *
     * @param participant The participant the bot plays.
     * @param page        Live view of the page the bot is on; updated before every step.
     */
    SubmissionSequence createSequence(Participant participant, PageContext page);
}
