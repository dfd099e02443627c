package org.sjsu.botworker.service;

import lombok.extern.slf4j.Slf4j;
import org.sjsu.botworker.config.BotWorkerProperties;
import org.sjsu.botworker.exception.ParticipantNotFoundException;
import org.sjsu.botworker.model.Submission;
import org.sjsu.botworker.model.dto.BotResponse;
import org.sjsu.botworker.model.entity.Participant;
import org.sjsu.botworker.repository.ParticipantRepository;
import org.sjsu.botworker.service.bot.ParticipantBotFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Owns the browser bots loaded in this process and the submissions they have prepared.
 * Everything outside the botworker reaches this state only through {@link BotCommand}s.
 */
@Service
@Slf4j
public class BotWorker {

    private final ParticipantRepository participantRepository;
    private final ParticipantBotFactory botFactory;
    private final BotSessionRegistry sessions;
    private final PreparedSubmitCache preparedSubmits = new PreparedSubmitCache();

    @Autowired
    public BotWorker(ParticipantRepository participantRepository,
                     ParticipantBotFactory botFactory,
                     BotWorkerProperties properties) {
        this.participantRepository = participantRepository;
        this.botFactory = botFactory;
        this.sessions = new BotSessionRegistry(properties.getSessionLimit());
    }

    /**
     * Loads (or reloads) the bot for a participant.
     *
     * @throws ParticipantNotFoundException if no participant has this code
     */
    public BotResponse initializeParticipant(String participantCode) {
        Participant participant = participantRepository.findByCode(participantCode)
                .orElseThrow(() -> new ParticipantNotFoundException(participantCode));
        prune(participantCode);
        // a submit prepared by the replaced bot must not leak into the new one
        preparedSubmits.removeAll(List.of(participantCode));

        BotSession session = new BotSession(participant.getCode());
        session.attach(botFactory.createSequence(participant, session));
        sessions.put(session);
        log.info("Initialized browser bot for participant {} ({} session(s) loaded)", participantCode, sessions.size());
        return BotResponse.ok();
    }

    /**
     * Computes the participant's next submission, unless one is already prepared.
     * <p>
     * Returns a request error (not an exception) when the participant is not loaded, an empty
     * response for a duplicate request or an exhausted bot, and the submission otherwise.
     */
    public BotResponse prepareNextSubmit(String participantCode, String path, String html) {
        Optional<BotSession> loaded = sessions.get(participantCode);
        if (loaded.isEmpty()) {
            log.warn("prepare_next_submit for participant {} which is not loaded", participantCode);
            return BotResponse.requestError(String.format(
                    "Participant %s not loaded in botworker. "
                            + "The botworker only stores the most recent %d sessions, "
                            + "and discards older sessions. Or, maybe the botworker "
                            + "was restarted after the session was created.",
                    participantCode, sessions.getLimit()));
        }
        BotSession session = loaded.get();

        // the bot checks which page it is on before producing the next submit
        session.setPath(path);
        session.setHtml(html);

        Optional<Submission> prepared = preparedSubmits.prepareIfAbsent(participantCode,
                () -> session.getSubmits().next().orElseGet(Submission::empty));
        if (prepared.isEmpty()) {
            log.debug("Submit for participant {} already prepared, ignoring duplicate request", participantCode);
            return BotResponse.empty();
        }
        Submission submission = prepared.get();
        if (submission.isEmpty()) {
            log.info("Bot for participant {} has no more submits", participantCode);
        }
        return BotResponse.of(submission);
    }

    /**
     * Removes and returns the participant's prepared submission.
     *
     * @throws org.sjsu.botworker.exception.PreparedSubmitNotFoundException if nothing was prepared
     */
    public Submission consumeNextSubmit(String participantCode) {
        return preparedSubmits.consume(participantCode);
    }

    public void clearAll() {
        sessions.clear();
        preparedSubmits.clear();
        log.info("Cleared all browser bot sessions and prepared submits");
    }

    public BotResponse ping() {
        return BotResponse.ok();
    }

    int getSessionCount() {
        return sessions.size();
    }

    Optional<Submission> peekPreparedSubmit(String participantCode) {
        return preparedSubmits.peek(participantCode);
    }

    private void prune(String incomingParticipantCode) {
        List<String> evicted = sessions.pruneFor(incomingParticipantCode);
        preparedSubmits.removeAll(evicted);
    }
}
