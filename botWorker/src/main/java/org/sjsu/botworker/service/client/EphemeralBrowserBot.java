package org.sjsu.botworker.service.client;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.sjsu.botworker.exception.BotWorkerException;
import org.sjsu.botworker.exception.BotWorkerResponseException;
import org.sjsu.botworker.exception.NoMoreSubmitsException;
import org.sjsu.botworker.model.Submission;
import org.sjsu.botworker.model.dto.BotResponse;
import org.sjsu.botworker.service.BotCommand;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Browser bot as seen from a single page request. Holds no state beyond the request it was
 * created for; the bot itself lives in the botworker.
 */
@Slf4j
@Getter
public class EphemeralBrowserBot {

    private static final String NO_SUBMISSION = "botworker is running but did not return a submission.";

    private final BrowserBotClient client;
    private final String participantCode;
    private final String sessionCode;
    private final String path;

    EphemeralBrowserBot(BrowserBotClient client, String participantCode, String sessionCode, String path) {
        this.client = client;
        this.participantCode = participantCode;
        this.sessionCode = sessionCode;
        this.path = path;
    }

    /**
     * Has the botworker compute the submission for the page being served. Calling it again
     * before {@link #getNextPostData()} does not advance the bot.
     *
     * @param html The rendered page, available to the bot's checks.
     * @throws AssertionError             if the botworker does not have this participant loaded
     * @throws BotWorkerResponseException if the bot raised while preparing the submission
     */
    public void prepareNextSubmit(String html) {
        Map<String, Object> kwargs = new LinkedHashMap<>();
        kwargs.put("participant_code", participantCode);
        kwargs.put("path", path);
        kwargs.put("html", html);

        BotResponse result = client.callOrDiagnose(BotCommand.PREPARE_NEXT_SUBMIT, participantCode, kwargs,
                client.getProperties().getPrepareTimeout(), NO_SUBMISSION);
        if (result.hasResponseError()) {
            throw new BotWorkerResponseException(result.getResponseError(), result.getTraceback());
        }
        if (result.hasRequestError()) {
            throw new AssertionError(result.getRequestError());
        }
    }

    /**
     * Takes the submission prepared by {@link #prepareNextSubmit(String)}.
     *
     * @return the form data to post
     * @throws NoMoreSubmitsException if the bot has finished
     */
    public Map<String, Object> getNextPostData() throws NoMoreSubmitsException {
        Map<String, Object> kwargs = new LinkedHashMap<>();
        kwargs.put("participant_code", participantCode);

        BotResponse result = client.callOrDiagnose(BotCommand.CONSUME_NEXT_SUBMIT, participantCode, kwargs,
                client.getProperties().getConsumeTimeout(), NO_SUBMISSION);
        if (result.hasResponseError()) {
            throw new BotWorkerResponseException(result.getResponseError(), result.getTraceback());
        }
        Submission submission = result.toSubmission();
        if (submission.isEmpty()) {
            throw new NoMoreSubmitsException(participantCode);
        }
        if (submission.getPostData() == null) {
            throw new BotWorkerException("Submission for participant " + participantCode + " has no post_data: " + submission);
        }
        return submission.getPostData();
    }

    public void sendCompletionMessage() {
        log.debug("Participant {} finished, notifying session {}", participantCode, sessionCode);
        client.publishCompletion(sessionCode, participantCode);
    }
}
