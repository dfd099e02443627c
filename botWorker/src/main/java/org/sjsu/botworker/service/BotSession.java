package org.sjsu.botworker.service;

import lombok.Getter;
import lombok.Setter;
import org.sjsu.botworker.service.bot.PageContext;
import org.sjsu.botworker.service.bot.SubmissionSequence;

/**
 * A browser bot loaded in the botworker's memory. The submission sequence reads the current
 * page from this session, so path and html must be set before the sequence is advanced.
 */
@Getter
public class BotSession implements PageContext {

    private final String participantCode;
    private SubmissionSequence submits;

    @Setter
    private volatile String path;
    @Setter
    private volatile String html;

    public BotSession(String participantCode) {
        this.participantCode = participantCode;
    }

    void attach(SubmissionSequence submits) {
        this.submits = submits;
    }
}
