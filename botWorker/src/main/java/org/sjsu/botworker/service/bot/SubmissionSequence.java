package org.sjsu.botworker.service.bot;

import org.sjsu.botworker.model.Submission;

import java.util.Optional;

/**
 * Lazily produces a participant's submissions, one per call.
 * <p>
 * Once {@link #next()} has returned {@link Optional#empty()} the sequence is exhausted and keeps
 * returning empty; it never throws for being exhausted. A sequence is owned by exactly one bot
 * session and cannot be restarted, only replaced.
 */
public interface SubmissionSequence {

    Optional<Submission> next();
}
