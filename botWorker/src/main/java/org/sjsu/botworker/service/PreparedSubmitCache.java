package org.sjsu.botworker.service;

import org.sjsu.botworker.exception.PreparedSubmitNotFoundException;
import org.sjsu.botworker.model.Submission;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Holds at most one prepared submission per participant until it is consumed.
 * <p>
 * A single lock covers the whole cache. The check for an existing entry and the computation of
 * a new one happen under that lock, so a duplicated prepare request never advances a bot twice.
 */
public class PreparedSubmitCache {

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Submission> prepared = new HashMap<>();

    /**
     * Stores the computed submission unless one is already prepared for the participant.
     *
     * @return the stored submission, or empty if an entry already existed and nothing was computed
     */
    public Optional<Submission> prepareIfAbsent(String participantCode, Supplier<Submission> compute) {
        lock.lock();
        try {
            if (prepared.containsKey(participantCode)) {
                return Optional.empty();
            }
            Submission submission = compute.get().withoutPageClass();
            prepared.put(participantCode, submission);
            return Optional.of(submission);
        } finally {
            lock.unlock();
        }
    }

    public Submission consume(String participantCode) {
        lock.lock();
        try {
            Submission submission = prepared.remove(participantCode);
            if (submission == null) {
                throw new PreparedSubmitNotFoundException(participantCode);
            }
            return submission.withoutPageClass();
        } finally {
            lock.unlock();
        }
    }

    Optional<Submission> peek(String participantCode) {
        lock.lock();
        try {
            return Optional.ofNullable(prepared.get(participantCode));
        } finally {
            lock.unlock();
        }
    }

    public void removeAll(Collection<String> participantCodes) {
        lock.lock();
        try {
            participantCodes.forEach(prepared::remove);
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            prepared.clear();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return prepared.size();
        } finally {
            lock.unlock();
        }
    }
}
