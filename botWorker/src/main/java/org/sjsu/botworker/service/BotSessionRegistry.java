package org.sjsu.botworker.service;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Bot sessions by participant code, least recently used first.
 */
@Slf4j
public class BotSessionRegistry {

    private final int limit;
    private final Map<String, BotSession> sessions = new LinkedHashMap<>(16, 0.75f, true);

    public BotSessionRegistry(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("Session limit must be positive, got " + limit);
        }
        this.limit = limit;
    }

    public synchronized void put(BotSession session) {
        sessions.put(session.getParticipantCode(), session);
    }

    public synchronized Optional<BotSession> get(String participantCode) {
        return Optional.ofNullable(sessions.get(participantCode));
    }

    /**
     * Evicts least recently used sessions so that the incoming participant fits under the limit.
     * Nothing is evicted when the participant is already loaded, since its session is replaced.
     *
     * @return codes of the evicted participants
     */
    public synchronized List<String> pruneFor(String incomingParticipantCode) {
        List<String> evicted = new ArrayList<>();
        if (sessions.containsKey(incomingParticipantCode)) {
            return evicted;
        }
        Iterator<String> eldest = sessions.keySet().iterator();
        while (sessions.size() >= limit && eldest.hasNext()) {
            evicted.add(eldest.next());
            eldest.remove();
        }
        if (!evicted.isEmpty()) {
            log.info("Pruned {} bot session(s) to stay under the limit of {}", evicted.size(), limit);
        }
        return evicted;
    }

    public synchronized void clear() {
        sessions.clear();
    }

    public synchronized int size() {
        return sessions.size();
    }

    public int getLimit() {
        return limit;
    }
}
