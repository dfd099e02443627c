package org.sjsu.botworker.service.bot;

import lombok.extern.slf4j.Slf4j;
import org.sjsu.botworker.model.Submission;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Plays back a fixed list of submissions. A step may name the path it expects the bot to be on;
 * if the bot is somewhere else the step fails instead of submitting to the wrong page.
 */
@Slf4j
public class ScriptedSubmissionSequence implements SubmissionSequence {

    public static final String EXPECTED_PATH = "path";

    private final String participantCode;
    private final List<Map<String, Object>> steps;
    private final PageContext page;
    private int position;

    public ScriptedSubmissionSequence(String participantCode, List<Map<String, Object>> steps, PageContext page) {
        this.participantCode = participantCode;
        this.steps = steps == null ? List.of() : new ArrayList<>(steps);
        this.page = page;
    }

    @Override
    public Optional<Submission> next() {
        if (position >= steps.size()) {
            return Optional.empty();
        }
        Map<String, Object> step = steps.get(position);
        Object expectedPath = step.get(EXPECTED_PATH);
        if (expectedPath != null && !expectedPath.toString().equals(page.getPath())) {
            throw new IllegalStateException(String.format(
                    "Bot for participant %s expected to be on page '%s' (step %d) but is on '%s'",
                    participantCode, expectedPath, position + 1, page.getPath()));
        }
        position++;
        log.debug("Participant {} submitting step {}/{} on {}", participantCode, position, steps.size(), page.getPath());

        Map<String, Object> fields = new LinkedHashMap<>(step);
        fields.remove(EXPECTED_PATH);
        fields.putIfAbsent(Submission.POST_DATA, Map.of());
        return Optional.of(Submission.fromMap(fields));
    }

    boolean isExhausted() {
        return position >= steps.size();
    }
}
