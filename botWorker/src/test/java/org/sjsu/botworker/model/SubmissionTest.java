package org.sjsu.botworker.model;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SubmissionTest {

    @Test
    void shouldSplitKnownFieldsFromAttributes() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("page_class", "Results");
        fields.put("post_data", Map.of("x", "1"));
        fields.put("must_fail", true);

        Submission submission = Submission.fromMap(fields);

        assertThat(submission.getPageClass()).isEqualTo("Results");
        assertThat(submission.getPostData()).containsEntry("x", "1");
        assertThat(submission.getAttributes()).containsOnlyKeys("must_fail");
        assertThat(submission.withoutPageClass().toMap()).containsOnlyKeys("post_data", "must_fail");
    }

    @Test
    void emptyMapShouldBeThePlaceholder() {
        assertThat(Submission.fromMap(Map.of())).isSameAs(Submission.empty());
        assertThat(Submission.fromMap(null).isEmpty()).isTrue();
        assertThat(Submission.empty().toMap()).isEmpty();
    }

    @Test
    void shouldRejectNonObjectPostData() {
        assertThatThrownBy(() -> Submission.fromMap(Map.of("post_data", "a=1")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldCopyPostDataDecodedFromJson() throws Exception {
        Map<String, Object> fields = new ObjectMapper().readValue(
                "{\"post_data\":{\"age\":30,\"tags\":[\"a\"]},\"page_class\":\"Survey\"}",
                new TypeReference<Map<String, Object>>() {});

        Submission submission = Submission.fromMap(fields);

        assertThat(submission.getPostData()).containsEntry("age", 30).containsEntry("tags", List.of("a"));
        assertThat(submission.getPageClass()).isEqualTo("Survey");
    }
}
