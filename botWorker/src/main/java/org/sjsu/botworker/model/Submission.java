package org.sjsu.botworker.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One form submission a browser bot makes. {@code pageClass} only identifies the page that
 * produced the submission inside the botworker and is never sent back to callers.
 * A submission without any fields is the placeholder for "no more submits".
 */
@Getter
@EqualsAndHashCode
@ToString
public final class Submission {

    public static final String POST_DATA = "post_data";
    public static final String PAGE_CLASS = "page_class";

    private static final Submission EMPTY = new Submission(null, null, Collections.emptyMap());

    private final String pageClass;
    private final Map<String, Object> postData;
    private final Map<String, Object> attributes;

    public Submission(String pageClass, Map<String, Object> postData, Map<String, Object> attributes) {
        this.pageClass = pageClass;
        this.postData = postData == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(postData));
        this.attributes = attributes == null || attributes.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static Submission of(String pageClass, Map<String, Object> postData) {
        return new Submission(pageClass, postData, null);
    }

    public static Submission empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return pageClass == null && postData == null && attributes.isEmpty();
    }

    public Submission withoutPageClass() {
        if (pageClass == null) {
            return this;
        }
        Submission stripped = new Submission(null, postData, attributes);
        return stripped.isEmpty() ? EMPTY : stripped;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> fields = new LinkedHashMap<>(attributes);
        if (postData != null) {
            fields.put(POST_DATA, postData);
        }
        if (pageClass != null) {
            fields.put(PAGE_CLASS, pageClass);
        }
        return fields;
    }

    public static Submission fromMap(Map<String, Object> fields) {
        if (fields == null || fields.isEmpty()) {
            return EMPTY;
        }
        Map<String, Object> attributes = new LinkedHashMap<>(fields);
        Object pageClass = attributes.remove(PAGE_CLASS);
        Object postData = attributes.remove(POST_DATA);
        Submission submission = new Submission(pageClass == null ? null : pageClass.toString(),
                postDataFields(postData), attributes);
        return submission.isEmpty() ? EMPTY : submission;
    }

    private static Map<String, Object> postDataFields(Object postData) {
        if (postData == null) {
            return null;
        }
        if (!(postData instanceof Map)) {
            throw new IllegalArgumentException("post_data must be an object, got " + postData.getClass().getSimpleName());
        }
        Map<?, ?> map = (Map<?, ?>) postData;
        Map<String, Object> fields = new LinkedHashMap<>();
        map.forEach((name, value) -> fields.put(String.valueOf(name), value));
        return fields;
    }
}
