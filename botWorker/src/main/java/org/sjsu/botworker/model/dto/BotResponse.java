package org.sjsu.botworker.model.dto;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonAutoDetect;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.sjsu.botworker.model.Submission;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Answer to exactly one {@link BotRequestDto}. Serialized as a flat JSON object: command
 * specific fields on success, {@code request_error} when the request made no sense for the
 * worker's state, {@code response_error} plus {@code traceback} when the command raised.
 */
@EqualsAndHashCode
@ToString
@JsonAutoDetect(getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public class BotResponse {

    public static final String OK = "ok";
    public static final String REQUEST_ERROR = "request_error";
    public static final String RESPONSE_ERROR = "response_error";
    public static final String TRACEBACK = "traceback";

    private final Map<String, Object> fields = new LinkedHashMap<>();

    public BotResponse() {
    }

    private BotResponse(Map<String, Object> fields) {
        this.fields.putAll(fields);
    }

    public static BotResponse ok() {
        return new BotResponse(Map.of(OK, true));
    }

    public static BotResponse empty() {
        return new BotResponse();
    }

    public static BotResponse of(Submission submission) {
        return new BotResponse(submission.toMap());
    }

    public static BotResponse requestError(String message) {
        return new BotResponse(Map.of(REQUEST_ERROR, message));
    }

    public static BotResponse responseError(String error, String traceback) {
        Map<String, Object> failure = new LinkedHashMap<>();
        failure.put(RESPONSE_ERROR, error);
        failure.put(TRACEBACK, traceback);
        return new BotResponse(failure);
    }

    @JsonAnyGetter
    public Map<String, Object> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    @JsonAnySetter
    public void setField(String name, Object value) {
        fields.put(name, value);
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    public boolean hasRequestError() {
        return fields.containsKey(REQUEST_ERROR);
    }

    public boolean hasResponseError() {
        return fields.containsKey(RESPONSE_ERROR);
    }

    public String getRequestError() {
        return stringField(REQUEST_ERROR);
    }

    public String getResponseError() {
        return stringField(RESPONSE_ERROR);
    }

    public String getTraceback() {
        return stringField(TRACEBACK);
    }

    public Submission toSubmission() {
        return Submission.fromMap(fields);
    }

    private String stringField(String name) {
        Object value = fields.get(name);
        return value == null ? null : value.toString();
    }
}
