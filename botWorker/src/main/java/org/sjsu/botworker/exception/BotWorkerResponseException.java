package org.sjsu.botworker.exception;

import lombok.Getter;

/**
 * A command raised inside the botworker. The message carries the worker-side stack trace so
 * that it shows up in the caller's own failure report.
 */
@Getter
public class BotWorkerResponseException extends BotWorkerException {

    private final String responseError;

    public BotWorkerResponseException(String responseError, String traceback) {
        super(traceback != null && !traceback.isEmpty() ? traceback : responseError);
        this.responseError = responseError;
    }
}
