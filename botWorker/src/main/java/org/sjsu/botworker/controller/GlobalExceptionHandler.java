package org.sjsu.botworker.controller;

import lombok.extern.slf4j.Slf4j;
import org.sjsu.botworker.exception.BotWorkerException;
import org.sjsu.botworker.exception.BotWorkerResponseException;
import org.sjsu.botworker.exception.BotWorkerUnreachableException;
import org.sjsu.botworker.exception.ParticipantNotFoundException;
import org.sjsu.botworker.model.dto.ApiErrorResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

@ControllerAdvice(basePackages = "org.sjsu.botworker.controller")
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(BotWorkerUnreachableException.class)
    public ResponseEntity<ApiErrorResponse> handleUnreachable(BotWorkerUnreachableException ex) {
        log.warn("[API] botworker unreachable");
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage());
    }

    @ExceptionHandler(BotWorkerResponseException.class)
    public ResponseEntity<ApiErrorResponse> handleResponseError(BotWorkerResponseException ex) {
        log.error("[API] botworker failed: {}", ex.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, ex.getResponseError());
    }

    @ExceptionHandler(ParticipantNotFoundException.class)
    public ResponseEntity<ApiErrorResponse> handleNotFound(ParticipantNotFoundException ex) {
        log.warn("[API] Not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(BotWorkerException.class)
    public ResponseEntity<ApiErrorResponse> handleBotWorker(BotWorkerException ex) {
        log.error("[API] botworker error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage());
    }

    private static ResponseEntity<ApiErrorResponse> respond(HttpStatus status, String message) {
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .message(message)
                .build();
        return ResponseEntity.status(status).body(body);
    }
}
