package com.vibeforge.controller;

import com.vibeforge.core.artifact.InvalidRequestException;
import com.vibeforge.core.artifact.StaleReferenceException;
import com.vibeforge.core.generation.GenerationFailedException;
import com.vibeforge.llm.CollaboratorException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/** Maps core exceptions onto HTTP statuses for the REST facade. */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(StaleReferenceException.class)
    public ResponseEntity<Map<String, String>> staleReference(StaleReferenceException e) {
        return error(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<Map<String, String>> invalidRequest(InvalidRequestException e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler({CollaboratorException.class, GenerationFailedException.class})
    public ResponseEntity<Map<String, String>> collaboratorFailure(RuntimeException e) {
        log.warn("[ApiExceptionHandler] Collaborator failure: {}", e.getMessage());
        return error(HttpStatus.BAD_GATEWAY, e.getMessage());
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status)
                .body(Map.of("error", status.getReasonPhrase(),
                             "message", message != null ? message : ""));
    }
}
