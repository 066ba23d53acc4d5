package com.kats.api.controller;

import com.kats.api.dto.ErrorBody;
import com.kats.domain.MalformedRecordException;
import com.kats.ingestion.checkpoint.CheckpointException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps checkpoint failures to ErrorBody responses.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(CheckpointException.class)
    public ResponseEntity<ErrorBody> handleCheckpointUnavailable(CheckpointException ex) {
        log.warn("Checkpoint store unavailable: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ErrorBody.of("CHECKPOINT_UNAVAILABLE", "Checkpoint store cannot be read"));
    }

    @ExceptionHandler(MalformedRecordException.class)
    public ResponseEntity<ErrorBody> handleMalformedCheckpoint(MalformedRecordException ex) {
        log.error("Stored checkpoint is malformed", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorBody.of("CHECKPOINT_MALFORMED", ex.getMessage()));
    }
}
