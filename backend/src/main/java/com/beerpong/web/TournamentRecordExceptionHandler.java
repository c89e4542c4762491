package com.beerpong.web;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class TournamentRecordExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(TournamentRecordExceptionHandler.class);

    @ExceptionHandler(TournamentRecordException.class)
    public ResponseEntity<ErrorResponse> handle(TournamentRecordException ex) {
        if (ex.getStatus().is5xxServerError()) {
            log.error("Tournament operation failed: {}", ex.getMessage(), ex);
        }
        return ResponseEntity
                .status(ex.getStatus())
                .body(new ErrorResponse(ex.getCode(), ex.getMessage()));
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleStorage(DataAccessException ex) {
        log.error("Storage failure outside a tournament operation", ex);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("storage_error", "Storage failure"));
    }

    public record ErrorResponse(
            String code,
            String message
    ) {
    }
}
