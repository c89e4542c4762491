package com.beerpong.web;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base for the caller-visible failures of the tournament lifecycle operations.
 * Each subtype fixes the HTTP status the API layer answers with.
 */
@Getter
public abstract class TournamentRecordException extends RuntimeException {

    private final HttpStatus status;
    private final String code;

    protected TournamentRecordException(HttpStatus status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }

    protected TournamentRecordException(HttpStatus status, String code, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.code = code;
    }
}
