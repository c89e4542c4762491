package com.beerpong.web;

import org.springframework.http.HttpStatus;

public class TournamentValidationException extends TournamentRecordException {

    public TournamentValidationException(String message) {
        super(HttpStatus.BAD_REQUEST, "validation_failed", message);
    }

    public static TournamentValidationException missingField(String field) {
        return new TournamentValidationException(field + " is required");
    }
}
