package com.beerpong.web;

import org.springframework.http.HttpStatus;

public class TournamentStorageException extends TournamentRecordException {

    public TournamentStorageException(String message, Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, "storage_error", message, cause);
    }
}
