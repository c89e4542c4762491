package com.beerpong.web;

import org.springframework.http.HttpStatus;

public class TournamentNotFoundException extends TournamentRecordException {

    public TournamentNotFoundException(Integer tournamentId) {
        super(HttpStatus.NOT_FOUND, "tournament_not_found", "Tournament not found: " + tournamentId);
    }
}
