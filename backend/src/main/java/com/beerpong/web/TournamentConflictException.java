package com.beerpong.web;

import org.springframework.http.HttpStatus;

public class TournamentConflictException extends TournamentRecordException {

    public TournamentConflictException(String code, String message) {
        super(HttpStatus.CONFLICT, code, message);
    }

    public TournamentConflictException(String code, String message, Throwable cause) {
        super(HttpStatus.CONFLICT, code, message, cause);
    }

    public static TournamentConflictException duplicateParticipant(Integer tournamentId, String name) {
        return new TournamentConflictException(
                "duplicate_participant",
                "Participant '" + name + "' is listed more than once for tournament " + tournamentId
        );
    }

    public static TournamentConflictException duplicateEntry(Integer tournamentId, Integer playerId, Throwable cause) {
        return new TournamentConflictException(
                "duplicate_participant",
                "Player " + playerId + " already has an entry in tournament " + tournamentId,
                cause
        );
    }
}
