package com.beerpong.controller;

import com.beerpong.dto.TournamentRequests;
import com.beerpong.dto.TournamentResponses;
import com.beerpong.service.TournamentService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/tournaments")
public class TournamentController {

    private final TournamentService tournamentService;

    public TournamentController(TournamentService tournamentService) {
        this.tournamentService = tournamentService;
    }

    @GetMapping
    public ResponseEntity<List<TournamentResponses.TournamentSummary>> listTournaments() {
        return ResponseEntity.ok(tournamentService.listTournaments());
    }

    @GetMapping("/{tournamentId}")
    public ResponseEntity<TournamentResponses.TournamentDetail> getTournament(@PathVariable Integer tournamentId) {
        return ResponseEntity.ok(tournamentService.getTournament(tournamentId));
    }

    @PostMapping
    public ResponseEntity<TournamentResponses.TournamentMutation> createTournament(
            @Valid @RequestBody TournamentRequests.TournamentRequest request
    ) {
        Integer tournamentId = tournamentService.createTournament(request.toSubmission());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new TournamentResponses.TournamentMutation("Tournament created successfully", tournamentId));
    }

    @PutMapping("/{tournamentId}")
    public ResponseEntity<TournamentResponses.TournamentMutation> updateTournament(
            @PathVariable Integer tournamentId,
            @Valid @RequestBody TournamentRequests.TournamentRequest request
    ) {
        Integer updatedId = tournamentService.updateTournament(tournamentId, request.toSubmission());
        return ResponseEntity.ok(new TournamentResponses.TournamentMutation("Tournament updated successfully", updatedId));
    }

    @DeleteMapping("/{tournamentId}")
    public ResponseEntity<TournamentResponses.TournamentMutation> deleteTournament(@PathVariable Integer tournamentId) {
        tournamentService.deleteTournament(tournamentId);
        return ResponseEntity.ok(new TournamentResponses.TournamentMutation("Tournament deleted successfully", tournamentId));
    }
}
