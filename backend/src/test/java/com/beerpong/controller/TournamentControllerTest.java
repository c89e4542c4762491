package com.beerpong.controller;

import com.beerpong.dto.TournamentResponses;
import com.beerpong.model.PlacementRank;
import com.beerpong.model.TournamentSubmission;
import com.beerpong.model.TournamentType;
import com.beerpong.service.TournamentService;
import com.beerpong.web.TournamentConflictException;
import com.beerpong.web.TournamentNotFoundException;
import com.beerpong.web.TournamentStorageException;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(TournamentController.class)
class TournamentControllerTest {

    private static final String VALID_BODY = """
            {
              "date": "2025-01-01",
              "type": "single",
              "flavor": "New Year Classic",
              "participants": ["Alice", "Bob"],
              "placements": { "firstPlace": ["Alice"] }
            }
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private TournamentService tournamentService;

    @Test
    void createTournamentReturnsCreatedId() throws Exception {
        when(tournamentService.createTournament(any())).thenReturn(12);

        mockMvc.perform(post("/api/tournaments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(VALID_BODY))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.tournamentId").value(12))
                .andExpect(jsonPath("$.message").value("Tournament created successfully"));

        ArgumentCaptor<TournamentSubmission> submissionCaptor = ArgumentCaptor.forClass(TournamentSubmission.class);
        verify(tournamentService).createTournament(submissionCaptor.capture());
        TournamentSubmission submission = submissionCaptor.getValue();
        assertEquals(LocalDate.of(2025, 1, 1), submission.date());
        assertEquals(TournamentType.SINGLE, submission.type());
        assertEquals(List.of("Alice", "Bob"), submission.participants());
        assertEquals(Set.of("Alice"), submission.placements().namesFor(PlacementRank.FIRST));
        assertEquals(Set.of(), submission.placements().namesFor(PlacementRank.SECOND));
    }

    @Test
    void createTournamentWithoutParticipantsReturnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/tournaments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "date": "2025-01-01",
                                  "type": "team",
                                  "placements": {}
                                }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fieldErrors.participants").value("participants is required"));

        verify(tournamentService, never()).createTournament(any());
    }

    @Test
    void createTournamentWithUnknownTypeReturnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/tournaments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "date": "2025-01-01",
                                  "type": "doubles",
                                  "participants": ["Alice"],
                                  "placements": {}
                                }
                                """))
                .andExpect(status().isBadRequest());

        verify(tournamentService, never()).createTournament(any());
    }

    @Test
    void createTournamentWithDuplicateParticipantReturnsConflict() throws Exception {
        when(tournamentService.createTournament(any()))
                .thenThrow(TournamentConflictException.duplicateParticipant(3, "Alice"));

        mockMvc.perform(post("/api/tournaments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(VALID_BODY))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("duplicate_participant"));
    }

    @Test
    void createTournamentStorageFailureReturnsServerError() throws Exception {
        when(tournamentService.createTournament(any()))
                .thenThrow(new TournamentStorageException("Failed to create tournament",
                        new DataAccessResourceFailureException("disk full")));

        mockMvc.perform(post("/api/tournaments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(VALID_BODY))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value("storage_error"));
    }

    @Test
    void updateTournamentReturnsOk() throws Exception {
        when(tournamentService.updateTournament(eq(5), any())).thenReturn(5);

        mockMvc.perform(put("/api/tournaments/{tournamentId}", 5)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(VALID_BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tournamentId").value(5));
    }

    @Test
    void updateUnknownTournamentReturnsNotFound() throws Exception {
        when(tournamentService.updateTournament(eq(99), any())).thenThrow(new TournamentNotFoundException(99));

        mockMvc.perform(put("/api/tournaments/{tournamentId}", 99)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(VALID_BODY))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("tournament_not_found"));
    }

    @Test
    void deleteUnknownTournamentReturnsNotFound() throws Exception {
        doThrow(new TournamentNotFoundException(41)).when(tournamentService).deleteTournament(41);

        mockMvc.perform(delete("/api/tournaments/{tournamentId}", 41))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Tournament not found: 41"));
    }

    @Test
    void deleteTournamentReturnsOk() throws Exception {
        mockMvc.perform(delete("/api/tournaments/{tournamentId}", 4))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tournamentId").value(4));

        verify(tournamentService).deleteTournament(4);
    }

    @Test
    void nonNumericIdReturnsBadRequest() throws Exception {
        mockMvc.perform(delete("/api/tournaments/{tournamentId}", "abc"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void getTournamentReturnsGroupedPlacements() throws Exception {
        when(tournamentService.getTournament(5)).thenReturn(new TournamentResponses.TournamentDetail(
                5,
                LocalDate.of(2025, 1, 1),
                TournamentType.TEAM,
                null,
                List.of("Bob", "Carol"),
                new TournamentResponses.Placements(List.of("Carol"), List.of(), List.of())
        ));

        mockMvc.perform(get("/api/tournaments/{tournamentId}", 5))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.date").value("2025-01-01"))
                .andExpect(jsonPath("$.type").value("team"))
                .andExpect(jsonPath("$.participants.length()").value(2))
                .andExpect(jsonPath("$.placements.firstPlace[0]").value("Carol"))
                .andExpect(jsonPath("$.placements.secondPlace.length()").value(0));
    }

    @Test
    void listTournamentsReturnsSummaries() throws Exception {
        when(tournamentService.listTournaments()).thenReturn(List.of(
                new TournamentResponses.TournamentSummary(
                        2, LocalDate.of(2025, 2, 1), TournamentType.SINGLE, "Rematch", List.of("Alice")),
                new TournamentResponses.TournamentSummary(
                        1, LocalDate.of(2025, 1, 1), TournamentType.TEAM, null, List.of())
        ));

        mockMvc.perform(get("/api/tournaments"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].id").value(2))
                .andExpect(jsonPath("$[0].participants[0]").value("Alice"))
                .andExpect(jsonPath("$[1].type").value("team"));
    }

    @Test
    void storageFailureOutsideServiceWrappingReturnsServerError() throws Exception {
        when(tournamentService.listTournaments()).thenThrow(new DataAccessResourceFailureException("pool exhausted"));

        mockMvc.perform(get("/api/tournaments"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value("storage_error"));
    }
}
