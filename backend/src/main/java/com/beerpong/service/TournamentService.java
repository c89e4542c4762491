package com.beerpong.service;

import com.beerpong.dto.TournamentResponses;
import com.beerpong.mapper.TournamentResponseMapper;
import com.beerpong.model.Tournament;
import com.beerpong.model.TournamentSubmission;
import com.beerpong.repository.TournamentEntryRepository;
import com.beerpong.repository.TournamentParticipantRow;
import com.beerpong.repository.TournamentRepository;
import com.beerpong.web.TournamentNotFoundException;
import com.beerpong.web.TournamentStorageException;
import com.beerpong.web.TournamentValidationException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Tournament lifecycle. Every mutation runs as one transaction covering the tournament row,
 * any newly registered players and the full entry set.
 */
@Service
@RequiredArgsConstructor
public class TournamentService {

    private static final Logger log = LoggerFactory.getLogger(TournamentService.class);

    private final TournamentRepository tournamentRepository;
    private final TournamentEntryRepository tournamentEntryRepository;
    private final TournamentEntryReconciler tournamentEntryReconciler;
    private final TournamentResponseMapper tournamentResponseMapper;

    @Transactional
    public Integer createTournament(TournamentSubmission submission) {
        validate(submission);
        try {
            OffsetDateTime now = OffsetDateTime.now();
            Tournament tournament = new Tournament();
            tournament.setDate(submission.date());
            tournament.setType(submission.type());
            tournament.setFlavor(submission.flavor());
            tournament.setCreatedAt(now);
            tournament.setUpdatedAt(now);

            Integer tournamentId = tournamentRepository.save(tournament).getId();
            tournamentEntryReconciler.reconcile(tournamentId, submission.participants(), submission.placements());

            log.info("Created tournament {} ({}, {}) with {} participant(s)",
                    tournamentId, submission.date(), submission.type().getValue(), submission.participants().size());
            return tournamentId;
        } catch (DataAccessException ex) {
            throw new TournamentStorageException("Failed to create tournament", ex);
        }
    }

    /**
     * Overwrites the tournament metadata and replaces its whole entry set.
     */
    @Transactional
    public Integer updateTournament(Integer tournamentId, TournamentSubmission submission) {
        validate(submission);
        try {
            int updatedRows = tournamentRepository.updateDetails(
                    tournamentId,
                    submission.date(),
                    submission.type(),
                    submission.flavor(),
                    OffsetDateTime.now()
            );
            if (updatedRows == 0) {
                throw new TournamentNotFoundException(tournamentId);
            }

            int removedEntries = tournamentEntryRepository.deleteAllForTournament(tournamentId);
            tournamentEntryReconciler.reconcile(tournamentId, submission.participants(), submission.placements());

            log.info("Updated tournament {}: replaced {} entr(ies) with {}",
                    tournamentId, removedEntries, submission.participants().size());
            return tournamentId;
        } catch (DataAccessException ex) {
            throw new TournamentStorageException("Failed to update tournament " + tournamentId, ex);
        }
    }

    @Transactional
    public void deleteTournament(Integer tournamentId) {
        int deletedRows;
        try {
            deletedRows = tournamentRepository.deleteTournamentById(tournamentId);
        } catch (DataAccessException ex) {
            throw new TournamentStorageException("Failed to delete tournament " + tournamentId, ex);
        }
        if (deletedRows == 0) {
            throw new TournamentNotFoundException(tournamentId);
        }
        log.info("Deleted tournament {}", tournamentId);
    }

    @Transactional(readOnly = true)
    public TournamentResponses.TournamentDetail getTournament(Integer tournamentId) {
        Tournament tournament = tournamentRepository.findById(tournamentId)
                .orElseThrow(() -> new TournamentNotFoundException(tournamentId));
        List<TournamentParticipantRow> rows = tournamentEntryRepository.findParticipantRows(List.of(tournamentId));
        return tournamentResponseMapper.toTournamentDetail(tournament, rows);
    }

    @Transactional(readOnly = true)
    public List<TournamentResponses.TournamentSummary> listTournaments() {
        List<Tournament> tournaments = tournamentRepository.findAllByOrderByDateDescIdDesc();
        if (tournaments.isEmpty()) {
            return List.of();
        }

        Map<Integer, List<TournamentParticipantRow>> rowsByTournament = tournamentEntryRepository
                .findParticipantRows(tournaments.stream().map(Tournament::getId).toList())
                .stream()
                .collect(Collectors.groupingBy(
                        TournamentParticipantRow::getTournamentId,
                        LinkedHashMap::new,
                        Collectors.toList()
                ));

        return tournaments.stream()
                .map(tournament -> tournamentResponseMapper.toTournamentSummary(
                        tournament,
                        rowsByTournament.getOrDefault(tournament.getId(), List.of())
                ))
                .toList();
    }

    private void validate(TournamentSubmission submission) {
        if (submission == null) {
            throw new TournamentValidationException("Tournament details are required");
        }
        if (submission.date() == null) {
            throw TournamentValidationException.missingField("date");
        }
        if (submission.type() == null) {
            throw TournamentValidationException.missingField("type");
        }
        if (submission.participants() == null) {
            throw TournamentValidationException.missingField("participants");
        }
        if (submission.placements() == null) {
            throw TournamentValidationException.missingField("placements");
        }
        for (String name : submission.participants()) {
            if (!StringUtils.hasText(name)) {
                throw new TournamentValidationException("participants must not contain blank names");
            }
        }
    }
}
