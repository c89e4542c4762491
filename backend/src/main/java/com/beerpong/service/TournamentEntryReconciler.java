package com.beerpong.service;

import com.beerpong.model.PlacementGroups;
import com.beerpong.model.TournamentEntry;
import com.beerpong.repository.TournamentEntryRepository;
import com.beerpong.web.TournamentConflictException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Writes the entry rows of a tournament from a participant list and its placement groups.
 * <p>
 * Writes are additive: when replacing a tournament's entries the caller removes the old rows
 * first, in the same transaction.
 */
@Service
@RequiredArgsConstructor
public class TournamentEntryReconciler {

    private static final Logger log = LoggerFactory.getLogger(TournamentEntryReconciler.class);
    private static final String ENTRY_UNIQUE_CONSTRAINT = "uq_tournament_entries_tournament_player";

    private final PlayerDirectoryService playerDirectoryService;
    private final PlacementResolver placementResolver;
    private final TournamentEntryRepository tournamentEntryRepository;

    @Transactional(propagation = Propagation.MANDATORY)
    public List<TournamentEntry> reconcile(
            Integer tournamentId,
            List<String> participantNames,
            PlacementGroups placementGroups
    ) {
        requireDistinctNames(tournamentId, participantNames);

        Map<String, Integer> playerIds = new LinkedHashMap<>();
        for (String name : participantNames) {
            playerIds.computeIfAbsent(name, playerDirectoryService::resolve);
        }

        List<TournamentEntry> written = new ArrayList<>(participantNames.size());
        for (String name : participantNames) {
            TournamentEntry entry = new TournamentEntry();
            entry.setTournamentId(tournamentId);
            entry.setPlayerId(playerIds.get(name));
            entry.setPlacement(placementResolver.rankOf(name, placementGroups).orElse(null));
            written.add(insert(entry));
        }

        log.debug("Reconciled {} entr(ies) for tournament {}", written.size(), tournamentId);
        return written;
    }

    private void requireDistinctNames(Integer tournamentId, List<String> participantNames) {
        Set<String> seen = new HashSet<>();
        for (String name : participantNames) {
            if (!seen.add(name)) {
                throw TournamentConflictException.duplicateParticipant(tournamentId, name);
            }
        }
    }

    private TournamentEntry insert(TournamentEntry entry) {
        try {
            return tournamentEntryRepository.saveAndFlush(entry);
        } catch (DataIntegrityViolationException ex) {
            if (violatesEntryUniqueness(ex)) {
                throw TournamentConflictException.duplicateEntry(entry.getTournamentId(), entry.getPlayerId(), ex);
            }
            throw ex;
        }
    }

    private static boolean violatesEntryUniqueness(Throwable ex) {
        for (Throwable cause = ex; cause != null; cause = cause.getCause()) {
            String message = cause.getMessage();
            if (message != null && message.toLowerCase(Locale.ROOT).contains(ENTRY_UNIQUE_CONSTRAINT)) {
                return true;
            }
        }
        return false;
    }
}
