package com.beerpong.service;

import com.beerpong.dto.PlayerResponses;
import com.beerpong.mapper.TournamentResponseMapper;
import com.beerpong.model.Player;
import com.beerpong.repository.PlayerRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Maps player names to stable identifiers. Names match exactly: no trimming or case folding.
 */
@Service
@RequiredArgsConstructor
public class PlayerDirectoryService {

    private static final Logger log = LoggerFactory.getLogger(PlayerDirectoryService.class);

    private final PlayerRepository playerRepository;
    private final TournamentResponseMapper tournamentResponseMapper;

    /**
     * Returns the id of the player with this exact name, registering the player on first sighting.
     *
     * @param name non-empty display name
     * @return stable player id
     */
    @Transactional
    public Integer resolve(String name) {
        return playerRepository.findByName(name)
                .map(Player::getId)
                .orElseGet(() -> register(name));
    }

    @Transactional(readOnly = true)
    public List<PlayerResponses.PlayerSummary> listPlayers() {
        return playerRepository.findAllByOrderByNameAsc().stream()
                .map(tournamentResponseMapper::toPlayerSummary)
                .toList();
    }

    private Integer register(String name) {
        Player player = new Player();
        player.setName(name);
        player.setCreatedAt(OffsetDateTime.now());
        Integer playerId = playerRepository.save(player).getId();
        log.debug("Registered player {} as id {}", name, playerId);
        return playerId;
    }
}
