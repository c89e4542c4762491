package com.beerpong.controller;

import com.beerpong.dto.PlayerResponses;
import com.beerpong.service.PlayerDirectoryService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read-only view of the player directory; players are registered through tournament submissions.
 */
@RestController
@RequestMapping("/api/players")
public class PlayerController {

    private final PlayerDirectoryService playerDirectoryService;

    public PlayerController(PlayerDirectoryService playerDirectoryService) {
        this.playerDirectoryService = playerDirectoryService;
    }

    @GetMapping
    public ResponseEntity<List<PlayerResponses.PlayerSummary>> listPlayers() {
        return ResponseEntity.ok(playerDirectoryService.listPlayers());
    }
}
