package com.beerpong.dto;

public final class PlayerResponses {

    private PlayerResponses() {
    }

    public record PlayerSummary(
            Integer id,
            String name
    ) {
    }
}
