package com.quick.codebattles.codebattles;

public record PlayerRef(String playerId, String roomCode) {
}
