package com.quick.codebattles.codebattles;

/**
 * Result of a finished room. Both fields are null when nobody survived.
 */
public record GameOutcome(String winnerId, String winnerName) {

    public static GameOutcome noWinner() {
        return new GameOutcome(null, null);
    }
}
