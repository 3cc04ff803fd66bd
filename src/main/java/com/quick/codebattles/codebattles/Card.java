package com.quick.codebattles.codebattles;

import java.util.Objects;

/**
 * Single-use problem instance held in a player's hand.
 */
public record Card(String id, Problem problem, Reward reward, Challenge challenge) {

    public Card {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(problem, "problem");
    }
}
