package com.quick.codebattles.codebattles;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Buff or debuff granted for solving a card. {@code amount} is in seconds and is
 * ignored by {@link RewardKind#FLASHBANG_TARGETED}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Reward(RewardKind kind, int amount) {

    public Reward {
        Objects.requireNonNull(kind, "kind");
        if (amount < 0) {
            throw new IllegalArgumentException("Reward amount must not be negative: " + amount);
        }
    }

    @JsonCreator
    public static Reward of(@JsonProperty("kind") @JsonAlias("effect") RewardKind kind,
                            @JsonProperty("amount") @JsonAlias("value") Integer amount) {
        return new Reward(kind, amount == null ? 0 : amount);
    }

    public long amountMillis() {
        return amount * 1000L;
    }
}
