package com.quick.codebattles.codebattles;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum EventType {
    CONNECTED,
    JOIN_ERROR,
    PLAYER_JOINED,
    GAME_STATE,
    GAME_STARTED,
    CARD_SELECTED,
    SOLUTION_PASSED,
    SOLUTION_FAILED,
    PLAYER_ELIMINATED,
    TARGET_SELECTION_REQUIRED,
    REWARD_APPLIED,
    FLASHBANG_APPLIED,
    GAME_ENDED,
    PLAYER_LEFT,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
