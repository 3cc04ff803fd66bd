package com.quick.codebattles.codebattles;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum GamePhase {
    LOBBY,
    PLAYING,
    ENDED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
