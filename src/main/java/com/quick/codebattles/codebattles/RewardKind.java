package com.quick.codebattles.codebattles;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum RewardKind {
    ADD_TIME("add_time", false),
    REMOVE_TIME_RANDOM("remove_time_random", false),
    REMOVE_TIME_ALL("remove_time_all", false),
    REMOVE_TIME_TARGETED("remove_time_targeted", true),
    FLASHBANG_TARGETED("flashbang_targeted", true);

    private final String wireName;
    private final boolean targeted;

    RewardKind(String wireName, boolean targeted) {
        this.wireName = wireName;
        this.targeted = targeted;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * Targeted kinds only take effect after the acting player picks a target.
     */
    public boolean isTargeted() {
        return targeted;
    }

    @JsonCreator
    public static RewardKind fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Reward kind is required");
        }
        // older clients send the random debuff as plain "remove_time"
        if ("remove_time".equalsIgnoreCase(value)) {
            return REMOVE_TIME_RANDOM;
        }
        for (RewardKind kind : values()) {
            if (kind.wireName.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown reward kind: " + value);
    }
}
