package com.quick.codebattles.codebattles;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * What {@link RewardEngine#apply} did with a reward.
 */
public enum RewardOutcome {
    /** State already changed and the room was told. */
    APPLIED,
    /** Stored on the actor; nothing happens until a target is chosen. */
    PENDING_TARGET,
    /** Nobody could be affected, so the reward was dropped. */
    NO_TARGETS;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
