package com.quick.codebattles.codebattles;

/**
 * Targeted reward waiting for its owner to pick a target. {@code selfTargetAllowed} is set only
 * for a debug reward whose owner was the sole candidate when it was requested.
 */
public record PendingReward(Reward reward, boolean selfTargetAllowed) {
}
