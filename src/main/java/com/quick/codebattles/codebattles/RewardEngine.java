package com.quick.codebattles.codebattles;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies card rewards to room state. Callers hold the room's monitor.
 * <p>
 * Rewards that need no input are applied immediately. Targeted rewards are parked on the
 * actor as a {@link PendingReward} and only change state in {@link #resolveTarget}.
 */
@Component
public class RewardEngine {

    private static final Logger log = LoggerFactory.getLogger(RewardEngine.class);

    private final EventGateway gateway;
    private final RandomSource random;
    private final Clock clock;

    public RewardEngine(EventGateway gateway, RandomSource random, Clock clock) {
        this.gateway = gateway;
        this.random = random;
        this.clock = clock;
    }

    public RewardOutcome apply(Room room, String actorId, Reward reward, boolean debug) {
        Player actor = room.findPlayer(actorId).orElse(null);
        if (actor == null) {
            return RewardOutcome.NO_TARGETS;
        }
        RewardOutcome outcome = switch (reward.kind()) {
            case ADD_TIME -> addTime(room, actor, reward);
            case REMOVE_TIME_RANDOM -> removeTimeRandom(room, actor, reward, debug);
            case REMOVE_TIME_ALL -> removeTimeAll(room, actor, reward, debug);
            case REMOVE_TIME_TARGETED, FLASHBANG_TARGETED -> requestTarget(room, actor, reward, debug);
        };
        log.info("reward room={} actor={} kind={} amount={} outcome={}",
                room.getCode(), actorId, reward.kind().getWireName(), reward.amount(), outcome);
        return outcome;
    }

    /**
     * Second half of a targeted reward. The actor's pending reward is cleared before the
     * target is validated, so a bad target still consumes it.
     */
    public void resolveTarget(Room room, String actorId, String targetId) {
        Player actor = room.findPlayer(actorId)
                .orElseThrow(() -> new GameValidationException(ValidationFailure.NO_PENDING_REWARD));
        PendingReward pending = actor.getPendingReward();
        if (pending == null) {
            throw new GameValidationException(ValidationFailure.NO_PENDING_REWARD);
        }
        actor.setPendingReward(null);

        Player target = room.findPlayer(targetId).orElse(null);
        if (target == null) {
            throw new GameValidationException(ValidationFailure.INVALID_TARGET);
        }
        if (target.isEliminated()) {
            throw new GameValidationException(ValidationFailure.INVALID_TARGET, "Cannot target eliminated player");
        }
        if (target == actor && !pending.selfTargetAllowed()) {
            throw new GameValidationException(ValidationFailure.INVALID_TARGET, "Cannot target yourself");
        }

        Reward reward = pending.reward();
        switch (reward.kind()) {
            case REMOVE_TIME_TARGETED -> {
                target.reduceDeadline(reward.amountMillis(), clock.millis());
                gateway.broadcast(room.getCode(), GameEvent.builder(EventType.REWARD_APPLIED)
                        .put("playerId", target.getId())
                        .put("effect", reward.kind())
                        .put("value", reward.amount())
                        .put("fromPlayer", actor.getId())
                        .put("targetName", target.getUsername())
                        .put("timerEndTime", target.getTimerEndTime())
                        .build());
            }
            case FLASHBANG_TARGETED -> gateway.send(target.getConnectionId(), GameEvent.builder(EventType.FLASHBANG_APPLIED)
                    .put("fromPlayer", actor.getId())
                    .put("fromUsername", actor.getUsername())
                    .build());
            default -> throw new IllegalStateException("Reward is not targeted: " + reward.kind());
        }
        log.info("reward-resolved room={} actor={} target={} kind={}",
                room.getCode(), actor.getId(), target.getId(), reward.kind().getWireName());
    }

    private RewardOutcome addTime(Room room, Player actor, Reward reward) {
        actor.extendDeadline(reward.amountMillis());
        gateway.broadcast(room.getCode(), GameEvent.builder(EventType.REWARD_APPLIED)
                .put("playerId", actor.getId())
                .put("effect", reward.kind())
                .put("value", reward.amount())
                .put("timerEndTime", actor.getTimerEndTime())
                .build());
        return RewardOutcome.APPLIED;
    }

    private RewardOutcome removeTimeRandom(Room room, Player actor, Reward reward, boolean debug) {
        List<Player> candidates = candidates(room, actor, debug);
        if (candidates.isEmpty()) {
            return RewardOutcome.NO_TARGETS;
        }
        Player target = random.pick(candidates);
        target.reduceDeadline(reward.amountMillis(), clock.millis());
        gateway.broadcast(room.getCode(), GameEvent.builder(EventType.REWARD_APPLIED)
                .put("playerId", target.getId())
                .put("effect", reward.kind())
                .put("value", reward.amount())
                .put("fromPlayer", actor.getId())
                .put("targetName", target.getUsername())
                .put("timerEndTime", target.getTimerEndTime())
                .build());
        return RewardOutcome.APPLIED;
    }

    private RewardOutcome removeTimeAll(Room room, Player actor, Reward reward, boolean debug) {
        List<Player> candidates = candidates(room, actor, debug);
        if (candidates.isEmpty()) {
            return RewardOutcome.NO_TARGETS;
        }
        long now = clock.millis();
        List<Map<String, Object>> affected = new ArrayList<>();
        for (Player target : candidates) {
            target.reduceDeadline(reward.amountMillis(), now);
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("playerId", target.getId());
            entry.put("username", target.getUsername());
            entry.put("timerEndTime", target.getTimerEndTime());
            affected.add(entry);
        }
        gateway.broadcast(room.getCode(), GameEvent.builder(EventType.REWARD_APPLIED)
                .put("effect", reward.kind())
                .put("value", reward.amount())
                .put("fromPlayer", actor.getId())
                .put("affectedPlayers", affected)
                .build());
        return RewardOutcome.APPLIED;
    }

    private RewardOutcome requestTarget(Room room, Player actor, Reward reward, boolean debug) {
        List<Player> candidates = candidates(room, actor, debug);
        if (candidates.isEmpty()) {
            return RewardOutcome.NO_TARGETS;
        }
        if (actor.hasPendingReward()) {
            log.debug("pending-reward-replaced room={} actor={} previous={}",
                    room.getCode(), actor.getId(), actor.getPendingReward().reward().kind());
        }
        boolean selfTargetAllowed = candidates.size() == 1 && candidates.get(0) == actor;
        actor.setPendingReward(new PendingReward(reward, selfTargetAllowed));

        long now = clock.millis();
        List<Map<String, Object>> targets = new ArrayList<>();
        for (Player candidate : candidates) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("playerId", candidate.getId());
            entry.put("username", candidate.getUsername());
            entry.put("timeRemaining", candidate.remainingSeconds(now));
            targets.add(entry);
        }
        gateway.send(actor.getConnectionId(), GameEvent.builder(EventType.TARGET_SELECTION_REQUIRED)
                .put("effect", reward.kind())
                .put("value", reward.amount())
                .put("availableTargets", targets)
                .build());
        return RewardOutcome.PENDING_TARGET;
    }

    /**
     * Active players other than the actor. In debug mode a lone active actor may target itself.
     */
    private List<Player> candidates(Room room, Player actor, boolean debug) {
        List<Player> candidates = new ArrayList<>();
        for (Player player : room.activePlayers()) {
            if (player != actor) {
                candidates.add(player);
            }
        }
        if (debug && candidates.isEmpty() && !actor.isEliminated()) {
            candidates.add(actor);
        }
        return candidates;
    }
}
