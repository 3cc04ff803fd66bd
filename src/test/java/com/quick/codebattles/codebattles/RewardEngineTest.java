package com.quick.codebattles.codebattles;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RewardEngineTest {

    private static final long NOW = 1_000_000L;

    private RecordingEventGateway gateway;
    private MutableClock clock;
    private RewardEngine engine;
    private Room room;

    @BeforeEach
    void setUp() {
        gateway = new RecordingEventGateway();
        clock = new MutableClock(NOW);
        engine = new RewardEngine(gateway, new SeededRandomSource(11L), clock);
        room = new Room("REWARD");
        room.addPlayer(player("a", NOW + 100_000L));
        room.addPlayer(player("b", NOW + 100_000L));
        room.addPlayer(player("c", NOW + 5_000L));
    }

    @Test
    void addTimeExtendsActorWithoutUpperBound() {
        Player a = room.findPlayer("a").orElseThrow();
        a.setTimerEndTime(NOW + 10_000_000L);

        RewardOutcome outcome = engine.apply(room, "a", new Reward(RewardKind.ADD_TIME, 30), false);

        assertEquals(RewardOutcome.APPLIED, outcome);
        assertEquals(NOW + 10_030_000L, a.getTimerEndTime());
        GameEvent event = gateway.broadcastsTo("REWARD", EventType.REWARD_APPLIED).get(0);
        assertEquals("a", event.get("playerId"));
        assertEquals(RewardKind.ADD_TIME, event.get("effect"));
        assertEquals(30, event.get("value"));
    }

    @Test
    void removeTimeRandomHitsSomeoneElseAndNeverBeforeNow() {
        room.findPlayer("b").orElseThrow().setEliminated(true);

        RewardOutcome outcome = engine.apply(room, "a", new Reward(RewardKind.REMOVE_TIME_RANDOM, 20), false);

        assertEquals(RewardOutcome.APPLIED, outcome);
        Player c = room.findPlayer("c").orElseThrow();
        assertEquals(NOW, c.getTimerEndTime());
        assertEquals(NOW + 100_000L, room.findPlayer("a").orElseThrow().getTimerEndTime());
        GameEvent event = gateway.broadcastsTo("REWARD", EventType.REWARD_APPLIED).get(0);
        assertEquals("c", event.get("playerId"));
        assertEquals("a", event.get("fromPlayer"));
    }

    @Test
    void removeTimeAllHitsEveryOtherActivePlayer() {
        RewardOutcome outcome = engine.apply(room, "a", new Reward(RewardKind.REMOVE_TIME_ALL, 30), false);

        assertEquals(RewardOutcome.APPLIED, outcome);
        assertEquals(NOW + 100_000L, room.findPlayer("a").orElseThrow().getTimerEndTime());
        assertEquals(NOW + 70_000L, room.findPlayer("b").orElseThrow().getTimerEndTime());
        assertEquals(NOW, room.findPlayer("c").orElseThrow().getTimerEndTime());

        List<GameEvent> events = gateway.broadcastsTo("REWARD", EventType.REWARD_APPLIED);
        assertEquals(1, events.size());
        List<?> affected = (List<?>) events.get(0).get("affectedPlayers");
        assertEquals(2, affected.size());
    }

    @Test
    void debuffWithNoOpponentsIsANoOp() {
        Room solo = new Room("SOLO01");
        solo.addPlayer(player("a", NOW + 1_000L));

        assertEquals(RewardOutcome.NO_TARGETS,
                engine.apply(solo, "a", new Reward(RewardKind.REMOVE_TIME_RANDOM, 20), false));
        assertEquals(RewardOutcome.NO_TARGETS,
                engine.apply(solo, "a", new Reward(RewardKind.REMOVE_TIME_TARGETED, 20), false));
        assertFalse(solo.findPlayer("a").orElseThrow().hasPendingReward());
        assertTrue(gateway.allBroadcasts(EventType.REWARD_APPLIED).isEmpty());
    }

    @Test
    void targetedRewardWaitsForTargetThenApplies() {
        RewardOutcome outcome = engine.apply(room, "a", new Reward(RewardKind.REMOVE_TIME_TARGETED, 50), false);

        assertEquals(RewardOutcome.PENDING_TARGET, outcome);
        assertTrue(room.findPlayer("a").orElseThrow().hasPendingReward());
        assertEquals(NOW + 100_000L, room.findPlayer("b").orElseThrow().getTimerEndTime());

        GameEvent request = gateway.lastSentTo("conn-a", EventType.TARGET_SELECTION_REQUIRED);
        List<?> targets = (List<?>) request.get("availableTargets");
        assertEquals(2, targets.size());
        assertEquals(100L, ((Map<?, ?>) targets.get(0)).get("timeRemaining"));

        engine.resolveTarget(room, "a", "b");

        assertEquals(NOW + 50_000L, room.findPlayer("b").orElseThrow().getTimerEndTime());
        assertFalse(room.findPlayer("a").orElseThrow().hasPendingReward());
        GameEvent applied = gateway.broadcastsTo("REWARD", EventType.REWARD_APPLIED).get(0);
        assertEquals("b", applied.get("playerId"));
        assertEquals("player-b", applied.get("targetName"));
    }

    @Test
    void targetedRemovalClampsAtNow() {
        engine.apply(room, "a", new Reward(RewardKind.REMOVE_TIME_TARGETED, 50), false);
        engine.resolveTarget(room, "a", "c");

        assertEquals(NOW, room.findPlayer("c").orElseThrow().getTimerEndTime());
    }

    @Test
    void flashbangIsSentOnlyToTarget() {
        engine.apply(room, "a", new Reward(RewardKind.FLASHBANG_TARGETED, 0), false);
        engine.resolveTarget(room, "a", "c");

        GameEvent flash = gateway.lastSentTo("conn-c", EventType.FLASHBANG_APPLIED);
        assertEquals("a", flash.get("fromPlayer"));
        assertEquals("player-a", flash.get("fromUsername"));
        assertTrue(gateway.sentTo("conn-b", EventType.FLASHBANG_APPLIED).isEmpty());
        assertEquals(NOW + 5_000L, room.findPlayer("c").orElseThrow().getTimerEndTime());
    }

    @Test
    void resolveWithoutPendingRewardFails() {
        GameValidationException ex = assertThrows(GameValidationException.class,
                () -> engine.resolveTarget(room, "a", "b"));
        assertEquals(ValidationFailure.NO_PENDING_REWARD, ex.getFailure());
    }

    @Test
    void invalidTargetStillConsumesPendingReward() {
        engine.apply(room, "a", new Reward(RewardKind.REMOVE_TIME_TARGETED, 50), false);

        GameValidationException ex = assertThrows(GameValidationException.class,
                () -> engine.resolveTarget(room, "a", "nobody"));
        assertEquals(ValidationFailure.INVALID_TARGET, ex.getFailure());
        assertNull(room.findPlayer("a").orElseThrow().getPendingReward());

        GameValidationException again = assertThrows(GameValidationException.class,
                () -> engine.resolveTarget(room, "a", "b"));
        assertEquals(ValidationFailure.NO_PENDING_REWARD, again.getFailure());
    }

    @Test
    void eliminatedAndSelfTargetsAreRejected() {
        room.findPlayer("b").orElseThrow().setEliminated(true);
        engine.apply(room, "a", new Reward(RewardKind.REMOVE_TIME_TARGETED, 50), false);
        GameValidationException eliminated = assertThrows(GameValidationException.class,
                () -> engine.resolveTarget(room, "a", "b"));
        assertEquals("Cannot target eliminated player", eliminated.getMessage());

        engine.apply(room, "a", new Reward(RewardKind.REMOVE_TIME_TARGETED, 50), false);
        GameValidationException self = assertThrows(GameValidationException.class,
                () -> engine.resolveTarget(room, "a", "a"));
        assertEquals("Cannot target yourself", self.getMessage());
    }

    @Test
    void debugRewardLetsLonePlayerTargetThemselves() {
        Room solo = new Room("SOLO02");
        solo.addPlayer(player("a", NOW + 60_000L));

        assertEquals(RewardOutcome.PENDING_TARGET,
                engine.apply(solo, "a", new Reward(RewardKind.REMOVE_TIME_TARGETED, 10), true));
        engine.resolveTarget(solo, "a", "a");

        assertEquals(NOW + 50_000L, solo.findPlayer("a").orElseThrow().getTimerEndTime());
    }

    @Test
    void debugRewardCannotTargetSelfWhenOthersAreAvailable() {
        engine.apply(room, "a", new Reward(RewardKind.REMOVE_TIME_TARGETED, 10), true);

        GameValidationException ex = assertThrows(GameValidationException.class,
                () -> engine.resolveTarget(room, "a", "a"));

        assertEquals("Cannot target yourself", ex.getMessage());
        assertEquals(NOW + 100_000L, room.findPlayer("a").orElseThrow().getTimerEndTime());
    }

    @Test
    void newTargetedRewardReplacesPendingOne() {
        engine.apply(room, "a", new Reward(RewardKind.REMOVE_TIME_TARGETED, 50), false);
        engine.apply(room, "a", new Reward(RewardKind.FLASHBANG_TARGETED, 0), false);

        assertEquals(RewardKind.FLASHBANG_TARGETED,
                room.findPlayer("a").orElseThrow().getPendingReward().reward().kind());
    }

    private static Player player(String id, long deadline) {
        Player player = new Player(id, "player-" + id, "conn-" + id);
        player.setTimerEndTime(deadline);
        return player;
    }
}
