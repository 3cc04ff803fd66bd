package com.quick.codebattles.codebattles;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RoomTest {

    @Test
    void firstJoinedPlayerIsHostAndHostPassesOnWhenTheyLeave() {
        Room room = new Room("ABCDEF");
        room.addPlayer(new Player("a", "alice", "c1"));
        room.addPlayer(new Player("b", "bob", "c2"));

        assertTrue(room.isHost("a"));
        assertFalse(room.isHost("b"));

        room.removePlayer("a");
        assertTrue(room.isHost("b"));
    }

    @Test
    void startIsHostOnlyAndDealsHandsWithSharedDeadline() {
        Room room = roomWith("a", "b");

        GameValidationException notHost = assertThrows(GameValidationException.class,
                () -> room.start("b", 5_000L, () -> List.of(TestProblems.card("x", null))));
        assertEquals(ValidationFailure.NOT_HOST, notHost.getFailure());
        assertEquals(GamePhase.LOBBY, room.getPhase());

        room.start("a", 5_000L, () -> List.of(TestProblems.card("x", null), TestProblems.card("y", null)));

        assertEquals(GamePhase.PLAYING, room.getPhase());
        for (Player player : room.getPlayers()) {
            assertEquals(5_000L, player.getTimerEndTime());
            assertEquals(2, player.getCards().size());
        }
    }

    @Test
    void startCannotBeRepeated() {
        Room room = roomWith("a");
        room.start("a", 1L, List::of);

        GameValidationException ex = assertThrows(GameValidationException.class, () -> room.start("a", 2L, List::of));
        assertEquals(ValidationFailure.GAME_ALREADY_STARTED, ex.getFailure());
    }

    @Test
    void startOnEmptyRoomIsRejected() {
        Room room = new Room("EMPTY1");
        GameValidationException ex = assertThrows(GameValidationException.class, () -> room.start("a", 1L, List::of));
        assertEquals(ValidationFailure.EMPTY_ROOM, ex.getFailure());
    }

    @Test
    void lastSurvivorWinsExactlyOnce() {
        Room room = roomWith("a", "b", "c");
        room.start("a", 1_000L, List::of);

        room.eliminate(room.findPlayer("a").orElseThrow(), 10L);
        assertTrue(room.evaluateWinCondition().isEmpty());

        room.eliminate(room.findPlayer("b").orElseThrow(), 20L);
        Optional<GameOutcome> outcome = room.evaluateWinCondition();

        assertTrue(outcome.isPresent());
        assertEquals("c", outcome.get().winnerId());
        assertEquals("player-c", outcome.get().winnerName());
        assertEquals(GamePhase.ENDED, room.getPhase());
        assertEquals("c", room.getWinnerId());

        assertTrue(room.evaluateWinCondition().isEmpty());
        assertEquals("c", room.getWinnerId());
    }

    @Test
    void everyoneEliminatedEndsWithoutWinner() {
        Room room = roomWith("a");
        room.start("a", 1_000L, List::of);

        room.eliminate(room.findPlayer("a").orElseThrow(), 10L);
        Optional<GameOutcome> outcome = room.evaluateWinCondition();

        assertTrue(outcome.isPresent());
        assertNull(outcome.get().winnerId());
        assertEquals(GamePhase.ENDED, room.getPhase());
    }

    @Test
    void lobbyNeverEndsOnItsOwn() {
        Room room = roomWith("a", "b");
        room.removePlayer("b");

        assertTrue(room.evaluateWinCondition().isEmpty());
        assertEquals(GamePhase.LOBBY, room.getPhase());
    }

    @Test
    void eliminationIsRecordedOnce() {
        Room room = roomWith("a");
        Player player = room.findPlayer("a").orElseThrow();

        assertTrue(room.eliminate(player, 42L));
        assertFalse(room.eliminate(player, 99L));
        assertEquals(42L, player.getEliminatedAt());
    }

    @Test
    void eliminationDropsPendingReward() {
        Room room = roomWith("a", "b");
        Player player = room.findPlayer("a").orElseThrow();
        player.setPendingReward(new PendingReward(new Reward(RewardKind.FLASHBANG_TARGETED, 0), false));

        room.eliminate(player, 5L);

        assertFalse(player.hasPendingReward());
    }

    @Test
    void roomWithGradingInFlightIsNotDisposable() {
        Room room = new Room("GRADE1");
        room.beginGrading();
        assertFalse(room.isDisposable());
        room.endGrading();
        assertTrue(room.isDisposable());
    }

    private static Room roomWith(String... ids) {
        Room room = new Room("ROOM01");
        for (String id : ids) {
            room.addPlayer(new Player(id, "player-" + id, "conn-" + id));
        }
        return room;
    }
}
