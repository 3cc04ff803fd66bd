package com.quick.codebattles.codebattles;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Client-facing copy of a room. Only the first test case of a problem is shown; the rest
 * stay on the server.
 */
public record RoomSnapshot(String roomCode,
                           GamePhase gameStatus,
                           String hostId,
                           String winner,
                           Map<String, PlayerView> players) {

    public static RoomSnapshot of(Room room) {
        Map<String, PlayerView> players = new LinkedHashMap<>();
        for (Player player : room.getPlayers()) {
            players.put(player.getId(), PlayerView.of(player));
        }
        String hostId = room.host().map(Player::getId).orElse(null);
        return new RoomSnapshot(room.getCode(), room.getPhase(), hostId, room.getWinnerId(), players);
    }

    public Map<String, Object> asData() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("players", players);
        data.put("gameStatus", gameStatus);
        data.put("roomCode", roomCode);
        data.put("hostId", hostId);
        data.put("winner", winner);
        return data;
    }

    public record PlayerView(String id,
                             String username,
                             Long timerEndTime,
                             @JsonProperty("isEliminated") boolean eliminated,
                             Long eliminatedAt,
                             String currentProblem,
                             List<CardView> cards,
                             boolean hasPendingReward) {

        static PlayerView of(Player player) {
            List<CardView> cards = player.getCards().stream().map(CardView::of).toList();
            return new PlayerView(player.getId(), player.getUsername(), player.getTimerEndTime(),
                    player.isEliminated(), player.getEliminatedAt(), player.getSelectedCardId(),
                    cards, player.hasPendingReward());
        }
    }

    public record CardView(String id, ProblemView problem, Reward reward, Challenge challenge) {

        public static CardView of(Card card) {
            return new CardView(card.id(), ProblemView.of(card.problem()), card.reward(), card.challenge());
        }
    }

    public record ProblemView(String title,
                              String description,
                              Difficulty difficulty,
                              String functionSignature,
                              String functionName,
                              List<String> parameters,
                              TestCase example,
                              int testCaseCount) {

        public static ProblemView of(Problem problem) {
            FunctionSignature signature = problem.signature();
            TestCase example = problem.testCases().isEmpty() ? null : problem.testCases().get(0);
            return new ProblemView(problem.title(), problem.description(), problem.difficulty(),
                    signature.declaration(), signature.name(), signature.parameterNames(),
                    example, problem.testCases().size());
        }
    }
}
