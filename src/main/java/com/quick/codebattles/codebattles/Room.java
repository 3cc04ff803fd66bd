package com.quick.codebattles.codebattles;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * One game session. Players keep join order; the first one is the host.
 * <p>
 * Not thread-safe: callers hold the room's monitor while reading or mutating it.
 */
@Getter
public class Room {

    private static final Logger log = LoggerFactory.getLogger(Room.class);

    private final String code;
    private final Map<String, Player> players = new LinkedHashMap<>();
    private GamePhase phase = GamePhase.LOBBY;
    private String winnerId;
    private boolean closed;
    private int inFlightGradings;

    public Room(String code) {
        this.code = code;
    }

    public Collection<Player> getPlayers() {
        return Collections.unmodifiableCollection(players.values());
    }

    public Optional<Player> findPlayer(String playerId) {
        return Optional.ofNullable(playerId == null ? null : players.get(playerId));
    }

    public Optional<Player> host() {
        return players.values().stream().findFirst();
    }

    public boolean isHost(String playerId) {
        return host().map(p -> p.getId().equals(playerId)).orElse(false);
    }

    public int size() {
        return players.size();
    }

    public boolean isEmpty() {
        return players.isEmpty();
    }

    public List<Player> activePlayers() {
        List<Player> active = new ArrayList<>();
        for (Player player : players.values()) {
            if (!player.isEliminated()) {
                active.add(player);
            }
        }
        return active;
    }

    public void addPlayer(Player player) {
        players.put(player.getId(), player);
    }

    public Optional<Player> removePlayer(String playerId) {
        return Optional.ofNullable(players.remove(playerId));
    }

    /**
     * lobby -> playing. Every player gets the same deadline and a freshly dealt hand.
     */
    public void start(String requesterId, long deadlineEpochMs, Supplier<List<Card>> dealer) {
        if (players.isEmpty()) {
            throw new GameValidationException(ValidationFailure.EMPTY_ROOM);
        }
        if (!isHost(requesterId)) {
            throw new GameValidationException(ValidationFailure.NOT_HOST);
        }
        if (phase != GamePhase.LOBBY) {
            throw new GameValidationException(ValidationFailure.GAME_ALREADY_STARTED);
        }
        phase = GamePhase.PLAYING;
        for (Player player : players.values()) {
            player.setTimerEndTime(deadlineEpochMs);
            player.setCards(new ArrayList<>(dealer.get()));
            player.setSelectedCardId(null);
        }
        log.info("room-started code={} players={}", code, players.size());
    }

    /**
     * Marks the player as out. Returns false when the player was already eliminated.
     */
    public boolean eliminate(Player player, long nowMs) {
        if (player.isEliminated()) {
            return false;
        }
        player.setEliminated(true);
        player.setEliminatedAt(nowMs);
        player.setPendingReward(null);
        return true;
    }

    /**
     * Ends the game when at most one player is still active. Only a playing room can end,
     * so repeated calls after the transition return empty.
     */
    public Optional<GameOutcome> evaluateWinCondition() {
        if (phase != GamePhase.PLAYING) {
            return Optional.empty();
        }
        List<Player> active = activePlayers();
        if (active.size() == 1) {
            Player winner = active.get(0);
            phase = GamePhase.ENDED;
            winnerId = winner.getId();
            log.info("room-ended code={} winner={}", code, winner.getId());
            return Optional.of(new GameOutcome(winner.getId(), winner.getUsername()));
        }
        if (active.isEmpty() && !players.isEmpty()) {
            phase = GamePhase.ENDED;
            winnerId = null;
            log.info("room-ended code={} winner=none", code);
            return Optional.of(GameOutcome.noWinner());
        }
        return Optional.empty();
    }

    public void beginGrading() {
        inFlightGradings++;
    }

    public void endGrading() {
        if (inFlightGradings > 0) {
            inFlightGradings--;
        }
    }

    /**
     * True when the room holds nobody and no grading result is still due.
     */
    public boolean isDisposable() {
        return players.isEmpty() && inFlightGradings == 0;
    }

    void close() {
        closed = true;
    }
}
