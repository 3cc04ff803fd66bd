package com.quick.codebattles.codebattles;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.BiConsumer;

/**
 * Turns inbound connection events into room mutations and outbound events.
 * <p>
 * Every handler body runs while holding the monitor of the room it touches. Grading is the
 * only step that runs outside that lock; its result is re-validated against the live room
 * before anything is applied.
 */
@Service
public class GameDispatcher {

    private static final Logger log = LoggerFactory.getLogger(GameDispatcher.class);

    private final RoomRegistry registry;
    private final ConnectionIndex connections;
    private final EventGateway gateway;
    private final CardFactory cardFactory;
    private final RewardEngine rewardEngine;
    private final GradingSandbox sandbox;
    private final Executor gradingExecutor;
    private final Clock clock;
    private final long timerMillis;
    private final int handSize;
    private final int maxPlayers;
    private final long eliminationGraceMillis;

    public GameDispatcher(RoomRegistry registry,
                          ConnectionIndex connections,
                          EventGateway gateway,
                          CardFactory cardFactory,
                          RewardEngine rewardEngine,
                          GradingSandbox sandbox,
                          @Qualifier("gradingExecutor") Executor gradingExecutor,
                          Clock clock,
                          @Value("${codebattles.game.timer-seconds:300}") long timerSeconds,
                          @Value("${codebattles.game.hand-size:5}") int handSize,
                          @Value("${codebattles.room.max-players:8}") int maxPlayers,
                          @Value("${codebattles.timer.grace-ms:2000}") long eliminationGraceMillis) {
        this.registry = registry;
        this.connections = connections;
        this.gateway = gateway;
        this.cardFactory = cardFactory;
        this.rewardEngine = rewardEngine;
        this.sandbox = sandbox;
        this.gradingExecutor = gradingExecutor;
        this.clock = clock;
        this.timerMillis = timerSeconds * 1000L;
        this.handSize = handSize;
        this.maxPlayers = maxPlayers;
        this.eliminationGraceMillis = eliminationGraceMillis;
    }

    public void onConnect(String connectionId) {
        log.debug("connection-opened id={}", connectionId);
        gateway.send(connectionId, GameEvent.builder(EventType.CONNECTED)
                .put("connectionId", connectionId)
                .build());
    }

    public void onDisconnect(String connectionId) {
        Optional<PlayerRef> ref = connections.unbind(connectionId);
        if (ref.isEmpty()) {
            log.debug("connection-closed id={} joined=false", connectionId);
            return;
        }
        String roomCode = ref.get().roomCode();
        gateway.leaveRoom(connectionId, roomCode);
        registry.get(roomCode).ifPresent(room -> {
            synchronized (room) {
                room.removePlayer(ref.get().playerId()).ifPresent(player -> {
                    log.info("player-left room={} player={} username={}", roomCode, player.getId(), player.getUsername());
                    gateway.broadcast(roomCode, GameEvent.builder(EventType.PLAYER_LEFT)
                            .put("playerId", player.getId())
                            .put("username", player.getUsername())
                            .build());
                    announceOutcome(room);
                });
            }
            registry.deleteIfEmpty(roomCode);
        });
    }

    public void joinRoom(String connectionId, String username, String roomCode) {
        guarded(connectionId, EventType.JOIN_ERROR, () -> {
            String name = username == null ? "" : username.strip();
            if (name.isEmpty()) {
                throw new GameValidationException(ValidationFailure.USERNAME_REQUIRED);
            }
            if (connections.resolve(connectionId).isPresent()) {
                throw new GameValidationException(ValidationFailure.ALREADY_JOINED);
            }
            Room room = registry.createOrJoin(roomCode);
            try {
                addPlayer(room, connectionId, name);
            } catch (GameValidationException e) {
                registry.deleteIfEmpty(room.getCode());
                throw e;
            }
        });
    }

    private void addPlayer(Room room, String connectionId, String name) {
        synchronized (room) {
            if (room.isClosed()) {
                throw RoomRegistry.roomNotFound(room.getCode());
            }
            if (room.getPhase() != GamePhase.LOBBY) {
                throw new GameValidationException(ValidationFailure.GAME_ALREADY_STARTED);
            }
            if (room.size() >= maxPlayers) {
                throw new GameValidationException(ValidationFailure.ROOM_FULL);
            }
            Player player = new Player(UUID.randomUUID().toString(), name, connectionId);
            if (!connections.bind(connectionId, new PlayerRef(player.getId(), room.getCode()))) {
                throw new GameValidationException(ValidationFailure.ALREADY_JOINED);
            }
            room.addPlayer(player);
            gateway.joinRoom(connectionId, room.getCode());
            log.info("player-joined room={} player={} username={}", room.getCode(), player.getId(), name);

            gateway.broadcast(room.getCode(), GameEvent.builder(EventType.PLAYER_JOINED)
                    .put("playerId", player.getId())
                    .put("username", name)
                    .put("roomCode", room.getCode())
                    .build());
            gateway.send(connectionId, GameEvent.of(EventType.GAME_STATE, RoomSnapshot.of(room).asData()));
        }
    }

    public void startGame(String connectionId) {
        withPlayer(connectionId, (room, player) -> {
            room.start(player.getId(), clock.millis() + timerMillis, () -> cardFactory.deal(handSize));
            RoomSnapshot snapshot = RoomSnapshot.of(room);
            gateway.broadcast(room.getCode(), GameEvent.builder(EventType.GAME_STARTED)
                    .put("players", snapshot.players())
                    .put("roomCode", room.getCode())
                    .build());
        });
    }

    public void selectCard(String connectionId, String cardId) {
        withPlayer(connectionId, (room, player) -> {
            requirePlaying(room);
            requireActive(player);
            Card card = player.findCard(cardId)
                    .orElseThrow(() -> new GameValidationException(ValidationFailure.CARD_NOT_FOUND));
            player.setSelectedCardId(card.id());
            gateway.broadcast(room.getCode(), GameEvent.builder(EventType.CARD_SELECTED)
                    .put("playerId", player.getId())
                    .put("cardId", card.id())
                    .put("problem", RoomSnapshot.ProblemView.of(card.problem()))
                    .build());
        });
    }

    /**
     * Validates the submission, then grades it on the grading executor. The result is applied
     * by {@link #completeSubmission} only if the player, the room and the selected card are
     * still in place.
     */
    public CompletableFuture<Void> submitSolution(String connectionId, String cardId, String code) {
        List<Submission> accepted = new ArrayList<>(1);
        withPlayer(connectionId, (room, player) -> {
            requireActive(player);
            requirePlaying(room);
            Card card = player.findCard(cardId)
                    .orElseThrow(() -> new GameValidationException(ValidationFailure.CARD_NOT_FOUND));
            if (!card.id().equals(player.getSelectedCardId())) {
                throw new GameValidationException(ValidationFailure.CARD_NOT_SELECTED);
            }
            if (player.isGrading()) {
                throw new GameValidationException(ValidationFailure.SUBMISSION_IN_PROGRESS);
            }
            player.setGrading(true);
            room.beginGrading();
            accepted.add(new Submission(room, player.getId(), card));
        });
        if (accepted.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }

        Submission submission = accepted.get(0);
        Problem problem = submission.card().problem();
        try {
            return CompletableFuture
                    .supplyAsync(() -> sandbox.execute(code, problem.signature(), problem.testCases()), gradingExecutor)
                    .exceptionally(ex -> {
                        log.error("grading-crashed room={} player={}", submission.room().getCode(), submission.playerId(), ex);
                        return GradingReport.failure("Grading failed: " + ex.getMessage());
                    })
                    .thenAccept(report -> completeSubmission(submission, report))
                    .whenComplete((ignored, ex) -> {
                        if (ex != null) {
                            log.error("grading-completion-failed room={} player={}",
                                    submission.room().getCode(), submission.playerId(), ex);
                        }
                    });
        } catch (RejectedExecutionException e) {
            log.warn("grading-rejected room={} player={}", submission.room().getCode(), submission.playerId());
            completeSubmission(submission, null);
            gateway.send(connectionId, GameEvent.error(ValidationFailure.GRADING_UNAVAILABLE.getDefaultMessage()));
            return CompletableFuture.completedFuture(null);
        }
    }

    public void reportElimination(String connectionId) {
        withPlayer(connectionId, (room, player) -> {
            requirePlaying(room);
            eliminate(room, player);
        });
    }

    public void applyTargetedDebuff(String connectionId, String targetPlayerId) {
        withPlayer(connectionId, (room, player) -> {
            if (player.isEliminated() || room.getPhase() != GamePhase.PLAYING) {
                // an out-of-play actor loses whatever was pending
                player.setPendingReward(null);
                requireActive(player);
                requirePlaying(room);
            }
            rewardEngine.resolveTarget(room, player.getId(), targetPlayerId);
        });
    }

    /**
     * Test hook: applies an arbitrary reward as if the caller had earned it, self-targeting allowed.
     */
    public void debugTriggerReward(String connectionId, Reward reward) {
        withPlayer(connectionId, (room, player) -> {
            if (reward == null) {
                throw new GameValidationException(ValidationFailure.REWARD_REQUIRED);
            }
            requirePlaying(room);
            rewardEngine.apply(room, player.getId(), reward, true);
        });
    }

    public void sendGameState(String connectionId) {
        withPlayer(connectionId, (room, player) ->
                gateway.send(connectionId, GameEvent.of(EventType.GAME_STATE, RoomSnapshot.of(room).asData())));
    }

    public void reportError(String connectionId, String message) {
        gateway.send(connectionId, GameEvent.error(message));
    }

    /**
     * Eliminates every player whose deadline passed more than the grace period ago.
     */
    public void sweepExpiredTimers() {
        long now = clock.millis();
        for (Room room : registry.rooms()) {
            synchronized (room) {
                if (room.isClosed() || room.getPhase() != GamePhase.PLAYING) {
                    continue;
                }
                for (Player player : room.activePlayers()) {
                    if (room.getPhase() != GamePhase.PLAYING) {
                        break;
                    }
                    Long deadline = player.getTimerEndTime();
                    if (deadline != null && deadline + eliminationGraceMillis < now) {
                        log.info("timer-expired room={} player={}", room.getCode(), player.getId());
                        eliminate(room, player);
                    }
                }
            }
        }
    }

    private void completeSubmission(Submission submission, GradingReport report) {
        Room room = submission.room();
        synchronized (room) {
            room.endGrading();
            Player player = room.findPlayer(submission.playerId()).orElse(null);
            if (player != null) {
                player.setGrading(false);
            }
            if (report != null) {
                applyReport(room, player, submission.card(), report);
            }
        }
        registry.deleteIfEmpty(room.getCode());
    }

    private void applyReport(Room room, Player player, Card card, GradingReport report) {
        if (player == null || room.isClosed()) {
            log.debug("grading-discarded room={} card={} reason=player-gone", room.getCode(), card.id());
            return;
        }
        if (room.getPhase() != GamePhase.PLAYING || player.isEliminated()) {
            log.debug("grading-discarded room={} player={} reason=not-active", room.getCode(), player.getId());
            return;
        }
        if (!card.id().equals(player.getSelectedCardId()) || player.findCard(card.id()).isEmpty()) {
            log.debug("grading-discarded room={} player={} reason=card-changed", room.getCode(), player.getId());
            return;
        }

        if (!report.passed()) {
            log.info("solution-failed room={} player={} problem={}", room.getCode(), player.getId(), card.problem().title());
            gateway.broadcast(room.getCode(), GameEvent.builder(EventType.SOLUTION_FAILED)
                    .put("playerId", player.getId())
                    .put("cardId", card.id())
                    .put("error", report.error())
                    .put("testResults", report.results())
                    .build());
            return;
        }

        player.removeCard(card.id());
        player.setSelectedCardId(null);
        RewardOutcome rewardOutcome = card.reward() == null
                ? null
                : rewardEngine.apply(room, player.getId(), card.reward(), false);
        Card replacement = cardFactory.draw();
        player.addCard(replacement);
        log.info("solution-passed room={} player={} problem={}", room.getCode(), player.getId(), card.problem().title());

        gateway.broadcast(room.getCode(), GameEvent.builder(EventType.SOLUTION_PASSED)
                .put("playerId", player.getId())
                .put("cardId", card.id())
                .put("testResults", report.results())
                .put("newCard", RoomSnapshot.CardView.of(replacement))
                .put("rewardOutcome", rewardOutcome)
                .build());
    }

    private void eliminate(Room room, Player player) {
        if (!room.eliminate(player, clock.millis())) {
            return;
        }
        log.info("player-eliminated room={} player={} username={}", room.getCode(), player.getId(), player.getUsername());
        gateway.broadcast(room.getCode(), GameEvent.builder(EventType.PLAYER_ELIMINATED)
                .put("playerId", player.getId())
                .put("username", player.getUsername())
                .put("eliminatedAt", player.getEliminatedAt())
                .build());
        announceOutcome(room);
    }

    private void announceOutcome(Room room) {
        room.evaluateWinCondition().ifPresent(outcome ->
                gateway.broadcast(room.getCode(), GameEvent.builder(EventType.GAME_ENDED)
                        .put("winner", outcome.winnerId())
                        .put("winnerName", outcome.winnerName())
                        .build()));
    }

    /**
     * Resolves the connection to its player and runs {@code action} under the room's lock.
     * Validation failures are sent back to the connection as an {@code error} event.
     */
    private void withPlayer(String connectionId, BiConsumer<Room, Player> action) {
        guarded(connectionId, EventType.ERROR, () -> {
            PlayerRef ref = connections.resolve(connectionId)
                    .orElseThrow(() -> new GameValidationException(ValidationFailure.NOT_JOINED));
            Room room = registry.get(ref.roomCode())
                    .orElseThrow(() -> new GameValidationException(ValidationFailure.NOT_JOINED));
            synchronized (room) {
                Player player = room.findPlayer(ref.playerId())
                        .orElseThrow(() -> new GameValidationException(ValidationFailure.NOT_JOINED));
                action.accept(room, player);
            }
        });
    }

    private void guarded(String connectionId, EventType errorType, Runnable action) {
        try {
            action.run();
        } catch (GameValidationException e) {
            log.debug("action-rejected connection={} failure={} message={}", connectionId, e.getFailure(), e.getMessage());
            gateway.send(connectionId, GameEvent.builder(errorType).put("message", e.getMessage()).build());
        }
    }

    private static void requirePlaying(Room room) {
        if (room.getPhase() != GamePhase.PLAYING) {
            throw new GameValidationException(ValidationFailure.GAME_NOT_IN_PROGRESS);
        }
    }

    private static void requireActive(Player player) {
        if (player.isEliminated()) {
            throw new GameValidationException(ValidationFailure.PLAYER_ELIMINATED);
        }
    }

    private record Submission(Room room, String playerId, Card card) {
    }
}
