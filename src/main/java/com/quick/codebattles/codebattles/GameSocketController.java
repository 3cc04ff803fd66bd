package com.quick.codebattles.codebattles;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.converter.MessageConversionException;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.MessageExceptionHandler;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.stereotype.Controller;

/**
 * Inbound STOMP endpoints. Clients send to {@code /app/<event>}; the STOMP session id is the
 * connection identity.
 */
@Slf4j
@Controller
@RequiredArgsConstructor
public class GameSocketController {

    private final GameDispatcher dispatcher;

    @MessageMapping("/join_room")
    public void joinRoom(@Header(SimpMessageHeaderAccessor.SESSION_ID_HEADER) String sessionId,
                         JoinRoomMessage message) {
        dispatcher.joinRoom(sessionId, message.getUsername(), message.getRoomCode());
    }

    @MessageMapping("/start_game")
    public void startGame(@Header(SimpMessageHeaderAccessor.SESSION_ID_HEADER) String sessionId) {
        dispatcher.startGame(sessionId);
    }

    @MessageMapping("/select_card")
    public void selectCard(@Header(SimpMessageHeaderAccessor.SESSION_ID_HEADER) String sessionId,
                           SelectCardMessage message) {
        dispatcher.selectCard(sessionId, message.getCardId());
    }

    @MessageMapping("/submit_solution")
    public void submitSolution(@Header(SimpMessageHeaderAccessor.SESSION_ID_HEADER) String sessionId,
                               SubmitSolutionMessage message) {
        dispatcher.submitSolution(sessionId, message.getCardId(), message.getCode());
    }

    @MessageMapping("/player_eliminated")
    public void playerEliminated(@Header(SimpMessageHeaderAccessor.SESSION_ID_HEADER) String sessionId) {
        dispatcher.reportElimination(sessionId);
    }

    @MessageMapping("/apply_targeted_debuff")
    public void applyTargetedDebuff(@Header(SimpMessageHeaderAccessor.SESSION_ID_HEADER) String sessionId,
                                    TargetedDebuffMessage message) {
        dispatcher.applyTargetedDebuff(sessionId, message.getTargetPlayerId());
    }

    @MessageMapping("/debug_trigger_reward")
    public void debugTriggerReward(@Header(SimpMessageHeaderAccessor.SESSION_ID_HEADER) String sessionId,
                                   DebugRewardMessage message) {
        dispatcher.debugTriggerReward(sessionId, message.getReward());
    }

    @MessageMapping("/get_game_state")
    public void getGameState(@Header(SimpMessageHeaderAccessor.SESSION_ID_HEADER) String sessionId) {
        dispatcher.sendGameState(sessionId);
    }

    @MessageExceptionHandler(MessageConversionException.class)
    public void handleUnreadablePayload(MessageConversionException e,
                                        @Header(SimpMessageHeaderAccessor.SESSION_ID_HEADER) String sessionId) {
        log.debug("unreadable-payload session={} reason={}", sessionId, e.getMessage());
        dispatcher.reportError(sessionId, ValidationFailure.BAD_REQUEST.getDefaultMessage());
    }
}
