package com.quick.codebattles.codebattles;

import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessageHeaders;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessageType;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * STOMP implementation of the gateway. Every event goes to the session's
 * {@code /user/queue/events} destination; room membership is tracked here so a broadcast
 * reaches exactly the connections that joined the room.
 */
@Slf4j
@Component
public class StompEventGateway implements EventGateway {

    public static final String EVENTS_DESTINATION = "/queue/events";

    private final SimpMessagingTemplate messagingTemplate;
    private final Map<String, Set<String>> connectionsByRoom = new ConcurrentHashMap<>();

    public StompEventGateway(SimpMessagingTemplate messagingTemplate) {
        this.messagingTemplate = messagingTemplate;
    }

    @Override
    public void joinRoom(String connectionId, String roomCode) {
        connectionsByRoom.computeIfAbsent(roomCode, code -> ConcurrentHashMap.newKeySet()).add(connectionId);
    }

    @Override
    public void leaveRoom(String connectionId, String roomCode) {
        connectionsByRoom.computeIfPresent(roomCode, (code, members) -> {
            members.remove(connectionId);
            return members.isEmpty() ? null : members;
        });
    }

    @Override
    public void broadcast(String roomCode, GameEvent event) {
        Set<String> members = connectionsByRoom.get(roomCode);
        if (members == null) {
            return;
        }
        for (String connectionId : List.copyOf(members)) {
            send(connectionId, event);
        }
    }

    @Override
    public void send(String connectionId, GameEvent event) {
        try {
            messagingTemplate.convertAndSendToUser(connectionId, EVENTS_DESTINATION, event, sessionHeaders(connectionId));
        } catch (MessagingException e) {
            log.warn("event-send-failed type={} connection={} reason={}", event.type(), connectionId, e.getMessage());
        }
    }

    int roomMemberCount(String roomCode) {
        Set<String> members = connectionsByRoom.get(roomCode);
        return members == null ? 0 : members.size();
    }

    private MessageHeaders sessionHeaders(String sessionId) {
        SimpMessageHeaderAccessor accessor = SimpMessageHeaderAccessor.create(SimpMessageType.MESSAGE);
        accessor.setSessionId(sessionId);
        accessor.setLeaveMutable(true);
        return accessor.getMessageHeaders();
    }
}
