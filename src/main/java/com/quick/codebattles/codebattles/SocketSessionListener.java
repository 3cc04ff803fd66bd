package com.quick.codebattles.codebattles;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionConnectedEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;
import org.springframework.web.socket.messaging.SessionSubscribeEvent;

/**
 * Feeds STOMP session lifecycle into the dispatcher.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SocketSessionListener {

    private static final String USER_EVENTS_DESTINATION = "/user" + StompEventGateway.EVENTS_DESTINATION;

    private final GameDispatcher dispatcher;

    @EventListener
    public void onConnected(SessionConnectedEvent event) {
        log.debug("stomp-connected session={}", StompHeaderAccessor.wrap(event.getMessage()).getSessionId());
    }

    // "connected" is sent once the client listens on its event queue, otherwise it would be lost
    @EventListener
    public void onSubscribe(SessionSubscribeEvent event) {
        StompHeaderAccessor accessor = StompHeaderAccessor.wrap(event.getMessage());
        if (USER_EVENTS_DESTINATION.equals(accessor.getDestination())) {
            dispatcher.onConnect(accessor.getSessionId());
        }
    }

    @EventListener
    public void onDisconnect(SessionDisconnectEvent event) {
        dispatcher.onDisconnect(event.getSessionId());
    }
}
