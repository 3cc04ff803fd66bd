package com.quick.codebattles.codebattles;

/**
 * Outbound side of the real-time channel. Rooms are addressed by code, single players by
 * their current connection id.
 */
public interface EventGateway {

    void joinRoom(String connectionId, String roomCode);

    void leaveRoom(String connectionId, String roomCode);

    void broadcast(String roomCode, GameEvent event);

    void send(String connectionId, GameEvent event);
}
