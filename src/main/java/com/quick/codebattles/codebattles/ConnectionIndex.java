package com.quick.codebattles.codebattles;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps a transport connection id to the player and room it joined.
 */
@Component
public class ConnectionIndex {

    private final Map<String, PlayerRef> byConnection = new ConcurrentHashMap<>();

    public boolean bind(String connectionId, PlayerRef ref) {
        return byConnection.putIfAbsent(connectionId, ref) == null;
    }

    public Optional<PlayerRef> resolve(String connectionId) {
        return connectionId == null ? Optional.empty() : Optional.ofNullable(byConnection.get(connectionId));
    }

    public Optional<PlayerRef> unbind(String connectionId) {
        return connectionId == null ? Optional.empty() : Optional.ofNullable(byConnection.remove(connectionId));
    }

    public int size() {
        return byConnection.size();
    }
}
