package com.quick.codebattles.codebattles;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outbound envelope: the event name plus its payload. Payload values may be null.
 */
public record GameEvent(EventType type, Map<String, Object> data) {

    public GameEvent {
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public static GameEvent of(EventType type, Map<String, Object> data) {
        return new GameEvent(type, data);
    }

    public static Builder builder(EventType type) {
        return new Builder(type);
    }

    public static GameEvent error(String message) {
        return builder(EventType.ERROR).put("message", message).build();
    }

    public Object get(String key) {
        return data.get(key);
    }

    public static final class Builder {
        private final EventType type;
        private final Map<String, Object> data = new LinkedHashMap<>();

        private Builder(EventType type) {
            this.type = type;
        }

        public Builder put(String key, Object value) {
            data.put(key, value);
            return this;
        }

        public GameEvent build() {
            return new GameEvent(type, data);
        }
    }
}
