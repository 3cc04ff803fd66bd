package com.quick.codebattles.codebattles;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns every live room, keyed by its code.
 */
@Component
public class RoomRegistry {

    private static final String ROOM_CODE_ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789";
    private static final int MAX_CODE_ATTEMPTS = 1000;
    private static final Logger log = LoggerFactory.getLogger(RoomRegistry.class);

    private final Map<String, Room> rooms = new ConcurrentHashMap<>();
    private final RandomSource random;
    private final int codeLength;

    public RoomRegistry(RandomSource random,
                        @Value("${codebattles.room.code-length:6}") int codeLength) {
        this.random = random;
        this.codeLength = codeLength;
    }

    /**
     * Returns the room for {@code code}, or creates a new lobby under a fresh code when
     * {@code code} is blank.
     *
     * @throws GameValidationException with {@link ValidationFailure#ROOM_NOT_FOUND} for an unknown code
     */
    public Room createOrJoin(String code) {
        String normalized = normalize(code);
        if (normalized.isEmpty()) {
            return create();
        }
        return get(normalized).orElseThrow(() -> roomNotFound(normalized));
    }

    public Optional<Room> get(String code) {
        String normalized = normalize(code);
        return normalized.isEmpty() ? Optional.empty() : Optional.ofNullable(rooms.get(normalized));
    }

    /**
     * Removes the room when it has no players and no grading in flight.
     */
    public boolean deleteIfEmpty(String code) {
        Room room = rooms.get(normalize(code));
        if (room == null) {
            return false;
        }
        synchronized (room) {
            if (!room.isDisposable() || room.isClosed()) {
                return false;
            }
            room.close();
            rooms.remove(room.getCode(), room);
        }
        log.info("room-deleted code={}", room.getCode());
        return true;
    }

    public Collection<Room> rooms() {
        return List.copyOf(rooms.values());
    }

    public int roomCount() {
        return rooms.size();
    }

    public int totalPlayerCount() {
        int total = 0;
        for (Room room : rooms()) {
            synchronized (room) {
                total += room.size();
            }
        }
        return total;
    }

    public static GameValidationException roomNotFound(String code) {
        return new GameValidationException(ValidationFailure.ROOM_NOT_FOUND, "Room " + code + " not found");
    }

    private Room create() {
        for (int attempt = 0; attempt < MAX_CODE_ATTEMPTS; attempt++) {
            String code = generateCode();
            Room room = new Room(code);
            if (rooms.putIfAbsent(code, room) == null) {
                log.info("room-created code={}", code);
                return room;
            }
        }
        throw new IllegalStateException("Could not allocate a free room code");
    }

    private String generateCode() {
        StringBuilder builder = new StringBuilder(codeLength);
        for (int i = 0; i < codeLength; i++) {
            builder.append(ROOM_CODE_ALPHABET.charAt(random.nextIntInclusive(0, ROOM_CODE_ALPHABET.length() - 1)));
        }
        return builder.toString();
    }

    private static String normalize(String code) {
        return code == null ? "" : code.strip().toUpperCase(Locale.ROOT);
    }
}
