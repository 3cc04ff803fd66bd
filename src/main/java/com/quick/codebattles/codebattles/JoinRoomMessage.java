package com.quick.codebattles.codebattles;

import lombok.Data;

@Data
public class JoinRoomMessage {
    private String username;
    private String roomCode; // blank creates a new room
}
