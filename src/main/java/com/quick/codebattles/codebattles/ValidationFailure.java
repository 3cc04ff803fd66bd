package com.quick.codebattles.codebattles;

public enum ValidationFailure {
    USERNAME_REQUIRED("Username required"),
    ROOM_NOT_FOUND("Room not found"),
    ROOM_FULL("Room is full"),
    ALREADY_JOINED("Already joined a room"),
    NOT_JOINED("Not connected"),
    GAME_ALREADY_STARTED("Game already started"),
    GAME_NOT_IN_PROGRESS("Game is not in progress"),
    NOT_HOST("Only host can start game"),
    EMPTY_ROOM("No players in game"),
    PLAYER_ELIMINATED("Player is eliminated"),
    CARD_NOT_FOUND("Card not found"),
    CARD_NOT_SELECTED("Card is not currently selected"),
    SUBMISSION_IN_PROGRESS("A submission is already being graded"),
    GRADING_UNAVAILABLE("Grading queue is full, try again"),
    REWARD_REQUIRED("Reward required"),
    NO_PENDING_REWARD("No pending reward"),
    INVALID_TARGET("Invalid target"),
    BAD_REQUEST("Malformed request");

    private final String defaultMessage;

    ValidationFailure(String defaultMessage) {
        this.defaultMessage = defaultMessage;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
