package com.quick.codebattles.codebattles;

/**
 * A rejected player action. Reported to the acting connection only; room state is left untouched.
 */
public class GameValidationException extends RuntimeException {

    private final ValidationFailure failure;

    public GameValidationException(ValidationFailure failure) {
        this(failure, failure.getDefaultMessage());
    }

    public GameValidationException(ValidationFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public ValidationFailure getFailure() {
        return failure;
    }
}
