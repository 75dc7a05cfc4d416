package org.ridethebus.exception;

public class InvalidGuessException extends GameException {

    public InvalidGuessException(String message) {
        super(ErrorCode.INVALID_GUESS, message);
    }
}
