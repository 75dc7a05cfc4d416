package org.ridethebus.exception;

public class InvalidStateException extends GameException {

    public InvalidStateException(String message) {
        super(ErrorCode.INVALID_STATE, message);
    }
}
