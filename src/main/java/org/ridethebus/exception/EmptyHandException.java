package org.ridethebus.exception;

public class EmptyHandException extends GameException {

    public EmptyHandException(String message) {
        super(ErrorCode.EMPTY_HAND, message);
    }
}
