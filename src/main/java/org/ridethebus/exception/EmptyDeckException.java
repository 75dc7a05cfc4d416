package org.ridethebus.exception;

public class EmptyDeckException extends GameException {

    public EmptyDeckException(String message) {
        super(ErrorCode.EMPTY_DECK, message);
    }
}
