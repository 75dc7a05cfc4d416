package org.ridethebus.exception;

public class InvalidConfigException extends GameException {

    public InvalidConfigException(String message) {
        super(ErrorCode.INVALID_CONFIG, message);
    }
}
