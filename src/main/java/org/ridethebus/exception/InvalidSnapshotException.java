package org.ridethebus.exception;

public class InvalidSnapshotException extends GameException {

    public InvalidSnapshotException(String message, Throwable cause) {
        super(ErrorCode.INVALID_SNAPSHOT, message, cause);
    }
}
