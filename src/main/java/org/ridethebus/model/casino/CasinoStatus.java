package org.ridethebus.model.casino;

public enum CasinoStatus {
    IN_PROGRESS,
    CASHED_OUT,
    BUSTED,
    COMPLETED;

    public boolean isTerminal() {
        return this != IN_PROGRESS;
    }
}
