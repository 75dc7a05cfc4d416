package org.ridethebus.model.social;

import org.ridethebus.config.GameConfig;
import org.ridethebus.model.card.GuessKind;

public enum DealRound {
    R1(GuessKind.COLOR, GameConfig.PENALTY_R1),
    R2(GuessKind.DIRECTION, GameConfig.PENALTY_R2),
    R3(GuessKind.RANGE, GameConfig.PENALTY_R3),
    R4(GuessKind.SUIT, GameConfig.PENALTY_R4);

    private final GuessKind kind;
    private final String penaltyKey;

    DealRound(GuessKind kind, String penaltyKey) {
        this.kind = kind;
        this.penaltyKey = penaltyKey;
    }

    public GuessKind kind() { return kind; }
    public String penaltyKey() { return penaltyKey; }

    public boolean isLast() { return this == R4; }

    public DealRound next() {
        return isLast() ? R1 : values()[ordinal() + 1];
    }
}
