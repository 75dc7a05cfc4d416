package org.ridethebus.model.social;

public enum LogType {
    GAME_CREATED,
    CARD_PUSHED,
    GUESS_MADE,
    PENALTY_APPLIED,
    REWARD_ASSIGNED,
    PHASE_STARTED,
    PYRAMID_FLIP,
    MATCH_COMMITTED,
    RIDER_SELECTED,
    BUS_FLIP,
    MODE_TOGGLE,
    REMATCH_STARTED,
    GAME_FINISHED
}
