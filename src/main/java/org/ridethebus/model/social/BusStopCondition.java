package org.ridethebus.model.social;

/**
 * Arrêt anticipé du bus, évalué après chaque carte retournée.
 */
@FunctionalInterface
public interface BusStopCondition {

    BusStopCondition NEVER = state -> false;

    BusStopCondition RIDER_HAND_EMPTY = state -> state.rider().getHand().isEmpty();

    boolean shouldStop(SocialGameState state);
}
