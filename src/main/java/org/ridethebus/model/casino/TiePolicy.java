package org.ridethebus.model.casino;

/** Sort d'une carte égale (manche 2) ou égale à une borne (manche 3) en mode casino. */
public enum TiePolicy {
    LOSE,
    WIN
}
