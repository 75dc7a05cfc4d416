package org.ridethebus.model;

/**
 * Résultat d'une action : le nouvel état (à conserver par l'appelant) et ce qui vient de se passer.
 */
public record Transition<S, O>(S state, O outcome) {}
