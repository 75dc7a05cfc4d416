package org.ridethebus.model.social;

public record PhaseOutcome(Phase from, Phase to, String riderId) {}
