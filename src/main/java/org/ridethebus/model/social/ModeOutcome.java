package org.ridethebus.model.social;

public record ModeOutcome(boolean alcoholMode, String unit) {}
