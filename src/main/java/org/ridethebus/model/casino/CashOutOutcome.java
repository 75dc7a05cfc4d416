package org.ridethebus.model.casino;

public record CashOutOutcome(int roundsWon, double multiplier, long payout) {}
