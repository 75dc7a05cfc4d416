package org.ridethebus.model.social;

import org.ridethebus.model.card.Card;

public record MatchOutcome(String playerId,
                           Card consumed,
                           int row,
                           int drinksToAssign,
                           int commitsThisFlip,
                           String unit) {}
