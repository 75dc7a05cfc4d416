package org.ridethebus.model.social;

import org.ridethebus.model.card.Card;

public record BusFlipOutcome(String riderId,
                             int position,
                             Card card,
                             int drinks,
                             int riderTotal,
                             boolean finished,
                             String unit) {}
