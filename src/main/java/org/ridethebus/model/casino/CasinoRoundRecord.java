package org.ridethebus.model.casino;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.ridethebus.model.card.Card;
import org.ridethebus.model.card.Guess;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CasinoRoundRecord {
    private int round;
    private Guess guess;
    private Card card;
    private boolean correct;
    private double multiplierAfter;
}
