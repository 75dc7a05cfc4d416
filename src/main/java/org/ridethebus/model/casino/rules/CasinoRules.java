package org.ridethebus.model.casino.rules;

import org.ridethebus.model.card.Card;
import org.ridethebus.model.card.CardRules;
import org.ridethebus.model.card.Guess;
import org.ridethebus.model.card.GuessKind;
import org.ridethebus.model.casino.TiePolicy;

import java.util.List;

public final class CasinoRules {
    private CasinoRules(){}

    public static GuessKind kindOf(int round) {
        return switch (round) {
            case 1 -> GuessKind.COLOR;
            case 2 -> GuessKind.DIRECTION;
            case 3 -> GuessKind.RANGE;
            case 4 -> GuessKind.SUIT;
            default -> throw new IllegalArgumentException("Manche casino inconnue: " + round);
        };
    }

    /**
     * Pas de repioche au casino : une égalité (manche 2) ou une borne (manche 3) est tranchée
     * par la politique d'égalité.
     */
    public static boolean isCorrect(int round, Guess guess, Card drawn, List<Card> previous, TiePolicy ties) {
        guess.requireKind(kindOf(round));
        return switch (round) {
            case 1 -> drawn.color() == guess.color();
            case 2 -> CardRules.sameRank(drawn, previous.get(0))
                    ? ties == TiePolicy.WIN
                    : CardRules.strictlyOnSide(guess, drawn, previous.get(0));
            case 3 -> CardRules.onBound(drawn, previous.get(0), previous.get(1))
                    ? ties == TiePolicy.WIN
                    : CardRules.strictlyInRange(guess, drawn, previous.get(0), previous.get(1));
            default -> drawn.getSuit() == guess.suit();
        };
    }

    public static long payout(long bet, double multiplier) {
        return (long) Math.floor(bet * multiplier);
    }
}
