package org.ridethebus.model.social.rules;

import org.ridethebus.exception.EmptyDeckException;
import org.ridethebus.model.card.Card;
import org.ridethebus.model.card.CardRules;
import org.ridethebus.model.card.Deck;
import org.ridethebus.model.card.Guess;
import org.ridethebus.model.social.DealRound;

import java.util.ArrayList;
import java.util.List;

public final class DealRules {
    private DealRules(){}

    public record Draw(Card card, List<Card> pushed) {}

    /**
     * Carte égale à la référence (R2) ou à une borne (R3) : la manche ne se résout pas.
     */
    public static boolean isPush(DealRound round, Card drawn, List<Card> hand) {
        return switch (round) {
            case R2 -> CardRules.sameRank(drawn, hand.get(0));
            case R3 -> CardRules.onBound(drawn, hand.get(0), hand.get(1));
            default -> false;
        };
    }

    /**
     * Pioche la carte qui résout la manche. Chaque carte "push" repart sous le paquet et on
     * repioche avec la même annonce, jusqu'à une carte non égale.
     */
    public static Draw drawResolving(Deck deck, DealRound round, List<Card> hand) {
        boolean resolvable = deck.getCards().stream().anyMatch(c -> !isPush(round, c, hand));
        if (!resolvable) {
            throw new EmptyDeckException("Aucune carte restante ne peut départager la manche " + round);
        }
        List<Card> pushed = new ArrayList<>();
        Card c = deck.draw();
        while (isPush(round, c, hand)) {
            pushed.add(c);
            deck.putBack(c);
            c = deck.draw();
        }
        return new Draw(c, pushed);
    }

    public static boolean isCorrect(DealRound round, Guess guess, Card drawn, List<Card> hand) {
        guess.requireKind(round.kind());
        return switch (round) {
            case R1 -> drawn.color() == guess.color();
            case R2 -> CardRules.strictlyOnSide(guess, drawn, hand.get(0));
            case R3 -> CardRules.strictlyInRange(guess, drawn, hand.get(0), hand.get(1));
            case R4 -> drawn.getSuit() == guess.suit();
        };
    }
}
