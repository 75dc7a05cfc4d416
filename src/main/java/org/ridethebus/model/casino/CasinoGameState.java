package org.ridethebus.model.casino;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.ridethebus.model.card.Card;
import org.ridethebus.model.card.Deck;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Session casino d'un joueur. {@code round} est la manche à jouer (1..4) ; après la 4e manche
 * gagnée elle reste à 4 avec le statut COMPLETED.
 */
@Data
@NoArgsConstructor
public class CasinoGameState {
    private long seed;
    private long bet;
    private int round = 1;
    private double multiplier = 1.0;
    private List<Card> drawn = new ArrayList<>();
    private CasinoStatus status = CasinoStatus.IN_PROGRESS;
    private long payout = 0;
    private Deck deck;
    private List<CasinoRoundRecord> history = new ArrayList<>();

    public Set<Card.Suit> suitsSeen() {
        Set<Card.Suit> seen = EnumSet.noneOf(Card.Suit.class);
        for (Card c : drawn) seen.add(c.getSuit());
        return seen;
    }

    public CasinoGameState copy() {
        CasinoGameState s = new CasinoGameState();
        s.seed = seed;
        s.bet = bet;
        s.round = round;
        s.multiplier = multiplier;
        s.drawn = new ArrayList<>(drawn);
        s.status = status;
        s.payout = payout;
        s.deck = deck == null ? null : deck.copy();
        s.history = new ArrayList<>(history);
        return s;
    }
}
