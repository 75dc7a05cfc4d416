package org.ridethebus.model.social.rules;

import org.ridethebus.model.card.Card;
import org.ridethebus.model.social.Player;

import java.util.List;

public final class BusRules {
    private BusRules(){}

    public static int drinksFor(Card c) {
        return switch (c.getRank()) {
            case JACK -> 1; case QUEEN -> 2; case KING -> 3; case ACE -> 4;
            default -> 0;
        };
    }

    /**
     * Passager du bus : le plus de cartes en main, puis la plus haute carte,
     * puis l'ordre d'arrivée (le premier inscrit l'emporte).
     */
    public static Player selectRider(List<Player> players) {
        Player best = null;
        for (Player p : players) {
            if (best == null || beats(p, best)) best = p;
        }
        return best;
    }

    private static boolean beats(Player challenger, Player holder) {
        int byCount = Integer.compare(challenger.getHand().size(), holder.getHand().size());
        if (byCount != 0) return byCount > 0;
        return topValue(challenger) > topValue(holder);
    }

    private static int topValue(Player p) {
        return p.topCard().map(Card::rankValue).orElse(-1);
    }
}
