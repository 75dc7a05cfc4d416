package org.ridethebus.service.casino;

import lombok.RequiredArgsConstructor;
import org.ridethebus.config.GameConfig;
import org.ridethebus.exception.InvalidStateException;
import org.ridethebus.model.card.Card;
import org.ridethebus.model.card.Guess;
import org.ridethebus.model.casino.CasinoGameState;
import org.ridethebus.model.casino.StrategyAdvice;
import org.ridethebus.model.casino.TiePolicy;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Conseil de jeu pour la variante casino. Lecture seule.
 * <p>
 * Modèle de probabilités figé : chaque manche est évaluée sur un paquet complet (13 rangs
 * équiprobables, 4 enseignes), sans tenir compte des cartes déjà sorties. C'est le modèle de la
 * table de cotes affichée aux joueurs.
 * <ul>
 *   <li>manche 2 : rangs strictement au-dessus / en dessous de la carte de référence ;</li>
 *   <li>manche 3 : rangs strictement entre les bornes / strictement en dehors ;</li>
 *   <li>manche 4 : 1 / (4 - enseignes déjà vues).</li>
 * </ul>
 * Avec la politique d'égalité WIN, les rangs égaux comptent comme gagnants des deux côtés.
 */
@Service
@RequiredArgsConstructor
public class StrategyAdvisor {
    private static final double RANKS = Card.Rank.values().length;

    private final GameConfig config;

    public StrategyAdvice advise(CasinoGameState s) {
        if (s.getStatus().isTerminal()) throw new InvalidStateException("Session terminée (" + s.getStatus() + ")");
        int round = s.getRound();
        Odds odds = switch (round) {
            case 1 -> new Odds(Guess.RED, 0.5, "Rouge ou noir : 50/50");
            case 2 -> directionOdds(s.getDrawn().get(0));
            case 3 -> rangeOdds(s.getDrawn().get(0), s.getDrawn().get(1));
            default -> suitOdds(s.suitsSeen());
        };

        double current = s.getBet() * s.getMultiplier();
        double cashOutValue = round == 1 ? 0.0 : current;
        double continueValue = odds.probability() * current * config.casinoFactor(round);
        boolean cashOut = round > 1 && continueValue < cashOutValue;

        String reasoning = String.format(Locale.ROOT, "%s. Espérance %.2f contre %.2f en encaissant.",
                odds.reasoning(), continueValue, cashOutValue);
        return new StrategyAdvice(round,
                cashOut ? StrategyAdvice.Action.CASH_OUT : StrategyAdvice.Action.GUESS,
                odds.guess(), odds.probability(), continueValue, cashOutValue, reasoning);
    }

    private record Odds(Guess guess, double probability, String reasoning) {}

    private Odds directionOdds(Card ref) {
        int above = Card.Rank.values().length - 1 - ref.rankValue();
        int below = ref.rankValue();
        int tie = tieBonus(1);
        boolean higher = above >= below;
        double p = ((higher ? above : below) + tie) / RANKS;
        return new Odds(higher ? Guess.HIGHER : Guess.LOWER, p,
                String.format(Locale.ROOT, "Référence %s : %d rangs au-dessus, %d en dessous, %.1f%% pour %s",
                        ref, above, below, p * 100, higher ? "plus haut" : "plus bas"));
    }

    private Odds rangeOdds(Card a, Card b) {
        int low = Math.min(a.rankValue(), b.rankValue());
        int high = Math.max(a.rankValue(), b.rankValue());
        int bounds = low == high ? 1 : 2;
        int inside = Math.max(0, high - low - 1);
        int outside = Card.Rank.values().length - inside - bounds;
        int tie = tieBonus(bounds);
        boolean in = inside > outside;
        double p = ((in ? inside : outside) + tie) / RANKS;
        return new Odds(in ? Guess.INSIDE : Guess.OUTSIDE, p,
                String.format(Locale.ROOT, "Écart %d : %d rangs dedans, %d dehors, %.1f%% pour %s",
                        high - low, inside, outside, p * 100, in ? "dedans" : "dehors"));
    }

    private Odds suitOdds(Set<Card.Suit> seen) {
        List<Card.Suit> unseen = Arrays.stream(Card.Suit.values()).filter(x -> !seen.contains(x)).toList();
        double p = 1.0 / unseen.size();
        Card.Suit pick = unseen.get(0);
        return new Odds(Guess.ofSuit(pick), p,
                String.format(Locale.ROOT, "%d enseigne(s) encore possible(s), %.1f%% pour %s",
                        unseen.size(), p * 100, pick.name().toLowerCase(Locale.ROOT)));
    }

    private int tieBonus(int tiedRanks) {
        return config.getCasinoTiePolicy() == TiePolicy.WIN ? tiedRanks : 0;
    }
}
