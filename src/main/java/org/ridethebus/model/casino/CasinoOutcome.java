package org.ridethebus.model.casino;

import org.ridethebus.model.card.Card;
import org.ridethebus.model.card.Guess;

/**
 * @param factor     multiplicateur de la manche jouée
 * @param multiplier multiplicateur cumulé après la manche (inchangé si perdu)
 * @param payout     gain définitif, 0 tant que la session continue
 */
public record CasinoOutcome(int round,
                            Guess guess,
                            Card card,
                            boolean correct,
                            double factor,
                            double multiplier,
                            CasinoStatus status,
                            long payout) {}
