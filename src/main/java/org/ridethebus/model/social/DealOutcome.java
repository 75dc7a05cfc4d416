package org.ridethebus.model.social;

import org.ridethebus.model.card.Card;
import org.ridethebus.model.card.Guess;

import java.util.List;

/**
 * @param pushed   cartes égales remises sous le paquet avant la carte décisive
 * @param reward   gorgées à distribuer (R4 réussie), attribution laissée aux joueurs
 */
public record DealOutcome(String playerId,
                          DealRound round,
                          Guess guess,
                          Card card,
                          boolean correct,
                          int penalty,
                          int reward,
                          List<Card> pushed,
                          boolean dealComplete,
                          String unit) {}
