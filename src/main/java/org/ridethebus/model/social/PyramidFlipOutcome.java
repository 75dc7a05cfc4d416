package org.ridethebus.model.social;

import org.ridethebus.model.card.Card;

import java.util.List;

/**
 * @param row rangée 1 (bas) à 5 (sommet)
 */
public record PyramidFlipOutcome(int row,
                                 int column,
                                 Card card,
                                 int drinkValue,
                                 List<String> matchingPlayerIds,
                                 boolean lastFlip,
                                 String unit) {}
