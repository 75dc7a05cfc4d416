package org.ridethebus.model.casino;

import org.ridethebus.model.card.Guess;

/**
 * @param bestGuess      meilleure annonce si l'on continue
 * @param continueValue  espérance de gain en jouant {@code bestGuess}
 * @param cashOutValue   gain immédiat en encaissant (0 en manche 1)
 */
public record StrategyAdvice(int round,
                             Action action,
                             Guess bestGuess,
                             double winProbability,
                             double continueValue,
                             double cashOutValue,
                             String reasoning) {

    public enum Action { GUESS, CASH_OUT }
}
