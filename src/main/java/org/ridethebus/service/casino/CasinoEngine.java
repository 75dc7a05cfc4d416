package org.ridethebus.service.casino;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.ridethebus.config.GameConfig;
import org.ridethebus.exception.InvalidGuessException;
import org.ridethebus.exception.InvalidStateException;
import org.ridethebus.model.Transition;
import org.ridethebus.model.card.Card;
import org.ridethebus.model.card.Deck;
import org.ridethebus.model.card.Guess;
import org.ridethebus.model.casino.*;
import org.ridethebus.model.casino.rules.CasinoRules;
import org.springframework.stereotype.Service;

/**
 * Variante casino : 4 manches à multiplicateur, encaissement possible après la 1re manche gagnée.
 * Même contrat que le moteur social : état en entrée, copie modifiée en sortie.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CasinoEngine {
    private final GameConfig config;

    public CasinoGameState start(long bet, long seed) {
        if (bet <= 0) throw new IllegalArgumentException("Mise invalide: " + bet);
        CasinoGameState s = new CasinoGameState();
        s.setSeed(seed);
        s.setBet(bet);
        s.setDeck(Deck.shuffled(seed));
        log.debug("Session casino ouverte: mise={}, seed={}", bet, seed);
        return s;
    }

    public Transition<CasinoGameState, CasinoOutcome> guess(CasinoGameState in, Guess guess) {
        requireInProgress(in);
        int round = in.getRound();
        if (guess == null) throw new InvalidGuessException("Annonce manquante pour la manche " + round);
        guess.requireKind(CasinoRules.kindOf(round));
        if (round == GameConfig.CASINO_ROUNDS && in.suitsSeen().contains(guess.suit())) {
            throw new InvalidGuessException("L'enseigne " + guess.suit() + " est déjà sortie");
        }

        CasinoGameState s = in.copy();
        Card card = s.getDeck().draw();
        boolean correct = CasinoRules.isCorrect(round, guess, card, s.getDrawn(), config.getCasinoTiePolicy());
        s.getDrawn().add(card);
        double factor = config.casinoFactor(round);

        if (correct) {
            s.setMultiplier(s.getMultiplier() * factor);
            if (round == GameConfig.CASINO_ROUNDS) {
                s.setStatus(CasinoStatus.COMPLETED);
                s.setPayout(CasinoRules.payout(s.getBet(), s.getMultiplier()));
                log.info("Session casino gagnée: mise={} -> {}", s.getBet(), s.getPayout());
            } else {
                s.setRound(round + 1);
            }
        } else {
            // perdu : tout est perdu, quel que soit le multiplicateur accumulé
            s.setStatus(CasinoStatus.BUSTED);
            s.setPayout(0);
            log.info("Session casino perdue en manche {}: mise={}", round, s.getBet());
        }
        s.getHistory().add(new CasinoRoundRecord(round, guess, card, correct, s.getMultiplier()));

        return new Transition<>(s, new CasinoOutcome(round, guess, card, correct, factor,
                s.getMultiplier(), s.getStatus(), s.getPayout()));
    }

    public Transition<CasinoGameState, CashOutOutcome> cashOut(CasinoGameState in) {
        requireInProgress(in);
        if (in.getRound() < 2) throw new InvalidStateException("Encaissement impossible avant d'avoir gagné la manche 1");

        CasinoGameState s = in.copy();
        s.setStatus(CasinoStatus.CASHED_OUT);
        s.setPayout(CasinoRules.payout(s.getBet(), s.getMultiplier()));
        log.info("Encaissement: mise={} x{} -> {}", s.getBet(), s.getMultiplier(), s.getPayout());
        return new Transition<>(s, new CashOutOutcome(s.getRound() - 1, s.getMultiplier(), s.getPayout()));
    }

    /** Gain si la manche en cours est gagnée. */
    public long potentialPayout(CasinoGameState s) {
        requireInProgress(s);
        return CasinoRules.payout(s.getBet(), s.getMultiplier() * config.casinoFactor(s.getRound()));
    }

    private void requireInProgress(CasinoGameState s) {
        if (s.getStatus() != CasinoStatus.IN_PROGRESS) {
            throw new InvalidStateException("Session terminée (" + s.getStatus() + ")");
        }
    }
}
