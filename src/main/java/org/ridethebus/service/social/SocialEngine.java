package org.ridethebus.service.social;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.ridethebus.config.GameConfig;
import org.ridethebus.exception.EmptyHandException;
import org.ridethebus.exception.InvalidGuessException;
import org.ridethebus.exception.InvalidStateException;
import org.ridethebus.model.Transition;
import org.ridethebus.model.card.Card;
import org.ridethebus.model.card.Deck;
import org.ridethebus.model.card.Guess;
import org.ridethebus.model.social.*;
import org.ridethebus.model.social.rules.BusRules;
import org.ridethebus.model.social.rules.DealRules;
import org.ridethebus.model.social.rules.PyramidRules;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Moteur de la variante sociale : distribution (R1..R4), pyramide, bus.
 * <p>
 * Sans état : chaque action reçoit l'état de la partie, travaille sur une copie et renvoie la
 * copie avec le résultat. En cas d'erreur l'état de l'appelant reste intact. L'appelant doit
 * sérialiser les actions d'une même partie.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SocialEngine {
    private final GameConfig config;

    public SocialGameState createGame(List<String> playerNames, long seed) {
        if (playerNames == null
                || playerNames.size() < config.getMinPlayers()
                || playerNames.size() > config.getMaxPlayers()) {
            throw new IllegalArgumentException("Il faut entre " + config.getMinPlayers()
                    + " et " + config.getMaxPlayers() + " joueurs");
        }
        SocialGameState s = new SocialGameState();
        s.setSeed(seed);
        s.setDeck(Deck.shuffled(seed));
        s.setAlcoholMode(config.isAlcoholModeEnabled());
        for (int i = 0; i < playerNames.size(); i++) {
            String name = playerNames.get(i);
            if (name == null || name.isBlank()) throw new IllegalArgumentException("Nom de joueur vide");
            s.getPlayers().add(new Player("p" + (i + 1), name.trim()));
        }
        s.addLog(LogType.GAME_CREATED, null, Map.of("players", playerNames.size(), "seed", String.valueOf(seed)));
        log.info("Partie créée: {} joueurs, seed={}", playerNames.size(), seed);
        return s;
    }

    // ------------------------------------------------------------------
    // Phase 1 : distribution
    // ------------------------------------------------------------------

    public Transition<SocialGameState, DealOutcome> guess(SocialGameState in, String playerId, Guess guess) {
        requirePhase(in, Phase.DEAL);
        if (in.dealComplete()) throw new InvalidStateException("Distribution terminée, lancez la pyramide");
        if (!in.currentPlayer().getId().equals(playerId)) {
            throw new InvalidStateException("Ce n'est pas au tour de " + playerId);
        }
        DealRound round = in.getRound();
        if (guess == null) throw new InvalidGuessException("Annonce manquante pour la manche " + round);
        guess.requireKind(round.kind());

        SocialGameState s = in.copy();
        Player p = s.currentPlayer();
        DealRules.Draw draw = DealRules.drawResolving(s.getDeck(), round, p.getHand());
        for (Card pushed : draw.pushed()) {
            s.addLog(LogType.CARD_PUSHED, p.getId(), Map.of("round", round.name(), "card", pushed.toString()));
        }
        Card card = draw.card();
        boolean correct = DealRules.isCorrect(round, guess, card, p.getHand());
        p.getHand().add(card);

        int penalty = 0, reward = 0;
        if (correct && round == DealRound.R4) {
            reward = config.reward(GameConfig.REWARD_DISTRIBUTE);
            p.setDrinksAssigned(p.getDrinksAssigned() + reward);
        } else if (!correct) {
            penalty = config.penalty(round.penaltyKey());
            p.setDrinksReceived(p.getDrinksReceived() + penalty);
        }

        s.addLog(LogType.GUESS_MADE, p.getId(), Map.of(
                "round", round.name(), "guess", guess.name(), "card", card.toString(), "correct", correct));
        if (penalty > 0) s.addLog(LogType.PENALTY_APPLIED, p.getId(), Map.of("amount", penalty));
        if (reward > 0) s.addLog(LogType.REWARD_ASSIGNED, p.getId(), Map.of("amount", reward));
        log.debug("{} {} annonce {} -> {} ({})", p.getId(), round, guess, card, correct ? "gagné" : "perdu");

        // tour suivant : même joueur manche suivante, ou joueur suivant en R1
        if (round.isLast()) s.setCurrentPlayerIndex(s.getCurrentPlayerIndex() + 1);
        s.setRound(round.next());
        if (s.dealComplete()) log.info("Distribution terminée (seed={})", s.getSeed());

        return new Transition<>(s, new DealOutcome(p.getId(), round, guess, card, correct, penalty, reward,
                List.copyOf(draw.pushed()), s.dealComplete(), unit(s)));
    }

    // ------------------------------------------------------------------
    // Phase 2 : pyramide
    // ------------------------------------------------------------------

    public Transition<SocialGameState, PhaseOutcome> startPyramid(SocialGameState in) {
        requirePhase(in, Phase.DEAL);
        if (!in.dealComplete()) throw new InvalidStateException("Tous les joueurs n'ont pas fini la distribution");

        SocialGameState s = in.copy();
        s.getDeck().requireAtLeast(GameConfig.PYRAMID_CARDS);
        s.setPyramid(PyramidRules.layout(s.getDeck()));
        s.setPhase(Phase.PYRAMID);
        s.addLog(LogType.PHASE_STARTED, null, Map.of("phase", Phase.PYRAMID.name()));
        log.info("Pyramide lancée (seed={})", s.getSeed());
        return new Transition<>(s, new PhaseOutcome(Phase.DEAL, Phase.PYRAMID, null));
    }

    public Transition<SocialGameState, PyramidFlipOutcome> flipPyramid(SocialGameState in) {
        requirePhase(in, Phase.PYRAMID);
        if (in.getPyramid().allFlipped()) throw new InvalidStateException("Toutes les cartes de la pyramide sont retournées");

        SocialGameState s = in.copy();
        Pyramid pyramid = s.getPyramid();
        PyramidCell cell = PyramidRules.flipNext(pyramid);
        Card card = cell.getCard();
        int value = config.rowValue(pyramid.getCursorRow());

        List<String> matching = new ArrayList<>();
        for (Player p : s.getPlayers()) {
            if (p.firstMatching(card.getRank()).isPresent()) matching.add(p.getId());
        }
        s.addLog(LogType.PYRAMID_FLIP, null, Map.of(
                "row", pyramid.getCursorRow() + 1, "col", pyramid.getCursorCol() + 1,
                "card", card.toString(), "value", value));
        log.debug("Pyramide rangée {} : {} ({} joueur(s) concerné(s))", pyramid.getCursorRow() + 1, card, matching.size());

        return new Transition<>(s, new PyramidFlipOutcome(pyramid.getCursorRow() + 1, pyramid.getCursorCol() + 1,
                card, value, List.copyOf(matching), pyramid.allFlipped(), unit(s)));
    }

    public Transition<SocialGameState, MatchOutcome> commitMatch(SocialGameState in, String playerId) {
        return commitMatch(in, playerId, null);
    }

    /**
     * Pose une carte de même rang que la carte retournée. {@code card} null : première carte correspondante.
     */
    public Transition<SocialGameState, MatchOutcome> commitMatch(SocialGameState in, String playerId, Card card) {
        requirePhase(in, Phase.PYRAMID);
        PyramidCell current = in.getPyramid().currentCell();
        if (current == null) throw new InvalidStateException("Aucune carte de la pyramide n'est retournée");
        Player holder = in.player(playerId)
                .orElseThrow(() -> new InvalidStateException("Joueur inconnu: " + playerId));
        if (!config.isAllowMultipleMatchesPerFlip() && in.getPyramid().commitsOf(playerId) >= 1) {
            throw new InvalidStateException(playerId + " a déjà posé une carte sur ce tirage");
        }
        Card.Rank rank = current.getCard().getRank();
        Card consumed;
        if (card == null) {
            consumed = holder.firstMatching(rank)
                    .orElseThrow(() -> new EmptyHandException(playerId + " n'a aucune carte " + rank));
        } else if (card.getRank() == rank && holder.getHand().contains(card)) {
            consumed = card;
        } else {
            throw new EmptyHandException(playerId + " ne peut pas poser " + card + " sur " + current.getCard());
        }

        SocialGameState s = in.copy();
        Player p = s.player(playerId).orElseThrow();
        Pyramid pyramid = s.getPyramid();
        p.getHand().remove(consumed);
        s.getDiscard().add(consumed);
        int value = config.rowValue(pyramid.getCursorRow());
        p.setDrinksAssigned(p.getDrinksAssigned() + value);
        int commits = pyramid.commitsOf(playerId) + 1;
        pyramid.getCommits().put(playerId, commits);

        s.addLog(LogType.MATCH_COMMITTED, playerId, Map.of(
                "card", consumed.toString(), "row", pyramid.getCursorRow() + 1, "drinks", value));
        return new Transition<>(s, new MatchOutcome(playerId, consumed, pyramid.getCursorRow() + 1, value, commits, unit(s)));
    }

    // ------------------------------------------------------------------
    // Phase 3 : bus
    // ------------------------------------------------------------------

    public Transition<SocialGameState, PhaseOutcome> startBus(SocialGameState in) {
        requirePhase(in, Phase.PYRAMID);
        if (!in.getPyramid().allFlipped()) throw new InvalidStateException("La pyramide n'est pas entièrement retournée");

        SocialGameState s = in.copy();
        Player rider = BusRules.selectRider(s.getPlayers());
        s.getDeck().requireAtLeast(config.getBusLength());
        for (int i = 0; i < config.getBusLength(); i++) s.getBusCards().add(s.getDeck().draw());
        s.setBusCursor(0);
        rider.setBusRider(true);
        s.setRiderId(rider.getId());
        s.setPhase(Phase.BUS);

        s.addLog(LogType.RIDER_SELECTED, rider.getId(), Map.of("cardsRemaining", rider.getHand().size()));
        s.addLog(LogType.PHASE_STARTED, null, Map.of("phase", Phase.BUS.name(), "cards", config.getBusLength()));
        log.info("Bus lancé, passager {} ({} cartes en main)", rider.getId(), rider.getHand().size());
        return new Transition<>(s, new PhaseOutcome(Phase.PYRAMID, Phase.BUS, rider.getId()));
    }

    public Transition<SocialGameState, BusFlipOutcome> flipBus(SocialGameState in) {
        return flipBus(in, BusStopCondition.NEVER);
    }

    public Transition<SocialGameState, BusFlipOutcome> flipBus(SocialGameState in, BusStopCondition stop) {
        requirePhase(in, Phase.BUS);

        SocialGameState s = in.copy();
        Card card = s.getBusCards().get(s.getBusCursor());
        s.setBusCursor(s.getBusCursor() + 1);
        Player rider = s.rider();
        int drinks = BusRules.drinksFor(card);
        rider.setDrinksReceived(rider.getDrinksReceived() + drinks);
        s.addLog(LogType.BUS_FLIP, rider.getId(), Map.of(
                "position", s.getBusCursor(), "card", card.toString(), "drinks", drinks));

        boolean finished = s.getBusCursor() >= s.getBusCards().size() || stop.shouldStop(s);
        if (finished) {
            s.setPhase(Phase.FINISHED);
            s.addLog(LogType.GAME_FINISHED, null, Map.of("busCards", s.getBusCursor()));
            log.info("Partie terminée, {} a reçu {} au total", rider.getId(), rider.getDrinksReceived());
        }
        return new Transition<>(s, new BusFlipOutcome(rider.getId(), s.getBusCursor(), card, drinks,
                rider.getDrinksReceived(), finished, unit(s)));
    }

    // ------------------------------------------------------------------
    // Divers
    // ------------------------------------------------------------------

    public Transition<SocialGameState, ModeOutcome> setAlcoholMode(SocialGameState in, boolean enabled) {
        if (in.getPhase() == Phase.FINISHED) throw new InvalidStateException("Partie terminée");
        SocialGameState s = in.copy();
        s.setAlcoholMode(enabled);
        s.addLog(LogType.MODE_TOGGLE, null, Map.of("alcohol", enabled));
        return new Transition<>(s, new ModeOutcome(enabled, unit(s)));
    }

    /** Revanche : mêmes joueurs, même ordre, nouvelle graine, compteurs remis à zéro. */
    public Transition<SocialGameState, PhaseOutcome> rematch(SocialGameState in, long seed) {
        requirePhase(in, Phase.FINISHED);
        List<String> names = in.getPlayers().stream().map(Player::getName).toList();
        SocialGameState s = createGame(names, seed);
        s.setAlcoholMode(in.isAlcoholMode());
        s.addLog(LogType.REMATCH_STARTED, null, Map.of("previousSeed", String.valueOf(in.getSeed())));
        return new Transition<>(s, new PhaseOutcome(Phase.FINISHED, Phase.DEAL, null));
    }

    private void requirePhase(SocialGameState s, Phase expected) {
        if (s.getPhase() != expected) {
            throw new InvalidStateException("Action réservée à la phase " + expected + " (phase actuelle: " + s.getPhase() + ")");
        }
    }

    private String unit(SocialGameState s) {
        return config.unitLabel(s.isAlcoholMode());
    }
}
