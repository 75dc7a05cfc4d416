package org.ridethebus.service.social;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.ridethebus.config.GameConfig;
import org.ridethebus.exception.EmptyDeckException;
import org.ridethebus.exception.EmptyHandException;
import org.ridethebus.exception.InvalidGuessException;
import org.ridethebus.exception.InvalidStateException;
import org.ridethebus.model.Transition;
import org.ridethebus.model.card.Guess;
import org.ridethebus.model.card.TestCards;
import org.ridethebus.model.social.*;

import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.ridethebus.model.card.TestCards.c;
import static org.ridethebus.model.card.TestCards.cards;

class SocialEngineTest {

    SocialEngine engine;

    // distribution (8), pyramide (15), bus (10)
    static final String[] RIGGED = {
            "2C", "5C", "9C", "2D", "3D", "6D", "10D", "QD",
            "2H", "2S", "3C", "3H", "3S", "4C", "4D", "4H", "4S", "5D", "5H", "5S", "6C", "6H", "6S",
            "JC", "7C", "QH", "7D", "KS", "7H", "AD", "7S", "8C", "8D"
    };

    @BeforeEach
    void setup() {
        engine = new SocialEngine(GameConfig.defaults());
    }

    private SocialGameState rigged(String... deck) {
        SocialGameState s = engine.createGame(List.of("Alice", "Bob"), 1L);
        s.setDeck(TestCards.deckStartingWith(deck));
        return s;
    }

    /** p1 : 2C 5C 9C 2D, p2 : 3D 6D 10D QD. */
    private SocialGameState dealt(SocialEngine e, SocialGameState s) {
        s = e.guess(s, "p1", Guess.RED).state();
        s = e.guess(s, "p1", Guess.HIGHER).state();
        s = e.guess(s, "p1", Guess.OUTSIDE).state();
        s = e.guess(s, "p1", Guess.DIAMONDS).state();
        s = e.guess(s, "p2", Guess.RED).state();
        s = e.guess(s, "p2", Guess.HIGHER).state();
        s = e.guess(s, "p2", Guess.INSIDE).state();
        s = e.guess(s, "p2", Guess.DIAMONDS).state();
        return s;
    }

    private SocialGameState pyramidAllFlipped(SocialGameState s) {
        s = engine.startPyramid(s).state();
        for (int i = 0; i < 15; i++) s = engine.flipPyramid(s).state();
        return s;
    }

    // ------------------------------------------------------------
    // createGame()
    // ------------------------------------------------------------
    @Test
    void createGame_ok() {
        SocialGameState s = engine.createGame(List.of("Alice", "Bob", "Chloé"), 42L);

        assertThat(s.getPlayers()).extracting(Player::getId).containsExactly("p1", "p2", "p3");
        assertThat(s.getPhase()).isEqualTo(Phase.DEAL);
        assertThat(s.getRound()).isEqualTo(DealRound.R1);
        assertThat(s.getDeck().size()).isEqualTo(52);
        assertThat(s.getLog()).extracting(LogEntry::getType).containsExactly(LogType.GAME_CREATED);
    }

    @Test
    void createGame_nombreDeJoueursInvalide() {
        assertThatThrownBy(() -> engine.createGame(List.of("Solo"), 1L))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> engine.createGame(List.of("a", "b", "c", "d", "e", "f", "g"), 1L))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> engine.createGame(List.of("a", " "), 1L))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------
    // distribution R1..R4
    // ------------------------------------------------------------
    @Test
    void guess_quatreManches_penalitesEtRecompense() {
        SocialGameState s = rigged(RIGGED);

        Transition<SocialGameState, DealOutcome> r1 = engine.guess(s, "p1", Guess.RED);
        assertThat(r1.outcome().card()).isEqualTo(c("2C"));
        assertThat(r1.outcome().correct()).isFalse();
        assertThat(r1.outcome().penalty()).isEqualTo(1);

        Transition<SocialGameState, DealOutcome> r2 = engine.guess(r1.state(), "p1", Guess.HIGHER);
        assertThat(r2.outcome().correct()).isTrue();
        assertThat(r2.outcome().penalty()).isZero();

        Transition<SocialGameState, DealOutcome> r3 = engine.guess(r2.state(), "p1", Guess.OUTSIDE);
        assertThat(r3.outcome().card()).isEqualTo(c("9C"));
        assertThat(r3.outcome().correct()).isTrue();

        Transition<SocialGameState, DealOutcome> r4 = engine.guess(r3.state(), "p1", Guess.DIAMONDS);
        assertThat(r4.outcome().correct()).isTrue();
        assertThat(r4.outcome().reward()).isEqualTo(5);
        assertThat(r4.outcome().unit()).isEqualTo("sip");

        Player p1 = r4.state().player("p1").orElseThrow();
        assertThat(p1.getHand()).containsExactly(c("2C"), c("5C"), c("9C"), c("2D"));
        assertThat(p1.getDrinksReceived()).isEqualTo(1);
        assertThat(p1.getDrinksAssigned()).isEqualTo(5);
        // au tour de p2
        assertThat(r4.state().currentPlayer().getId()).isEqualTo("p2");
        assertThat(r4.state().getRound()).isEqualTo(DealRound.R1);
    }

    @Test
    void guess_finDeDistribution() {
        SocialGameState s = dealt(engine, rigged(RIGGED));

        assertThat(s.dealComplete()).isTrue();
        assertThat(s.getPhase()).isEqualTo(Phase.DEAL);
        assertThat(s.player("p2").orElseThrow().getDrinksReceived()).isEqualTo(1);
        assertThatThrownBy(() -> engine.guess(s, "p1", Guess.RED)).isInstanceOf(InvalidStateException.class);
    }

    @Test
    void guess_r2_carteEgaleRepiochee() {
        SocialGameState s = rigged("7C", "7D", "7H", "9S");
        s = engine.guess(s, "p1", Guess.BLACK).state();

        Transition<SocialGameState, DealOutcome> t = engine.guess(s, "p1", Guess.LOWER);

        assertThat(t.outcome().pushed()).containsExactly(c("7D"), c("7H"));
        assertThat(t.outcome().card()).isEqualTo(c("9S"));
        assertThat(t.outcome().correct()).isFalse();
        assertThat(t.state().player("p1").orElseThrow().getHand()).containsExactly(c("7C"), c("9S"));
        assertThat(t.state().getDeck().getCards()).endsWith(c("7D"), c("7H"));
        assertThat(t.state().getLog()).extracting(LogEntry::getType)
                .containsSubsequence(LogType.CARD_PUSHED, LogType.CARD_PUSHED, LogType.GUESS_MADE);
    }

    @Test
    void guess_pasSonTour() {
        SocialGameState s = rigged(RIGGED);

        assertThatThrownBy(() -> engine.guess(s, "p2", Guess.RED)).isInstanceOf(InvalidStateException.class);
    }

    @Test
    void guess_annonceHorsManche_etatIntact() {
        SocialGameState s = rigged(RIGGED);

        assertThatThrownBy(() -> engine.guess(s, "p1", Guess.HIGHER)).isInstanceOf(InvalidGuessException.class);
        assertThat(s.getDeck().size()).isEqualTo(52);
        assertThat(s.getLog()).hasSize(1);
    }

    @Test
    void guess_annonceManquante() {
        SocialGameState s = rigged(RIGGED);

        assertThatThrownBy(() -> engine.guess(s, "p1", null)).isInstanceOf(InvalidGuessException.class);
        assertThat(s.getDeck().size()).isEqualTo(52);
    }

    @Test
    void guess_paquetEpuise_etatIntact() {
        SocialGameState s = engine.createGame(List.of("Alice", "Bob"), 1L);
        s.setDeck(TestCards.deckOf(cards("7C", "7D")));
        SocialGameState afterR1 = engine.guess(s, "p1", Guess.BLACK).state();

        assertThatThrownBy(() -> engine.guess(afterR1, "p1", Guess.HIGHER)).isInstanceOf(EmptyDeckException.class);
        assertThat(afterR1.getDeck().getCards()).containsExactly(c("7D"));
        assertThat(afterR1.currentPlayer().getHand()).containsExactly(c("7C"));
        assertThat(afterR1.getRound()).isEqualTo(DealRound.R2);
    }

    @Test
    void guess_neModifiePasLEtatRecu() {
        SocialGameState s = rigged(RIGGED);

        engine.guess(s, "p1", Guess.RED);

        assertThat(s.getDeck().size()).isEqualTo(52);
        assertThat(s.getPlayers().get(0).getHand()).isEmpty();
    }

    // ------------------------------------------------------------
    // pyramide
    // ------------------------------------------------------------
    @Test
    void startPyramid_avantFinDeDistribution() {
        SocialGameState s = rigged(RIGGED);

        assertThatThrownBy(() -> engine.startPyramid(s)).isInstanceOf(InvalidStateException.class);
    }

    @Test
    void startPyramid_quinzeCartesFacesCachees() {
        Transition<SocialGameState, PhaseOutcome> t = engine.startPyramid(dealt(engine, rigged(RIGGED)));
        Pyramid p = t.state().getPyramid();

        assertThat(t.outcome().to()).isEqualTo(Phase.PYRAMID);
        assertThat(p.getRows()).extracting(List::size).containsExactly(5, 4, 3, 2, 1);
        assertThat(p.flippedCount()).isZero();
        assertThat(p.getRows().get(0).get(0).getCard()).isEqualTo(c("2H"));
    }

    @Test
    void commitMatch_avantToutTirage() {
        SocialGameState s = engine.startPyramid(dealt(engine, rigged(RIGGED))).state();

        assertThatThrownBy(() -> engine.commitMatch(s, "p1")).isInstanceOf(InvalidStateException.class);
    }

    @Test
    void flipPyramid_etCommitMatch() {
        SocialGameState s = engine.startPyramid(dealt(engine, rigged(RIGGED))).state();

        Transition<SocialGameState, PyramidFlipOutcome> flip = engine.flipPyramid(s);
        assertThat(flip.outcome().card()).isEqualTo(c("2H"));
        assertThat(flip.outcome().row()).isEqualTo(1);
        assertThat(flip.outcome().drinkValue()).isEqualTo(1);
        assertThat(flip.outcome().matchingPlayerIds()).containsExactly("p1");

        Transition<SocialGameState, MatchOutcome> match = engine.commitMatch(flip.state(), "p1");
        assertThat(match.outcome().consumed()).isEqualTo(c("2C"));
        assertThat(match.outcome().drinksToAssign()).isEqualTo(1);
        Player p1 = match.state().player("p1").orElseThrow();
        assertThat(p1.getHand()).containsExactly(c("5C"), c("9C"), c("2D"));
        assertThat(p1.getDrinksAssigned()).isEqualTo(5 + 1);
        assertThat(match.state().getDiscard()).containsExactly(c("2C"));

        // une seule pose par joueur et par tirage par défaut
        assertThatThrownBy(() -> engine.commitMatch(match.state(), "p1")).isInstanceOf(InvalidStateException.class);
        assertThatThrownBy(() -> engine.commitMatch(match.state(), "p2")).isInstanceOf(EmptyHandException.class);
    }

    @Test
    void commitMatch_reglePlusieursPoses() {
        SocialEngine multi = new SocialEngine(GameConfig.defaults().toBuilder().allowMultipleMatchesPerFlip(true).build());
        SocialGameState s = multi.createGame(List.of("Alice", "Bob"), 1L);
        s.setDeck(TestCards.deckStartingWith(RIGGED));
        s = multi.startPyramid(dealt(multi, s)).state();
        s = multi.flipPyramid(s).state();

        Transition<SocialGameState, MatchOutcome> first = multi.commitMatch(s, "p1");
        Transition<SocialGameState, MatchOutcome> second = multi.commitMatch(first.state(), "p1");

        assertThat(second.outcome().consumed()).isEqualTo(c("2D"));
        assertThat(second.outcome().commitsThisFlip()).isEqualTo(2);
        // rangée 1 x 2 poses
        assertThat(second.state().player("p1").orElseThrow().getDrinksAssigned()).isEqualTo(5 + 2);
        assertThatThrownBy(() -> multi.commitMatch(second.state(), "p1")).isInstanceOf(EmptyHandException.class);
    }

    @Test
    void commitMatch_carteDesigneeNonCorrespondante() {
        SocialGameState s = engine.startPyramid(dealt(engine, rigged(RIGGED))).state();
        SocialGameState flipped = engine.flipPyramid(s).state();

        assertThatThrownBy(() -> engine.commitMatch(flipped, "p1", c("5C"))).isInstanceOf(EmptyHandException.class);
        assertThat(engine.commitMatch(flipped, "p1", c("2D")).outcome().consumed()).isEqualTo(c("2D"));
    }

    @Test
    void flipPyramid_aucuneCorrespondance() {
        SocialGameState s = engine.startPyramid(dealt(engine, rigged(RIGGED))).state();
        // 2H 2S 3C 3H 3S sans poser
        for (int i = 0; i < 5; i++) s = engine.flipPyramid(s).state();

        Transition<SocialGameState, PyramidFlipOutcome> sixth = engine.flipPyramid(s);
        assertThat(sixth.outcome().card()).isEqualTo(c("4C"));
        assertThat(sixth.outcome().row()).isEqualTo(2);
        assertThat(sixth.outcome().matchingPlayerIds()).isEmpty();
        assertThatThrownBy(() -> engine.commitMatch(sixth.state(), "p1")).isInstanceOf(EmptyHandException.class);
        assertThatThrownBy(() -> engine.commitMatch(sixth.state(), "p2")).isInstanceOf(EmptyHandException.class);
        assertThatThrownBy(() -> engine.commitMatch(sixth.state(), "p9")).isInstanceOf(InvalidStateException.class);
    }

    @Test
    void flipPyramid_valeurParRangee() {
        SocialGameState s = engine.startPyramid(dealt(engine, rigged(RIGGED))).state();
        int[] expected = {1, 1, 1, 1, 1, 2, 2, 2, 2, 3, 3, 3, 4, 4, 5};
        for (int i = 0; i < 15; i++) {
            Transition<SocialGameState, PyramidFlipOutcome> t = engine.flipPyramid(s);
            assertThat(t.outcome().drinkValue()).isEqualTo(expected[i]);
            assertThat(t.outcome().lastFlip()).isEqualTo(i == 14);
            s = t.state();
        }
        SocialGameState done = s;
        assertThatThrownBy(() -> engine.flipPyramid(done)).isInstanceOf(InvalidStateException.class);
    }

    // ------------------------------------------------------------
    // bus
    // ------------------------------------------------------------
    @Test
    void startBus_pyramideIncomplete() {
        SocialGameState s = engine.flipPyramid(engine.startPyramid(dealt(engine, rigged(RIGGED))).state()).state();

        assertThatThrownBy(() -> engine.startBus(s)).isInstanceOf(InvalidStateException.class);
    }

    @Test
    void startBus_egaliteDeCartes_plusHauteCarteMonte() {
        SocialGameState s = pyramidAllFlipped(dealt(engine, rigged(RIGGED)));

        Transition<SocialGameState, PhaseOutcome> t = engine.startBus(s);

        // 4 cartes chacun, Q de p2 > 9 de p1
        assertThat(t.outcome().riderId()).isEqualTo("p2");
        assertThat(t.state().rider().isBusRider()).isTrue();
        assertThat(t.state().getBusCards()).hasSize(10).startsWith(c("JC"));
    }

    @Test
    void flipBus_figuresEtAsFontDixGorgees() {
        SocialGameState s = engine.startBus(pyramidAllFlipped(dealt(engine, rigged(RIGGED)))).state();
        int total = 0;
        Transition<SocialGameState, BusFlipOutcome> t = null;
        for (int i = 0; i < 10; i++) {
            t = engine.flipBus(s);
            total += t.outcome().drinks();
            assertThat(t.outcome().finished()).isEqualTo(i == 9);
            s = t.state();
        }

        assertThat(total).isEqualTo(1 + 2 + 3 + 4);
        assertThat(s.getPhase()).isEqualTo(Phase.FINISHED);
        // 1 gorgée de la distribution + 10 dans le bus
        assertThat(t.outcome().riderTotal()).isEqualTo(11);
        SocialGameState finished = s;
        assertThatThrownBy(() -> engine.flipBus(finished)).isInstanceOf(InvalidStateException.class);
    }

    @Test
    void flipBus_arretAnticipe() {
        SocialGameState s = engine.startBus(pyramidAllFlipped(dealt(engine, rigged(RIGGED)))).state();
        BusStopCondition afterThree = state -> state.getBusCursor() >= 3;

        s = engine.flipBus(s, afterThree).state();
        s = engine.flipBus(s, afterThree).state();
        Transition<SocialGameState, BusFlipOutcome> t = engine.flipBus(s, afterThree);

        assertThat(t.outcome().finished()).isTrue();
        assertThat(t.outcome().position()).isEqualTo(3);
        assertThat(t.state().getPhase()).isEqualTo(Phase.FINISHED);
    }

    @Test
    void flipBus_arretMainDuPassagerVide() {
        SocialGameState s = engine.startBus(pyramidAllFlipped(dealt(engine, rigged(RIGGED)))).state();

        Transition<SocialGameState, BusFlipOutcome> first = engine.flipBus(s, BusStopCondition.RIDER_HAND_EMPTY);
        assertThat(first.outcome().finished()).isFalse();
        assertThat(first.state().getPhase()).isEqualTo(Phase.BUS);

        SocialGameState emptied = first.state();
        emptied.rider().getHand().clear();
        Transition<SocialGameState, BusFlipOutcome> t = engine.flipBus(emptied, BusStopCondition.RIDER_HAND_EMPTY);

        assertThat(t.outcome().finished()).isTrue();
        assertThat(t.outcome().position()).isEqualTo(2);
        assertThat(t.state().getPhase()).isEqualTo(Phase.FINISHED);
    }

    // ------------------------------------------------------------
    // partie complète sur paquet mélangé
    // ------------------------------------------------------------
    private SocialGameState playToEnd(long seed) {
        SocialGameState s = engine.createGame(List.of("Alice", "Bob", "Chloé", "Dan"), seed);
        Guess[] script = {Guess.RED, Guess.HIGHER, Guess.INSIDE, Guess.SPADES};
        while (!s.dealComplete()) {
            s = engine.guess(s, s.currentPlayer().getId(), script[s.getRound().ordinal()]).state();
        }
        s = engine.startPyramid(s).state();
        while (!s.getPyramid().allFlipped()) {
            Transition<SocialGameState, PyramidFlipOutcome> flip = engine.flipPyramid(s);
            s = flip.state();
            for (String id : flip.outcome().matchingPlayerIds()) s = engine.commitMatch(s, id).state();
        }
        s = engine.startBus(s).state();
        while (s.getPhase() == Phase.BUS) s = engine.flipBus(s).state();
        return s;
    }

    @Test
    void partieComplete_memeGraineMemePartie() {
        assertThat(playToEnd(2024L)).isEqualTo(playToEnd(2024L));
    }

    @Test
    void partieComplete_aucuneCartePerdue() {
        SocialGameState s = playToEnd(99L);
        int inHands = s.getPlayers().stream().mapToInt(p -> p.getHand().size()).sum();

        assertThat(s.getPhase()).isEqualTo(Phase.FINISHED);
        assertThat(s.getDeck().size() + inHands + s.getDiscard().size()
                + s.getPyramid().cellCount() + s.getBusCards().size()).isEqualTo(52);
        assertThat(s.getPlayers()).filteredOn(Player::isBusRider).hasSize(1);
    }

    // ------------------------------------------------------------
    // mode et revanche
    // ------------------------------------------------------------
    @Test
    void setAlcoholMode_changeLUnite() {
        SocialGameState s = engine.setAlcoholMode(rigged(RIGGED), false).state();

        Transition<SocialGameState, DealOutcome> t = engine.guess(s, "p1", Guess.RED);
        assertThat(t.outcome().unit()).isEqualTo("point");
        assertThat(t.state().getLog()).extracting(LogEntry::getType).contains(LogType.MODE_TOGGLE);
    }

    @Test
    void rematch_memesJoueursCompteursRemisAZero() {
        SocialGameState finished = playToEnd(7L);

        Transition<SocialGameState, PhaseOutcome> t = engine.rematch(finished, 8L);

        assertThat(t.state().getSeed()).isEqualTo(8L);
        assertThat(t.state().getPhase()).isEqualTo(Phase.DEAL);
        assertThat(t.state().getPlayers()).extracting(Player::getName).containsExactly("Alice", "Bob", "Chloé", "Dan");
        assertThat(t.state().getPlayers()).allSatisfy(p -> {
            assertThat(p.getHand()).isEmpty();
            assertThat(p.getDrinksReceived()).isZero();
            assertThat(p.isBusRider()).isFalse();
        });
        assertThat(t.state().getLog()).extracting(LogEntry::getType).endsWith(LogType.REMATCH_STARTED);
    }

    @Test
    void rematch_partieEnCours() {
        assertThatThrownBy(() -> engine.rematch(rigged(RIGGED), 2L)).isInstanceOf(InvalidStateException.class);
    }
}
