package org.ridethebus.model.social;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.ridethebus.exception.InvalidStateException;
import org.ridethebus.model.card.Card;
import org.ridethebus.model.card.Deck;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Partie sociale complète. Valeur détenue par l'appelant : le moteur la copie, modifie la copie
 * et la renvoie, sans jamais garder de référence.
 */
@Data
@NoArgsConstructor
public class SocialGameState {
    private long seed;
    private List<Player> players = new ArrayList<>();
    private Phase phase = Phase.DEAL;
    private DealRound round = DealRound.R1;
    private int currentPlayerIndex = 0;
    private Deck deck;
    private List<Card> discard = new ArrayList<>();
    private Pyramid pyramid = new Pyramid();
    private List<Card> busCards = new ArrayList<>();
    private int busCursor = 0;
    private String riderId;
    private boolean alcoholMode = true;
    private List<LogEntry> log = new ArrayList<>();

    public boolean dealComplete() {
        return currentPlayerIndex >= players.size();
    }

    public Player currentPlayer() {
        if (dealComplete()) throw new InvalidStateException("Tous les joueurs ont reçu leurs 4 cartes");
        return players.get(currentPlayerIndex);
    }

    public Optional<Player> player(String playerId) {
        return players.stream().filter(p -> p.getId().equals(playerId)).findFirst();
    }

    public Player rider() {
        if (riderId == null) throw new InvalidStateException("Aucun passager du bus désigné");
        return player(riderId).orElseThrow(() -> new InvalidStateException("Passager inconnu: " + riderId));
    }

    public void addLog(LogType type, String playerId, Map<String, Object> payload) {
        log.add(new LogEntry(log.size() + 1, type, playerId, payload));
    }

    public SocialGameState copy() {
        SocialGameState s = new SocialGameState();
        s.seed = seed;
        for (Player p : players) s.players.add(p.copy());
        s.phase = phase;
        s.round = round;
        s.currentPlayerIndex = currentPlayerIndex;
        s.deck = deck == null ? null : deck.copy();
        s.discard = new ArrayList<>(discard);
        s.pyramid = pyramid.copy();
        s.busCards = new ArrayList<>(busCards);
        s.busCursor = busCursor;
        s.riderId = riderId;
        s.alcoholMode = alcoholMode;
        s.log = new ArrayList<>(log);
        return s;
    }
}
