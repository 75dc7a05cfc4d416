package org.ridethebus.model.card;

import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.ridethebus.exception.EmptyDeckException;

import java.util.*;

/**
 * Paquet de 52 cartes mélangé de façon déterministe.
 * <p>
 * Les cartes sont générées couleur par couleur (CLUBS → SPADES, TWO → ACE) puis mélangées avec
 * {@code Collections.shuffle(cards, new Random(seed))}. L'algorithme de mélange (Fisher–Yates
 * descendant) et le générateur (LCG 48 bits) sont fixés par le contrat du JDK : une même graine
 * donne toujours le même ordre. On pioche par le dessus (index 0).
 */
@Slf4j
@Data
@NoArgsConstructor
public class Deck {
    public static final int SIZE = 52;

    private long seed;
    private List<Card> cards = new ArrayList<>();

    public static Deck shuffled(long seed) {
        List<Card> tmp = new ArrayList<>(SIZE);
        for (Card.Suit s : Card.Suit.values()) {
            for (Card.Rank r : Card.Rank.values()) tmp.add(new Card(r, s));
        }
        Collections.shuffle(tmp, new Random(seed));
        Deck d = new Deck();
        d.seed = seed;
        d.cards = tmp;
        return d;
    }

    public Card draw() {
        if (cards.isEmpty()) {
            log.warn("Paquet vide (seed={})", seed);
            throw new EmptyDeckException("Plus aucune carte dans le paquet");
        }
        return cards.remove(0);
    }

    /** Remet une carte sous le paquet (règle de la carte égale). */
    public void putBack(Card c) {
        cards.add(c);
    }

    public void requireAtLeast(int n) {
        if (cards.size() < n) {
            log.warn("Paquet insuffisant: {} cartes restantes, {} requises (seed={})", cards.size(), n, seed);
            throw new EmptyDeckException("Il faut " + n + " cartes, il en reste " + cards.size());
        }
    }

    public int size() {
        return cards.size();
    }

    public Deck copy() {
        Deck d = new Deck();
        d.seed = seed;
        d.cards = new ArrayList<>(cards);
        return d;
    }
}
