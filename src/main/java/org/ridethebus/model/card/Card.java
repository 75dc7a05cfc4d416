package org.ridethebus.model.card;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;

@Getter
@EqualsAndHashCode
public class Card {
    private final Rank rank;
    private final Suit suit;

    @JsonCreator
    public Card(@JsonProperty("rank") Rank rank, @JsonProperty("suit") Suit suit) {
        this.rank = rank;
        this.suit = suit;
    }

    // As fort partout : l'ordre de l'enum fait foi
    public int rankValue() {
        return rank.ordinal();
    }

    public Color color() {
        return suit.color();
    }

    @Override
    public String toString() {
        return rank.label() + suit.symbol();
    }

    public enum Suit {
        CLUBS("♣", Color.BLACK), DIAMONDS("♦", Color.RED), HEARTS("♥", Color.RED), SPADES("♠", Color.BLACK);

        private final String symbol;
        private final Color color;

        Suit(String symbol, Color color) {
            this.symbol = symbol;
            this.color = color;
        }

        public String symbol() { return symbol; }
        public Color color() { return color; }
    }

    public enum Rank {
        TWO("2"), THREE("3"), FOUR("4"), FIVE("5"), SIX("6"), SEVEN("7"), EIGHT("8"),
        NINE("9"), TEN("10"), JACK("J"), QUEEN("Q"), KING("K"), ACE("A");

        private final String label;

        Rank(String label) { this.label = label; }

        public String label() { return label; }
    }

    public enum Color { RED, BLACK }
}
