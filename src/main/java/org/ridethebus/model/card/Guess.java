package org.ridethebus.model.card;

import org.ridethebus.exception.InvalidGuessException;

import java.util.Locale;

/**
 * Toutes les annonces possibles, chacune rattachée à son type de manche.
 * Une annonce d'un autre type que celui attendu est refusée avant toute pioche.
 */
public enum Guess {
    RED(GuessKind.COLOR),
    BLACK(GuessKind.COLOR),
    HIGHER(GuessKind.DIRECTION),
    LOWER(GuessKind.DIRECTION),
    INSIDE(GuessKind.RANGE),
    OUTSIDE(GuessKind.RANGE),
    CLUBS(GuessKind.SUIT),
    DIAMONDS(GuessKind.SUIT),
    HEARTS(GuessKind.SUIT),
    SPADES(GuessKind.SUIT);

    private final GuessKind kind;

    Guess(GuessKind kind) {
        this.kind = kind;
    }

    public GuessKind kind() {
        return kind;
    }

    public Card.Color color() {
        return switch (this) {
            case RED -> Card.Color.RED;
            case BLACK -> Card.Color.BLACK;
            default -> throw new InvalidGuessException(this + " n'est pas une couleur");
        };
    }

    public Card.Suit suit() {
        return switch (this) {
            case CLUBS -> Card.Suit.CLUBS;
            case DIAMONDS -> Card.Suit.DIAMONDS;
            case HEARTS -> Card.Suit.HEARTS;
            case SPADES -> Card.Suit.SPADES;
            default -> throw new InvalidGuessException(this + " n'est pas une enseigne");
        };
    }

    public static Guess ofSuit(Card.Suit suit) {
        return valueOf(suit.name());
    }

    public void requireKind(GuessKind expected) {
        if (kind != expected) {
            throw new InvalidGuessException("Annonce " + this + " invalide, attendu: " + expected);
        }
    }

    /** Décode une annonce venant du client ("red", "Higher", ...). */
    public static Guess parse(String raw) {
        if (raw == null || raw.isBlank()) throw new InvalidGuessException("Annonce vide");
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new InvalidGuessException("Annonce inconnue: " + raw);
        }
    }
}
