package org.ridethebus.model.card;

/**
 * Comparaisons de rangs communes aux deux variantes (As fort).
 */
public final class CardRules {
    private CardRules(){}

    public static boolean sameRank(Card a, Card b) {
        return a.rankValue() == b.rankValue();
    }

    /** Vrai si {@code drawn} est strictement du côté annoncé par rapport à {@code ref}. */
    public static boolean strictlyOnSide(Guess direction, Card drawn, Card ref) {
        direction.requireKind(GuessKind.DIRECTION);
        return direction == Guess.HIGHER
                ? drawn.rankValue() > ref.rankValue()
                : drawn.rankValue() < ref.rankValue();
    }

    public static boolean onBound(Card drawn, Card a, Card b) {
        return drawn.rankValue() == a.rankValue() || drawn.rankValue() == b.rankValue();
    }

    public static boolean strictlyInside(Card drawn, Card a, Card b) {
        int low = Math.min(a.rankValue(), b.rankValue());
        int high = Math.max(a.rankValue(), b.rankValue());
        return low < drawn.rankValue() && drawn.rankValue() < high;
    }

    /** Strictement dedans ou strictement dehors selon l'annonce ; une borne ne vaut ni l'un ni l'autre. */
    public static boolean strictlyInRange(Guess range, Card drawn, Card a, Card b) {
        range.requireKind(GuessKind.RANGE);
        if (onBound(drawn, a, b)) return false;
        boolean inside = strictlyInside(drawn, a, b);
        return range == Guess.INSIDE ? inside : !inside;
    }
}
