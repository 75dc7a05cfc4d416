package org.ridethebus.config;

import lombok.Builder;
import lombok.Value;
import org.ridethebus.exception.InvalidConfigException;
import org.ridethebus.model.card.Deck;
import org.ridethebus.model.casino.TiePolicy;

import java.util.List;
import java.util.Map;

/**
 * Valeurs de règles figées, lues par les moteurs et jamais modifiées par eux.
 */
@Value
@Builder(toBuilder = true)
public class GameConfig {

    public static final String PENALTY_R1 = "sips_wrong_guess_r1";
    public static final String PENALTY_R2 = "sips_wrong_guess_r2";
    public static final String PENALTY_R3 = "sips_wrong_guess_r3";
    public static final String PENALTY_R4 = "sips_wrong_guess_r4";
    public static final String REWARD_DISTRIBUTE = "reward_distribute_drinks";

    public static final int PYRAMID_CARDS = 15;
    public static final int DEAL_ROUNDS = 4;
    public static final int CASINO_ROUNDS = 4;

    Map<String, Integer> penalties;
    Map<String, Integer> rewards;
    List<Integer> pyramidRowValues;   // du bas vers le haut
    boolean allowMultipleMatchesPerFlip;
    boolean alcoholModeEnabled;
    String drinkUnit;
    String pointUnit;
    int minPlayers;
    int maxPlayers;
    int busLength;
    List<Double> casinoMultipliers;
    TiePolicy casinoTiePolicy;

    public static GameConfig defaults() {
        return GameConfig.builder()
                .penalties(Map.of(PENALTY_R1, 1, PENALTY_R2, 1, PENALTY_R3, 1, PENALTY_R4, 1))
                .rewards(Map.of(REWARD_DISTRIBUTE, 5))
                .pyramidRowValues(List.of(1, 2, 3, 4, 5))
                .allowMultipleMatchesPerFlip(false)
                .alcoholModeEnabled(true)
                .drinkUnit("sip")
                .pointUnit("point")
                .minPlayers(2)
                .maxPlayers(6)
                .busLength(10)
                .casinoMultipliers(List.of(2.0, 2.0, 3.0, 4.0))
                .casinoTiePolicy(TiePolicy.LOSE)
                .build()
                .validate();
    }

    public int penalty(String key) {
        Integer v = penalties == null ? null : penalties.get(key);
        if (v == null) throw new InvalidConfigException("Clé de pénalité manquante: penalty." + key);
        return v;
    }

    public int reward(String key) {
        Integer v = rewards == null ? null : rewards.get(key);
        if (v == null) throw new InvalidConfigException("Clé de récompense manquante: reward." + key);
        return v;
    }

    /** Valeur d'une rangée de la pyramide, rowIndex à partir de 0 (rangée du bas). */
    public int rowValue(int rowIndex) {
        return pyramidRowValues.get(rowIndex);
    }

    /** Multiplicateur de la manche casino {@code round} (1..4). */
    public double casinoFactor(int round) {
        return casinoMultipliers.get(round - 1);
    }

    public String unitLabel(boolean alcohol) {
        return alcohol ? drinkUnit : pointUnit;
    }

    /**
     * Vérifie la cohérence de la configuration. Toute clé absente est fatale.
     */
    public GameConfig validate() {
        for (String k : List.of(PENALTY_R1, PENALTY_R2, PENALTY_R3, PENALTY_R4)) {
            if (penalty(k) < 0) throw new InvalidConfigException("Pénalité négative: " + k);
        }
        if (reward(REWARD_DISTRIBUTE) < 0) throw new InvalidConfigException("Récompense négative");
        if (pyramidRowValues == null || pyramidRowValues.size() != 5)
            throw new InvalidConfigException("pyramid.row-values doit contenir 5 valeurs");
        if (casinoMultipliers == null || casinoMultipliers.size() != CASINO_ROUNDS)
            throw new InvalidConfigException("casino.multipliers doit contenir " + CASINO_ROUNDS + " valeurs");
        for (Double m : casinoMultipliers) {
            if (m == null || m <= 0) throw new InvalidConfigException("Multiplicateur casino invalide: " + m);
        }
        if (casinoTiePolicy == null) throw new InvalidConfigException("casino.tie-policy manquant");
        if (drinkUnit == null || pointUnit == null) throw new InvalidConfigException("Libellés d'unité manquants");
        if (minPlayers < 2 || maxPlayers < minPlayers)
            throw new InvalidConfigException("Bornes de joueurs invalides: " + minPlayers + ".." + maxPlayers);
        if (busLength <= 0) throw new InvalidConfigException("bus.length doit être > 0");
        // un seul paquet doit suffire à la plus grande table
        int needed = maxPlayers * DEAL_ROUNDS + PYRAMID_CARDS + busLength;
        if (needed > Deck.SIZE)
            throw new InvalidConfigException("Un paquet ne suffit pas: " + needed + " cartes pour " + maxPlayers + " joueurs");
        return this;
    }
}
