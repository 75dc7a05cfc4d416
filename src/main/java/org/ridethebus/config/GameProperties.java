package org.ridethebus.config;

import lombok.Data;
import org.ridethebus.model.casino.TiePolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@ConfigurationProperties(prefix = "ridebus")
public class GameProperties {

    // clés attendues telles quelles : [sips_wrong_guess_r1] ... (notation crochets dans le .properties)
    private Map<String, Integer> penalty = new LinkedHashMap<>();
    private Map<String, Integer> reward = new LinkedHashMap<>();
    private Pyramid pyramid = new Pyramid();
    private HouseRules houseRules = new HouseRules();
    private AlcoholMode alcoholMode = new AlcoholMode();
    private Players players = new Players();
    private Bus bus = new Bus();
    private Casino casino = new Casino();

    @Data
    public static class Pyramid {
        private List<Integer> rowValues = new ArrayList<>();
    }

    @Data
    public static class HouseRules {
        private boolean allowMultipleMatchesPerFlip = false;
    }

    @Data
    public static class AlcoholMode {
        private boolean enabled = true;
        private String drinkUnit = "sip";
        private String pointUnit = "point";
    }

    @Data
    public static class Players {
        private int min = 2;
        private int max = 6;
    }

    @Data
    public static class Bus {
        private int length = 10;
    }

    @Data
    public static class Casino {
        private List<Double> multipliers = new ArrayList<>();
        private TiePolicy tiePolicy = TiePolicy.LOSE;
    }

    public GameConfig toConfig() {
        return GameConfig.builder()
                .penalties(Map.copyOf(penalty))
                .rewards(Map.copyOf(reward))
                .pyramidRowValues(List.copyOf(pyramid.getRowValues()))
                .allowMultipleMatchesPerFlip(houseRules.isAllowMultipleMatchesPerFlip())
                .alcoholModeEnabled(alcoholMode.isEnabled())
                .drinkUnit(alcoholMode.getDrinkUnit())
                .pointUnit(alcoholMode.getPointUnit())
                .minPlayers(players.getMin())
                .maxPlayers(players.getMax())
                .busLength(bus.getLength())
                .casinoMultipliers(List.copyOf(casino.getMultipliers()))
                .casinoTiePolicy(casino.getTiePolicy())
                .build()
                .validate();
    }
}
