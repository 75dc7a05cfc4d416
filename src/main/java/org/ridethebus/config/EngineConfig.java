package org.ridethebus.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
@EnableConfigurationProperties(GameProperties.class)
public class EngineConfig {

    // échoue au démarrage si une clé manque : pas de valeur silencieuse par défaut
    @Bean
    public GameConfig gameConfig(GameProperties properties) {
        GameConfig cfg = properties.toConfig();
        log.info("Configuration chargée: joueurs {}..{}, bus={} cartes, multiplicateurs casino={}, égalités casino={}",
                cfg.getMinPlayers(), cfg.getMaxPlayers(), cfg.getBusLength(),
                cfg.getCasinoMultipliers(), cfg.getCasinoTiePolicy());
        return cfg;
    }
}
