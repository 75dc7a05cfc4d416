package org.ridethebus.service.snapshot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.ridethebus.config.GameConfig;
import org.ridethebus.exception.InvalidSnapshotException;
import org.ridethebus.model.casino.CasinoGameState;
import org.ridethebus.model.social.SocialGameState;
import org.springframework.stereotype.Service;

/**
 * Sauvegarde / restauration JSON des parties pour la couche de persistance.
 * L'ordre du paquet fait partie de l'état : une partie restaurée continue à l'identique.
 */
@Service
@RequiredArgsConstructor
public class GameSnapshotCodec {
    private final ObjectMapper objectMapper;

    public String write(Object state) {
        try {
            return objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException ex) {
            throw new InvalidSnapshotException("Sauvegarde impossible: " + ex.getOriginalMessage(), ex);
        }
    }

    public SocialGameState readSocial(String json) {
        SocialGameState s = read(json, SocialGameState.class);
        if (s.getDeck() == null || s.getPlayers() == null || s.getPlayers().isEmpty() || s.getPhase() == null) {
            throw new InvalidSnapshotException("Partie sociale incomplète", null);
        }
        return s;
    }

    public CasinoGameState readCasino(String json) {
        CasinoGameState s = read(json, CasinoGameState.class);
        if (s.getDeck() == null || s.getStatus() == null) {
            throw new InvalidSnapshotException("Session casino incomplète", null);
        }
        if (s.getBet() <= 0 || s.getRound() < 1 || s.getRound() > GameConfig.CASINO_ROUNDS) {
            throw new InvalidSnapshotException("Session casino incohérente: mise=" + s.getBet() + ", manche=" + s.getRound(), null);
        }
        return s;
    }

    private <T> T read(String json, Class<T> type) {
        if (json == null || json.isBlank()) throw new InvalidSnapshotException("Sauvegarde vide", null);
        try {
            T value = objectMapper.readValue(json, type);
            if (value == null) throw new InvalidSnapshotException("Sauvegarde vide", null);
            return value;
        } catch (JsonProcessingException ex) {
            throw new InvalidSnapshotException("Sauvegarde illisible: " + ex.getOriginalMessage(), ex);
        }
    }
}
