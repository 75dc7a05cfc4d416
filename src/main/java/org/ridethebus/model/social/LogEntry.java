package org.ridethebus.model.social;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

// pas d'horodatage : une même graine doit rejouer un journal identique
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LogEntry {
    private int seq;
    private LogType type;
    private String playerId;
    private Map<String, Object> payload;
}
